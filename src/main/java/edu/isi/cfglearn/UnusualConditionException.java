package edu.isi.cfglearn;
/** for runs that stop somewhere they shouldn't, like a learner that
    exceeds its iteration cap because its oracles disagree */
public class UnusualConditionException extends Exception {
	/** Constructs a new exception with the specified detail message. */
	public UnusualConditionException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
}
