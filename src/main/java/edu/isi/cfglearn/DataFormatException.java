package edu.isi.cfglearn;
/** for errors in the format of grammar, string, and corpus files */
public class DataFormatException extends Exception {
	/** Constructs a new exception with null as its detail message. */
	public DataFormatException() { super(); }
	/** Constructs a new exception for the offending text. */
	public DataFormatException(String message) { super(message); }
	/** Constructs a new exception for the offending text, with the underlying cause. */
	public DataFormatException(String message, Throwable cause) { super(message, cause); }
}
