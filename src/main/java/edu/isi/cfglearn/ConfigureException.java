package edu.isi.cfglearn;
/** for errors in the command line: missing files, contradictory modes,
    unparseable state lists */
public class ConfigureException extends Exception {
	/** Constructs a new exception with the specified detail message. */
	public ConfigureException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
