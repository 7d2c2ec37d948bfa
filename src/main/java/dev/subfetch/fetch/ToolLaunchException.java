package dev.subfetch.fetch;

/** Thrown when none of the ways of invoking the external tool could start a process */
public class ToolLaunchException extends Exception {
	public ToolLaunchException(String message, Throwable cause) {
		super(message, cause);
	}
}
