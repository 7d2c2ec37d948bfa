package dev.subfetch.util;

import java.io.IOException;

/** A process was started but its output could not be collected. The process has been destroyed. */
public class ProcessOutputException extends IOException {

	public ProcessOutputException(String message, IOException cause) {
		super(message, cause);
	}
}
