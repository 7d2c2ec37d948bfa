package dev.subfetch.util;

import java.util.Locale;

/** Captured outcome of an external process that was launched and ran to completion */
public record CommandResult(int exitCode, String stdout, String stderr) {

	public boolean success() {
		return exitCode == 0;
	}

	/** Standard output and standard error joined by a newline, lower-cased and trimmed */
	public String combinedLowercase() {
		return (stdout.toLowerCase(Locale.ROOT) + "\n" + stderr.toLowerCase(Locale.ROOT)).trim();
	}

	@Override
	public String toString() {
		return "exit code %d (%d bytes stdout, %d bytes stderr)".formatted(exitCode, stdout.length(), stderr.length());
	}
}
