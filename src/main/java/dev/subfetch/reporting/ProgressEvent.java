package dev.subfetch.reporting;

import java.time.Instant;

/** A lifecycle event of one download job */
public record ProgressEvent(String jobName, EventType eventType, String message, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		OUTPUT,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String jobName) {
		return new ProgressEvent(jobName, EventType.STARTED, "Download started", Instant.now(), null);
	}

	/** A line of output the fetch tool printed for the job */
	public static ProgressEvent output(String jobName, String line) {
		return new ProgressEvent(jobName, EventType.OUTPUT, line, Instant.now(), null);
	}

	public static ProgressEvent completed(String jobName, String message) {
		return new ProgressEvent(jobName, EventType.COMPLETED, message, Instant.now(), null);
	}

	public static ProgressEvent failed(String jobName, String message, Throwable error) {
		return new ProgressEvent(jobName, EventType.FAILED, message, Instant.now(), error);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, jobName, eventType, message);
	}
}
