package dev.subfetch.job;

import java.util.Objects;

/**
 * Status of a subtitle download job. A job moves from {@link State#PENDING} to {@link
 * State#RUNNING} to exactly one terminal state; {@code reason} carries the human readable text of
 * {@link State#EMBEDDED_EXISTS} and {@link State#FAILED}.
 */
public record JobStatus(State state, String reason) {
	public enum State {
		PENDING,
		RUNNING,
		SUCCESS,
		EMBEDDED_EXISTS,
		FAILED
	}

	public static final String CANCELLED = "Cancelled";

	private static final JobStatus PENDING = new JobStatus(State.PENDING, null);
	private static final JobStatus RUNNING = new JobStatus(State.RUNNING, null);
	private static final JobStatus SUCCESS = new JobStatus(State.SUCCESS, null);

	public JobStatus {
		Objects.requireNonNull(state, "state");
	}

	public static JobStatus pending() {
		return PENDING;
	}

	public static JobStatus running() {
		return RUNNING;
	}

	public static JobStatus success() {
		return SUCCESS;
	}

	public static JobStatus embeddedExists(String reason) {
		return new JobStatus(State.EMBEDDED_EXISTS, reason);
	}

	public static JobStatus failed(String reason) {
		return new JobStatus(State.FAILED, reason);
	}

	public static JobStatus cancelled() {
		return failed(CANCELLED);
	}

	public boolean isTerminal() {
		return state == State.SUCCESS || state == State.EMBEDDED_EXISTS || state == State.FAILED;
	}

	/** Success and embedded-exists both count as a satisfied job */
	public boolean isSatisfied() {
		return state == State.SUCCESS || state == State.EMBEDDED_EXISTS;
	}

	public boolean isCancelled() {
		return state == State.FAILED && CANCELLED.equals(reason);
	}

	/** Short label used in logs and summaries */
	public String label() {
		return switch (state) {
			case PENDING -> "Pending";
			case RUNNING -> "Running";
			case SUCCESS -> "Success";
			case EMBEDDED_EXISTS -> "Embedded";
			case FAILED -> "Failed";
		};
	}

	@Override
	public String toString() {
		return reason == null ? label() : label() + " (" + reason + ")";
	}
}
