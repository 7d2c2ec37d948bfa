package dev.subfetch.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one download run. It is checked before a job is admitted and
 * before the external tool is launched, never while a process is running.
 */
public class CancellationToken {
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}
}
