package dev.subfetch.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodically refreshed copy of a {@link JobStore}, so that a frequent poller (a progress
 * display) does not contend for the store's lock on every read. A refresh takes one consistent
 * snapshot; between refreshes the cached jobs may lag behind the store by up to the interval.
 */
public class ProgressCache {
	public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMillis(500);

	private final JobStore store;
	private final Clock clock;
	private final Duration refreshInterval;

	private List<Job> cachedJobs = List.of();
	private JobCounts cachedCounts = JobCounts.EMPTY;
	private Instant lastUpdate;

	public ProgressCache(JobStore store, Clock clock, Duration refreshInterval) {
		this.store = store;
		this.clock = clock;
		this.refreshInterval = refreshInterval;
	}

	/** The cached jobs, refreshed first if the cache is older than the refresh interval */
	public synchronized List<Job> jobs() {
		refreshIfStale();
		return cachedJobs;
	}

	public synchronized JobCounts counts() {
		refreshIfStale();
		return cachedCounts;
	}

	/** Take a new snapshot regardless of its age */
	public synchronized void refresh() {
		cachedJobs = store.snapshot();
		cachedCounts = JobCounts.of(cachedJobs);
		lastUpdate = clock.instant();
	}

	public synchronized Instant lastUpdate() {
		return lastUpdate;
	}

	private void refreshIfStale() {
		Instant now = clock.instant();
		if (lastUpdate == null || Duration.between(lastUpdate, now).compareTo(refreshInterval) >= 0) {
			refresh();
		}
	}
}
