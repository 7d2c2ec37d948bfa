package dev.subfetch.job;

import dev.subfetch.fetch.FetchOptions;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs subtitle downloads for a list of videos with bounded concurrency. One run is active at a
 * time; each run starts with a fresh set of jobs.
 */
public interface DownloadManager {
	int DEFAULT_CONCURRENCY = 25;
	int MAX_CONCURRENCY = 100;

	/**
	 * Start a download run in the background.
	 *
	 * @param targets The videos to fetch subtitles for, in admission order
	 * @param concurrency Maximum number of jobs running at once, between 1 and {@link
	 *     #MAX_CONCURRENCY}
	 * @param options Languages and force flags passed to every job
	 * @throws IllegalArgumentException if the concurrency is out of range
	 * @throws IllegalStateException if a run is still in progress
	 */
	void submit(List<Path> targets, int concurrency, FetchOptions options);

	/** Request cancellation of the current run. Jobs whose tool is already running are not killed. */
	void cancel();

	/** Whether the scheduler of the current run is still admitting or waiting for jobs */
	boolean isRunning();

	/** The jobs of the current run, as of the last cache refresh */
	List<Job> snapshot();

	/** Per-state counts of the current run, as of the last cache refresh */
	JobCounts counts();

	/**
	 * Block until the current run's scheduler has finished.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	void awaitCompletion() throws InterruptedException;

	/** One line describing the current run */
	String statusLine();

	static boolean isValidConcurrency(int concurrency) {
		return concurrency >= 1 && concurrency <= MAX_CONCURRENCY;
	}
}
