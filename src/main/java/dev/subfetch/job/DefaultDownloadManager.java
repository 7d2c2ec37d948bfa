package dev.subfetch.job;

import dev.subfetch.fetch.FetchOptions;
import dev.subfetch.fetch.FetchPipeline;
import dev.subfetch.reporting.ProgressReporter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Download manager that runs each submitted run on its own scheduler thread. The caller reads
 * progress through a {@link ProgressCache}, so frequent polling does not contend with the workers
 * for the job store.
 */
public class DefaultDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadManager.class);

	private final FetchPipeline pipeline;
	private final ProgressReporter reporter;
	private final Clock clock;
	private final Duration cacheRefreshInterval;
	private final Duration pollInterval;

	private volatile Run current;

	public DefaultDownloadManager(FetchPipeline pipeline, ProgressReporter reporter) {
		this(
				pipeline,
				reporter,
				Clock.systemUTC(),
				ProgressCache.DEFAULT_REFRESH_INTERVAL,
				DownloadScheduler.POLL_INTERVAL);
	}

	public DefaultDownloadManager(
			FetchPipeline pipeline,
			ProgressReporter reporter,
			Clock clock,
			Duration cacheRefreshInterval,
			Duration pollInterval) {
		this.pipeline = pipeline;
		this.reporter = reporter;
		this.clock = clock;
		this.cacheRefreshInterval = cacheRefreshInterval;
		this.pollInterval = pollInterval;
	}

	@Override
	public synchronized void submit(List<Path> targets, int concurrency, FetchOptions options) {
		if (!DownloadManager.isValidConcurrency(concurrency)) {
			throw new IllegalArgumentException(
					"Concurrency must be between 1 and " + MAX_CONCURRENCY + ", got " + concurrency);
		}
		if (isRunning()) {
			throw new IllegalStateException("A download run is already in progress");
		}

		CancellationToken token = new CancellationToken();
		JobStore store = new JobStore(targets);
		ProgressCache cache = new ProgressCache(store, clock, cacheRefreshInterval);
		DownloadScheduler scheduler = new DownloadScheduler(
				store,
				concurrency,
				token,
				(index, target) -> new FetchWorker(index, target, store, token, pipeline, options, reporter),
				pollInterval);
		Thread thread = new Thread(scheduler, "download-scheduler");
		thread.setDaemon(true);
		current = new Run(store, cache, token, thread);

		logger.info(
				"Submitting {} videos, languages {}, force {}, overwrite {}",
				targets.size(),
				options.languages(),
				options.force(),
				options.overwrite());
		thread.start();
	}

	@Override
	public void cancel() {
		if (isRunning()) {
			logger.info("Cancelling downloads");
		}
		Run run = current;
		if (run != null) {
			run.token().cancel();
		}
	}

	/** Whether the latest run was cancelled */
	public boolean isCancelled() {
		Run run = current;
		return run != null && run.token().isCancelled();
	}

	CancellationToken currentToken() {
		Run run = current;
		return run == null ? null : run.token();
	}

	@Override
	public boolean isRunning() {
		Run run = current;
		return run != null && run.thread().isAlive();
	}

	@Override
	public List<Job> snapshot() {
		Run run = current;
		return run == null ? List.of() : run.cache().jobs();
	}

	@Override
	public JobCounts counts() {
		Run run = current;
		return run == null ? JobCounts.EMPTY : run.cache().counts();
	}

	@Override
	public void awaitCompletion() throws InterruptedException {
		Run run = current;
		if (run != null) {
			run.thread().join();
			run.cache().refresh();
		}
	}

	@Override
	public String statusLine() {
		Run run = current;
		if (run == null) {
			return "Idle";
		}
		if (run.thread().isAlive()) {
			JobCounts counts = run.cache().counts();
			return "Downloading: %d completed, %d running, %d pending"
					.formatted(counts.completed(), counts.running(), counts.pending());
		}
		JobCounts counts = run.store().counts();
		return "Jobs completed: %d successful, %d failed".formatted(counts.completed(), counts.failed());
	}

	private record Run(JobStore store, ProgressCache cache, CancellationToken token, Thread thread) {}
}
