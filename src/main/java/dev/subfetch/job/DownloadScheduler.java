package dev.subfetch.job;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission loop of one download run. Jobs are admitted in submission order while fewer than
 * {@code concurrency} workers are in flight, and each admitted job is handed to a fixed pool of
 * {@code concurrency} threads. The loop only ever sleeps for {@link #POLL_INTERVAL}, so a
 * cancellation is noticed within one interval.
 *
 * <p>On cancellation every job that is still pending or running is marked {@code
 * Failed("Cancelled")} and no further job is admitted. Workers that already launched the tool are
 * left to finish; their outcome is discarded by the store.
 */
public class DownloadScheduler implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(DownloadScheduler.class);

	public static final Duration POLL_INTERVAL = Duration.ofMillis(200);

	/** Creates the worker for a job that was just marked running */
	@FunctionalInterface
	public interface WorkerFactory {
		Runnable create(int index, Path target);
	}

	private final JobStore store;
	private final int concurrency;
	private final CancellationToken token;
	private final WorkerFactory workerFactory;
	private final Duration pollInterval;

	public DownloadScheduler(JobStore store, int concurrency, CancellationToken token, WorkerFactory workerFactory) {
		this(store, concurrency, token, workerFactory, POLL_INTERVAL);
	}

	public DownloadScheduler(
			JobStore store,
			int concurrency,
			CancellationToken token,
			WorkerFactory workerFactory,
			Duration pollInterval) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
		}
		this.store = store;
		this.concurrency = concurrency;
		this.token = token;
		this.workerFactory = workerFactory;
		this.pollInterval = pollInterval;
	}

	@Override
	public void run() {
		Deque<Integer> pending = new ArrayDeque<>();
		for (int i = 0; i < store.size(); i++) {
			pending.add(i);
		}
		List<Future<?>> live = new ArrayList<>();
		ExecutorService pool = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
		logger.info("Starting {} downloads with {} workers", pending.size(), concurrency);

		try {
			while (true) {
				live.removeIf(Future::isDone);

				while (live.size() < concurrency && !pending.isEmpty()) {
					if (token.isCancelled()) {
						cancelRemaining();
						return;
					}
					int index = pending.poll();
					Optional<Path> target = store.markRunning(index);
					if (target.isPresent()) {
						live.add(pool.submit(workerFactory.create(index, target.get())));
					}
				}

				if (token.isCancelled()) {
					cancelRemaining();
					return;
				}
				if (pending.isEmpty() && live.isEmpty()) {
					break;
				}
				Thread.sleep(pollInterval.toMillis());
			}
			logger.info("All downloads finished: {}", store.counts());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancelRemaining();
		} finally {
			pool.shutdown();
		}
	}

	private void cancelRemaining() {
		int cancelled = store.cancelRemaining();
		logger.info("Download run cancelled, {} jobs marked as cancelled", cancelled);
	}

	private static class WorkerThreadFactory implements ThreadFactory {
		private final AtomicInteger count = new AtomicInteger();

		@Override
		public Thread newThread(Runnable r) {
			Thread thread = new Thread(r, "fetch-worker-" + count.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
