package dev.subfetch.reporting;

import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs job events from a single thread, so that the output of concurrently running workers is
 * written one event at a time instead of interleaved. Also keeps track of the jobs in flight.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.output("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Set<String> runningJobs;
	private final AtomicInteger completedJobs;
	private final AtomicInteger failedJobs;
	private final AtomicBoolean running;
	private Thread reporterThread;

	public ProgressReporter() {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningJobs = ConcurrentHashMap.newKeySet();
		this.completedJobs = new AtomicInteger();
		this.failedJobs = new AtomicInteger();
		this.running = new AtomicBoolean(false);
	}

	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "progress-reporter");
			reporterThread.setDaemon(true);
			reporterThread.start();
			logger.debug("Progress reporter started");
		}
	}

	/** Queue an event; events reported before {@link #start()} are logged once the thread runs */
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();
				if (event == POISON_PILL) {
					break;
				}
				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (Exception e) {
				logger.error("Error processing event", e);
			}
		}
		logger.debug("Progress reporter stopped");
	}

	void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> {
				runningJobs.add(event.jobName());
				logger.info("Started: {} | Running: {}", event.jobName(), runningJobs.size());
			}
			case OUTPUT -> logger.info("{}: {}", event.jobName(), event.message());
			case COMPLETED -> {
				runningJobs.remove(event.jobName());
				completedJobs.incrementAndGet();
				logger.info("Completed: {} - {} | Running: {}", event.jobName(), event.message(), runningJobs.size());
			}
			case FAILED -> {
				runningJobs.remove(event.jobName());
				failedJobs.incrementAndGet();
				if (event.error() != null) {
					logger.error("Failed: {} - {}", event.jobName(), event.message(), event.error());
				} else {
					logger.warn("Failed: {} - {}", event.jobName(), event.message());
				}
			}
		}
	}

	public int getRunningCount() {
		return runningJobs.size();
	}

	public int getCompletedCount() {
		return completedJobs.get();
	}

	public int getFailedCount() {
		return failedJobs.get();
	}

	/** Stop the reporter after the queued events have been logged */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
