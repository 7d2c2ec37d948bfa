package dev.subfetch.install;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background thread that probes both dependency stages every {@code interval} and publishes the
 * result on a queue the caller drains with {@link #poll()}. The fetch tool is only probed once the
 * package manager is available. Polling stops for good once both stages are available, or when
 * the monitor is closed.
 *
 * <p>The wait between rounds is split into short slices so that {@link #close()} is noticed
 * quickly.
 */
public class InstallationMonitor implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(InstallationMonitor.class);

	public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
	public static final Duration SLEEP_SLICE = Duration.ofMillis(100);
	static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

	private final DependencyProbe probe;
	private final Duration interval;
	private final Duration slice;
	private final BlockingQueue<DependencyStatus> channel = new LinkedBlockingQueue<>();
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private final AtomicInteger sent = new AtomicInteger();
	private Thread thread;

	public InstallationMonitor(DependencyProbe probe) {
		this(probe, DEFAULT_INTERVAL, SLEEP_SLICE);
	}

	public InstallationMonitor(DependencyProbe probe, Duration interval, Duration slice) {
		this.probe = probe;
		this.interval = interval;
		this.slice = slice;
	}

	public synchronized void start() {
		if (thread == null) {
			thread = new Thread(this, "installation-monitor");
			thread.setDaemon(true);
			thread.start();
		}
	}

	@Override
	public void run() {
		logger.debug("Installation monitor started");
		try {
			while (!closed.get()) {
				boolean packageManager = probe.isAvailable(Stage.PACKAGE_MANAGER);
				boolean fetchTool = packageManager && probe.isAvailable(Stage.FETCH_TOOL);
				if (closed.get()) {
					break;
				}
				channel.add(new DependencyStatus(packageManager, fetchTool));
				sent.incrementAndGet();
				if (packageManager && fetchTool) {
					logger.debug("All dependencies available, monitor stopping");
					break;
				}
				long slices = Math.max(1, interval.toMillis() / Math.max(1, slice.toMillis()));
				for (long i = 0; i < slices && !closed.get(); i++) {
					Thread.sleep(slice.toMillis());
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		logger.debug("Installation monitor stopped");
	}

	/** Drain every status published since the last call and return the newest one */
	public Optional<DependencyStatus> poll() {
		DependencyStatus latest = null;
		DependencyStatus next;
		while ((next = channel.poll()) != null) {
			latest = next;
		}
		return Optional.ofNullable(latest);
	}

	public boolean isAlive() {
		Thread t = thread;
		return t != null && t.isAlive();
	}

	/** Number of statuses published so far */
	int sentCount() {
		return sent.get();
	}

	/** Stop the monitor, waiting a bounded time for its thread to exit */
	@Override
	public void close() {
		if (closed.compareAndSet(false, true)) {
			Thread t;
			synchronized (this) {
				t = thread;
			}
			if (t == null) {
				return;
			}
			try {
				t.join(SHUTDOWN_TIMEOUT.toMillis());
				if (t.isAlive()) {
					logger.warn("Installation monitor did not exit within {}s, continuing", SHUTDOWN_TIMEOUT.toSeconds());
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}
}
