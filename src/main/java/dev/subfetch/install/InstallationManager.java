package dev.subfetch.install;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the two-stage install state machine from the statuses of an {@link InstallationMonitor}.
 * When the package manager is available and the fetch tool is not, the fetch tool installer is
 * started automatically, at most once for the lifetime of the manager. Installers run on their
 * own threads and hand their result back through {@link DependencyState}.
 *
 * <p>{@link #refresh()} and {@link #handleInstallResults()} are meant to be called from a single
 * polling thread.
 */
public class InstallationManager implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(InstallationManager.class);

	private final Installer installer;
	private final InstallationMonitor monitor;
	private final DependencyState state = new DependencyState();
	private final AtomicBoolean autoInstallAttempted = new AtomicBoolean(false);
	private final AtomicInteger installsStarted = new AtomicInteger();
	private volatile String statusMessage = "Checking dependencies...";

	public InstallationManager(DependencyProbe probe, Installer installer) {
		this(installer, new InstallationMonitor(probe));
	}

	public InstallationManager(Installer installer, InstallationMonitor monitor) {
		this.installer = installer;
		this.monitor = monitor;
	}

	public void start() {
		monitor.start();
	}

	/** Apply the newest status published by the monitor, if any */
	public DependencyStatus refresh() {
		monitor.poll().ifPresent(this::apply);
		return state.status();
	}

	void apply(DependencyStatus status) {
		boolean packageManager = status.packageManagerAvailable();
		boolean hadPackageManager = state.setAvailable(Stage.PACKAGE_MANAGER, packageManager);
		if (!packageManager) {
			statusMessage = Stage.PACKAGE_MANAGER.displayName() + " is not installed";
			return;
		}
		if (!hadPackageManager) {
			logger.info("{} is available", Stage.PACKAGE_MANAGER.displayName());
		}

		boolean hadFetchTool = state.isAvailable(Stage.FETCH_TOOL);
		boolean fetchTool = status.fetchToolAvailable() || hadFetchTool;
		state.setAvailable(Stage.FETCH_TOOL, fetchTool);
		if (fetchTool) {
			if (!hadFetchTool) {
				logger.info("{} is available", Stage.FETCH_TOOL.displayName());
			}
			statusMessage = "All dependencies installed, ready to download subtitles";
		} else if (autoInstallAttempted.compareAndSet(false, true)) {
			logger.info(
					"{} detected, installing {} automatically",
					Stage.PACKAGE_MANAGER.displayName(),
					Stage.FETCH_TOOL.displayName());
			statusMessage = "Installing " + Stage.FETCH_TOOL.displayName() + "...";
			startInstall(Stage.FETCH_TOOL);
		}
	}

	/**
	 * Start the installer of a stage on a new thread.
	 *
	 * @return false if an install of that stage is already in progress or its result has not been
	 *     handled yet
	 */
	public boolean startInstall(Stage stage) {
		if (!state.beginInstall(stage)) {
			logger.debug("Install of {} already in progress", stage.displayName());
			return false;
		}
		installsStarted.incrementAndGet();
		Thread thread = new Thread(() -> runInstaller(stage), "install-" + stage.displayName());
		thread.setDaemon(true);
		thread.start();
		return true;
	}

	private void runInstaller(Stage stage) {
		InstallResult result;
		try {
			installer.install(stage);
			result = InstallResult.ok(stage);
		} catch (InstallException e) {
			result = InstallResult.failure(stage, e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			result = InstallResult.failure(stage, "Installation interrupted");
		} catch (RuntimeException e) {
			logger.error("Unexpected error installing {}", stage.displayName(), e);
			result = InstallResult.failure(stage, "Unexpected error: " + e.getMessage());
		}
		if (!state.offerResult(result)) {
			logger.warn("Dropping install result for {}, previous result not handled", stage.displayName());
		}
	}

	/** Take and clear the result of a finished installer, if there is one */
	public Optional<InstallResult> takeInstallResult(Stage stage) {
		return state.takeResult(stage);
	}

	/** Collect the results of finished installers and update the state accordingly */
	public List<InstallResult> handleInstallResults() {
		List<InstallResult> handled = new ArrayList<>();
		for (Stage stage : Stage.values()) {
			if (!state.isInstalling(stage)) {
				continue;
			}
			Optional<InstallResult> result = takeInstallResult(stage);
			if (result.isEmpty()) {
				continue;
			}
			state.endInstall(stage);
			InstallResult r = result.get();
			if (r.isSuccess()) {
				logger.info("{} installed successfully", stage.displayName());
				state.setAvailable(stage, true);
				statusMessage = stage.displayName() + " installed";
			} else {
				logger.error("{} installation failed: {}", stage.displayName(), r.error());
				statusMessage = stage.displayName() + " install failed: " + r.error();
			}
			handled.add(r);
		}
		return handled;
	}

	public DependencyStatus status() {
		return state.status();
	}

	public boolean isInstalling(Stage stage) {
		return state.isInstalling(stage);
	}

	public boolean isInstalling() {
		return state.isInstalling(Stage.PACKAGE_MANAGER) || state.isInstalling(Stage.FETCH_TOOL);
	}

	public String statusMessage() {
		return statusMessage;
	}

	public boolean isMonitoring() {
		return monitor.isAlive();
	}

	int installsStarted() {
		return installsStarted.get();
	}

	@Override
	public void close() {
		monitor.close();
	}
}
