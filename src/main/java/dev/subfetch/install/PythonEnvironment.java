package dev.subfetch.install;

import dev.subfetch.util.CommandResult;
import dev.subfetch.util.FileUtils;
import dev.subfetch.util.Platform;
import dev.subfetch.util.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes and installs pipx and subliminal on the local machine. On Windows and macOS pipx is not
 * needed and its stage always counts as available.
 */
public class PythonEnvironment implements DependencyProbe, Installer {
	private static final Logger logger = LoggerFactory.getLogger(PythonEnvironment.class);

	static final List<String> PYTHON_COMMANDS = List.of("python3", "python", "py");

	static final List<List<String>> PIPX_INSTALL_ATTEMPTS = List.of(
			List.of("python3", "-m", "pip", "install", "--user", "pipx"),
			List.of("python", "-m", "pip", "install", "--user", "pipx"),
			List.of("apt", "install", "-y", "python3-pipx"),
			List.of("dnf", "install", "-y", "python3-pipx"),
			List.of("pacman", "-S", "--noconfirm", "python-pipx"));

	private final ProcessRunner runner;

	public PythonEnvironment(ProcessRunner runner) {
		this.runner = runner;
	}

	/** The version line of the first Python 3 interpreter found, e.g. {@code Python 3.12.1} */
	public Optional<String> pythonVersion() {
		for (String cmd : PYTHON_COMMANDS) {
			Optional<CommandResult> result = tryRun(List.of(cmd, "--version"));
			if (result.isPresent() && result.get().success()) {
				String stdout = result.get().stdout().trim();
				String version = stdout.isEmpty() ? result.get().stderr().trim() : stdout;
				if (version.startsWith("Python 3.")) {
					logger.debug("Found {} using {}", version, cmd);
					return Optional.of(version);
				}
			}
		}
		logger.debug("No Python 3 installation found");
		return Optional.empty();
	}

	@Override
	public boolean isAvailable(Stage stage) {
		return switch (stage) {
			case PACKAGE_MANAGER -> isPipxAvailable();
			case FETCH_TOOL -> isSubliminalInstalled();
		};
	}

	boolean isPipxAvailable() {
		if (runner.platform() != Platform.LINUX) {
			return true;
		}
		return tryRun(List.of("pipx", "--version")).map(CommandResult::success).orElse(false);
	}

	boolean isSubliminalInstalled() {
		Optional<CommandResult> direct = tryRun(List.of("subliminal", "--version"));
		if (direct.isPresent()
				&& direct.get().success()
				&& direct.get().combinedLowercase().contains("subliminal")) {
			logger.debug("subliminal found as a direct command");
			return true;
		}

		Optional<CommandResult> pipx = tryRun(List.of("pipx", "list"));
		if (pipx.isPresent()
				&& pipx.get().success()
				&& pipx.get().stdout().toLowerCase(Locale.ROOT).contains("subliminal")) {
			logger.debug("subliminal found in pipx list");
			return true;
		}

		for (String cmd : PYTHON_COMMANDS) {
			Optional<CommandResult> show = tryRun(List.of(cmd, "-m", "pip", "show", "subliminal"));
			if (show.isPresent() && show.get().success() && show.get().stdout().contains("Name: subliminal")) {
				logger.debug("subliminal found with {} -m pip show", cmd);
				return true;
			}
			Optional<CommandResult> imported =
					tryRun(List.of(cmd, "-c", "import subliminal; print('subliminal available')"));
			if (imported.isPresent()
					&& imported.get().success()
					&& imported.get().stdout().contains("subliminal available")) {
				logger.debug("subliminal importable with {}", cmd);
				return true;
			}
		}
		logger.debug("subliminal not found");
		return false;
	}

	@Override
	public void install(Stage stage) throws InstallException, InterruptedException {
		switch (stage) {
			case PACKAGE_MANAGER -> installPipx();
			case FETCH_TOOL -> installSubliminal();
		}
	}

	void installPipx() throws InstallException, InterruptedException {
		if (runner.platform() != Platform.LINUX) {
			return;
		}
		for (List<String> attempt : PIPX_INSTALL_ATTEMPTS) {
			if (runQuietly(attempt)) {
				logger.info("pipx installed using {}", attempt.get(0));
				addUserScriptsToPath();
				return;
			}
		}
		throw new InstallException(Stage.PACKAGE_MANAGER, "Could not install pipx with pip or the system package manager");
	}

	void installSubliminal() throws InstallException, InterruptedException {
		if (runner.platform().isWindows()) {
			logger.info("Installing subliminal with pip");
			for (String cmd : List.of("python", "py", "python3")) {
				if (runQuietly(List.of(cmd, "-m", "pip", "install", "subliminal"))) {
					logger.info("subliminal installed using {}", cmd);
					addUserScriptsToPath();
					return;
				}
			}
			throw new InstallException(Stage.FETCH_TOOL, "pip install failed");
		}

		logger.info("Installing subliminal with pipx");
		if (runner.platform() == Platform.LINUX && !isPipxAvailable()) {
			logger.info("pipx not found, installing it first");
			for (List<String> attempt : PIPX_INSTALL_ATTEMPTS) {
				if (runQuietly(attempt)) {
					logger.info("pipx installed using {}", attempt.get(0));
					break;
				}
			}
		}
		if (runQuietly(List.of("pipx", "install", "subliminal"))) {
			logger.info("subliminal installed using pipx");
			addUserScriptsToPath();
			return;
		}

		logger.info("pipx install failed, falling back to pip --user");
		for (String cmd : List.of("python3", "python")) {
			if (runQuietly(List.of(cmd, "-m", "pip", "install", "--user", "subliminal"))) {
				logger.info("subliminal installed using {} -m pip", cmd);
				addUserScriptsToPath();
				return;
			}
		}
		throw new InstallException(Stage.FETCH_TOOL, "pipx/pip install failed");
	}

	/**
	 * Make the per-user scripts directory resolvable for the commands this process launches.
	 * Tools installed with {@code pip --user} or pipx land there and may not be on the inherited
	 * PATH.
	 */
	void addUserScriptsToPath() {
		if (runner.platform().isWindows()) {
			for (String cmd : List.of("python", "py")) {
				Optional<CommandResult> base = tryRun(List.of(cmd, "-m", "site", "--user-base"));
				if (base.isPresent() && base.get().success() && !base.get().stdout().isBlank()) {
					runner.addSearchPath(Path.of(base.get().stdout().trim()).resolve("Scripts"));
					return;
				}
			}
			logger.warn("Could not determine the Python user base, new scripts may not be found");
			return;
		}
		Path localBin = FileUtils.userHome().resolve(".local").resolve("bin");
		if (Files.isDirectory(localBin)) {
			runner.addSearchPath(localBin);
		}
	}

	private boolean runQuietly(List<String> command) throws InterruptedException {
		try {
			CommandResult result = runner.run(command, Map.of());
			if (!result.success()) {
				logger.warn("{} failed: {}", String.join(" ", command), result.stderr().trim());
			}
			return result.success();
		} catch (IOException e) {
			logger.debug("Could not run {}: {}", command.get(0), e.getMessage());
			return false;
		}
	}

	private Optional<CommandResult> tryRun(List<String> command) {
		try {
			return Optional.of(runner.run(command, Map.of()));
		} catch (IOException e) {
			return Optional.empty();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Optional.empty();
		}
	}
}
