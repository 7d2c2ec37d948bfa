package dev.subfetch;

import dev.subfetch.config.AppContext;
import dev.subfetch.install.DependencyStatus;
import dev.subfetch.install.InstallResult;
import dev.subfetch.install.InstallationManager;
import dev.subfetch.install.PythonEnvironment;
import dev.subfetch.install.Stage;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/** Shows the dependency status and optionally installs what is missing */
@Command(
		name = "status",
		description = "Show whether Python, pipx and subliminal are available",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@ParentCommand
	private Main parent;

	@Option(
			names = {"--install"},
			description = "Install pipx and subliminal if they are missing")
	private boolean install;

	@Option(
			names = {"--timeout"},
			description = "Maximum number of seconds to wait for the installation (default: 600)",
			defaultValue = "600")
	private int timeoutSeconds;

	@Override
	public Integer call() throws Exception {
		AppContext context = parent.context();
		PythonEnvironment python = context.pythonEnvironment();

		logger.info("Dependency Status");
		logger.info("=================");
		logger.info("Python: {}", python.pythonVersion().orElse("not found"));
		boolean packageManager = python.isAvailable(Stage.PACKAGE_MANAGER);
		boolean fetchTool = packageManager && python.isAvailable(Stage.FETCH_TOOL);
		logger.info("{}: {}", Stage.PACKAGE_MANAGER.displayName(), packageManager ? "available" : "not found");
		logger.info("{}: {}", Stage.FETCH_TOOL.displayName(), fetchTool ? "available" : "not found");

		if (fetchTool) {
			return 0;
		}
		if (!install) {
			logger.info("");
			logger.info("Run 'subfetch status --install' to install the missing dependencies");
			return 1;
		}
		return runInstall(context.installationManager(), packageManager);
	}

	private int runInstall(InstallationManager manager, boolean packageManagerAvailable) throws InterruptedException {
		logger.info("");
		manager.start();
		if (!packageManagerAvailable) {
			logger.info("Installing {}...", Stage.PACKAGE_MANAGER.displayName());
			manager.startInstall(Stage.PACKAGE_MANAGER);
		}

		Instant deadline = Instant.now().plus(Duration.ofSeconds(timeoutSeconds));
		String lastMessage = null;
		boolean failed = false;
		while (Instant.now().isBefore(deadline)) {
			DependencyStatus status = manager.refresh();
			for (InstallResult result : manager.handleInstallResults()) {
				if (!result.isSuccess()) {
					failed = true;
				}
			}
			if (!manager.statusMessage().equals(lastMessage)) {
				lastMessage = manager.statusMessage();
				logger.info(lastMessage);
			}
			if (status.available(Stage.FETCH_TOOL)) {
				return 0;
			}
			if (failed && !manager.isInstalling()) {
				return 1;
			}
			Thread.sleep(500);
		}
		logger.error("Error: Installation did not finish within {} seconds", timeoutSeconds);
		return 1;
	}
}
