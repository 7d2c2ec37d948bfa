package dev.subfetch;

import dev.subfetch.config.AppContext;
import dev.subfetch.config.Settings;
import dev.subfetch.fetch.FetchOptions;
import dev.subfetch.install.Stage;
import dev.subfetch.job.DownloadManager;
import dev.subfetch.job.Job;
import dev.subfetch.job.JobCounts;
import dev.subfetch.subtitle.Languages;
import dev.subfetch.subtitle.ScanResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/** Scans a folder and downloads the missing subtitles */
@Command(
		name = "download",
		description = "Scan a folder and download missing subtitles for every video in it",
		mixinStandardHelpOptions = true)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	private static final long STATUS_INTERVAL_MILLIS = 1000;

	@ParentCommand
	private Main parent;

	@Parameters(index = "0", description = "Folder to scan recursively")
	private Path folder;

	@Option(
			names = {"-l", "--language"},
			description = "Subtitle language code, repeatable (default: the saved languages)")
	private List<String> languages;

	@Option(
			names = {"-c", "--concurrency"},
			description = "Maximum number of parallel downloads, 1 to 100 (default: the saved value, 25)")
	private Integer concurrency;

	@Option(
			names = {"--force"},
			description = "Download even if the tool reports existing or embedded subtitles")
	private boolean force;

	@Option(
			names = {"--overwrite"},
			description = "Replace subtitle files that already exist")
	private boolean overwrite;

	@Option(
			names = {"--ignore-extras"},
			description = "Skip local extras folders such as 'Featurettes' and 'Trailers'")
	private boolean ignoreExtras;

	@Option(
			names = {"--save"},
			description = "Save the given options as the new defaults")
	private boolean save;

	@Override
	public Integer call() throws Exception {
		AppContext context = parent.context();
		Settings settings = context.settings();
		if (languages != null && !languages.isEmpty()) {
			settings.languages(languages);
		}
		if (concurrency != null) {
			settings.concurrentDownloads(concurrency);
		}
		settings.forceDownload(settings.forceDownload() || force);
		settings.overwriteExisting(settings.overwriteExisting() || overwrite);
		settings.ignoreLocalExtras(settings.ignoreLocalExtras() || ignoreExtras);

		if (settings.languages().isEmpty()) {
			logger.error("No language selected, use -l/--language");
			return 2;
		}
		if (!DownloadManager.isValidConcurrency(settings.concurrentDownloads())) {
			logger.error(
					"Concurrency must be between 1 and {}, got {}",
					DownloadManager.MAX_CONCURRENCY,
					settings.concurrentDownloads());
			return 2;
		}
		for (String language : settings.languages()) {
			if (!Languages.isKnown(language)) {
				logger.warn("Warning: Unknown language code: {}", language);
			}
		}
		if (save) {
			try {
				context.settingsStore().save(settings);
				logger.info("Settings saved to {}", context.settingsStore().settingsFile());
			} catch (IOException e) {
				logger.warn("Warning: Could not save settings: {}", e.getMessage());
			}
		}

		context.updateChecker().start();
		if (!context.pythonEnvironment().isAvailable(Stage.FETCH_TOOL)) {
			logger.warn("Warning: subliminal was not found, run 'subfetch status --install' to install it");
		}

		logger.info("Subtitle Download");
		logger.info("=================");
		logger.info("Folder: {}", folder.toAbsolutePath());
		logger.info("Settings: {}", settings);
		logger.info("");

		ScanResult scan;
		try {
			scan = context.videoScanner(settings.ignoreLocalExtras())
					.scan(folder, settings.languages(), settings.overwriteExisting());
		} catch (IOException e) {
			logger.error("Error: Cannot scan {}: {}", folder, e.getMessage());
			return 1;
		}
		logger.info("Found {} videos, {} missing subtitles", scan.videos().size(), scan.missing().size());
		if (scan.ignoredFolders() > 0) {
			logger.info("Ignored {} extras folders", scan.ignoredFolders());
		}
		if (scan.missing().isEmpty()) {
			logger.info("Nothing to download");
			return 0;
		}

		DownloadManager downloads = context.downloadManager();
		FetchOptions options =
				new FetchOptions(settings.languages(), settings.forceDownload(), settings.overwriteExisting());
		downloads.submit(scan.missing(), settings.concurrentDownloads(), options);

		Thread cancelOnExit = new Thread(() -> cancelAndWait(downloads), "cancel-downloads");
		Runtime.getRuntime().addShutdownHook(cancelOnExit);
		try {
			String last = null;
			while (downloads.isRunning()) {
				String line = downloads.statusLine();
				if (!line.equals(last)) {
					logger.info(line);
					last = line;
				}
				Thread.sleep(STATUS_INTERVAL_MILLIS);
			}
			downloads.awaitCompletion();
		} finally {
			removeHook(cancelOnExit);
		}

		printSummary(downloads);
		context.updateChecker()
				.newerVersion()
				.ifPresent(v -> logger.info("A newer version is available: {} (running {})", v, AppContext.VERSION));
		return downloads.counts().failed() > 0 ? 1 : 0;
	}

	private void printSummary(DownloadManager downloads) {
		logger.info("");
		logger.info("Download Summary");
		logger.info("================");
		for (Job job : downloads.snapshot()) {
			if (!job.status().isSatisfied()) {
				logger.info("  {}: {}", job.target().getFileName(), job.status());
			} else if (job.warning() != null) {
				logger.info("  {}: {} ({})", job.target().getFileName(), job.status(), job.warning());
			}
		}
		JobCounts counts = downloads.counts();
		logger.info("Successful: {}", counts.success());
		logger.info("Embedded: {}", counts.embedded());
		logger.info("Failed: {}", counts.failed());
		logger.info(downloads.statusLine());
	}

	private static void cancelAndWait(DownloadManager downloads) {
		if (!downloads.isRunning()) {
			return;
		}
		logger.info("Cancelling downloads, waiting for running jobs to be marked");
		downloads.cancel();
		try {
			downloads.awaitCompletion();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			// JVM is already shutting down, the hook is running
			logger.debug("Shutdown in progress, leaving cancel hook registered");
		}
	}
}
