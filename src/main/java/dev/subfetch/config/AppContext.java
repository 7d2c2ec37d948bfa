package dev.subfetch.config;

import dev.subfetch.fetch.FetchPipeline;
import dev.subfetch.fetch.OutcomeClassifier;
import dev.subfetch.fetch.SubliminalTool;
import dev.subfetch.install.InstallationManager;
import dev.subfetch.install.PythonEnvironment;
import dev.subfetch.job.DefaultDownloadManager;
import dev.subfetch.job.DownloadManager;
import dev.subfetch.reporting.ProgressReporter;
import dev.subfetch.subtitle.FfprobeEmbeddedSubtitleProbe;
import dev.subfetch.subtitle.SubtitleFiles;
import dev.subfetch.subtitle.VideoScanner;
import dev.subfetch.util.HttpUtils;
import dev.subfetch.util.ProcessRunner;
import dev.subfetch.util.UpdateChecker;

/**
 * Owns the long-lived components of the application. Built once at startup and handed to every
 * command; closing it stops the background threads.
 */
public class AppContext implements AutoCloseable {
	public static final String VERSION = "1.0.0";

	private final SettingsStore settingsStore;
	private final Settings settings;
	private final ProcessRunner processRunner;
	private final PythonEnvironment pythonEnvironment;
	private final ProgressReporter reporter;
	private final DownloadManager downloadManager;
	private final InstallationManager installationManager;
	private final UpdateChecker updateChecker;

	public AppContext(SettingsStore settingsStore, ProcessRunner processRunner) {
		this.settingsStore = settingsStore;
		this.settings = settingsStore.load();
		this.processRunner = processRunner;
		this.pythonEnvironment = new PythonEnvironment(processRunner);
		this.reporter = new ProgressReporter();
		FetchPipeline pipeline = new FetchPipeline(
				new SubliminalTool(processRunner),
				new SubtitleFiles(),
				new OutcomeClassifier(new FfprobeEmbeddedSubtitleProbe(processRunner)));
		this.downloadManager = new DefaultDownloadManager(pipeline, reporter);
		this.installationManager = new InstallationManager(pythonEnvironment, pythonEnvironment);
		this.updateChecker = new UpdateChecker(new HttpUtils("subfetch-version-check"), VERSION);
		reporter.start();
	}

	public static AppContext create() {
		return new AppContext(new SettingsStore(), new ProcessRunner());
	}

	public SettingsStore settingsStore() {
		return settingsStore;
	}

	public Settings settings() {
		return settings;
	}

	public ProcessRunner processRunner() {
		return processRunner;
	}

	public PythonEnvironment pythonEnvironment() {
		return pythonEnvironment;
	}

	public DownloadManager downloadManager() {
		return downloadManager;
	}

	public InstallationManager installationManager() {
		return installationManager;
	}

	public UpdateChecker updateChecker() {
		return updateChecker;
	}

	public VideoScanner videoScanner(boolean ignoreExtras) {
		return new VideoScanner(ignoreExtras);
	}

	@Override
	public void close() {
		downloadManager.cancel();
		installationManager.close();
		reporter.close();
	}
}
