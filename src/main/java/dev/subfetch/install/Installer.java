package dev.subfetch.install;

/** Installs one dependency stage. Runs on its own thread and may take minutes. */
@FunctionalInterface
public interface Installer {

	/**
	 * @throws InstallException if every install method for the stage failed
	 * @throws InterruptedException if interrupted while an install command was running
	 */
	void install(Stage stage) throws InstallException, InterruptedException;
}
