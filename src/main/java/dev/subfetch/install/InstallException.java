package dev.subfetch.install;

/** Installation of a dependency stage failed */
public class InstallException extends Exception {
	private final Stage stage;

	public InstallException(Stage stage, String message) {
		super(message);
		this.stage = stage;
	}

	public InstallException(Stage stage, String message, Throwable cause) {
		super(message, cause);
		this.stage = stage;
	}

	public Stage stage() {
		return stage;
	}
}
