package dev.subfetch.install;

/**
 * Outcome of one installer run.
 *
 * @param stage The stage that was installed
 * @param error Null on success, otherwise the reason the install failed
 */
public record InstallResult(Stage stage, String error) {

	public static InstallResult ok(Stage stage) {
		return new InstallResult(stage, null);
	}

	public static InstallResult failure(Stage stage, String error) {
		return new InstallResult(stage, error);
	}

	public boolean isSuccess() {
		return error == null;
	}
}
