package dev.subfetch.install;

/** Availability of both stages as seen by one probe round */
public record DependencyStatus(boolean packageManagerAvailable, boolean fetchToolAvailable) {

	public static final DependencyStatus UNKNOWN = new DependencyStatus(false, false);

	public boolean available(Stage stage) {
		return switch (stage) {
			case PACKAGE_MANAGER -> packageManagerAvailable;
			case FETCH_TOOL -> fetchToolAvailable;
		};
	}

	public boolean bothAvailable() {
		return packageManagerAvailable && fetchToolAvailable;
	}
}
