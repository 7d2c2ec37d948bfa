package dev.subfetch.install;

/** The two staged dependencies; the fetch tool is installed through the package manager */
public enum Stage {
	PACKAGE_MANAGER("pipx"),
	FETCH_TOOL("subliminal");

	private final String displayName;

	Stage(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
