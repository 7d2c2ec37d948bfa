package dev.subfetch.util;

import java.util.Locale;

/** The operating system family the application is running on */
public enum Platform {
	WINDOWS,
	MACOS,
	LINUX;

	private static final Platform CURRENT = detect(System.getProperty("os.name", ""));

	public static Platform current() {
		return CURRENT;
	}

	static Platform detect(String osName) {
		var lower = osName.toLowerCase(Locale.ROOT);
		if (lower.contains("win")) {
			return WINDOWS;
		}
		if (lower.contains("mac") || lower.contains("darwin")) {
			return MACOS;
		}
		return LINUX;
	}

	public boolean isWindows() {
		return this == WINDOWS;
	}
}
