package dev.subfetch.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Utility class for file operations */
public class FileUtils {

	private static final String APP_DIR = "subfetch";

	/** Ensure a directory exists, creating it if necessary */
	public static Path ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
		return directory;
	}

	/** Per-user configuration directory ({@code $XDG_CONFIG_HOME/subfetch} or {@code ~/.config/subfetch}) */
	public static Path userConfigDir() {
		return xdgDir("XDG_CONFIG_HOME", ".config");
	}

	/** The user's home directory */
	public static Path userHome() {
		return Path.of(System.getProperty("user.home"));
	}

	/** File name of a path, or "Unknown" for paths without one */
	public static String fileName(Path path) {
		Path name = path.getFileName();
		return name != null ? name.toString() : "Unknown";
	}

	private static Path xdgDir(String variable, String fallback) {
		String base = System.getenv(variable);
		Path root = base != null && !base.isBlank() ? Path.of(base) : userHome().resolve(fallback);
		return root.resolve(APP_DIR);
	}
}
