package dev.subfetch.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.subfetch.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads and writes {@link Settings} as JSON */
public class SettingsStore {
	private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

	public static final String FILE_NAME = "settings.json";

	private static final ObjectMapper mapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private final Path settingsFile;

	public SettingsStore() {
		this(FileUtils.userConfigDir().resolve(FILE_NAME));
	}

	public SettingsStore(Path settingsFile) {
		this.settingsFile = settingsFile;
	}

	public Path settingsFile() {
		return settingsFile;
	}

	/** Load the settings, falling back to defaults if the file is missing or cannot be parsed */
	public Settings load() {
		if (!Files.exists(settingsFile)) {
			logger.debug("Settings file {} not found, using defaults", settingsFile);
			return new Settings();
		}
		try {
			Settings settings = mapper.readValue(settingsFile.toFile(), Settings.class);
			if (settings == null) {
				logger.warn("Settings file {} is empty, using defaults", settingsFile);
				return new Settings();
			}
			logger.info("Settings loaded from {}", settingsFile);
			return settings.sanitized();
		} catch (IOException e) {
			logger.warn("Failed to parse settings file {}: {}. Using defaults.", settingsFile, e.getMessage());
			return new Settings();
		}
	}

	public void save(Settings settings) throws IOException {
		Path parent = settingsFile.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		try (var writer = Files.newBufferedWriter(settingsFile)) {
			mapper.writeValue(writer, settings);
			writer.write("\n");
		}
		logger.debug("Settings saved to {}", settingsFile);
	}
}
