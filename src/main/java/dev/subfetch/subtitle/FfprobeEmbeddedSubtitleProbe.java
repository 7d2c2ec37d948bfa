package dev.subfetch.subtitle;

import dev.subfetch.util.CommandResult;
import dev.subfetch.util.ProcessRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the subtitle streams of a media file with {@code ffprobe}. The file is only read. When
 * ffprobe is missing or fails, nothing is reported as embedded.
 */
public class FfprobeEmbeddedSubtitleProbe implements EmbeddedSubtitleProbe {
	private static final Logger logger = LoggerFactory.getLogger(FfprobeEmbeddedSubtitleProbe.class);

	private final ProcessRunner runner;

	public FfprobeEmbeddedSubtitleProbe(ProcessRunner runner) {
		this.runner = runner;
	}

	@Override
	public Optional<String> findEmbeddedLanguage(Path video, List<String> languages) {
		List<String> command = List.of(
				"ffprobe",
				"-v",
				"error",
				"-select_streams",
				"s",
				"-show_entries",
				"stream=index:stream_tags=language",
				"-of",
				"csv=p=0",
				video.toString());
		try {
			CommandResult result = runner.run(command, Map.of());
			if (!result.success()) {
				logger.debug("ffprobe failed for {} with exit code {}", video, result.exitCode());
				return Optional.empty();
			}
			return matchLanguage(result.stdout(), languages);
		} catch (IOException e) {
			logger.debug("Could not run ffprobe for {}: {}", video, e.getMessage());
			return Optional.empty();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Optional.empty();
		}
	}

	/**
	 * Match ffprobe's {@code index,language} lines against the requested codes. A stream tag
	 * matches a code when it is equal to it or starts with it, so both {@code en} and {@code eng}
	 * match {@code en}.
	 */
	static Optional<String> matchLanguage(String ffprobeOutput, List<String> languages) {
		for (String line : ffprobeOutput.split("\\R")) {
			String[] parts = line.split(",");
			if (parts.length < 2) {
				continue;
			}
			String streamLanguage = parts[1].trim().toLowerCase(Locale.ROOT);
			if (streamLanguage.isEmpty()) {
				continue;
			}
			for (String requested : languages) {
				String code = requested.toLowerCase(Locale.ROOT);
				if (streamLanguage.startsWith(code)) {
					return Optional.of(Languages.displayName(requested));
				}
			}
		}
		return Optional.empty();
	}
}
