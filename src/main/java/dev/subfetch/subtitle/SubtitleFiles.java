package dev.subfetch.subtitle;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates subtitle files by naming convention: {@code <stem>.<lang>.<ext>} for a specific language
 * and {@code <stem>.<ext>} for a generic subtitle, next to the video.
 */
public class SubtitleFiles implements SubtitleLookup {
	private static final Logger logger = LoggerFactory.getLogger(SubtitleFiles.class);

	public static final List<String> SUBTITLE_EXTENSIONS = List.of("srt", "sub", "ssa", "ass", "vtt");

	/**
	 * Find at most one subtitle file per requested language, then at most one generic subtitle
	 * file. Files that do not exist are not included.
	 */
	@Override
	public List<Path> find(Path video, List<String> languages) {
		Path folder = video.toAbsolutePath().getParent();
		Optional<String> stem = stem(video);
		if (folder == null || stem.isEmpty()) {
			return List.of();
		}

		List<Path> found = new ArrayList<>();
		for (String language : languages) {
			firstExisting(folder, stem.get() + "." + language).ifPresent(found::add);
		}
		firstExisting(folder, stem.get()).ifPresent(found::add);

		if (found.isEmpty()) {
			logger.debug("No subtitle files found for {}", video);
		} else {
			logger.debug("Found {} subtitle files for {}", found.size(), video);
		}
		return found;
	}

	/**
	 * True if any of the requested languages has neither a language-specific nor a generic
	 * subtitle file next to the video. A generic subtitle satisfies every language.
	 */
	public static boolean isMissingSubtitle(Path video, List<String> languages) {
		Path folder = video.toAbsolutePath().getParent();
		Optional<String> stem = stem(video);
		if (folder == null || stem.isEmpty()) {
			return false;
		}
		boolean hasGeneric = firstExisting(folder, stem.get()).isPresent();
		for (String language : languages) {
			if (!hasGeneric && firstExisting(folder, stem.get() + "." + language).isEmpty()) {
				return true;
			}
		}
		return false;
	}

	/** File name without its last extension */
	static Optional<String> stem(Path video) {
		Path name = video.getFileName();
		if (name == null) {
			return Optional.empty();
		}
		String fileName = name.toString();
		int dot = fileName.lastIndexOf('.');
		return Optional.of(dot > 0 ? fileName.substring(0, dot) : fileName);
	}

	private static Optional<Path> firstExisting(Path folder, String baseName) {
		for (String ext : SUBTITLE_EXTENSIONS) {
			Path candidate = folder.resolve(baseName + "." + ext);
			if (Files.exists(candidate)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}
}
