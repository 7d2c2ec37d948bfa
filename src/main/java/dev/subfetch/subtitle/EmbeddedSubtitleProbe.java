package dev.subfetch.subtitle;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** Detects subtitle streams already present inside a media container */
@FunctionalInterface
public interface EmbeddedSubtitleProbe {

	/** A probe that never finds anything, for when no media inspection tool is available */
	EmbeddedSubtitleProbe NONE = (video, languages) -> Optional.empty();

	/**
	 * Look for an embedded subtitle stream in one of the requested languages.
	 *
	 * @param video The media file to inspect
	 * @param languages Requested language codes in preference order
	 * @return The human readable name of the matched language, if any stream matched
	 */
	Optional<String> findEmbeddedLanguage(Path video, List<String> languages);
}
