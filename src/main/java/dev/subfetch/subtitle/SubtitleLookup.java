package dev.subfetch.subtitle;

import java.nio.file.Path;
import java.util.List;

/** Finds subtitle files that exist on disk next to a video */
@FunctionalInterface
public interface SubtitleLookup {

	/**
	 * @param video The video file
	 * @param languages Requested language codes in preference order
	 * @return Existing subtitle files, language-specific ones first, in lookup order
	 */
	List<Path> find(Path video, List<String> languages);
}
