package dev.subfetch.fetch;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a finished tool run produced for one video.
 *
 * @param outcome The classified outcome
 * @param resultPaths Subtitle files found next to the video after the run
 * @param output Combined, lower-cased tool output
 */
public record FetchResult(Outcome outcome, List<Path> resultPaths, String output) {
	public FetchResult {
		resultPaths = List.copyOf(resultPaths);
	}
}
