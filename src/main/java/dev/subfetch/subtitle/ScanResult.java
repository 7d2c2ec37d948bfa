package dev.subfetch.subtitle;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of scanning a folder for videos.
 *
 * @param videos Every video found, in traversal order
 * @param missing The videos that need a download
 * @param ignoredFolders Number of extras folders that were skipped
 */
public record ScanResult(List<Path> videos, List<Path> missing, int ignoredFolders) {
	public ScanResult {
		videos = List.copyOf(videos);
		missing = List.copyOf(missing);
	}
}
