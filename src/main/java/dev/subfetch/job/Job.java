package dev.subfetch.job;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable view of one subtitle download job.
 *
 * @param target The video file the job fetches subtitles for, unique within a run
 * @param status The current status
 * @param resultPaths Subtitle files found on disk after the tool ran, in lookup order
 * @param warning A recoverable problem the tool reported although the job succeeded, or null
 */
public record Job(Path target, JobStatus status, List<Path> resultPaths, String warning) {

	public Job {
		resultPaths = List.copyOf(resultPaths);
	}

	public static Job pending(Path target) {
		return new Job(target, JobStatus.pending(), List.of(), null);
	}

	Job withStatus(JobStatus newStatus) {
		return new Job(target, newStatus, resultPaths, warning);
	}

	Job withOutcome(JobStatus newStatus, List<Path> newResultPaths, String newWarning) {
		return new Job(target, newStatus, newResultPaths, newWarning);
	}
}
