package dev.subfetch.fetch;

import dev.subfetch.job.JobStatus;

/**
 * Classified result of one tool run.
 *
 * @param status The terminal job status
 * @param warning A recoverable problem that did not prevent success, or null
 */
public record Outcome(JobStatus status, String warning) {

	public static Outcome of(JobStatus status) {
		return new Outcome(status, null);
	}
}
