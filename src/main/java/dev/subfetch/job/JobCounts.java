package dev.subfetch.job;

import java.util.List;

/** Per-state tally of a job snapshot */
public record JobCounts(int total, int pending, int running, int success, int embedded, int failed) {

	public static final JobCounts EMPTY = new JobCounts(0, 0, 0, 0, 0, 0);

	public static JobCounts of(List<Job> jobs) {
		int pending = 0, running = 0, success = 0, embedded = 0, failed = 0;
		for (Job job : jobs) {
			switch (job.status().state()) {
				case PENDING -> pending++;
				case RUNNING -> running++;
				case SUCCESS -> success++;
				case EMBEDDED_EXISTS -> embedded++;
				case FAILED -> failed++;
			}
		}
		return new JobCounts(jobs.size(), pending, running, success, embedded, failed);
	}

	/** Jobs that ended satisfied, either fetched or already embedded */
	public int completed() {
		return success + embedded;
	}

	public int finished() {
		return success + embedded + failed;
	}

	@Override
	public String toString() {
		return "%d total, %d pending, %d running, %d successful, %d embedded, %d failed"
				.formatted(total, pending, running, success, embedded, failed);
	}
}
