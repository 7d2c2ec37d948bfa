package dev.subfetch.job;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The ordered set of jobs of one download run, shared by the scheduler, its workers and the
 * caller. Every read and write happens under the store's monitor, which is held only for the
 * instant of the access and never around a process invocation.
 *
 * <p>Transitions are guarded so that each job reaches exactly one terminal status: only a pending
 * job can start running, only a running job can be completed, and the cancellation sweep rewrites
 * whatever is still pending or running.
 */
public class JobStore {
	private final List<Job> jobs;

	public JobStore(List<Path> targets) {
		this.jobs = new ArrayList<>(targets.size());
		for (Path target : targets) {
			jobs.add(Job.pending(target));
		}
	}

	public synchronized int size() {
		return jobs.size();
	}

	/**
	 * Move a pending job to running.
	 *
	 * @param index Index of the job in submission order
	 * @return The job's target, or empty if the job was no longer pending
	 */
	public synchronized Optional<Path> markRunning(int index) {
		Job job = jobs.get(index);
		if (job.status().state() != JobStatus.State.PENDING) {
			return Optional.empty();
		}
		jobs.set(index, job.withStatus(JobStatus.running()));
		return Optional.of(job.target());
	}

	/**
	 * Record the terminal outcome of a running job.
	 *
	 * @return true if the outcome was applied, false if the job had already been completed or
	 *     cancelled
	 */
	public synchronized boolean complete(int index, JobStatus status, List<Path> resultPaths, String warning) {
		if (!status.isTerminal()) {
			throw new IllegalArgumentException("Not a terminal status: " + status);
		}
		Job job = jobs.get(index);
		if (job.status().state() != JobStatus.State.RUNNING) {
			return false;
		}
		jobs.set(index, job.withOutcome(status, resultPaths, warning));
		return true;
	}

	/** Fail a running job without result paths */
	public boolean fail(int index, String reason) {
		return complete(index, JobStatus.failed(reason), List.of(), null);
	}

	/**
	 * Mark every job that is still pending or running as cancelled.
	 *
	 * @return Number of jobs that were rewritten
	 */
	public synchronized int cancelRemaining() {
		int count = 0;
		for (int i = 0; i < jobs.size(); i++) {
			Job job = jobs.get(i);
			if (!job.status().isTerminal()) {
				jobs.set(i, job.withStatus(JobStatus.cancelled()));
				count++;
			}
		}
		return count;
	}

	public synchronized Job get(int index) {
		return jobs.get(index);
	}

	/** A consistent copy of all jobs taken under a single lock acquisition */
	public synchronized List<Job> snapshot() {
		return List.copyOf(jobs);
	}

	public JobCounts counts() {
		return JobCounts.of(snapshot());
	}
}
