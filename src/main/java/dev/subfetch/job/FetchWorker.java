package dev.subfetch.job;

import dev.subfetch.fetch.FetchOptions;
import dev.subfetch.fetch.FetchPipeline;
import dev.subfetch.fetch.FetchResult;
import dev.subfetch.fetch.OutcomeClassifier;
import dev.subfetch.fetch.ToolLaunchException;
import dev.subfetch.reporting.ProgressEvent;
import dev.subfetch.reporting.ProgressReporter;
import dev.subfetch.util.FileUtils;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the fetch pipeline for one running job and writes its terminal status. Nothing thrown by
 * the pipeline escapes: every failure becomes a {@code Failed} status.
 */
class FetchWorker implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(FetchWorker.class);

	private final int index;
	private final Path target;
	private final JobStore store;
	private final CancellationToken token;
	private final FetchPipeline pipeline;
	private final FetchOptions options;
	private final ProgressReporter reporter;

	FetchWorker(
			int index,
			Path target,
			JobStore store,
			CancellationToken token,
			FetchPipeline pipeline,
			FetchOptions options,
			ProgressReporter reporter) {
		this.index = index;
		this.target = target;
		this.store = store;
		this.token = token;
		this.pipeline = pipeline;
		this.options = options;
		this.reporter = reporter;
	}

	@Override
	public void run() {
		String name = FileUtils.fileName(target);
		if (token.isCancelled()) {
			store.fail(index, JobStatus.CANCELLED);
			return;
		}
		reporter.report(ProgressEvent.started(name));
		try {
			FetchResult result = pipeline.fetch(target, options);
			for (String line : result.output().split("\\R")) {
				if (!line.isBlank()) {
					reporter.report(ProgressEvent.output(name, line));
				}
			}
			JobStatus status = result.outcome().status();
			boolean applied =
					store.complete(index, status, result.resultPaths(), result.outcome().warning());
			if (!applied) {
				logger.debug("Discarding outcome of {} because the job was cancelled", target);
				return;
			}
			for (Path subtitle : result.resultPaths()) {
				reporter.report(ProgressEvent.output(name, "Subtitle: " + subtitle));
			}
			if (status.isSatisfied()) {
				reporter.report(ProgressEvent.completed(name, status.toString()));
			} else {
				reporter.report(ProgressEvent.failed(name, status.reason(), null));
			}
		} catch (ToolLaunchException e) {
			store.fail(index, OutcomeClassifier.TOOL_NOT_RUNNABLE);
			reporter.report(ProgressEvent.failed(name, OutcomeClassifier.TOOL_NOT_RUNNABLE, e));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			store.fail(index, JobStatus.CANCELLED);
			reporter.report(ProgressEvent.failed(name, JobStatus.CANCELLED, null));
		} catch (Exception e) {
			store.fail(index, "Unexpected error: " + e.getMessage());
			reporter.report(ProgressEvent.failed(name, "Unexpected error", e));
		}
	}
}
