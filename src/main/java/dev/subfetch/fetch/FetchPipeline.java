package dev.subfetch.fetch;

import dev.subfetch.subtitle.SubtitleLookup;
import dev.subfetch.util.CommandResult;
import java.nio.file.Path;
import java.util.List;

/** Runs the fetch tool for one video, looks up the subtitle files on disk and classifies the run */
public class FetchPipeline {
	private final SubtitleFetchTool tool;
	private final SubtitleLookup lookup;
	private final OutcomeClassifier classifier;

	public FetchPipeline(SubtitleFetchTool tool, SubtitleLookup lookup, OutcomeClassifier classifier) {
		this.tool = tool;
		this.lookup = lookup;
		this.classifier = classifier;
	}

	/**
	 * @throws ToolLaunchException if the tool could not be started in any of its invocation forms
	 * @throws InterruptedException if interrupted while waiting for the tool
	 */
	public FetchResult fetch(Path target, FetchOptions options) throws ToolLaunchException, InterruptedException {
		CommandResult result = tool.download(target, options);
		String output = result.combinedLowercase();
		List<Path> found = lookup.find(target, options.languages());
		Outcome outcome = classifier.classify(target, output, found.size(), options);
		return new FetchResult(outcome, found, output);
	}
}
