package dev.subfetch.fetch;

import dev.subfetch.job.JobStatus;
import dev.subfetch.subtitle.EmbeddedSubtitleProbe;
import dev.subfetch.subtitle.Languages;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the free-form output of a tool run into a terminal job status.
 *
 * <p>The tool's text is advisory and the files found on disk are authoritative: whenever subtitle
 * files exist after the run, the job is a success regardless of what the tool printed. Text
 * without any zero-result or error marker is also a success.
 *
 * <p>The marker phrases match the wording of subliminal 2.x. A change in that wording silently
 * changes the classification.
 */
public class OutcomeClassifier {
	static final String ZERO_FETCHED_MARKER = "downloaded 0 subtitle";
	static final List<String> ERROR_MARKERS = List.of("error", "failed");
	static final List<String> CACHE_ERROR_SIGNATURES = List.of("dbm.error", "db type could not be determined");
	static final List<String> ALREADY_SATISFIED_PHRASES = List.of(
			"embedded",
			"already exists",
			"no need to download",
			"subtitle(s) already present",
			"has embedded subtitles",
			"skipping");

	public static final String NO_SUBTITLES_AVAILABLE = "No subtitles available, embedded or external";
	public static final String NO_SUBTITLES_ONLINE = "No subtitles found online";
	public static final String CACHE_ERROR_RETRY = "Recoverable cache error, retry later";
	public static final String TOOL_ERROR = "Tool reported an error, see log";
	public static final String TOOL_NOT_RUNNABLE = "Tool not runnable";
	public static final String CACHE_ERROR_WARNING = "Cache error reported, subtitles were fetched anyway";

	private final EmbeddedSubtitleProbe embeddedProbe;

	public OutcomeClassifier(EmbeddedSubtitleProbe embeddedProbe) {
		this.embeddedProbe = embeddedProbe;
	}

	/**
	 * Classify one tool run.
	 *
	 * @param target The video the tool ran for, used only for the embedded-subtitle probe
	 * @param output Combined standard output and standard error of the tool
	 * @param discoveredFiles Number of subtitle files found on disk after the run
	 * @param options The languages and force flag of the run
	 * @return The terminal outcome
	 */
	public Outcome classify(Path target, String output, int discoveredFiles, FetchOptions options) {
		String text = output.toLowerCase(Locale.ROOT);
		boolean filesExist = discoveredFiles > 0;

		if (text.contains(ZERO_FETCHED_MARKER)) {
			if (filesExist) {
				return Outcome.of(JobStatus.success());
			}
			if (options.force()) {
				return Outcome.of(JobStatus.failed(NO_SUBTITLES_ONLINE));
			}
			return classifyNothingFetched(target, text, options.languages());
		}

		if (containsAny(text, ERROR_MARKERS)) {
			if (containsAny(text, CACHE_ERROR_SIGNATURES)) {
				return filesExist
						? new Outcome(JobStatus.success(), CACHE_ERROR_WARNING)
						: Outcome.of(JobStatus.failed(CACHE_ERROR_RETRY));
			}
			return filesExist ? Outcome.of(JobStatus.success()) : Outcome.of(JobStatus.failed(TOOL_ERROR));
		}

		return Outcome.of(JobStatus.success());
	}

	private Outcome classifyNothingFetched(Path target, String text, List<String> languages) {
		Optional<String> embedded = embeddedProbe.findEmbeddedLanguage(target, languages);
		if (embedded.isPresent()) {
			return Outcome.of(JobStatus.embeddedExists(embeddedReason(embedded.get())));
		}
		if (containsAny(text, ALREADY_SATISFIED_PHRASES)) {
			// The tool claims the subtitles are present but the probe could not say which language
			return Outcome.of(JobStatus.embeddedExists(embeddedReason(Languages.displayName(languages.get(0)))));
		}
		return Outcome.of(JobStatus.failed(NO_SUBTITLES_AVAILABLE));
	}

	static String embeddedReason(String languageName) {
		return "Embedded " + languageName + " subtitles already exist (no external subtitles found online)";
	}

	private static boolean containsAny(String text, List<String> phrases) {
		for (String phrase : phrases) {
			if (text.contains(phrase)) {
				return true;
			}
		}
		return false;
	}
}
