package dev.subfetch.fetch;

import java.util.List;

/**
 * Per-run options passed to the fetch tool.
 *
 * @param languages Requested language codes, in preference order; never empty
 * @param force Fetch even if the tool believes subtitles already exist, and skip the embedded check
 * @param overwrite Replace subtitle files that already exist on disk
 */
public record FetchOptions(List<String> languages, boolean force, boolean overwrite) {

	public FetchOptions {
		languages = List.copyOf(languages);
		if (languages.isEmpty()) {
			throw new IllegalArgumentException("At least one language is required");
		}
	}

	/** Whether the tool must be invoked with its force flag */
	public boolean forceFlag() {
		return force || overwrite;
	}
}
