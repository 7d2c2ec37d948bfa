package dev.subfetch.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.subfetch.job.DownloadManager;
import java.util.ArrayList;
import java.util.List;

/** User preferences that persist between sessions */
@JsonPropertyOrder({
	"selected_languages",
	"force_download",
	"overwrite_existing",
	"concurrent_downloads",
	"ignore_local_extras"
})
@JsonIgnoreProperties(ignoreUnknown = true)
public class Settings {
	@JsonProperty("selected_languages")
	private List<String> languages;

	@JsonProperty("force_download")
	private boolean forceDownload;

	@JsonProperty("overwrite_existing")
	private boolean overwriteExisting;

	@JsonProperty("concurrent_downloads")
	private int concurrentDownloads;

	@JsonProperty("ignore_local_extras")
	private boolean ignoreLocalExtras;

	public Settings() {
		languages = new ArrayList<>();
		concurrentDownloads = DownloadManager.DEFAULT_CONCURRENCY;
	}

	public List<String> languages() {
		return languages;
	}

	public Settings languages(List<String> languages) {
		this.languages = new ArrayList<>(languages);
		return this;
	}

	public boolean forceDownload() {
		return forceDownload;
	}

	public Settings forceDownload(boolean forceDownload) {
		this.forceDownload = forceDownload;
		return this;
	}

	public boolean overwriteExisting() {
		return overwriteExisting;
	}

	public Settings overwriteExisting(boolean overwriteExisting) {
		this.overwriteExisting = overwriteExisting;
		return this;
	}

	public int concurrentDownloads() {
		return concurrentDownloads;
	}

	public Settings concurrentDownloads(int concurrentDownloads) {
		this.concurrentDownloads = concurrentDownloads;
		return this;
	}

	public boolean ignoreLocalExtras() {
		return ignoreLocalExtras;
	}

	public Settings ignoreLocalExtras(boolean ignoreLocalExtras) {
		this.ignoreLocalExtras = ignoreLocalExtras;
		return this;
	}

	/** Drop empty language entries and replace values that cannot be used with their defaults */
	public Settings sanitized() {
		List<String> valid = new ArrayList<>();
		if (languages != null) {
			for (String language : languages) {
				if (language != null && !language.isBlank()) {
					valid.add(language.trim());
				}
			}
		}
		languages = valid;
		if (!DownloadManager.isValidConcurrency(concurrentDownloads)) {
			concurrentDownloads = DownloadManager.DEFAULT_CONCURRENCY;
		}
		return this;
	}

	@Override
	public String toString() {
		return "languages=%s, force=%s, overwrite=%s, ignore_extras=%s, concurrent=%d"
				.formatted(languages, forceDownload, overwriteExisting, ignoreLocalExtras, concurrentDownloads);
	}
}
