package dev.subfetch.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Looks up the latest published release in the background */
public class UpdateChecker {
	private static final Logger logger = LoggerFactory.getLogger(UpdateChecker.class);

	public static final String RELEASES_URL = "https://api.github.com/repos/subfetch/subfetch/releases/latest";

	private static final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Result of a finished check.
	 *
	 * @param latestVersion The latest release tag, or null if the check failed
	 * @param error Why the check failed, or null
	 */
	public record Result(String latestVersion, String error) {}

	private final HttpUtils httpUtils;
	private final String currentVersion;
	private final String releasesUrl;
	private volatile Result result;
	private Thread thread;

	public UpdateChecker(HttpUtils httpUtils, String currentVersion) {
		this(httpUtils, currentVersion, RELEASES_URL);
	}

	public UpdateChecker(HttpUtils httpUtils, String currentVersion, String releasesUrl) {
		this.httpUtils = httpUtils;
		this.currentVersion = currentVersion;
		this.releasesUrl = releasesUrl;
	}

	/** Start the check on a daemon thread; does nothing if it was already started */
	public synchronized void start() {
		if (thread == null) {
			thread = new Thread(this::check, "update-check");
			thread.setDaemon(true);
			thread.start();
		}
	}

	void check() {
		try {
			String json = httpUtils.downloadString(releasesUrl);
			result = new Result(parseTagName(json), null);
			logger.debug("Latest release is {}", result.latestVersion());
		} catch (IOException e) {
			result = new Result(null, e.getMessage());
			logger.debug("Update check failed: {}", e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			result = new Result(null, "Interrupted");
		} catch (RuntimeException e) {
			result = new Result(null, "Unexpected error: " + e.getMessage());
			logger.debug("Update check failed", e);
		}
	}

	/** The result of the check, empty while it is still running */
	public Optional<Result> result() {
		return Optional.ofNullable(result);
	}

	/** The latest version if the check has finished and found a newer release than the running one */
	public Optional<String> newerVersion() {
		Result r = result;
		if (r == null || r.latestVersion() == null) {
			return Optional.empty();
		}
		return VersionComparator.isOutdated(currentVersion, r.latestVersion())
				? Optional.of(r.latestVersion())
				: Optional.empty();
	}

	public String currentVersion() {
		return currentVersion;
	}

	static String parseTagName(String json) throws IOException {
		JsonNode node = mapper.readTree(json);
		JsonNode tag = node.get("tag_name");
		if (tag == null || !tag.isTextual()) {
			throw new IOException("No tag_name in response");
		}
		return tag.asText();
	}
}
