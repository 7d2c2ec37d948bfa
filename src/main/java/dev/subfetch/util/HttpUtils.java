package dev.subfetch.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** Utility class for HTTP operations */
public class HttpUtils {

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	private final HttpClient httpClient;
	private final String userAgent;

	public static final String GITHUB_TOKEN_PROP = "github.token";
	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);

	public HttpUtils(String userAgent) {
		this.userAgent = userAgent;
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
	}

	/** Download content from a URL as a string */
	public String downloadString(String url) throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest request = request(url).build();
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw new IOException(
						"Failed to download content: " + url + " - HTTP status: " + response.statusCode());
			}
			return response.body();
		});
	}

	private HttpRequest.Builder request(String url) {
		URI uri = URI.create(url);
		HttpRequest.Builder builder =
				HttpRequest.newBuilder().uri(uri).header("User-Agent", userAgent).GET();

		// GitHub rate-limits anonymous API calls, use a token when one is configured
		if (uri.getHost().equalsIgnoreCase("api.github.com")) {
			String token = System.getProperty(GITHUB_TOKEN_PROP);
			if (token != null && !token.isEmpty()) {
				builder.header("Authorization", "Bearer " + token);
			}
		}

		return builder;
	}

	/**
	 * Retry an operation with exponential backoff
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < DEFAULT_MAX_RETRIES; attempt++) {
			try {
				return operation.get();
			} catch (IOException e) {
				lastException = e;
				if (attempt < DEFAULT_MAX_RETRIES - 1) {
					long backoffMillis = INITIAL_BACKOFF.toMillis() * (1L << attempt);
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException;
	}
}
