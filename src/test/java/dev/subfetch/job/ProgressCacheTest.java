package dev.subfetch.job;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressCacheTest {

	private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

	@Test
	void testFirstReadTakesSnapshot() {
		JobStore store = new JobStore(List.of(Path.of("a.mkv"), Path.of("b.mkv")));
		ProgressCache cache = new ProgressCache(store, clock, Duration.ofMillis(500));

		assertThat(cache.lastUpdate()).isNull();
		assertThat(cache.counts().pending()).isEqualTo(2);
		assertThat(cache.lastUpdate()).isEqualTo(clock.instant());
	}

	@Test
	void testReadsWithinIntervalAreServedFromCache() {
		// Given
		JobStore store = new JobStore(List.of(Path.of("a.mkv"), Path.of("b.mkv")));
		ProgressCache cache = new ProgressCache(store, clock, Duration.ofMillis(500));
		cache.counts();

		// When
		store.markRunning(0);
		clock.advance(Duration.ofMillis(499));

		// Then
		assertThat(cache.counts().running()).isZero();
		assertThat(cache.jobs().get(0).status()).isEqualTo(JobStatus.pending());
	}

	@Test
	void testStaleCacheIsRefreshed() {
		// Given
		JobStore store = new JobStore(List.of(Path.of("a.mkv"), Path.of("b.mkv")));
		ProgressCache cache = new ProgressCache(store, clock, Duration.ofMillis(500));
		cache.counts();

		// When
		store.markRunning(0);
		clock.advance(Duration.ofMillis(500));

		// Then
		assertThat(cache.counts().running()).isEqualTo(1);
		assertThat(cache.jobs().get(0).status()).isEqualTo(JobStatus.running());
	}

	@Test
	void testExplicitRefresh() {
		JobStore store = new JobStore(List.of(Path.of("a.mkv")));
		ProgressCache cache = new ProgressCache(store, clock, Duration.ofHours(1));
		cache.counts();
		store.markRunning(0);

		cache.refresh();

		assertThat(cache.counts().running()).isEqualTo(1);
	}

	@Test
	void testJobsAndCountsComeFromTheSameSnapshot() {
		// Given
		JobStore store = new JobStore(List.of(Path.of("a.mkv"), Path.of("b.mkv"), Path.of("c.mkv")));
		store.markRunning(0);
		store.complete(0, JobStatus.success(), List.of(), null);
		ProgressCache cache = new ProgressCache(store, clock, Duration.ofMillis(500));

		// When
		List<Job> jobs = cache.jobs();
		JobCounts counts = cache.counts();

		// Then
		assertThat(counts).isEqualTo(JobCounts.of(jobs));
	}
}
