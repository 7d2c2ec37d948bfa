package dev.subfetch.job;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class DownloadSchedulerTest {

	private static final Duration FAST_POLL = Duration.ofMillis(10);

	private static List<Path> targets(int n) {
		List<Path> targets = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			targets.add(Path.of("video" + i + ".mkv"));
		}
		return targets;
	}

	@Test
	void testConcurrencyLimitAndSubmissionOrder() {
		// Given
		JobStore store = new JobStore(targets(10));
		AtomicInteger active = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		List<Integer> admitted = new CopyOnWriteArrayList<>();
		DownloadScheduler scheduler = new DownloadScheduler(
				store,
				3,
				new CancellationToken(),
				(index, target) -> {
					admitted.add(index);
					return () -> {
						int now = active.incrementAndGet();
						peak.accumulateAndGet(now, Math::max);
						try {
							Thread.sleep(20);
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
						store.complete(index, JobStatus.success(), List.of(), null);
						active.decrementAndGet();
					};
				},
				FAST_POLL);

		// When
		scheduler.run();

		// Then
		assertThat(peak.get()).isBetween(1, 3);
		assertThat(admitted).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
		assertThat(store.snapshot()).allSatisfy(job -> assertThat(job.status()).isEqualTo(JobStatus.success()));
	}

	@Test
	void testConcurrencyOfOneRunsSequentially() {
		JobStore store = new JobStore(targets(4));
		AtomicInteger active = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		DownloadScheduler scheduler = new DownloadScheduler(
				store,
				1,
				new CancellationToken(),
				(index, target) -> () -> {
					peak.accumulateAndGet(active.incrementAndGet(), Math::max);
					store.complete(index, JobStatus.failed("no"), List.of(), null);
					active.decrementAndGet();
				},
				FAST_POLL);

		scheduler.run();

		assertThat(peak.get()).isEqualTo(1);
		assertThat(store.counts().failed()).isEqualTo(4);
	}

	@Test
	void testCancelMarksEveryUnfinishedJobAndDiscardsLateOutcomes() throws Exception {
		// Given
		JobStore store = new JobStore(targets(5));
		CancellationToken token = new CancellationToken();
		CountDownLatch started = new CountDownLatch(2);
		CountDownLatch release = new CountDownLatch(1);
		CountDownLatch finished = new CountDownLatch(2);
		AtomicInteger created = new AtomicInteger();
		List<Boolean> applied = new CopyOnWriteArrayList<>();
		DownloadScheduler scheduler = new DownloadScheduler(
				store,
				2,
				token,
				(index, target) -> {
					created.incrementAndGet();
					return () -> {
						started.countDown();
						try {
							release.await();
							applied.add(store.complete(index, JobStatus.success(), List.of(), null));
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						} finally {
							finished.countDown();
						}
					};
				},
				FAST_POLL);
		Thread schedulerThread = new Thread(scheduler, "test-scheduler");
		schedulerThread.start();
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		// When
		token.cancel();
		schedulerThread.join(5000);
		release.countDown();
		assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();

		// Then
		assertThat(schedulerThread.isAlive()).isFalse();
		assertThat(created.get()).isEqualTo(2);
		assertThat(applied).containsExactly(false, false);
		assertThat(store.snapshot()).allSatisfy(job -> assertThat(job.status().isCancelled()).isTrue());
	}

	@Test
	void testCancelledBeforeStartAdmitsNothing() {
		// Given
		JobStore store = new JobStore(targets(3));
		CancellationToken token = new CancellationToken();
		token.cancel();
		AtomicInteger created = new AtomicInteger();

		// When
		new DownloadScheduler(
						store,
						2,
						token,
						(index, target) -> {
							created.incrementAndGet();
							return () -> {};
						},
						FAST_POLL)
				.run();

		// Then
		assertThat(created.get()).isZero();
		assertThat(store.counts().failed()).isEqualTo(3);
	}

	@Test
	void testEmptyRunFinishesImmediately() {
		JobStore store = new JobStore(List.of());

		new DownloadScheduler(store, 5, new CancellationToken(), (index, target) -> () -> {}, FAST_POLL).run();

		assertThat(store.size()).isZero();
	}

	@Test
	void testInvalidConcurrency() {
		JobStore store = new JobStore(targets(1));

		assertThatThrownBy(() -> new DownloadScheduler(store, 0, new CancellationToken(), (i, t) -> () -> {}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("at least 1");
	}
}
