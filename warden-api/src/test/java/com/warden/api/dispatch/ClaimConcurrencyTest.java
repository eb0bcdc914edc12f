package com.warden.api.dispatch;

import com.warden.api.StoreFixtures;
import com.warden.domain.job.JobStatus;
import com.warden.infrastructure.job.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent claims on PostgreSQL, where {@code SKIP LOCKED} is applied before {@code LIMIT}:
 * a claim comes back empty only when every queued job is taken or locked by another claimant.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ClaimConcurrencyTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void postgres(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
  }

  private static final int POLLERS = 8;

  @Autowired DispatchService dispatch;
  @Autowired StoreFixtures fixtures;
  @Autowired JobRepository jobs;

  private long deploymentId;

  @BeforeEach
  void setUp() {
    fixtures.wipe();
    deploymentId = fixtures.deployment(fixtures.integration("aws-s3"), "default", null);
  }

  @ParameterizedTest(name = "{0} pollers, {1} queued jobs")
  @CsvSource({"8, 3", "8, 8", "8, 12"})
  void oneClaimPerPollerReturnsMinOfPollersAndJobs(int pollers, int queued) throws Exception {
    List<Long> enqueued = new ArrayList<>();
    for (int i = 0; i < queued; i++) enqueued.add(dispatch.enqueue(deploymentId));

    List<Optional<JobView>> results = claimConcurrently(pollers, () -> dispatch.claimNext("default"));

    List<Long> claimed = results.stream().flatMap(Optional::stream).map(JobView::id).toList();
    int expected = Math.min(pollers, queued);

    assertThat(claimed).hasSize(expected).doesNotHaveDuplicates();
    assertThat(enqueued).containsAll(claimed);
    assertThat(results.stream().filter(Optional::isEmpty).count()).isEqualTo(pollers - expected);
    assertThat(jobs.countByStatus(JobStatus.IN_PROGRESS)).isEqualTo(expected);
    assertThat(jobs.countByStatus(JobStatus.QUEUED)).isEqualTo(queued - expected);
  }

  @Test
  void pollersDrainTheQueueWithoutOverlap() throws Exception {
    int queued = 40;
    List<Long> enqueued = new ArrayList<>();
    for (int i = 0; i < queued; i++) enqueued.add(dispatch.enqueue(deploymentId));

    ConcurrentLinkedQueue<Long> claimed = new ConcurrentLinkedQueue<>();
    claimConcurrently(POLLERS, () -> {
      // an empty claim means nothing is left that another poller will not take
      Optional<JobView> job = dispatch.claimNext("default");
      while (job.isPresent()) {
        claimed.add(job.get().id());
        job = dispatch.claimNext("default");
      }
      return job;
    });

    assertThat(claimed).hasSize(queued);
    assertThat(new HashSet<>(claimed)).containsExactlyInAnyOrderElementsOf(enqueued);
    assertThat(jobs.countByStatus(JobStatus.QUEUED)).isZero();
  }

  private static <T> List<T> claimConcurrently(int pollers, Callable<T> claim) throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(pollers);
    try {
      List<Future<T>> futures = new ArrayList<>();
      for (int p = 0; p < pollers; p++) {
        futures.add(pool.submit(() -> {
          start.await();
          return claim.call();
        }));
      }
      start.countDown();
      List<T> results = new ArrayList<>();
      for (Future<T> f : futures) results.add(f.get(60, TimeUnit.SECONDS));
      return results;
    } finally {
      pool.shutdownNow();
    }
  }
}
