package dev.scriptorium.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import dev.scriptorium.BaseIntegrationTest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JpaJobLockStoreIT extends BaseIntegrationTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired JpaJobLockStore store;

  @Test
  void firstAcquireCreatesTheLock() {
    assertThat(store.tryAcquire("reindex", "a", T0, T0.plusSeconds(60))).isTrue();
    assertThat(store.tryAcquire("reindex", "b", T0.plusSeconds(10), T0.plusSeconds(70))).isFalse();
  }

  @Test
  void expiredLeaseCanBeTakenOver() {
    store.tryAcquire("reindex", "a", T0, T0.plusSeconds(60));

    assertThat(store.tryAcquire("reindex", "b", T0.plusSeconds(60), T0.plusSeconds(120))).isTrue();
    assertThat(store.findAll())
        .singleElement()
        .satisfies(lock -> assertThat(lock.holder()).isEqualTo("b"));
  }

  @Test
  void renewOnlyExtendsAnUnexpiredLeaseOfTheHolder() {
    store.tryAcquire("reindex", "a", T0, T0.plusSeconds(60));

    assertThat(store.renew("reindex", "b", T0.plusSeconds(30), T0.plusSeconds(90))).isFalse();
    assertThat(store.renew("reindex", "a", T0.plusSeconds(30), T0.plusSeconds(90))).isTrue();
    assertThat(store.renew("reindex", "a", T0.plusSeconds(90), T0.plusSeconds(150))).isFalse();
  }

  @Test
  void releaseOnlyByHolder() {
    store.tryAcquire("reindex", "a", T0, T0.plusSeconds(60));

    assertThat(store.release("reindex", "b")).isFalse();
    assertThat(store.release("reindex", "a")).isTrue();
    assertThat(store.findAll().get(0).stateAt(T0)).isEqualTo(LockState.UNLOCKED);
    assertThat(store.tryAcquire("reindex", "b", T0.plusSeconds(1), T0.plusSeconds(61))).isTrue();
  }

  @Test
  void concurrentContendersProduceExactlyOneWinner() throws Exception {
    int contenders = 8;
    ExecutorService pool = Executors.newFixedThreadPool(contenders);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < contenders; i++) {
        String worker = "worker-" + i;
        Callable<Boolean> attempt =
            () -> {
              start.await();
              return store.tryAcquire("cleanup", worker, T0, T0.plusSeconds(60));
            };
        results.add(pool.submit(attempt));
      }
      start.countDown();

      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(30, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
