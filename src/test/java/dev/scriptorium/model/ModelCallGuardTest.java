package dev.scriptorium.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ModelCallGuardTest {

  private final ModelCallGuard guard = new ModelCallGuard(Duration.ofMillis(200), 2);

  @AfterEach
  void tearDown() {
    guard.shutdown();
  }

  @Test
  void returnsResultOfSuccessfulCall() {
    assertThat(guard.call("embed query", () -> 42)).isEqualTo(42);
  }

  @Test
  void wrapsModelFailure() {
    assertThatThrownBy(
            () ->
                guard.call(
                    "score",
                    () -> {
                      throw new IllegalStateException("onnx session closed");
                    }))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessageContaining("onnx session closed")
        .hasCauseInstanceOf(IllegalStateException.class)
        .satisfies(e -> assertThat(((ModelUnavailableException) e).getOperation()).isEqualTo("score"));
  }

  @Test
  void timesOutAndInterruptsSlowCall() throws InterruptedException {
    CountDownLatch interrupted = new CountDownLatch(1);

    assertThatThrownBy(
            () ->
                guard.call(
                    "embed batch",
                    () -> {
                      try {
                        Thread.sleep(10_000);
                      } catch (InterruptedException e) {
                        interrupted.countDown();
                      }
                      return null;
                    }))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessageContaining("timed out");

    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void rejectsCallsAfterShutdown() {
    guard.shutdown();

    assertThatThrownBy(() -> guard.call("embed query", () -> 1))
        .isInstanceOf(ModelUnavailableException.class);
  }
}
