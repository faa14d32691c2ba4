package dev.scriptorium.model;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs embedding and scoring model calls with a time budget.
 *
 * <p>Calls execute on a dedicated bounded pool; the caller waits at most {@code timeout}. A call
 * that times out is cancelled (its worker thread interrupted) and reported as a {@link
 * ModelUnavailableException}, as is any exception the model throws.
 */
@Component
public class ModelCallGuard {

  private static final Logger log = LoggerFactory.getLogger(ModelCallGuard.class);

  private final Duration timeout;
  private final ExecutorService executor;

  @Autowired
  public ModelCallGuard(ModelProperties properties) {
    this(properties.timeout(), properties.concurrency());
  }

  public ModelCallGuard(Duration timeout, int concurrency) {
    this.timeout = timeout;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            concurrency,
            runnable -> {
              Thread thread = new Thread(runnable, "model-call-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Invokes a model call within the configured time budget.
   *
   * @param operation short description used in logs and error messages
   * @param call the model invocation
   * @return the call's result
   * @throws ModelUnavailableException if the call fails, times out, or the caller is interrupted
   */
  public <T> T call(String operation, Supplier<T> call) {
    Future<T> future;
    try {
      future = executor.submit(call::get);
    } catch (RejectedExecutionException e) {
      throw new ModelUnavailableException(operation, "Model executor is shut down", e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Model call '{}' exceeded {}ms", operation, timeout.toMillis());
      throw new ModelUnavailableException(
          operation, "Model call '" + operation + "' timed out after " + timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("Model call '{}' failed: {}", operation, cause.getMessage());
      throw new ModelUnavailableException(
          operation, "Model call '" + operation + "' failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ModelUnavailableException(operation, "Interrupted while waiting for " + operation, e);
    }
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }
}
