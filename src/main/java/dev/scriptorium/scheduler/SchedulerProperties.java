package dev.scriptorium.scheduler;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Scheduler settings bound from {@code scriptorium.scheduler.*}.
 *
 * @param enabled whether this process takes part in leader election at all
 * @param workerId identity written into lock rows; defaults to {@code <hostname>-<pid>-<random>}
 * @param initialDelay delay before the first tick of every job
 * @param jobs per-job overrides keyed by job name
 */
@ConfigurationProperties(prefix = "scriptorium.scheduler")
public record SchedulerProperties(
    @DefaultValue("true") boolean enabled,
    @Nullable String workerId,
    @DefaultValue("30s") Duration initialDelay,
    @Nullable Map<String, JobSettings> jobs) {

  public SchedulerProperties {
    if (workerId == null || workerId.isBlank()) {
      workerId = defaultWorkerId();
    }
    if (initialDelay.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.scheduler.initial-delay must not be negative, got: " + initialDelay);
    }
    jobs = jobs == null ? Map.of() : Map.copyOf(jobs);
  }

  public Duration intervalFor(ScheduledJob job) {
    JobSettings settings = jobs.get(job.name());
    return settings != null && settings.interval() != null
        ? settings.interval()
        : job.defaultInterval();
  }

  public Duration leaseFor(ScheduledJob job) {
    JobSettings settings = jobs.get(job.name());
    return settings != null && settings.lease() != null ? settings.lease() : job.defaultLease();
  }

  static String defaultWorkerId() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      host = "unknown-host";
    }
    String random = UUID.randomUUID().toString().substring(0, 8);
    return host + "-" + ProcessHandle.current().pid() + "-" + random;
  }

  /**
   * Overrides for one job.
   *
   * @param interval delay between the end of one tick and the start of the next
   * @param lease lease length; renewed every half lease while the job runs
   */
  public record JobSettings(@Nullable Duration interval, @Nullable Duration lease) {}
}
