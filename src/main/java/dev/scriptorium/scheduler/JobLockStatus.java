package dev.scriptorium.scheduler;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Lock state as exposed for observability. */
public record JobLockStatus(
    String jobName,
    LockState state,
    @Nullable String holder,
    @Nullable Instant leaseExpiresAt,
    @Nullable Instant acquiredAt) {}
