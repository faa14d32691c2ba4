package dev.scriptorium.scheduler;

import org.jspecify.annotations.Nullable;

/**
 * Handle a running job body uses to check it still holds its lease.
 *
 * <p>Long-running bodies call {@link #ensureLeadership()} between units of work. When the lease is
 * lost, the runner also interrupts the body's thread so blocking calls return early.
 */
public class JobContext {

  private final String jobName;
  private final String holder;
  private volatile boolean leadershipLost;
  private volatile @Nullable Thread bodyThread;

  public JobContext(String jobName, String holder) {
    this.jobName = jobName;
    this.holder = holder;
  }

  public String jobName() {
    return jobName;
  }

  public String holder() {
    return holder;
  }

  public boolean isLeader() {
    return !leadershipLost;
  }

  /**
   * @throws LeadershipLostException if the lease has been lost
   */
  public void ensureLeadership() {
    if (leadershipLost) {
      throw new LeadershipLostException(jobName, holder);
    }
  }

  void bindThread(@Nullable Thread thread) {
    this.bodyThread = thread;
  }

  void markLeadershipLost() {
    leadershipLost = true;
    Thread thread = bodyThread;
    if (thread != null) {
      thread.interrupt();
    }
  }
}
