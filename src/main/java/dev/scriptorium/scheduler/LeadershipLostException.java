package dev.scriptorium.scheduler;

/** Thrown inside a job body once the worker no longer holds the job's lease. */
public class LeadershipLostException extends RuntimeException {

  public LeadershipLostException(String jobName, String holder) {
    super("Worker " + holder + " lost the lease on job '" + jobName + "'");
  }
}
