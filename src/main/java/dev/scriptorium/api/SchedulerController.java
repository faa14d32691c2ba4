package dev.scriptorium.api;

import dev.scriptorium.scheduler.JobLockManager;
import dev.scriptorium.scheduler.JobLockStatus;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of job locks across all workers. */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

  private final JobLockManager lockManager;

  public SchedulerController(JobLockManager lockManager) {
    this.lockManager = lockManager;
  }

  @GetMapping("/locks")
  public List<JobLockStatus> locks() {
    return lockManager.status();
  }
}
