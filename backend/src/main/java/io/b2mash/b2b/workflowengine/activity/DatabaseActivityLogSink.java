package io.b2mash.b2b.workflowengine.activity;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Persists activity to {@code activity_logs} in its own transaction. */
@Service
public class DatabaseActivityLogSink implements ActivityLogSink {

  private final ActivityLogRepository activityLogRepository;

  public DatabaseActivityLogSink(ActivityLogRepository activityLogRepository) {
    this.activityLogRepository = activityLogRepository;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void logEvent(ActivityLoggedEvent event) {
    activityLogRepository.save(
        new ActivityLog(
            event.firmId(),
            event.message(),
            event.actorId(),
            event.projectId(),
            event.taskId(),
            event.occurredAt()));
  }
}
