package io.b2mash.b2b.workflowengine.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards activity to the sink once the originating transaction has committed. A sink failure is
 * logged and never propagates back into the workflow operation.
 */
@Component
public class ActivityEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ActivityEventHandler.class);

  private final ActivityLogSink activityLogSink;

  public ActivityEventHandler(ActivityLogSink activityLogSink) {
    this.activityLogSink = activityLogSink;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onActivityLogged(ActivityLoggedEvent event) {
    try {
      activityLogSink.logEvent(event);
    } catch (Exception e) {
      log.warn(
          "Failed to record activity for firm={} project={} task={}",
          event.firmId(),
          event.projectId(),
          event.taskId(),
          e);
    }
  }
}
