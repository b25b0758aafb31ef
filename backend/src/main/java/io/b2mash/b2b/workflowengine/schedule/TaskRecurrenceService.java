package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Turns tasks into recurring masters and back. */
@Service
public class TaskRecurrenceService {

  private static final Logger log = LoggerFactory.getLogger(TaskRecurrenceService.class);

  private final TaskRepository taskRepository;
  private final DueDateCalculator dueDateCalculator;
  private final ApplicationEventPublisher eventPublisher;

  public TaskRecurrenceService(
      TaskRepository taskRepository,
      DueDateCalculator dueDateCalculator,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.dueDateCalculator = dueDateCalculator;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Makes the task a recurring master. The next occurrence is seeded from the task's due date, or
   * today when it has none.
   */
  @Transactional
  public Task configureRecurrence(UUID taskId, String rule, UUID actorId) {
    var task = lockTask(taskId);
    if (task.isRecurringInstance()) {
      throw new InvalidStateException(
          "Recurring instance",
          "Task " + taskId + " is an instance of master " + task.getMasterTaskId()
              + "; configure recurrence on the master instead");
    }
    var parsed = dueDateCalculator.validate(rule);
    LocalDate base = task.getDueDate() != null ? task.getDueDate() : LocalDate.now();
    LocalDate nextDue = dueDateCalculator.next(parsed, base);
    task.configureRecurrence(parsed.toString(), nextDue);

    log.info("Task {} recurs '{}', next occurrence {}", taskId, parsed, nextDue);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forTask(
            task.getFirmId(),
            task.getProjectId(),
            taskId,
            actorId,
            "Set task '" + task.getTitle() + "' to recur " + parsed));
    return task;
  }

  @Transactional
  public Task clearRecurrence(UUID taskId, UUID actorId) {
    var task = lockTask(taskId);
    if (!task.isRecurring()) {
      return task;
    }
    task.clearRecurrence();

    log.info("Task {} no longer recurs", taskId);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forTask(
            task.getFirmId(),
            task.getProjectId(),
            taskId,
            actorId,
            "Stopped recurrence of task '" + task.getTitle() + "'"));
    return task;
  }

  private Task lockTask(UUID taskId) {
    return taskRepository
        .findByIdForUpdate(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }
}
