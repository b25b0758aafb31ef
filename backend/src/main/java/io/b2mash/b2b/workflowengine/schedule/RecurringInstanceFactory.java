package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.project.ProjectRepository;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import io.b2mash.b2b.workflowengine.workflow.WorkflowStages;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates occurrences of a recurring master task. Idempotent: if an occurrence for the computed
 * due date already exists it is returned instead of creating a duplicate.
 *
 * <p>Completing a task goes through {@link #generateNext}, which steps from the completion date.
 * The periodic sweep goes through {@link #generateDue}, which steps from the latest occurrence
 * already generated. Both lock the master row for the duration of the call, leave the master's
 * {@code nextDueDate} on the first date not yet generated, and rely on the unique index on {@code
 * (master_task_id, due_date)} to back the existence check.
 */
@Service
public class RecurringInstanceFactory {

  private static final Logger log = LoggerFactory.getLogger(RecurringInstanceFactory.class);

  private final TaskRepository taskRepository;
  private final TaskStatusRepository taskStatusRepository;
  private final ProjectRepository projectRepository;
  private final DueDateCalculator dueDateCalculator;
  private final ApplicationEventPublisher eventPublisher;

  public RecurringInstanceFactory(
      TaskRepository taskRepository,
      TaskStatusRepository taskStatusRepository,
      ProjectRepository projectRepository,
      DueDateCalculator dueDateCalculator,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.taskStatusRepository = taskStatusRepository;
    this.projectRepository = projectRepository;
    this.dueDateCalculator = dueDateCalculator;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Generates the occurrence after the later of the master's last completion and its due date.
   *
   * @return empty when the task is not (or no longer) recurring
   * @throws InvalidStateException if {@code masterTaskId} is itself a generated instance
   */
  @Transactional
  public Optional<RecurringInstance> generateNext(UUID masterTaskId, UUID actorId) {
    var master = lockMaster(masterTaskId);
    if (master.isEmpty()) {
      return Optional.empty();
    }
    LocalDate fromDate = later(master.get().getLastCompletedOn(), master.get().getDueDate());
    LocalDate nextDue = dueDateCalculator.next(master.get().getRecurrenceRule(), fromDate);
    return Optional.of(occurrenceOn(master.get(), nextDue, actorId));
  }

  /**
   * Generates the occurrence after the latest one already generated (or after the master's own
   * due date when there is none), provided it falls on or before {@code asOf}. Never steps back
   * behind the master's scheduled {@code nextDueDate}.
   *
   * @return empty when the task is not recurring or its next occurrence is not yet due
   * @throws InvalidStateException if {@code masterTaskId} is itself a generated instance
   */
  @Transactional
  public Optional<RecurringInstance> generateDue(UUID masterTaskId, LocalDate asOf, UUID actorId) {
    var master = lockMaster(masterTaskId);
    if (master.isEmpty()) {
      return Optional.empty();
    }
    var task = master.get();
    LocalDate fromDate = latestGeneratedDueDate(task).orElse(null);
    if (task.getLastCompletedOn() != null || task.getDueDate() != null) {
      fromDate = later(fromDate, later(task.getLastCompletedOn(), task.getDueDate()));
    }
    // nextDueDate already points past dates taken by project tasks of the same origin
    LocalDate nextDue = task.getNextDueDate();
    if (fromDate != null) {
      nextDue = later(nextDue, dueDateCalculator.next(task.getRecurrenceRule(), fromDate));
    }
    if (nextDue == null) {
      return Optional.empty();
    }

    if (nextDue.isAfter(asOf)) {
      task.scheduleNextOccurrence(nextDue);
      log.debug("Next occurrence of master {} is due {}, after {}", masterTaskId, nextDue, asOf);
      return Optional.empty();
    }
    return Optional.of(occurrenceOn(task, nextDue, actorId));
  }

  /**
   * Locks the master and checks that it can generate occurrences.
   *
   * @return empty when the task is not (or no longer) recurring
   */
  private Optional<Task> lockMaster(UUID masterTaskId) {
    var master =
        taskRepository
            .findByIdForUpdate(masterTaskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", masterTaskId));

    if (master.isRecurringInstance()) {
      throw new InvalidStateException(
          "Not a recurring master",
          "Task " + masterTaskId + " is an instance of master " + master.getMasterTaskId());
    }
    if (!master.isRecurring() || master.getRecurrenceRule() == null) {
      log.debug("Task {} is not recurring; nothing to generate", masterTaskId);
      return Optional.empty();
    }
    return Optional.of(master);
  }

  /** Returns the occurrence due on {@code dueDate}, creating it when it does not exist yet. */
  private RecurringInstance occurrenceOn(Task master, LocalDate dueDate, UUID actorId) {
    var existing = findExistingOccurrence(master, dueDate);
    if (existing.isPresent()) {
      advanceSchedule(master, dueDate);
      log.debug(
          "Occurrence of master {} due {} already exists as task {}",
          master.getId(),
          dueDate,
          existing.get().getId());
      return new RecurringInstance(existing.get(), false);
    }

    var instance =
        taskRepository.saveAndFlush(
            Task.newRecurringInstance(master, dueDate, defaultStatusFor(master)));
    advanceSchedule(master, dueDate);

    log.info(
        "Generated recurring instance {} of master {} due {}",
        instance.getId(),
        master.getId(),
        dueDate);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forTask(
            master.getFirmId(),
            master.getProjectId(),
            instance.getId(),
            actorId,
            "Generated recurring task '" + instance.getTitle() + "' due " + dueDate));

    return new RecurringInstance(instance, true);
  }

  /** Points {@code nextDueDate} at the occurrence after the latest one generated so far. */
  private void advanceSchedule(Task master, LocalDate occurrenceDate) {
    LocalDate latest = later(occurrenceDate, latestGeneratedDueDate(master).orElse(null));
    master.scheduleNextOccurrence(dueDateCalculator.next(master.getRecurrenceRule(), latest));
  }

  private Optional<LocalDate> latestGeneratedDueDate(Task master) {
    return taskRepository
        .findFirstByMasterTaskIdOrderByDueDateDesc(master.getId())
        .map(Task::getDueDate);
  }

  /** An instance of the master, or a project task with the same origin, due on that date. */
  private Optional<Task> findExistingOccurrence(Task master, LocalDate dueDate) {
    var instance = taskRepository.findByMasterTaskIdAndDueDate(master.getId(), dueDate);
    if (instance.isPresent()
        || master.getProjectId() == null
        || master.getTemplateTaskOriginId() == null) {
      return instance;
    }
    return taskRepository
        .findSameOriginOnDate(
            master.getProjectId(), master.getTemplateTaskOriginId(), dueDate, master.getId())
        .stream()
        .findFirst();
  }

  private TaskStatus defaultStatusFor(Task master) {
    UUID workTypeId;
    if (master.getProjectId() != null) {
      workTypeId =
          projectRepository
              .findById(master.getProjectId())
              .orElseThrow(() -> new ResourceNotFoundException("Project", master.getProjectId()))
              .getWorkTypeId();
    } else {
      workTypeId =
          taskStatusRepository
              .findById(master.getStatusId())
              .orElseThrow(() -> new ResourceNotFoundException("TaskStatus", master.getStatusId()))
              .getWorkTypeId();
    }
    var stages = taskStatusRepository.findByWorkTypeIdOrderByPosition(workTypeId);
    return WorkflowStages.of(workTypeId, stages).defaultStage();
  }

  private static LocalDate later(LocalDate a, LocalDate b) {
    if (a == null && b == null) {
      return LocalDate.now();
    }
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isAfter(b) ? a : b;
  }
}
