package io.b2mash.b2b.workflowengine.cascade;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.exception.StaleCascadeException;
import io.b2mash.b2b.workflowengine.project.Project;
import io.b2mash.b2b.workflowengine.project.ProjectRepository;
import io.b2mash.b2b.workflowengine.schedule.RecurringInstance;
import io.b2mash.b2b.workflowengine.schedule.RecurringInstanceFactory;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import io.b2mash.b2b.workflowengine.workflow.WorkflowStages;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies task status changes across the ordered stages of a project's work type.
 *
 * <p>Only template-originated tasks that are not recurring instances take part, and automatic
 * cascading only happens in projects with dependency mode on:
 *
 * <ul>
 *   <li>Forward: the trigger at stage k reaches the terminal stage, so every earlier stage that is
 *       not terminal is completed.
 *   <li>Backward: the trigger at stage k returns to the default stage, so every later stage that
 *       is terminal is reset to default.
 * </ul>
 *
 * <p>Locks are taken in a fixed order (project row, trigger task, candidate tasks by id) so two
 * cascades in one project serialize instead of deadlocking. All writes of one call commit together.
 */
@Service
public class StageCascadeEngine {

  private static final Logger log = LoggerFactory.getLogger(StageCascadeEngine.class);

  private final TaskRepository taskRepository;
  private final TaskStatusRepository taskStatusRepository;
  private final ProjectRepository projectRepository;
  private final ProjectProgressTracker progressTracker;
  private final RecurringInstanceFactory recurringInstanceFactory;
  private final ApplicationEventPublisher eventPublisher;

  public StageCascadeEngine(
      TaskRepository taskRepository,
      TaskStatusRepository taskStatusRepository,
      ProjectRepository projectRepository,
      ProjectProgressTracker progressTracker,
      RecurringInstanceFactory recurringInstanceFactory,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.taskStatusRepository = taskStatusRepository;
    this.projectRepository = projectRepository;
    this.progressTracker = progressTracker;
    this.recurringInstanceFactory = recurringInstanceFactory;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public CascadeSummary advanceTaskStatus(UUID taskId, UUID newStatusId, UUID actorId) {
    return advanceTaskStatus(taskId, newStatusId, null, actorId);
  }

  /**
   * Moves a task to a new stage and cascades the change.
   *
   * @param expectedVersion the task version the caller last saw, or null to skip the check
   * @throws StaleCascadeException if the task changed since {@code expectedVersion} or a
   *     concurrent writer is detected while cascading
   */
  @Transactional
  public CascadeSummary advanceTaskStatus(
      UUID taskId, UUID newStatusId, Integer expectedVersion, UUID actorId) {
    // 1. Project lock first; the task's project never changes so an unlocked read is enough
    UUID projectId = resolveProjectId(taskId);
    try {
      Project project =
          projectId != null
              ? projectRepository
                  .findByIdForUpdate(projectId)
                  .orElseThrow(() -> new ResourceNotFoundException("Project", projectId))
              : null;
      var task =
          taskRepository
              .findByIdForUpdate(taskId)
              .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
      if (expectedVersion != null && expectedVersion != task.getVersion()) {
        throw new StaleCascadeException(
            projectId,
            "Task "
                + taskId
                + " is at version "
                + task.getVersion()
                + " but version "
                + expectedVersion
                + " was expected");
      }

      // 2. Validate the target stage against the task's workflow
      var oldStatus =
          taskStatusRepository
              .findById(task.getStatusId())
              .orElseThrow(() -> new ResourceNotFoundException("TaskStatus", task.getStatusId()));
      var newStatus =
          taskStatusRepository
              .findById(newStatusId)
              .orElseThrow(() -> new ResourceNotFoundException("TaskStatus", newStatusId));
      UUID workTypeId = project != null ? project.getWorkTypeId() : oldStatus.getWorkTypeId();
      if (!newStatus.getFirmId().equals(task.getFirmId())
          || !newStatus.getWorkTypeId().equals(workTypeId)) {
        throw new InvalidStateException(
            "Invalid status",
            "Status " + newStatusId + " is not a stage of work type " + workTypeId);
      }
      var stages =
          WorkflowStages.of(
              workTypeId, taskStatusRepository.findByWorkTypeIdOrderByPosition(workTypeId));

      // 3. Apply to the trigger task
      boolean reachedTerminal = newStatus.isTerminal() && !oldStatus.isTerminal();
      boolean returnedToDefault = newStatus.isDefault() && !oldStatus.isDefault();
      task.changeStatus(newStatus, actorId);

      var completed = new ArrayList<UUID>();
      var reset = new ArrayList<UUID>();
      var newlyTerminal = new ArrayList<Task>();
      if (reachedTerminal) {
        newlyTerminal.add(task);
      }
      var direction = CascadeDirection.NONE;

      // 4. Cascade across the project's template-originated tasks
      List<Task> candidates = List.of();
      Map<UUID, Integer> positions = Map.of();
      if (project != null) {
        candidates = taskRepository.findCascadeCandidatesForUpdate(project.getId());
        positions = progressTracker.stagePositions(candidates);
      }
      Integer triggerPosition = positions.get(task.getId());
      if (project != null
          && project.isTaskDependencyMode()
          && task.getTemplateTaskOriginId() != null
          && !task.isRecurringInstance()
          && triggerPosition != null) {
        int k = triggerPosition;
        if (reachedTerminal) {
          direction = CascadeDirection.FORWARD;
          for (var candidate : candidates) {
            int position = positions.getOrDefault(candidate.getId(), -1);
            if (position >= 1
                && position < k
                && !stages.isTerminal(candidate.getStatusId())) {
              candidate.changeStatus(stages.terminalStage(), actorId);
              completed.add(candidate.getId());
              newlyTerminal.add(candidate);
            }
          }
        } else if (returnedToDefault) {
          direction = CascadeDirection.BACKWARD;
          for (var candidate : candidates) {
            int position = positions.getOrDefault(candidate.getId(), -1);
            if (position > k && stages.isTerminal(candidate.getStatusId())) {
              candidate.changeStatus(stages.defaultStage(), actorId);
              reset.add(candidate.getId());
            }
          }
        }
      }

      // 5. Recurrence on completion
      var generated = generateOccurrences(newlyTerminal, actorId);

      taskRepository.flush();

      // 6. Reconcile project state
      KanbanColumn column = null;
      int completedTasks = 0;
      int totalTasks = 0;
      if (project != null) {
        var progress = progressTracker.reconcile(project, candidates, positions, stages);
        projectRepository.saveAndFlush(project);
        column = progress.column();
        completedTasks = progress.completedTasks();
        totalTasks = progress.totalTasks();
      }

      log.info(
          "Task {} moved to stage '{}' ({}): {} completed, {} reset",
          taskId,
          newStatus.getName(),
          direction,
          completed.size(),
          reset.size());
      eventPublisher.publishEvent(
          ActivityLoggedEvent.forTask(
              task.getFirmId(),
              projectId,
              taskId,
              actorId,
              describeAdvance(task, newStatus, completed.size(), reset.size())));

      return new CascadeSummary(
          projectId,
          taskId,
          direction,
          completed,
          reset,
          List.of(),
          column,
          completedTasks,
          totalTasks,
          generated);
    } catch (ConcurrencyFailureException e) {
      throw new StaleCascadeException(
          projectId, "Concurrent modification while updating task " + taskId, e);
    }
  }

  /**
   * Moves a project straight to a Kanban column, leaving the tasks as if they had been moved one
   * by one: earlier stages completed, the target stage active, later stages back at default.
   * Applies regardless of the project's dependency mode.
   */
  @Transactional
  public CascadeSummary moveProjectToColumn(UUID projectId, KanbanColumn target, UUID actorId) {
    try {
      var project =
          projectRepository
              .findByIdForUpdate(projectId)
              .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
      var stages = progressTracker.stagesOf(project);
      if (!target.completed()) {
        // Fails fast on a position outside 1..N
        stages.atPosition(target.stagePosition());
      }

      var candidates = taskRepository.findCascadeCandidatesForUpdate(projectId);
      var positions = progressTracker.stagePositions(candidates);

      var completed = new ArrayList<UUID>();
      var reset = new ArrayList<UUID>();
      var reactivated = new ArrayList<UUID>();
      var newlyTerminal = new ArrayList<Task>();

      for (var candidate : candidates) {
        Integer position = positions.get(candidate.getId());
        if (position == null) {
          continue;
        }
        boolean terminal = stages.isTerminal(candidate.getStatusId());
        if (target.completed() || position < target.stagePosition()) {
          if (!terminal) {
            candidate.changeStatus(stages.terminalStage(), actorId);
            completed.add(candidate.getId());
            newlyTerminal.add(candidate);
          }
        } else if (position.equals(target.stagePosition())) {
          if (terminal) {
            candidate.changeStatus(stages.firstActiveStage(), actorId);
            reactivated.add(candidate.getId());
          }
        } else if (!stages.isDefault(candidate.getStatusId())) {
          candidate.changeStatus(stages.defaultStage(), actorId);
          reset.add(candidate.getId());
        }
      }

      var generated = generateOccurrences(newlyTerminal, actorId);
      taskRepository.flush();

      var progress = progressTracker.reconcile(project, candidates, positions, stages);
      projectRepository.saveAndFlush(project);

      log.info(
          "Project {} moved to column {}: {} completed, {} reset, {} reactivated",
          projectId,
          target,
          completed.size(),
          reset.size(),
          reactivated.size());
      eventPublisher.publishEvent(
          ActivityLoggedEvent.forProject(
              project.getFirmId(),
              projectId,
              actorId,
              "Moved project '" + project.getName() + "' to " + describeColumn(target, stages)));

      return new CascadeSummary(
          projectId,
          null,
          CascadeDirection.COLUMN_MOVE,
          completed,
          reset,
          reactivated,
          progress.column(),
          progress.completedTasks(),
          progress.totalTasks(),
          generated);
    } catch (ConcurrencyFailureException e) {
      throw new StaleCascadeException(
          projectId, "Concurrent modification while moving project " + projectId, e);
    }
  }

  @Transactional
  public CascadeSummary moveProjectToColumn(UUID projectId, String column, UUID actorId) {
    return moveProjectToColumn(projectId, KanbanColumn.parse(column), actorId);
  }

  @Transactional(readOnly = true)
  public KanbanColumn kanbanColumn(UUID projectId) {
    return progress(projectId).column();
  }

  @Transactional(readOnly = true)
  public ProjectProgress progress(UUID projectId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    return progressTracker.progressOf(project);
  }

  private UUID resolveProjectId(UUID taskId) {
    Optional<UUID> projectId = taskRepository.findProjectIdById(taskId);
    if (projectId.isEmpty() && !taskRepository.existsById(taskId)) {
      throw new ResourceNotFoundException("Task", taskId);
    }
    return projectId.orElse(null);
  }

  /**
   * Records the completion on each affected recurring master and generates its next occurrence.
   * An occurrence completed ahead of its due date counts as completed on the due date, so early
   * completion advances the series instead of regenerating the same date.
   */
  private List<UUID> generateOccurrences(List<Task> newlyTerminal, UUID actorId) {
    var generated = new ArrayList<UUID>();
    LocalDate today = LocalDate.now();
    for (var task : newlyTerminal) {
      UUID masterId =
          task.isRecurringInstance()
              ? task.getMasterTaskId()
              : task.isRecurring() ? task.getId() : null;
      if (masterId == null) {
        continue;
      }
      var master =
          masterId.equals(task.getId())
              ? task
              : taskRepository.findByIdForUpdate(masterId).orElse(null);
      if (master == null || !master.isRecurring()) {
        continue;
      }
      LocalDate due = task.getDueDate();
      master.recordCompletion(due != null && due.isAfter(today) ? due : today);
      recurringInstanceFactory
          .generateNext(masterId, actorId)
          .filter(RecurringInstance::created)
          .ifPresent(instance -> generated.add(instance.task().getId()));
    }
    return generated;
  }

  private static String describeAdvance(
      Task task, TaskStatus status, int completedCount, int resetCount) {
    var message = new StringBuilder();
    message.append("Moved task '").append(task.getTitle()).append("' to '");
    message.append(status.getName()).append("'");
    if (completedCount > 0) {
      message.append("; auto-completed ").append(completedCount).append(" earlier task(s)");
    }
    if (resetCount > 0) {
      message.append("; reset ").append(resetCount).append(" later task(s)");
    }
    return message.toString();
  }

  private static String describeColumn(KanbanColumn column, WorkflowStages stages) {
    if (column.completed()) {
      return "Completed";
    }
    return "'" + stages.atPosition(column.stagePosition()).getName() + "'";
  }
}
