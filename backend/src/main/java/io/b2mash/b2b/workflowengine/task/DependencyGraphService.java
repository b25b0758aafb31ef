package io.b2mash.b2b.workflowengine.task;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.CycleDetectedException;
import io.b2mash.b2b.workflowengine.exception.InvalidDependencyScopeException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.firm.FirmRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the firm-scoped task dependency graph. Edge additions lock the firm row, so the cycle
 * check and the insert see one consistent graph and concurrent additions in a firm serialize.
 */
@Service
public class DependencyGraphService {

  private static final Logger log = LoggerFactory.getLogger(DependencyGraphService.class);

  private final TaskRepository taskRepository;
  private final TaskDependencyRepository taskDependencyRepository;
  private final FirmRepository firmRepository;
  private final ApplicationEventPublisher eventPublisher;

  public DependencyGraphService(
      TaskRepository taskRepository,
      TaskDependencyRepository taskDependencyRepository,
      FirmRepository firmRepository,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.taskDependencyRepository = taskDependencyRepository;
    this.firmRepository = firmRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Records that {@code taskId} depends on {@code dependsOnTaskId}. Adding an existing edge is a
   * no-op that returns the existing edge.
   *
   * @throws InvalidDependencyScopeException if the tasks belong to different firms
   * @throws CycleDetectedException if the edge would close a cycle; the graph is left unchanged
   */
  @Transactional
  public TaskDependency addDependency(UUID taskId, UUID dependsOnTaskId, UUID actorId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    var dependsOn =
        taskRepository
            .findById(dependsOnTaskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", dependsOnTaskId));
    if (!task.getFirmId().equals(dependsOn.getFirmId())) {
      throw new InvalidDependencyScopeException(
          "Task " + taskId + " and task " + dependsOnTaskId + " belong to different firms");
    }

    firmRepository
        .findByIdForUpdate(task.getFirmId())
        .orElseThrow(() -> new ResourceNotFoundException("Firm", task.getFirmId()));

    var existing = taskDependencyRepository.findByTaskIdAndDependsOnTaskId(taskId, dependsOnTaskId);
    if (existing.isPresent()) {
      return existing.get();
    }

    var graph =
        DependencyGraph.ofTaskDependencies(taskDependencyRepository.findByFirmId(task.getFirmId()));
    if (graph.wouldCreateCycle(taskId, dependsOnTaskId)) {
      throw new CycleDetectedException(taskId, dependsOnTaskId);
    }

    var dependency =
        taskDependencyRepository.saveAndFlush(
            new TaskDependency(task.getFirmId(), taskId, dependsOnTaskId, actorId));

    log.info("Task {} now depends on task {}", taskId, dependsOnTaskId);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forTask(
            task.getFirmId(),
            task.getProjectId(),
            taskId,
            actorId,
            "Task '" + task.getTitle() + "' now depends on '" + dependsOn.getTitle() + "'"));
    return dependency;
  }

  /** Removes an edge. Returns false when it did not exist. */
  @Transactional
  public boolean removeDependency(UUID taskId, UUID dependsOnTaskId, UUID actorId) {
    var existing = taskDependencyRepository.findByTaskIdAndDependsOnTaskId(taskId, dependsOnTaskId);
    if (existing.isEmpty()) {
      return false;
    }
    var dependency = existing.get();
    taskDependencyRepository.delete(dependency);

    log.info("Task {} no longer depends on task {}", taskId, dependsOnTaskId);
    var task = taskRepository.findById(taskId).orElse(null);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forTask(
            dependency.getFirmId(),
            task != null ? task.getProjectId() : null,
            taskId,
            actorId,
            "Removed dependency of task " + taskId + " on task " + dependsOnTaskId));
    return true;
  }

  /** Whether adding {@code taskId -> dependsOnTaskId} would create a cycle in its firm. */
  @Transactional(readOnly = true)
  public boolean wouldCreateCycle(UUID taskId, UUID dependsOnTaskId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    return DependencyGraph.ofTaskDependencies(
            taskDependencyRepository.findByFirmId(task.getFirmId()))
        .wouldCreateCycle(taskId, dependsOnTaskId);
  }

  @Transactional(readOnly = true)
  public List<TaskDependency> findDependencies(UUID taskId) {
    return taskDependencyRepository.findByTaskId(taskId);
  }

  /** Direct dependencies of the task that are not completed yet. */
  @Transactional(readOnly = true)
  public List<Task> findBlockingTasks(UUID taskId) {
    var dependsOnIds =
        taskDependencyRepository.findByTaskId(taskId).stream()
            .map(TaskDependency::getDependsOnTaskId)
            .toList();
    if (dependsOnIds.isEmpty()) {
      return List.of();
    }
    return taskRepository.findIncompleteByIdIn(dependsOnIds);
  }

  @Transactional(readOnly = true)
  public boolean isBlocked(UUID taskId) {
    return !findBlockingTasks(taskId).isEmpty();
  }
}
