package io.b2mash.b2b.workflowengine.cascade;

import io.b2mash.b2b.workflowengine.project.Project;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.template.TemplateTask;
import io.b2mash.b2b.workflowengine.template.TemplateTaskRepository;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import io.b2mash.b2b.workflowengine.workflow.WorkflowStages;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Derives a project's Kanban column from its template-originated tasks and writes the derived
 * state back onto the project.
 *
 * <p>The column is the stage position of the first task, in stage order, that is not terminal.
 * When every such task is terminal the column is {@link KanbanColumn#COMPLETED}; a project with no
 * template-originated tasks sits in stage 1.
 */
@Component
public class ProjectProgressTracker {

  private final TaskRepository taskRepository;
  private final TaskStatusRepository taskStatusRepository;
  private final TemplateTaskRepository templateTaskRepository;

  public ProjectProgressTracker(
      TaskRepository taskRepository,
      TaskStatusRepository taskStatusRepository,
      TemplateTaskRepository templateTaskRepository) {
    this.taskRepository = taskRepository;
    this.taskStatusRepository = taskStatusRepository;
    this.templateTaskRepository = templateTaskRepository;
  }

  public WorkflowStages stagesOf(Project project) {
    return WorkflowStages.of(
        project.getWorkTypeId(),
        taskStatusRepository.findByWorkTypeIdOrderByPosition(project.getWorkTypeId()));
  }

  /** Stage position of each task, keyed by task id, taken from its origin template task. */
  public Map<UUID, Integer> stagePositions(Collection<Task> tasks) {
    var originIds =
        tasks.stream().map(Task::getTemplateTaskOriginId).collect(Collectors.toSet());
    Map<UUID, Integer> positionByOrigin =
        templateTaskRepository.findAllById(originIds).stream()
            .collect(Collectors.toMap(TemplateTask::getId, TemplateTask::getPosition));
    return tasks.stream()
        .filter(t -> positionByOrigin.containsKey(t.getTemplateTaskOriginId()))
        .collect(
            Collectors.toMap(Task::getId, t -> positionByOrigin.get(t.getTemplateTaskOriginId())));
  }

  /** Read-only progress of a project. */
  public ProjectProgress progressOf(Project project) {
    var candidates = taskRepository.findCascadeCandidates(project.getId());
    return progressOf(candidates, stagePositions(candidates), stagesOf(project));
  }

  public ProjectProgress progressOf(
      List<Task> candidates, Map<UUID, Integer> positions, WorkflowStages stages) {
    var ordered =
        candidates.stream()
            .filter(t -> positions.containsKey(t.getId()))
            .sorted(
                Comparator.<Task>comparingInt(t -> positions.get(t.getId()))
                    .thenComparing(Task::getId))
            .toList();
    int completed = (int) ordered.stream().filter(t -> stages.isTerminal(t.getStatusId())).count();

    if (ordered.isEmpty()) {
      return new ProjectProgress(KanbanColumn.stage(1), 0, 0);
    }
    var column =
        ordered.stream()
            .filter(t -> !stages.isTerminal(t.getStatusId()))
            .findFirst()
            .map(t -> KanbanColumn.stage(positions.get(t.getId())))
            .orElse(KanbanColumn.COMPLETED);
    return new ProjectProgress(column, completed, ordered.size());
  }

  /** Writes the derived column and ACTIVE/COMPLETED status onto the project. */
  public ProjectProgress reconcile(
      Project project, List<Task> candidates, Map<UUID, Integer> positions, WorkflowStages stages) {
    var progress = progressOf(candidates, positions, stages);
    var column = progress.column();
    UUID currentStatusId =
        column.completed()
            ? stages.terminalStage().getId()
            : stages.atPosition(Math.min(column.stagePosition(), stages.size())).getId();
    project.syncWorkflowState(currentStatusId, column.completed());
    return progress;
  }
}
