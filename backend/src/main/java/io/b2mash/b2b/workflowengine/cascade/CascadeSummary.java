package io.b2mash.b2b.workflowengine.cascade;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one status transition or column move.
 *
 * @param triggerTaskId the task moved by the caller; null for column moves
 * @param completedTaskIds tasks forced to the terminal stage
 * @param resetTaskIds tasks forced back to the default stage
 * @param reactivatedTaskIds tasks stepped back from terminal to an active stage
 * @param column the project's Kanban column after the change; null for standalone tasks
 * @param generatedTaskIds recurring instances created because a master or instance completed
 */
public record CascadeSummary(
    UUID projectId,
    UUID triggerTaskId,
    CascadeDirection direction,
    List<UUID> completedTaskIds,
    List<UUID> resetTaskIds,
    List<UUID> reactivatedTaskIds,
    KanbanColumn column,
    int completedTasks,
    int totalTasks,
    List<UUID> generatedTaskIds) {

  public CascadeSummary {
    completedTaskIds = List.copyOf(completedTaskIds);
    resetTaskIds = List.copyOf(resetTaskIds);
    reactivatedTaskIds = List.copyOf(reactivatedTaskIds);
    generatedTaskIds = List.copyOf(generatedTaskIds);
  }

  public int cascadedCount() {
    return completedTaskIds.size() + resetTaskIds.size() + reactivatedTaskIds.size();
  }
}
