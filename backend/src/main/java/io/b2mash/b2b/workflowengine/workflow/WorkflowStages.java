package io.b2mash.b2b.workflowengine.workflow;

import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view over the ordered stages of one work type. Validates the stage invariants on
 * construction: contiguous positions 1..N, position 1 the only default, position N the only
 * terminal.
 */
public final class WorkflowStages {

  private final UUID workTypeId;
  private final List<TaskStatus> ordered;
  private final Map<UUID, TaskStatus> byId;

  private WorkflowStages(UUID workTypeId, List<TaskStatus> ordered) {
    this.workTypeId = workTypeId;
    this.ordered = ordered;
    this.byId = ordered.stream().collect(Collectors.toMap(TaskStatus::getId, Function.identity()));
  }

  public static WorkflowStages of(UUID workTypeId, List<TaskStatus> stages) {
    var ordered = stages.stream().sorted(Comparator.comparingInt(TaskStatus::getPosition)).toList();
    if (ordered.isEmpty()) {
      throw new InvalidStateException(
          "Workflow has no stages", "Work type " + workTypeId + " has no task statuses");
    }
    for (int i = 0; i < ordered.size(); i++) {
      var stage = ordered.get(i);
      boolean first = i == 0;
      boolean last = i == ordered.size() - 1;
      if (stage.getPosition() != i + 1
          || stage.isDefault() != first
          || stage.isTerminal() != last) {
        throw new InvalidStateException(
            "Corrupt workflow stages",
            "Work type " + workTypeId + " has an invalid stage at position " + stage.getPosition());
      }
    }
    return new WorkflowStages(workTypeId, ordered);
  }

  public UUID workTypeId() {
    return workTypeId;
  }

  public List<TaskStatus> ordered() {
    return ordered;
  }

  public int size() {
    return ordered.size();
  }

  public TaskStatus defaultStage() {
    return ordered.get(0);
  }

  public TaskStatus terminalStage() {
    return ordered.get(ordered.size() - 1);
  }

  /** First stage that is neither default nor terminal; the default stage when there is none. */
  public TaskStatus firstActiveStage() {
    return ordered.stream()
        .filter(s -> !s.isDefault() && !s.isTerminal())
        .findFirst()
        .orElse(defaultStage());
  }

  public TaskStatus atPosition(int position) {
    if (position < 1 || position > ordered.size()) {
      throw new InvalidStateException(
          "Invalid stage position",
          "Position " + position + " is outside 1.." + ordered.size() + " for work type "
              + workTypeId);
    }
    return ordered.get(position - 1);
  }

  public Optional<TaskStatus> find(UUID statusId) {
    return Optional.ofNullable(statusId).map(byId::get);
  }

  public boolean contains(UUID statusId) {
    return statusId != null && byId.containsKey(statusId);
  }

  public boolean isTerminal(UUID statusId) {
    return find(statusId).map(TaskStatus::isTerminal).orElse(false);
  }

  public boolean isDefault(UUID statusId) {
    return find(statusId).map(TaskStatus::isDefault).orElse(false);
  }
}
