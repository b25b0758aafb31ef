package io.b2mash.b2b.workflowengine.cascade;

import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import java.util.Locale;

/**
 * A project's Kanban column: either a 1-based stage position or the terminal "completed" column.
 */
public record KanbanColumn(Integer stagePosition, boolean completed) {

  public static final KanbanColumn COMPLETED = new KanbanColumn(null, true);

  private static final String COMPLETED_NAME = "completed";

  public KanbanColumn {
    if (completed == (stagePosition != null)) {
      throw new IllegalArgumentException(
          "A column is either a stage position or completed, not both");
    }
    if (stagePosition != null && stagePosition < 1) {
      throw new IllegalArgumentException("Stage position must be >= 1, got: " + stagePosition);
    }
  }

  public static KanbanColumn stage(int position) {
    return new KanbanColumn(position, false);
  }

  /** Parses {@code "completed"} or a stage position such as {@code "2"}. */
  public static KanbanColumn parse(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidStateException("Invalid Kanban column", "Column must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (COMPLETED_NAME.equals(normalized)) {
      return COMPLETED;
    }
    try {
      int position = Integer.parseInt(normalized);
      if (position < 1) {
        throw new InvalidStateException(
            "Invalid Kanban column", "Stage position must be >= 1, got: " + value);
      }
      return stage(position);
    } catch (NumberFormatException e) {
      throw new InvalidStateException(
          "Invalid Kanban column", "Expected a stage position or 'completed', got: " + value);
    }
  }

  @Override
  public String toString() {
    return completed ? COMPLETED_NAME : String.valueOf(stagePosition);
  }
}
