package io.b2mash.b2b.workflowengine.task;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH
}
