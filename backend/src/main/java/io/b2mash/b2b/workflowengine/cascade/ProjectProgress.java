package io.b2mash.b2b.workflowengine.cascade;

/** Kanban column plus completed/total counts over a project's template-originated tasks. */
public record ProjectProgress(KanbanColumn column, int completedTasks, int totalTasks) {}
