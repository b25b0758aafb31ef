package io.b2mash.b2b.workflowengine.cascade;

public enum CascadeDirection {
  /** Trigger reached the terminal stage; earlier stages were completed. */
  FORWARD,
  /** Trigger went back to the default stage; later stages were reset. */
  BACKWARD,
  /** Status changed without cascading. */
  NONE,
  /** Project moved directly to a Kanban column. */
  COLUMN_MOVE
}
