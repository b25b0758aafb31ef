package io.b2mash.b2b.workflowengine.project;

public enum ProjectStatus {
  ACTIVE,
  COMPLETED
}
