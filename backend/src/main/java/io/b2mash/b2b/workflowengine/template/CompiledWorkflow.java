package io.b2mash.b2b.workflowengine.template;

import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.WorkType;
import java.util.List;

/** Result of compiling a template: the work type and its stages in position order. */
public record CompiledWorkflow(WorkType workType, List<TaskStatus> stages) {

  public CompiledWorkflow {
    stages = List.copyOf(stages);
  }
}
