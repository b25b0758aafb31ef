package io.b2mash.b2b.workflowengine.template;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.EmptyTemplateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.project.ProjectRepository;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import io.b2mash.b2b.workflowengine.workflow.WorkType;
import io.b2mash.b2b.workflowengine.workflow.WorkTypeRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a template's ordered task list into a work type with one stage per task.
 *
 * <p>Stage i takes the name of template task i. Position 1 is the default stage and position N the
 * terminal one. Each template task is re-linked to its stage. Recompiling replaces the stage set
 * in place while nothing references it; once tasks or projects point at the old stages, the old
 * work type is retired and a new one is linked so existing work is never altered.
 */
@Service
public class TemplateCompiler {

  private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

  static final String FIRST_STAGE_COLOR = "#6b7280";
  static final String MIDDLE_STAGE_COLOR = "#3b82f6";
  static final String LAST_STAGE_COLOR = "#10b981";

  private final TemplateRepository templateRepository;
  private final TemplateTaskRepository templateTaskRepository;
  private final WorkTypeRepository workTypeRepository;
  private final TaskStatusRepository taskStatusRepository;
  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;
  private final ApplicationEventPublisher eventPublisher;

  public TemplateCompiler(
      TemplateRepository templateRepository,
      TemplateTaskRepository templateTaskRepository,
      WorkTypeRepository workTypeRepository,
      TaskStatusRepository taskStatusRepository,
      TaskRepository taskRepository,
      ProjectRepository projectRepository,
      ApplicationEventPublisher eventPublisher) {
    this.templateRepository = templateRepository;
    this.templateTaskRepository = templateTaskRepository;
    this.workTypeRepository = workTypeRepository;
    this.taskStatusRepository = taskStatusRepository;
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public CompiledWorkflow compile(UUID templateId, UUID actorId) {
    // 1. Lock the template so concurrent compiles serialize
    var template =
        templateRepository
            .findByIdForUpdate(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("Template", templateId));

    var templateTasks = templateTaskRepository.findByTemplateIdOrderByPosition(templateId);
    if (templateTasks.isEmpty()) {
      throw new EmptyTemplateException(templateId);
    }

    // 2. Resolve the work type: reuse it in place, or retire it and start a new one
    var workType = resolveWorkType(template, templateTasks);

    // 3. One stage per template task, in order
    int count = templateTasks.size();
    var stages = new ArrayList<TaskStatus>(count);
    for (int i = 0; i < count; i++) {
      var templateTask = templateTasks.get(i);
      int position = i + 1;
      var stage =
          taskStatusRepository.save(
              new TaskStatus(
                  template.getFirmId(),
                  workType.getId(),
                  templateTask.getTitle(),
                  colorFor(position, count),
                  position,
                  position == 1,
                  position == count));
      templateTask.linkDefaultStatus(stage.getId());
      stages.add(stage);
    }
    templateTaskRepository.saveAll(templateTasks);

    log.info(
        "Compiled template {} into work type {} with {} stages",
        templateId,
        workType.getId(),
        count);

    eventPublisher.publishEvent(
        ActivityLoggedEvent.forFirm(
            template.getFirmId(),
            actorId,
            "Compiled template '"
                + template.getName()
                + "' into "
                + count
                + " workflow stage"
                + (count == 1 ? "" : "s")));

    return new CompiledWorkflow(workType, stages);
  }

  private WorkType resolveWorkType(Template template, List<TemplateTask> templateTasks) {
    if (template.getWorkTypeId() != null) {
      var existing = workTypeRepository.findById(template.getWorkTypeId()).orElse(null);
      if (existing != null) {
        var oldStages = taskStatusRepository.findByWorkTypeIdOrderByPosition(existing.getId());
        if (!isReferenced(existing, oldStages)) {
          existing.rename(template.getName(), template.getDescription());
          // Unlink before delete so no template task ever points at a removed stage
          templateTasks.forEach(tt -> tt.linkDefaultStatus(null));
          templateTaskRepository.saveAll(templateTasks);
          taskStatusRepository.deleteAll(oldStages);
          taskStatusRepository.flush();
          return existing;
        }
        existing.retire();
        log.info(
            "Retired work type {} of template {}; its stages are in use",
            existing.getId(),
            template.getId());
      }
    }

    var workType =
        workTypeRepository.save(
            new WorkType(template.getFirmId(), template.getName(), template.getDescription()));
    template.linkWorkType(workType.getId());
    templateRepository.save(template);
    return workType;
  }

  private boolean isReferenced(WorkType workType, List<TaskStatus> stages) {
    if (projectRepository.existsByWorkTypeId(workType.getId())) {
      return true;
    }
    if (stages.isEmpty()) {
      return false;
    }
    var stageIds = stages.stream().map(TaskStatus::getId).toList();
    return taskRepository.existsByStatusIdIn(stageIds)
        || projectRepository.existsByCurrentStatusIdIn(stageIds);
  }

  static String colorFor(int position, int count) {
    if (position == count) {
      return LAST_STAGE_COLOR;
    }
    return position == 1 ? FIRST_STAGE_COLOR : MIDDLE_STAGE_COLOR;
  }
}
