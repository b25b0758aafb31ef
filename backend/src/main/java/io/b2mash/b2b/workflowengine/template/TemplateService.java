package io.b2mash.b2b.workflowengine.template;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.exception.CycleDetectedException;
import io.b2mash.b2b.workflowengine.exception.InvalidDependencyScopeException;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.exception.TemplateInUseException;
import io.b2mash.b2b.workflowengine.firm.FirmRepository;
import io.b2mash.b2b.workflowengine.project.ProjectRepository;
import io.b2mash.b2b.workflowengine.schedule.DueDateCalculator;
import io.b2mash.b2b.workflowengine.task.DependencyGraph;
import io.b2mash.b2b.workflowengine.template.dto.CreateTemplateRequest;
import io.b2mash.b2b.workflowengine.template.dto.TemplateTaskRequest;
import io.b2mash.b2b.workflowengine.template.dto.UpdateTemplateRequest;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class TemplateService {

  private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

  private final TemplateRepository templateRepository;
  private final TemplateTaskRepository templateTaskRepository;
  private final FirmRepository firmRepository;
  private final ProjectRepository projectRepository;
  private final TemplateCompiler templateCompiler;
  private final DueDateCalculator dueDateCalculator;
  private final ApplicationEventPublisher eventPublisher;

  public TemplateService(
      TemplateRepository templateRepository,
      TemplateTaskRepository templateTaskRepository,
      FirmRepository firmRepository,
      ProjectRepository projectRepository,
      TemplateCompiler templateCompiler,
      DueDateCalculator dueDateCalculator,
      ApplicationEventPublisher eventPublisher) {
    this.templateRepository = templateRepository;
    this.templateTaskRepository = templateTaskRepository;
    this.firmRepository = firmRepository;
    this.projectRepository = projectRepository;
    this.templateCompiler = templateCompiler;
    this.dueDateCalculator = dueDateCalculator;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Template create(@Valid CreateTemplateRequest request, UUID actorId) {
    if (!firmRepository.existsById(request.firmId())) {
      throw new ResourceNotFoundException("Firm", request.firmId());
    }
    var taskRequests = request.tasks() != null ? request.tasks() : List.<TemplateTaskRequest>of();
    validateTaskRequests(taskRequests);

    var template =
        templateRepository.save(
            new Template(
                request.firmId(),
                request.name(),
                request.description(),
                request.taskDependencyMode(),
                actorId));

    replaceTasks(template, taskRequests);

    log.info("Created template {} with {} tasks", template.getId(), taskRequests.size());
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forFirm(
            template.getFirmId(), actorId, "Created template '" + template.getName() + "'"));

    // An empty template stays uncompiled until tasks are added
    if (!taskRequests.isEmpty()) {
      templateCompiler.compile(template.getId(), actorId);
    }
    return template;
  }

  @Transactional
  public Template update(UUID templateId, @Valid UpdateTemplateRequest request, UUID actorId) {
    var template =
        templateRepository
            .findByIdForUpdate(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("Template", templateId));

    boolean inUse = projectRepository.existsByTemplateId(templateId);
    if (request.tasks() != null && inUse) {
      throw new TemplateInUseException(templateId, "Its task list can no longer change.");
    }

    template.update(request.name(), request.description(), request.taskDependencyMode());
    templateRepository.save(template);

    if (request.tasks() != null) {
      validateTaskRequests(request.tasks());
      // Drop element collections and rows explicitly; the compiler relinks the new rows
      var existing = templateTaskRepository.findByTemplateIdOrderByPosition(templateId);
      templateTaskRepository.deleteAll(existing);
      templateTaskRepository.flush();
      replaceTasks(template, request.tasks());
      if (!request.tasks().isEmpty()) {
        templateCompiler.compile(templateId, actorId);
      }
    }

    log.info("Updated template {} (tasksReplaced={})", templateId, request.tasks() != null);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forFirm(
            template.getFirmId(), actorId, "Updated template '" + template.getName() + "'"));
    return template;
  }

  @Transactional
  public void delete(UUID templateId, UUID actorId) {
    var template =
        templateRepository
            .findByIdForUpdate(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("Template", templateId));

    if (projectRepository.existsByTemplateId(templateId)) {
      throw new TemplateInUseException(templateId, "Delete them first.");
    }

    templateTaskRepository.deleteAll(
        templateTaskRepository.findByTemplateIdOrderByPosition(templateId));
    templateRepository.delete(template);

    log.info("Deleted template {}", templateId);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forFirm(
            template.getFirmId(), actorId, "Deleted template '" + template.getName() + "'"));
  }

  @Transactional(readOnly = true)
  public Template get(UUID templateId) {
    return templateRepository
        .findById(templateId)
        .orElseThrow(() -> new ResourceNotFoundException("Template", templateId));
  }

  @Transactional(readOnly = true)
  public List<Template> listForFirm(UUID firmId) {
    return templateRepository.findByFirmIdOrderByNameAsc(firmId);
  }

  @Transactional(readOnly = true)
  public List<TemplateTask> listTasks(UUID templateId) {
    return templateTaskRepository.findByTemplateIdOrderByPosition(templateId);
  }

  /** Rejects bad rules, ambiguous due dates and out-of-template dependency positions. */
  private void validateTaskRequests(List<TemplateTaskRequest> requests) {
    int count = requests.size();
    for (int i = 0; i < count; i++) {
      var request = requests.get(i);
      int position = i + 1;
      if (request.daysFromStart() != null && request.recurrenceRule() != null) {
        throw new InvalidStateException(
            "Ambiguous due date",
            "Template task "
                + position
                + " sets both daysFromStart and recurrenceRule; at most one is allowed.");
      }
      if (request.recurrenceRule() != null) {
        dueDateCalculator.validate(request.recurrenceRule());
      }
      if (request.dependsOnPositions() != null) {
        for (Integer dependsOn : request.dependsOnPositions()) {
          if (dependsOn == null || dependsOn < 1 || dependsOn > count) {
            throw new InvalidDependencyScopeException(
                "Template task "
                    + position
                    + " depends on position "
                    + dependsOn
                    + ", which is not part of this template.");
          }
        }
      }
    }
  }

  private void replaceTasks(Template template, List<TemplateTaskRequest> requests) {
    var saved = new ArrayList<TemplateTask>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      var request = requests.get(i);
      String rule =
          request.recurrenceRule() != null
              ? dueDateCalculator.validate(request.recurrenceRule()).toString()
              : null;
      saved.add(
          templateTaskRepository.save(
              new TemplateTask(
                  template.getId(),
                  request.title(),
                  request.description(),
                  i + 1,
                  request.daysFromStart(),
                  rule,
                  request.estimatedHours(),
                  request.defaultPriority(),
                  request.defaultAssigneeId())));
    }

    // Dependencies by position, checked for cycles edge by edge
    var graph = DependencyGraph.empty();
    for (int i = 0; i < requests.size(); i++) {
      var positions = requests.get(i).dependsOnPositions();
      if (positions == null || positions.isEmpty()) {
        continue;
      }
      var task = saved.get(i);
      var dependencyIds = new HashSet<UUID>();
      for (Integer position : positions) {
        var dependsOn = saved.get(position - 1);
        if (graph.wouldCreateCycle(task.getId(), dependsOn.getId())) {
          throw new CycleDetectedException(task.getId(), dependsOn.getId());
        }
        graph.addEdge(task.getId(), dependsOn.getId());
        dependencyIds.add(dependsOn.getId());
      }
      task.replaceDependencies(dependencyIds);
    }
    templateTaskRepository.saveAll(saved);
  }
}
