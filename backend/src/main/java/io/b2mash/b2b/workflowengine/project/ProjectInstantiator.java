package io.b2mash.b2b.workflowengine.project;

import io.b2mash.b2b.workflowengine.activity.ActivityLoggedEvent;
import io.b2mash.b2b.workflowengine.cascade.ProjectProgressTracker;
import io.b2mash.b2b.workflowengine.client.ClientRepository;
import io.b2mash.b2b.workflowengine.exception.EmptyTemplateException;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.project.dto.InstantiateProjectRequest;
import io.b2mash.b2b.workflowengine.schedule.DueDateCalculator;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskDependency;
import io.b2mash.b2b.workflowengine.task.TaskDependencyRepository;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.template.TemplateCompiler;
import io.b2mash.b2b.workflowengine.template.TemplateRepository;
import io.b2mash.b2b.workflowengine.template.TemplateTask;
import io.b2mash.b2b.workflowengine.template.TemplateTaskRepository;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import io.b2mash.b2b.workflowengine.workflow.WorkflowStages;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Creates a project and its tasks from a template in one transaction. All inputs are validated
 * before the first row is written.
 */
@Service
@Validated
public class ProjectInstantiator {

  private static final Logger log = LoggerFactory.getLogger(ProjectInstantiator.class);

  private final TemplateRepository templateRepository;
  private final TemplateTaskRepository templateTaskRepository;
  private final TemplateCompiler templateCompiler;
  private final ClientRepository clientRepository;
  private final ProjectRepository projectRepository;
  private final TaskRepository taskRepository;
  private final TaskDependencyRepository taskDependencyRepository;
  private final TaskStatusRepository taskStatusRepository;
  private final DueDateCalculator dueDateCalculator;
  private final ProjectProgressTracker progressTracker;
  private final ApplicationEventPublisher eventPublisher;

  public ProjectInstantiator(
      TemplateRepository templateRepository,
      TemplateTaskRepository templateTaskRepository,
      TemplateCompiler templateCompiler,
      ClientRepository clientRepository,
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      TaskDependencyRepository taskDependencyRepository,
      TaskStatusRepository taskStatusRepository,
      DueDateCalculator dueDateCalculator,
      ProjectProgressTracker progressTracker,
      ApplicationEventPublisher eventPublisher) {
    this.templateRepository = templateRepository;
    this.templateTaskRepository = templateTaskRepository;
    this.templateCompiler = templateCompiler;
    this.clientRepository = clientRepository;
    this.projectRepository = projectRepository;
    this.taskRepository = taskRepository;
    this.taskDependencyRepository = taskDependencyRepository;
    this.taskStatusRepository = taskStatusRepository;
    this.dueDateCalculator = dueDateCalculator;
    this.progressTracker = progressTracker;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Project instantiate(@Valid InstantiateProjectRequest request, UUID actorId) {
    // 1. Validate dates
    if (request.dueDate() != null && request.dueDate().isBefore(request.startDate())) {
      throw new InvalidStateException(
          "Invalid project dates",
          "Due date " + request.dueDate() + " is before start date " + request.startDate());
    }

    // 2. Load template and client; a client of another firm is reported as not found
    var template =
        templateRepository
            .findById(request.templateId())
            .orElseThrow(() -> new ResourceNotFoundException("Template", request.templateId()));
    var client =
        clientRepository
            .findById(request.clientId())
            .filter(c -> c.getFirmId().equals(template.getFirmId()))
            .orElseThrow(() -> new ResourceNotFoundException("Client", request.clientId()));
    if (!client.isActive()) {
      throw new InvalidStateException(
          "Client inactive", "Cannot create a project for inactive client " + client.getId());
    }

    var templateTasks = templateTaskRepository.findByTemplateIdOrderByPosition(template.getId());
    if (templateTasks.isEmpty()) {
      throw new EmptyTemplateException(template.getId());
    }

    // 3. Due dates up front so a bad recurrence rule fails before any insert
    var dueDates = new HashMap<UUID, LocalDate>();
    for (var tt : templateTasks) {
      dueDates.put(tt.getId(), dueDateFor(tt, request.startDate()));
    }

    // 4. Compile on demand
    if (template.getWorkTypeId() == null) {
      templateCompiler.compile(template.getId(), actorId);
    }
    UUID workTypeId = template.getWorkTypeId();
    var stages =
        WorkflowStages.of(
            workTypeId, taskStatusRepository.findByWorkTypeIdOrderByPosition(workTypeId));

    // 5. Project
    boolean dependencyMode =
        request.dependencyModeOverride() != null
            ? request.dependencyModeOverride()
            : template.isTaskDependencyMode();
    String name =
        request.name() != null && !request.name().isBlank()
            ? request.name()
            : client.getName() + " - " + template.getName();
    var project =
        projectRepository.save(
            new Project(
                template.getFirmId(),
                name,
                client.getId(),
                workTypeId,
                template.getId(),
                request.startDate(),
                request.dueDate(),
                request.priority(),
                dependencyMode,
                stages.defaultStage().getId(),
                actorId));

    // 6. Tasks, remembering templateTaskId -> taskId for dependency remapping
    var taskIdByTemplateTaskId = new HashMap<UUID, UUID>();
    var tasks = new ArrayList<Task>(templateTasks.size());
    for (var tt : templateTasks) {
      LocalDate dueDate = dueDates.get(tt.getId());
      var task =
          new Task(
              project.getFirmId(),
              project.getId(),
              tt.getTitle(),
              tt.getDescription(),
              statusFor(tt, stages),
              tt.getDefaultPriority(),
              tt.getDefaultAssigneeId(),
              tt.getEstimatedHours(),
              dueDate,
              tt.getId(),
              actorId);
      if (tt.isRecurring()) {
        task.configureRecurrence(
            tt.getRecurrenceRule(), dueDateCalculator.next(tt.getRecurrenceRule(), dueDate));
      }
      task = taskRepository.save(task);
      taskIdByTemplateTaskId.put(tt.getId(), task.getId());
      tasks.add(task);
    }

    // 7. Remap template-local dependencies onto the new task ids
    int dependencyCount =
        remapDependencies(project, templateTasks, taskIdByTemplateTaskId, actorId);

    taskRepository.flush();
    Map<UUID, Integer> positions = progressTracker.stagePositions(tasks);
    progressTracker.reconcile(project, tasks, positions, stages);
    projectRepository.save(project);

    log.info(
        "Instantiated template {} -> project {} with {} tasks and {} dependencies",
        template.getId(),
        project.getId(),
        tasks.size(),
        dependencyCount);
    eventPublisher.publishEvent(
        ActivityLoggedEvent.forProject(
            project.getFirmId(),
            project.getId(),
            actorId,
            "Created project '"
                + project.getName()
                + "' from template '"
                + template.getName()
                + "' with "
                + tasks.size()
                + " tasks"));

    return project;
  }

  private LocalDate dueDateFor(TemplateTask templateTask, LocalDate startDate) {
    if (templateTask.getDaysFromStart() != null) {
      return startDate.plusDays(templateTask.getDaysFromStart());
    }
    if (templateTask.getRecurrenceRule() != null) {
      return dueDateCalculator.next(templateTask.getRecurrenceRule(), startDate);
    }
    return null;
  }

  /** The template task's own stage when it belongs to this workflow, else the default stage. */
  private static TaskStatus statusFor(TemplateTask templateTask, WorkflowStages stages) {
    return stages.find(templateTask.getDefaultStatusId()).orElse(stages.defaultStage());
  }

  private int remapDependencies(
      Project project,
      List<TemplateTask> templateTasks,
      Map<UUID, UUID> taskIdByTemplateTaskId,
      UUID actorId) {
    int created = 0;
    for (var tt : templateTasks) {
      UUID taskId = taskIdByTemplateTaskId.get(tt.getId());
      for (UUID dependsOnTemplateTaskId : tt.getDependencies()) {
        UUID dependsOnTaskId = taskIdByTemplateTaskId.get(dependsOnTemplateTaskId);
        if (dependsOnTaskId == null) {
          log.warn(
              "Dropping dependency of template task {} on {}: not part of project {}",
              tt.getId(),
              dependsOnTemplateTaskId,
              project.getId());
          continue;
        }
        taskDependencyRepository.save(
            new TaskDependency(project.getFirmId(), taskId, dependsOnTaskId, actorId));
        created++;
      }
    }
    return created;
  }
}
