package io.b2mash.b2b.workflowengine.project;

import static io.b2mash.b2b.workflowengine.testutil.TestWorkflowFactory.stagedTemplate;
import static io.b2mash.b2b.workflowengine.testutil.TestWorkflowFactory.taxReturnTemplate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.workflowengine.TestcontainersConfiguration;
import io.b2mash.b2b.workflowengine.activity.ActivityLog;
import io.b2mash.b2b.workflowengine.activity.ActivityLogRepository;
import io.b2mash.b2b.workflowengine.client.Client;
import io.b2mash.b2b.workflowengine.client.ClientRepository;
import io.b2mash.b2b.workflowengine.exception.EmptyTemplateException;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.workflowengine.firm.Firm;
import io.b2mash.b2b.workflowengine.firm.FirmRepository;
import io.b2mash.b2b.workflowengine.project.dto.InstantiateProjectRequest;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskDependency;
import io.b2mash.b2b.workflowengine.task.TaskDependencyRepository;
import io.b2mash.b2b.workflowengine.task.TaskPriority;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.template.Template;
import io.b2mash.b2b.workflowengine.template.TemplateRepository;
import io.b2mash.b2b.workflowengine.template.TemplateService;
import io.b2mash.b2b.workflowengine.template.TemplateTaskRepository;
import io.b2mash.b2b.workflowengine.template.dto.CreateTemplateRequest;
import io.b2mash.b2b.workflowengine.template.dto.TemplateTaskRequest;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import jakarta.validation.ConstraintViolationException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ProjectInstantiatorIntegrationTest {

  private static final UUID ACTOR = UUID.randomUUID();
  private static final LocalDate START = LocalDate.of(2024, 1, 1);

  @Autowired private ProjectInstantiator projectInstantiator;
  @Autowired private TemplateService templateService;
  @Autowired private TemplateRepository templateRepository;
  @Autowired private TemplateTaskRepository templateTaskRepository;
  @Autowired private TaskRepository taskRepository;
  @Autowired private TaskDependencyRepository taskDependencyRepository;
  @Autowired private TaskStatusRepository taskStatusRepository;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private ActivityLogRepository activityLogRepository;
  @Autowired private FirmRepository firmRepository;
  @Autowired private ClientRepository clientRepository;

  private UUID firmId;
  private Client client;

  @BeforeEach
  void setUp() {
    firmId = firmRepository.save(new Firm("Instantiation Firm")).getId();
    client = clientRepository.save(new Client(firmId, "Acme Ltd"));
  }

  @Test
  void instantiate_createsTasksWithOffsetDueDates() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var project = instantiate(template);

    var tasks = tasksByTitle(project.getId());
    assertThat(tasks).containsOnlyKeys("Collect Docs", "Prepare", "Review");
    assertThat(tasks.get("Collect Docs").getDueDate()).isEqualTo(LocalDate.of(2024, 1, 1));
    assertThat(tasks.get("Prepare").getDueDate()).isEqualTo(LocalDate.of(2024, 1, 6));
    assertThat(tasks.get("Review").getDueDate()).isEqualTo(LocalDate.of(2024, 1, 11));
    assertThat(tasks.values()).allMatch(t -> t.getTemplateTaskOriginId() != null);
    assertThat(tasks.values()).allMatch(t -> t.getFirmId().equals(firmId));
  }

  @Test
  void instantiate_tenDayOffset_landsTenDaysAfterStart() {
    var template =
        templateService.create(
            new CreateTemplateRequest(
                firmId,
                "Single",
                null,
                false,
                List.of(TemplateTaskRequest.offset("Filing", 10))),
            ACTOR);

    var project = instantiate(template);

    assertThat(taskRepository.findByProjectId(project.getId()))
        .extracting(Task::getDueDate)
        .containsExactly(LocalDate.of(2024, 1, 11));
  }

  @Test
  void instantiate_tasksTakeTheirCompiledStage() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var project = instantiate(template);

    var stages = taskStatusRepository.findByWorkTypeIdOrderByPosition(project.getWorkTypeId());
    var tasks = tasksByTitle(project.getId());
    assertThat(tasks.get("Collect Docs").getStatusId()).isEqualTo(stages.get(0).getId());
    assertThat(tasks.get("Prepare").getStatusId()).isEqualTo(stages.get(1).getId());
    assertThat(tasks.get("Review").getStatusId()).isEqualTo(stages.get(2).getId());
    assertThat(tasks.get("Review").isCompleted()).isTrue();
    assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
    assertThat(project.getCurrentStatusId()).isEqualTo(stages.get(0).getId());
  }

  @Test
  void instantiate_remapsTemplateDependenciesOntoNewTasks() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var project = instantiate(template);

    var tasks = tasksByTitle(project.getId());
    assertThat(taskDependencyRepository.findByTaskId(tasks.get("Prepare").getId()))
        .extracting(TaskDependency::getDependsOnTaskId)
        .containsExactly(tasks.get("Collect Docs").getId());
    assertThat(taskDependencyRepository.findByTaskId(tasks.get("Review").getId()))
        .extracting(TaskDependency::getDependsOnTaskId)
        .containsExactly(tasks.get("Prepare").getId());
    assertThat(taskDependencyRepository.findByTaskId(tasks.get("Collect Docs").getId())).isEmpty();
  }

  @Test
  void instantiate_dependencyOutsideTemplate_isDropped() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var other = templateService.create(stagedTemplate(firmId, "Other", true, "Elsewhere"), ACTOR);
    var foreignTaskId = templateService.listTasks(other.getId()).get(0).getId();
    var collectDocs = templateService.listTasks(template.getId()).get(0);
    collectDocs.replaceDependencies(Set.of(foreignTaskId));
    templateTaskRepository.save(collectDocs);

    var project = instantiate(template);

    var tasks = tasksByTitle(project.getId());
    assertThat(tasks).hasSize(3);
    assertThat(taskDependencyRepository.findByTaskId(tasks.get("Collect Docs").getId())).isEmpty();
    assertThat(taskDependencyRepository.findByTaskId(tasks.get("Prepare").getId())).hasSize(1);
  }

  @Test
  void instantiate_inheritsOrOverridesDependencyMode() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var inherited = instantiate(template);
    var overridden =
        projectInstantiator.instantiate(
            new InstantiateProjectRequest(
                template.getId(), client.getId(), START, null, false, null, null),
            ACTOR);

    assertThat(inherited.isTaskDependencyMode()).isTrue();
    assertThat(overridden.isTaskDependencyMode()).isFalse();
  }

  @Test
  void instantiate_derivesNameAndKeepsRequestFields() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var derived = instantiate(template);
    var named =
        projectInstantiator.instantiate(
            new InstantiateProjectRequest(
                template.getId(),
                client.getId(),
                START,
                LocalDate.of(2024, 4, 15),
                null,
                "Acme 2023 return",
                TaskPriority.HIGH),
            ACTOR);

    assertThat(derived.getName()).isEqualTo("Acme Ltd - Tax Return");
    assertThat(derived.getPriority()).isEqualTo(TaskPriority.MEDIUM);
    assertThat(derived.getTemplateId()).isEqualTo(template.getId());
    assertThat(derived.getClientId()).isEqualTo(client.getId());
    assertThat(named.getName()).isEqualTo("Acme 2023 return");
    assertThat(named.getPriority()).isEqualTo(TaskPriority.HIGH);
    assertThat(named.getDueDate()).isEqualTo(LocalDate.of(2024, 4, 15));
  }

  @Test
  void instantiate_recurringTemplateTask_becomesRecurringMaster() {
    var template =
        templateService.create(
            new CreateTemplateRequest(
                firmId,
                "Monthly Close",
                null,
                false,
                List.of(
                    TemplateTaskRequest.offset("Setup", 0),
                    TemplateTaskRequest.recurring("Close Books", "monthly:last_day"))),
            ACTOR);

    var project = instantiate(template);

    var closeBooks = tasksByTitle(project.getId()).get("Close Books");
    assertThat(closeBooks.isRecurring()).isTrue();
    assertThat(closeBooks.getRecurrenceRule()).isEqualTo("monthly:last_day");
    assertThat(closeBooks.getDueDate()).isEqualTo(LocalDate.of(2024, 2, 29));
    assertThat(closeBooks.getNextDueDate()).isEqualTo(LocalDate.of(2024, 3, 31));
    assertThat(closeBooks.getMasterTaskId()).isNull();
    assertThat(tasksByTitle(project.getId()).get("Setup").isRecurring()).isFalse();
  }

  @Test
  void instantiate_uncompiledTemplate_compilesOnDemand() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var previousWorkType = template.getWorkTypeId();
    detachWorkType(template.getId());

    var project = instantiate(template);

    var relinked = templateRepository.findById(template.getId()).orElseThrow();
    assertThat(relinked.getWorkTypeId()).isNotNull().isNotEqualTo(previousWorkType);
    assertThat(project.getWorkTypeId()).isEqualTo(relinked.getWorkTypeId());
    assertThat(taskStatusRepository.findByWorkTypeIdOrderByPosition(project.getWorkTypeId()))
        .extracting(TaskStatus::getName)
        .containsExactly("Collect Docs", "Prepare", "Review");
  }

  @Test
  void instantiate_singleTaskTemplate_isBornCompleted() {
    var template = templateService.create(stagedTemplate(firmId, "One Off", true, "Do"), ACTOR);

    var project = instantiate(template);

    assertThat(project.getStatus()).isEqualTo(ProjectStatus.COMPLETED);
    assertThat(project.getCompletedAt()).isNotNull();
  }

  @Test
  void instantiate_writesActivityAfterCommit() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);

    var project = instantiate(template);

    assertThat(activityLogRepository.findByProjectIdOrderByOccurredAtAsc(project.getId()))
        .extracting(ActivityLog::getMessage)
        .anyMatch(m -> m.contains("Acme Ltd - Tax Return") && m.contains("3 tasks"));
  }

  @Test
  void instantiate_inactiveClient_rejected() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var inactive = new Client(firmId, "Dormant Co");
    inactive.deactivate();
    var saved = clientRepository.save(inactive);

    assertThatThrownBy(
            () ->
                projectInstantiator.instantiate(
                    InstantiateProjectRequest.of(template.getId(), saved.getId(), START), ACTOR))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void instantiate_clientOfAnotherFirm_notFound() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var otherFirm = firmRepository.save(new Firm("Other Firm"));
    var foreign = clientRepository.save(new Client(otherFirm.getId(), "Foreign Co"));

    assertThatThrownBy(
            () ->
                projectInstantiator.instantiate(
                    InstantiateProjectRequest.of(template.getId(), foreign.getId(), START), ACTOR))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void instantiate_dueBeforeStart_rejectedWithoutWrites() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var request =
        new InstantiateProjectRequest(
            template.getId(), client.getId(), START, START.minusDays(1), null, null, null);

    assertThatThrownBy(() -> projectInstantiator.instantiate(request, ACTOR))
        .isInstanceOf(InvalidStateException.class);
    assertThat(projectRepository.existsByTemplateId(template.getId())).isFalse();
  }

  @Test
  void instantiate_emptyTemplate_rejected() {
    var template =
        templateService.create(
            new CreateTemplateRequest(firmId, "Empty", null, true, List.of()), ACTOR);

    assertThatThrownBy(() -> instantiate(template)).isInstanceOf(EmptyTemplateException.class);
    assertThat(projectRepository.existsByTemplateId(template.getId())).isFalse();
  }

  @Test
  void instantiate_unknownTemplate_notFound() {
    assertThatThrownBy(
            () ->
                projectInstantiator.instantiate(
                    InstantiateProjectRequest.of(UUID.randomUUID(), client.getId(), START), ACTOR))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void instantiate_missingStartDate_failsBeanValidation() {
    var template = templateService.create(taxReturnTemplate(firmId), ACTOR);
    var request = InstantiateProjectRequest.of(template.getId(), client.getId(), null);

    assertThatThrownBy(() -> projectInstantiator.instantiate(request, ACTOR))
        .isInstanceOf(ConstraintViolationException.class);
  }

  private Project instantiate(Template template) {
    return projectInstantiator.instantiate(
        InstantiateProjectRequest.of(template.getId(), client.getId(), START), ACTOR);
  }

  private Map<String, Task> tasksByTitle(UUID projectId) {
    return taskRepository.findByProjectId(projectId).stream()
        .collect(Collectors.toMap(Task::getTitle, Function.identity()));
  }

  private void detachWorkType(UUID templateId) {
    var template = templateRepository.findById(templateId).orElseThrow();
    template.linkWorkType(null);
    for (var task : templateTaskRepository.findByTemplateIdOrderByPosition(templateId)) {
      task.linkDefaultStatus(null);
      templateTaskRepository.save(task);
    }
    templateRepository.save(template);
  }
}
