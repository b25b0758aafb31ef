package io.b2mash.b2b.workflowengine.schedule;

import static io.b2mash.b2b.workflowengine.testutil.TestWorkflowFactory.stagedTemplate;
import static io.b2mash.b2b.workflowengine.testutil.TestWorkflowFactory.standaloneTask;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.workflowengine.TestcontainersConfiguration;
import io.b2mash.b2b.workflowengine.cascade.CascadeDirection;
import io.b2mash.b2b.workflowengine.cascade.StageCascadeEngine;
import io.b2mash.b2b.workflowengine.client.Client;
import io.b2mash.b2b.workflowengine.client.ClientRepository;
import io.b2mash.b2b.workflowengine.exception.InvalidStateException;
import io.b2mash.b2b.workflowengine.exception.UnknownRecurrenceRuleException;
import io.b2mash.b2b.workflowengine.firm.Firm;
import io.b2mash.b2b.workflowengine.firm.FirmRepository;
import io.b2mash.b2b.workflowengine.project.ProjectInstantiator;
import io.b2mash.b2b.workflowengine.project.dto.InstantiateProjectRequest;
import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import io.b2mash.b2b.workflowengine.template.TemplateService;
import io.b2mash.b2b.workflowengine.template.dto.CreateTemplateRequest;
import io.b2mash.b2b.workflowengine.template.dto.TemplateTaskRequest;
import io.b2mash.b2b.workflowengine.workflow.TaskStatus;
import io.b2mash.b2b.workflowengine.workflow.TaskStatusRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
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
class RecurringInstanceFactoryIntegrationTest {

  private static final UUID ACTOR = UUID.randomUUID();

  @Autowired private RecurringInstanceFactory recurringInstanceFactory;
  @Autowired private RecurringTaskSweep recurringTaskSweep;
  @Autowired private TaskRecurrenceService taskRecurrenceService;
  @Autowired private StageCascadeEngine cascadeEngine;
  @Autowired private TemplateService templateService;
  @Autowired private ProjectInstantiator projectInstantiator;
  @Autowired private TaskRepository taskRepository;
  @Autowired private TaskStatusRepository taskStatusRepository;
  @Autowired private FirmRepository firmRepository;
  @Autowired private ClientRepository clientRepository;

  private UUID firmId;
  private List<TaskStatus> stages;

  @BeforeEach
  void setUp() {
    firmId = firmRepository.save(new Firm("Recurrence Firm")).getId();
    var template =
        templateService.create(stagedTemplate(firmId, "Routine", true, "Open", "Done"), ACTOR);
    stages = taskStatusRepository.findByWorkTypeIdOrderByPosition(template.getWorkTypeId());
  }

  @Test
  void configureRecurrence_seedsNextOccurrenceFromDueDate() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "Weekly");

    assertThat(master.isRecurring()).isTrue();
    assertThat(master.getRecurrenceRule()).isEqualTo("weekly");
    assertThat(master.getNextDueDate()).isEqualTo(LocalDate.of(2099, 1, 17));
  }

  @Test
  void configureRecurrence_unknownRule_rejected() {
    var task = taskRepository.save(standaloneTask(firmId, stages.get(0), "X", null, ACTOR));

    assertThatThrownBy(
            () -> taskRecurrenceService.configureRecurrence(task.getId(), "hourly", ACTOR))
        .isInstanceOf(UnknownRecurrenceRuleException.class);
    assertThat(taskRepository.findById(task.getId()).orElseThrow().isRecurring()).isFalse();
  }

  @Test
  void generateNext_createsInstanceInDefaultStage() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");

    var result = recurringInstanceFactory.generateNext(master.getId(), ACTOR).orElseThrow();

    assertThat(result.created()).isTrue();
    var instance = result.task();
    assertThat(instance.getMasterTaskId()).isEqualTo(master.getId());
    assertThat(instance.getDueDate()).isEqualTo(LocalDate.of(2099, 1, 17));
    assertThat(instance.getStatusId()).isEqualTo(stages.get(0).getId());
    assertThat(instance.getTitle()).isEqualTo("Payroll");
    assertThat(instance.isRecurring()).isFalse();
  }

  @Test
  void generateNext_twice_createsOnlyOneInstance() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");

    var first = recurringInstanceFactory.generateNext(master.getId(), ACTOR).orElseThrow();
    var second = recurringInstanceFactory.generateNext(master.getId(), ACTOR).orElseThrow();

    assertThat(second.created()).isFalse();
    assertThat(second.task().getId()).isEqualTo(first.task().getId());
    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId())).hasSize(1);
  }

  @Test
  void generateNext_nonRecurringTask_returnsEmpty() {
    var task = taskRepository.save(standaloneTask(firmId, stages.get(0), "Once", null, ACTOR));

    assertThat(recurringInstanceFactory.generateNext(task.getId(), ACTOR)).isEmpty();
  }

  @Test
  void generateNext_onInstance_rejected() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");
    var instance = recurringInstanceFactory.generateNext(master.getId(), ACTOR).orElseThrow();

    assertThatThrownBy(() -> recurringInstanceFactory.generateNext(instance.task().getId(), ACTOR))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> {
              assertThat(e.getBody().getType()).isEqualTo(InvalidStateException.PROBLEM_TYPE);
              assertThat(e.getBody().getTitle()).isEqualTo("Not a recurring master");
            });
    assertThatThrownBy(
            () ->
                taskRecurrenceService.configureRecurrence(
                    instance.task().getId(), "daily", ACTOR))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void completingMasterThenInstance_walksTheSeriesForward() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");
    var done = stages.get(1).getId();

    var first = cascadeEngine.advanceTaskStatus(master.getId(), done, ACTOR);
    assertThat(first.generatedTaskIds()).hasSize(1);
    var firstInstance = taskRepository.findById(first.generatedTaskIds().get(0)).orElseThrow();
    assertThat(firstInstance.getDueDate()).isEqualTo(LocalDate.of(2099, 1, 17));

    var second = cascadeEngine.advanceTaskStatus(firstInstance.getId(), done, ACTOR);
    assertThat(second.generatedTaskIds()).hasSize(1);

    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId()))
        .extracting(Task::getDueDate)
        .containsExactly(LocalDate.of(2099, 1, 17), LocalDate.of(2099, 1, 24));
    var reloadedMaster = taskRepository.findById(master.getId()).orElseThrow();
    assertThat(reloadedMaster.getLastCompletedOn()).isEqualTo(LocalDate.of(2099, 1, 17));
    assertThat(reloadedMaster.getNextDueDate()).isEqualTo(LocalDate.of(2099, 1, 31));
  }

  @Test
  void sweep_generatesOnlyOnceTheOccurrenceIsDue() {
    var master = recurringTask("Bank Feeds", LocalDate.of(2024, 1, 1), "weekly");

    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 7))).isZero();
    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 8))).isEqualTo(1);
    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 8))).isZero();

    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId()))
        .extracting(Task::getDueDate)
        .containsExactly(LocalDate.of(2024, 1, 8));
  }

  @Test
  void sweep_weeklyMaster_generatesOneOccurrencePerWeek() {
    var master = recurringTask("Bank Feeds", LocalDate.of(2024, 1, 1), "weekly");

    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 8))).isEqualTo(1);
    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 15))).isEqualTo(1);
    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 1, 22))).isEqualTo(1);

    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId()))
        .extracting(Task::getDueDate)
        .containsExactly(
            LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 22));
    assertThat(taskRepository.findById(master.getId()).orElseThrow().getNextDueDate())
        .isEqualTo(LocalDate.of(2024, 1, 29));
  }

  @Test
  void sweep_afterCompletion_continuesFromLatestOccurrence() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");
    var first = recurringInstanceFactory.generateNext(master.getId(), ACTOR).orElseThrow();
    assertThat(first.task().getDueDate()).isEqualTo(LocalDate.of(2099, 1, 17));

    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2099, 1, 23))).isZero();
    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2099, 1, 24))).isEqualTo(1);

    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId()))
        .extracting(Task::getDueDate)
        .containsExactly(LocalDate.of(2099, 1, 17), LocalDate.of(2099, 1, 24));
  }

  @Test
  void generateDue_notYetDue_createsNothing() {
    var master = recurringTask("Payroll", LocalDate.of(2099, 1, 10), "weekly");

    assertThat(
            recurringInstanceFactory.generateDue(master.getId(), LocalDate.of(2099, 1, 16), ACTOR))
        .isEmpty();
    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId())).isEmpty();
    assertThat(taskRepository.findById(master.getId()).orElseThrow().getNextDueDate())
        .isEqualTo(LocalDate.of(2099, 1, 17));
  }

  @Test
  void sweep_skipsClearedRecurrence() {
    var master = recurringTask("Bank Feeds", LocalDate.of(2024, 1, 1), "weekly");
    taskRecurrenceService.clearRecurrence(master.getId(), ACTOR);

    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 6, 1))).isZero();
    assertThat(taskRepository.findByMasterTaskIdOrderByDueDateAsc(master.getId())).isEmpty();
  }

  @Test
  void templateRecurringTask_instanceStaysOutOfTheCascade() {
    var template =
        templateService.create(
            new CreateTemplateRequest(
                firmId,
                "Monthly Close",
                null,
                true,
                List.of(
                    TemplateTaskRequest.offset("Setup", 0),
                    TemplateTaskRequest.recurring("Close Books", "monthly:last_day"))),
            ACTOR);
    var client = clientRepository.save(new Client(firmId, "Stark Industries"));
    var request =
        InstantiateProjectRequest.of(template.getId(), client.getId(), LocalDate.of(2024, 1, 1));
    var project = projectInstantiator.instantiate(request, ACTOR);
    var projectStages =
        taskStatusRepository.findByWorkTypeIdOrderByPosition(project.getWorkTypeId());

    assertThat(recurringTaskSweep.runSweep(firmId, LocalDate.of(2024, 3, 31))).isEqualTo(1);
    var instance =
        taskRepository.findByProjectId(project.getId()).stream()
            .filter(Task::isRecurringInstance)
            .findFirst()
            .orElseThrow();
    assertThat(instance.getDueDate()).isEqualTo(LocalDate.of(2024, 3, 31));
    assertThat(instance.getStatusId()).isEqualTo(projectStages.get(0).getId());
    assertThat(instance.getTemplateTaskOriginId()).isNotNull();

    var summary =
        cascadeEngine.advanceTaskStatus(
            instance.getId(), projectStages.get(projectStages.size() - 1).getId(), ACTOR);

    assertThat(summary.direction()).isEqualTo(CascadeDirection.NONE);
    assertThat(summary.completedTaskIds()).isEmpty();
    assertThat(summary.totalTasks()).isEqualTo(2);
    assertThat(summary.generatedTaskIds()).hasSize(1);
    var setup =
        taskRepository.findByProjectId(project.getId()).stream()
            .filter(t -> t.getTitle().equals("Setup"))
            .findFirst()
            .orElseThrow();
    assertThat(setup.isCompleted()).isFalse();
  }

  private Task recurringTask(String title, LocalDate dueDate, String rule) {
    var task = taskRepository.save(standaloneTask(firmId, stages.get(0), title, dueDate, ACTOR));
    return taskRecurrenceService.configureRecurrence(task.getId(), rule, ACTOR);
  }
}
