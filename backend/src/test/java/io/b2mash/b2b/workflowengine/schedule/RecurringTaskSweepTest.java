package io.b2mash.b2b.workflowengine.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.workflowengine.task.Task;
import io.b2mash.b2b.workflowengine.task.TaskRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class RecurringTaskSweepTest {

  private static final UUID FIRM_ID = UUID.randomUUID();
  private static final LocalDate AS_OF = LocalDate.of(2024, 3, 1);

  @Mock private TaskRepository taskRepository;
  @Mock private RecurringInstanceFactory recurringInstanceFactory;

  private RecurringTaskSweep sweep;

  @BeforeEach
  void setUp() {
    sweep = new RecurringTaskSweep(taskRepository, recurringInstanceFactory);
  }

  @Test
  void runSweep_countsOnlyCreatedInstances() {
    var created = master();
    var existing = master();
    var notRecurring = master();
    when(taskRepository.findDueRecurringMasters(FIRM_ID, AS_OF))
        .thenReturn(List.of(created, existing, notRecurring));
    when(recurringInstanceFactory.generateDue(created.getId(), AS_OF, null))
        .thenReturn(Optional.of(new RecurringInstance(mock(Task.class), true)));
    when(recurringInstanceFactory.generateDue(existing.getId(), AS_OF, null))
        .thenReturn(Optional.of(new RecurringInstance(mock(Task.class), false)));
    when(recurringInstanceFactory.generateDue(notRecurring.getId(), AS_OF, null))
        .thenReturn(Optional.empty());

    assertThat(sweep.runSweep(FIRM_ID, AS_OF)).isEqualTo(1);
  }

  @Test
  void runSweep_continuesPastFailingMaster() {
    var failing = master();
    var duplicate = master();
    var healthy = master();
    when(taskRepository.findDueRecurringMasters(FIRM_ID, AS_OF))
        .thenReturn(List.of(failing, duplicate, healthy));
    when(recurringInstanceFactory.generateDue(failing.getId(), AS_OF, null))
        .thenThrow(new IllegalStateException("boom"));
    when(recurringInstanceFactory.generateDue(duplicate.getId(), AS_OF, null))
        .thenThrow(new DataIntegrityViolationException("uq_tasks_master_due"));
    when(recurringInstanceFactory.generateDue(healthy.getId(), AS_OF, null))
        .thenReturn(Optional.of(new RecurringInstance(mock(Task.class), true)));

    assertThat(sweep.runSweep(FIRM_ID, AS_OF)).isEqualTo(1);
    verify(recurringInstanceFactory).generateDue(healthy.getId(), AS_OF, null);
  }

  @Test
  void runSweep_noDueMasters_returnsZero() {
    when(taskRepository.findDueRecurringMasters(FIRM_ID, AS_OF)).thenReturn(List.of());

    assertThat(sweep.runSweep(FIRM_ID, AS_OF)).isZero();
    verify(taskRepository).findDueRecurringMasters(FIRM_ID, AS_OF);
  }

  private static Task master() {
    var task = mock(Task.class);
    when(task.getId()).thenReturn(UUID.randomUUID());
    return task;
  }
}
