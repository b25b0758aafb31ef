package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.task.TaskRepository;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Generates the due occurrence of every recurring master in one firm. Each master runs in its own
 * transaction through the {@link RecurringInstanceFactory} proxy; a failing master is logged and
 * skipped.
 */
@Component
public class RecurringTaskSweep {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskSweep.class);

  private final TaskRepository taskRepository;
  private final RecurringInstanceFactory recurringInstanceFactory;

  public RecurringTaskSweep(
      TaskRepository taskRepository, RecurringInstanceFactory recurringInstanceFactory) {
    this.taskRepository = taskRepository;
    this.recurringInstanceFactory = recurringInstanceFactory;
  }

  /** Returns the number of instances created. */
  public int runSweep(UUID firmId, LocalDate asOf) {
    var dueMasters = taskRepository.findDueRecurringMasters(firmId, asOf);
    int created = 0;

    for (var master : dueMasters) {
      try {
        var result = recurringInstanceFactory.generateDue(master.getId(), asOf, null);
        if (result.isPresent() && result.get().created()) {
          created++;
        }
      } catch (DataIntegrityViolationException e) {
        // Another trigger inserted the same occurrence first
        log.info("Occurrence of master {} was generated concurrently", master.getId());
      } catch (Exception e) {
        log.error("Failed to generate next occurrence of master {}", master.getId(), e);
      }
    }

    log.info(
        "Recurring sweep for firm {} as of {}: {} due masters, {} instances created",
        firmId,
        asOf,
        dueMasters.size(),
        created);
    return created;
  }
}
