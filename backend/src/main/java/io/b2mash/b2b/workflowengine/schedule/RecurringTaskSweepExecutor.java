package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.firm.FirmRepository;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the recurring task sweep for every firm. Daily at 02:00 by default ({@code
 * workflow.recurrence.sweep-cron}). Firms are processed independently; a failing firm does not
 * stop the others.
 */
@Component
@ConditionalOnProperty(
    prefix = "workflow.recurrence",
    name = "sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RecurringTaskSweepExecutor {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskSweepExecutor.class);

  private final FirmRepository firmRepository;
  private final RecurringTaskSweep recurringTaskSweep;

  public RecurringTaskSweepExecutor(
      FirmRepository firmRepository, RecurringTaskSweep recurringTaskSweep) {
    this.firmRepository = firmRepository;
    this.recurringTaskSweep = recurringTaskSweep;
  }

  @Scheduled(cron = "${workflow.recurrence.sweep-cron:0 0 2 * * *}")
  public void executeSweep() {
    log.info("Recurring task sweep started");
    LocalDate today = LocalDate.now();
    var firms = firmRepository.findAll();
    int totalCreated = 0;

    for (var firm : firms) {
      try {
        totalCreated += recurringTaskSweep.runSweep(firm.getId(), today);
      } catch (Exception e) {
        log.error("Failed to run recurring sweep for firm {}", firm.getId(), e);
      }
    }

    log.info(
        "Recurring task sweep completed: {} firms processed, {} instances created",
        firms.size(),
        totalCreated);
  }
}
