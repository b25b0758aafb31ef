package io.b2mash.b2b.workflowengine.config;

import io.b2mash.b2b.workflowengine.schedule.AnnualRecurrenceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for recurring task generation.
 *
 * @param annualMode how {@code annually} rules advance: a flat 365 days or one calendar year
 * @param sweepEnabled whether the scheduled recurring sweep runs
 * @param sweepCron cron expression for the scheduled recurring sweep
 */
@ConfigurationProperties(prefix = "workflow.recurrence")
public record RecurrenceProperties(
    @DefaultValue("FIXED_365_DAYS") AnnualRecurrenceMode annualMode,
    @DefaultValue("true") boolean sweepEnabled,
    @DefaultValue("0 0 2 * * *") String sweepCron) {

  public static RecurrenceProperties defaults() {
    return new RecurrenceProperties(AnnualRecurrenceMode.FIXED_365_DAYS, true, "0 0 2 * * *");
  }
}
