package io.b2mash.b2b.workflowengine.schedule;

/** How an {@code annually} rule advances a due date. */
public enum AnnualRecurrenceMode {
  /** Flat 365 days, no leap-year awareness. */
  FIXED_365_DAYS,
  /** Same day next calendar year; Feb 29 clamps to Feb 28. */
  CALENDAR_YEAR
}
