package io.b2mash.b2b.workflowengine.schedule;

public enum RecurrenceFrequency {
  DAILY,
  WEEKLY,
  MONTHLY,
  QUARTERLY,
  ANNUALLY
}
