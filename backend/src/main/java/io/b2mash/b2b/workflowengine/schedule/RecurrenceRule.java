package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.exception.UnknownRecurrenceRuleException;
import java.util.Locale;

/**
 * Parsed recurrence rule of the form {@code frequency[:qualifier]}, e.g. {@code weekly}, {@code
 * monthly:15}, {@code monthly:last_biz_day}, {@code quarterly:last_biz_day}.
 *
 * <p>Only {@code monthly} and {@code quarterly} accept a qualifier. {@code monthly} takes a day of
 * month (1-31), {@code last_day} or {@code last_biz_day}. {@code quarterly} takes any qualifier,
 * but only {@code last_biz_day} changes the date; every other quarterly form steps 90 days.
 */
public record RecurrenceRule(RecurrenceFrequency frequency, String qualifier) {

  public static final String LAST_DAY = "last_day";
  public static final String LAST_BUSINESS_DAY = "last_biz_day";

  public RecurrenceRule {
    if (frequency == null) {
      throw new IllegalArgumentException("frequency must not be null");
    }
  }

  /**
   * Parses a rule string, case-insensitively and ignoring surrounding whitespace.
   *
   * @throws UnknownRecurrenceRuleException if the frequency or qualifier is not recognised
   */
  public static RecurrenceRule parse(String rule) {
    if (rule == null || rule.isBlank()) {
      throw new UnknownRecurrenceRuleException(String.valueOf(rule));
    }
    String normalized = rule.trim().toLowerCase(Locale.ROOT);
    String[] parts = normalized.split(":", -1);
    if (parts.length > 2) {
      throw new UnknownRecurrenceRuleException(rule);
    }

    RecurrenceFrequency frequency;
    try {
      frequency = RecurrenceFrequency.valueOf(parts[0].toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new UnknownRecurrenceRuleException(rule);
    }

    String qualifier = parts.length == 2 ? parts[1] : null;
    if (qualifier != null && !isValidQualifier(frequency, qualifier)) {
      throw new UnknownRecurrenceRuleException(rule);
    }
    return new RecurrenceRule(frequency, qualifier);
  }

  private static boolean isValidQualifier(RecurrenceFrequency frequency, String qualifier) {
    return switch (frequency) {
      case MONTHLY ->
          LAST_DAY.equals(qualifier)
              || LAST_BUSINESS_DAY.equals(qualifier)
              || parseDayOfMonth(qualifier) != null;
      case QUARTERLY -> !qualifier.isEmpty();
      default -> false;
    };
  }

  private static Integer parseDayOfMonth(String qualifier) {
    if (qualifier.isEmpty()
        || qualifier.length() > 2
        || !qualifier.chars().allMatch(Character::isDigit)) {
      return null;
    }
    int day = Integer.parseInt(qualifier);
    return day >= 1 && day <= 31 ? day : null;
  }

  /** Day-of-month qualifier, or null when the rule has none. */
  public Integer dayOfMonth() {
    return qualifier == null ? null : parseDayOfMonth(qualifier);
  }

  public boolean isLastDay() {
    return LAST_DAY.equals(qualifier);
  }

  public boolean isLastBusinessDay() {
    return LAST_BUSINESS_DAY.equals(qualifier);
  }

  @Override
  public String toString() {
    String name = frequency.name().toLowerCase(Locale.ROOT);
    return qualifier == null ? name : name + ":" + qualifier;
  }
}
