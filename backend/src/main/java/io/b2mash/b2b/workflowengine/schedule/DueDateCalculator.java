package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.config.RecurrenceProperties;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import org.springframework.stereotype.Component;

/**
 * Computes the next due date for a recurrence rule. Pure date arithmetic: no clock, no I/O.
 *
 * <p>Business days are Monday to Friday; holidays are not considered.
 */
@Component
public class DueDateCalculator {

  private final RecurrenceProperties recurrenceProperties;

  public DueDateCalculator(RecurrenceProperties recurrenceProperties) {
    this.recurrenceProperties = recurrenceProperties;
  }

  public LocalDate next(String rule, LocalDate base) {
    return next(RecurrenceRule.parse(rule), base);
  }

  public LocalDate next(RecurrenceRule rule, LocalDate base) {
    if (base == null) {
      throw new IllegalArgumentException("base date must not be null");
    }
    return switch (rule.frequency()) {
      case DAILY -> base.plusDays(1);
      case WEEKLY -> base.plusDays(7);
      case MONTHLY -> nextMonthly(rule, base);
      case QUARTERLY ->
          rule.isLastBusinessDay() ? lastBusinessDayOfNextQuarter(base) : base.plusDays(90);
      case ANNUALLY ->
          recurrenceProperties.annualMode() == AnnualRecurrenceMode.CALENDAR_YEAR
              ? base.plusYears(1)
              : base.plusDays(365);
    };
  }

  /** Validates a rule string without computing a date. */
  public RecurrenceRule validate(String rule) {
    return RecurrenceRule.parse(rule);
  }

  private LocalDate nextMonthly(RecurrenceRule rule, LocalDate base) {
    YearMonth nextMonth = YearMonth.from(base).plusMonths(1);
    if (rule.isLastDay()) {
      return nextMonth.atEndOfMonth();
    }
    if (rule.isLastBusinessDay()) {
      return walkBackToBusinessDay(nextMonth.atEndOfMonth());
    }
    Integer day = rule.dayOfMonth();
    if (day == null) {
      return base.plusMonths(1);
    }
    // Nearest occurrence of the day strictly after base, clamped to the month's length.
    LocalDate sameMonth = clampedDay(YearMonth.from(base), day);
    if (sameMonth.isAfter(base)) {
      return sameMonth;
    }
    return clampedDay(nextMonth, day);
  }

  private LocalDate lastBusinessDayOfNextQuarter(LocalDate base) {
    YearMonth shifted = YearMonth.from(base).plusMonths(3);
    int quarterEndMonth = ((shifted.getMonthValue() - 1) / 3 + 1) * 3;
    YearMonth quarterEnd = YearMonth.of(shifted.getYear(), quarterEndMonth);
    return walkBackToBusinessDay(quarterEnd.atEndOfMonth());
  }

  private static LocalDate clampedDay(YearMonth month, int day) {
    return month.atDay(Math.min(day, month.lengthOfMonth()));
  }

  private static LocalDate walkBackToBusinessDay(LocalDate date) {
    LocalDate result = date;
    while (result.getDayOfWeek() == DayOfWeek.SATURDAY
        || result.getDayOfWeek() == DayOfWeek.SUNDAY) {
      result = result.minusDays(1);
    }
    return result;
  }
}
