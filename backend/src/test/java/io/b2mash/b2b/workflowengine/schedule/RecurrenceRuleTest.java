package io.b2mash.b2b.workflowengine.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.workflowengine.exception.UnknownRecurrenceRuleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RecurrenceRuleTest {

  @Test
  void parse_bareFrequency_hasNoQualifier() {
    var rule = RecurrenceRule.parse("weekly");
    assertThat(rule.frequency()).isEqualTo(RecurrenceFrequency.WEEKLY);
    assertThat(rule.qualifier()).isNull();
    assertThat(rule.dayOfMonth()).isNull();
  }

  @Test
  void parse_monthlyDay_exposesDayOfMonth() {
    var rule = RecurrenceRule.parse("monthly:15");
    assertThat(rule.frequency()).isEqualTo(RecurrenceFrequency.MONTHLY);
    assertThat(rule.dayOfMonth()).isEqualTo(15);
    assertThat(rule.isLastDay()).isFalse();
  }

  @Test
  void parse_isCaseInsensitiveAndTrimmed() {
    var rule = RecurrenceRule.parse("  Quarterly:LAST_BIZ_DAY ");
    assertThat(rule.frequency()).isEqualTo(RecurrenceFrequency.QUARTERLY);
    assertThat(rule.isLastBusinessDay()).isTrue();
    assertThat(rule.toString()).isEqualTo("quarterly:last_biz_day");
  }

  @Test
  void parse_quarterlyWithOtherQualifier_isAccepted() {
    var rule = RecurrenceRule.parse("quarterly:15");
    assertThat(rule.frequency()).isEqualTo(RecurrenceFrequency.QUARTERLY);
    assertThat(rule.isLastBusinessDay()).isFalse();
    assertThat(rule.toString()).isEqualTo("quarterly:15");
  }

  @Test
  void toString_normalizesBareRule() {
    assertThat(RecurrenceRule.parse("ANNUALLY").toString()).isEqualTo("annually");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "  ",
        "hourly",
        "monthly:0",
        "monthly:32",
        "monthly:first_day",
        "monthly:",
        "weekly:2",
        "quarterly:",
        "annually:1",
        "monthly:1:2"
      })
  void parse_rejectsUnknownRules(String rule) {
    assertThatThrownBy(() -> RecurrenceRule.parse(rule))
        .isInstanceOf(UnknownRecurrenceRuleException.class);
  }

  @Test
  void parse_null_throws() {
    assertThatThrownBy(() -> RecurrenceRule.parse(null))
        .isInstanceOf(UnknownRecurrenceRuleException.class);
  }

  @Test
  void unknownRule_exposesOffendingRule() {
    assertThatThrownBy(() -> RecurrenceRule.parse("fortnightly"))
        .isInstanceOfSatisfying(
            UnknownRecurrenceRuleException.class,
            e -> assertThat(e.getRule()).isEqualTo("fortnightly"));
  }
}
