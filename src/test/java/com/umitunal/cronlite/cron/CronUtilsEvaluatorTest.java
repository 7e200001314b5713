package com.umitunal.cronlite.cron;

import com.umitunal.cronlite.error.InvalidCronExpressionException;
import com.umitunal.cronlite.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class CronUtilsEvaluatorTest {

    private final CronUtilsEvaluator evaluator = new CronUtilsEvaluator(ZoneOffset.UTC);

    private static long at(String isoInstant) {
        return Instant.parse(isoInstant).toEpochMilli();
    }

    @Test
    @DisplayName("Should find the next five-second boundary")
    void testNextOccurrence() {
        long next = evaluator.nextOccurrence("*/5 * * * * *", at("2024-01-01T00:00:03Z"));

        assertThat(next).isEqualTo(at("2024-01-01T00:00:05Z"));
    }

    @Test
    @DisplayName("Should return an instant strictly after the starting point")
    void testStrictlyAfter() {
        assertThat(evaluator.nextOccurrence("*/5 * * * * *", at("2024-01-01T00:00:05Z")))
                .isEqualTo(at("2024-01-01T00:00:10Z"));
        assertThat(evaluator.nextOccurrence("*/5 * * * * *", at("2024-01-01T00:00:05.500Z")))
                .isEqualTo(at("2024-01-01T00:00:10Z"));
    }

    @Test
    @DisplayName("Should list consecutive occurrences in order")
    void testNextOccurrences() {
        assertThat(evaluator.nextOccurrences("*/5 * * * * *", 3, at("2024-01-01T00:00:03Z")))
                .containsExactly(
                        at("2024-01-01T00:00:05Z"),
                        at("2024-01-01T00:00:10Z"),
                        at("2024-01-01T00:00:15Z"));
    }

    @Test
    @DisplayName("Should reject a non-positive occurrence count")
    void testNonPositiveCount() {
        assertThatThrownBy(() -> evaluator.nextOccurrences("* * * * * *", 0, 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> evaluator.nextOccurrences("* * * * * *", -2, 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should reject malformed expressions")
    void testInvalidExpressions() {
        assertThat(evaluator.validate("*/5 * * * * *")).isTrue();
        assertThat(evaluator.validate("not a cron")).isFalse();
        assertThat(evaluator.validate("* * * * *")).isFalse();
        assertThat(evaluator.validate("")).isFalse();
        assertThat(evaluator.validate(null)).isFalse();

        assertThatThrownBy(() -> evaluator.nextOccurrence("61 * * * * *", 0))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageStartingWith("Invalid cron expression: 61 * * * * *");
    }

    @Test
    @DisplayName("Should evaluate wall-clock fields in the configured zone")
    void testZone() {
        CronUtilsEvaluator istanbul = new CronUtilsEvaluator(ZoneId.of("Europe/Istanbul"));

        long next = istanbul.nextOccurrence("0 0 9 * * *", at("2024-01-01T00:00:00Z"));

        assertThat(next).isEqualTo(at("2024-01-01T06:00:00Z"));
    }

    @Test
    @DisplayName("Should describe an expression in words")
    void testDescribe() {
        assertThat(evaluator.describe("*/5 * * * * *")).isNotBlank();
        assertThatThrownBy(() -> evaluator.describe("nope"))
                .isInstanceOf(InvalidCronExpressionException.class);
    }
}
