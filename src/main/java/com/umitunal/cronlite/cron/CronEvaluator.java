package com.umitunal.cronlite.cron;

import com.umitunal.cronlite.error.InvalidCronExpressionException;

import java.util.List;

/**
 * Computes execution instants for six-field cron expressions
 * ({@code second minute hour day-of-month month day-of-week}).
 *
 * Implementations parse the expression on every call.
 */
public interface CronEvaluator {

    /**
     * Checks if the expression can be parsed.
     */
    boolean validate(String expression);

    /**
     * Gets the first execution instant strictly after the given instant.
     *
     * @param fromInstant millis since epoch
     * @return millis since epoch
     * @throws InvalidCronExpressionException if the expression is malformed or never fires
     */
    long nextOccurrence(String expression, long fromInstant);

    /**
     * Gets the next {@code count} execution instants after the given instant, in order.
     *
     * @throws com.umitunal.cronlite.error.ValidationException if count is not positive
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    List<Long> nextOccurrences(String expression, int count, long fromInstant);

    /**
     * Gets a human-readable description of the expression.
     *
     * @throws InvalidCronExpressionException if the expression is malformed
     */
    String describe(String expression);
}
