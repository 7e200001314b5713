package com.umitunal.cronlite.cron;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.cronlite.error.InvalidCronExpressionException;
import com.umitunal.cronlite.error.ValidationException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Cron evaluator backed by cron-utils, using the Spring-style definition
 * with a leading seconds field.
 */
public class CronUtilsEvaluator implements CronEvaluator {
    private final CronParser parser;
    private final ZoneId zone;

    public CronUtilsEvaluator() {
        this(ZoneId.systemDefault());
    }

    public CronUtilsEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public boolean validate(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    @Override
    public long nextOccurrence(String expression, long fromInstant) {
        return next(ExecutionTime.forCron(parse(expression)), expression, fromInstant);
    }

    @Override
    public List<Long> nextOccurrences(String expression, int count, long fromInstant) {
        if (count <= 0) {
            throw new ValidationException("Count must be a positive number: " + count);
        }
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));

        List<Long> occurrences = new ArrayList<>(count);
        long cursor = fromInstant;
        for (int i = 0; i < count; i++) {
            cursor = next(executionTime, expression, cursor);
            occurrences.add(cursor);
        }
        return occurrences;
    }

    @Override
    public String describe(String expression) {
        return CronDescriptor.instance(Locale.UK).describe(parse(expression));
    }

    private Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "Cron expression is required");
        }
        try {
            return parser.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    private long next(ExecutionTime executionTime, String expression, long fromInstant) {
        // Cron fields stop at seconds, so sub-second precision is dropped before matching
        ZonedDateTime from = Instant.ofEpochMilli(fromInstant).atZone(zone).truncatedTo(ChronoUnit.SECONDS);
        ZonedDateTime next = executionTime.nextExecution(from)
                .orElseThrow(() -> new InvalidCronExpressionException(expression, "Expression never fires"));

        long nextMillis = next.toInstant().toEpochMilli();
        while (nextMillis <= fromInstant) {
            next = executionTime.nextExecution(next)
                    .orElseThrow(() -> new InvalidCronExpressionException(expression, "Expression never fires"));
            nextMillis = next.toInstant().toEpochMilli();
        }
        return nextMillis;
    }
}
