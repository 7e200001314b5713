package com.umitunal.cronlite.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Flat, string-only representation of a job as stored in a durable mirror.
 * Absent values are stored as empty strings.
 */
public final class JobRecord {
    public static final String ID = "id";
    public static final String SCHEDULE_TIME = "scheduleTime";
    public static final String HANDLER_NAME = "handlerName";
    public static final String DATA = "data";
    public static final String STATUS = "status";
    public static final String CREATED_AT = "createdAt";
    public static final String RETRY_STRATEGY = "retryStrategy";
    public static final String RECURRING = "recurring";
    public static final String CRON_EXPRESSION = "cronExpression";
    public static final String INTERVAL_MS = "intervalMs";
    public static final String EXECUTED_AT = "executedAt";
    public static final String LAST_ERROR = "lastError";
    public static final String RETRY_COUNT = "retryCount";

    private final Map<String, String> fields;

    public JobRecord() {
        this.fields = new LinkedHashMap<>();
    }

    public JobRecord(Map<String, String> fields) {
        this();
        merge(fields);
    }

    /**
     * Gets a field value, or null if the field is not present.
     */
    public String get(String field) {
        return fields.get(field);
    }

    public JobRecord put(String field, String value) {
        fields.put(Objects.requireNonNull(field, "field"), value == null ? "" : value);
        return this;
    }

    /**
     * Overwrite the given fields, keeping every other field.
     */
    public JobRecord merge(Map<String, String> partial) {
        partial.forEach(this::put);
        return this;
    }

    public String getId() {
        return fields.get(ID);
    }

    /**
     * Gets the schedule time if present and numeric.
     */
    public OptionalLong getScheduleTime() {
        String value = fields.get(SCHEDULE_TIME);
        if (value == null || value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public JobRecord copy() {
        return new JobRecord(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRecord)) return false;
        return fields.equals(((JobRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "JobRecord" + fields;
    }
}
