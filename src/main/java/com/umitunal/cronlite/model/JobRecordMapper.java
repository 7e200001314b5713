package com.umitunal.cronlite.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.error.ValidationException;
import com.umitunal.cronlite.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;

import static com.umitunal.cronlite.model.JobRecord.*;

/**
 * Converts jobs to flat mirror records and back.
 *
 * Nested values ({@code data}, {@code retryStrategy}) are stored as JSON strings.
 * Malformed nested values decode to a safe default instead of failing the record;
 * a record missing its id or schedule time is rejected as corrupt.
 */
public class JobRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(JobRecordMapper.class);

    public static final String DEFAULT_HANDLER = "defaultHandler";

    private final JsonCodec<Map<String, Object>> dataCodec;
    private final JsonCodec<RetryStrategy> retryStrategyCodec;

    public JobRecordMapper() {
        this(new JsonCodec<>(new TypeReference<Map<String, Object>>() {}),
             new JsonCodec<>(RetryStrategy.class));
    }

    public JobRecordMapper(JsonCodec<Map<String, Object>> dataCodec, JsonCodec<RetryStrategy> retryStrategyCodec) {
        this.dataCodec = dataCodec;
        this.retryStrategyCodec = retryStrategyCodec;
    }

    public JobRecord toRecord(Job job) {
        JobRecord record = new JobRecord();
        record.put(ID, job.getId());
        record.put(SCHEDULE_TIME, Long.toString(job.getScheduleTime()));
        record.put(HANDLER_NAME, job.getHandlerName());
        record.put(DATA, dataCodec.encodeToString(job.getData() == null ? Collections.emptyMap() : job.getData()));
        record.put(STATUS, job.getStatus().wireName());
        record.put(CREATED_AT, Long.toString(job.getCreatedAt()));
        record.put(RETRY_STRATEGY, job.getRetryStrategy() == null ? "" : retryStrategyCodec.encodeToString(job.getRetryStrategy()));
        record.put(RECURRING, Boolean.toString(job.isRecurring()));
        record.put(CRON_EXPRESSION, job.getCronExpression());
        record.put(INTERVAL_MS, job.getIntervalMs() == null ? "" : job.getIntervalMs().toString());
        record.put(EXECUTED_AT, job.getExecutedAt() == null ? "" : job.getExecutedAt().toString());
        record.put(LAST_ERROR, job.getLastError());
        record.put(RETRY_COUNT, Integer.toString(job.getRetryCount()));
        return record;
    }

    /**
     * Rebuild a job from a mirror record.
     *
     * @throws ValidationException if the record is corrupt
     */
    public ScheduledJob fromRecord(JobRecord record) {
        String id = record.getId();
        if (isEmpty(id)) {
            throw new ValidationException("Record has no id: " + record);
        }
        OptionalLong scheduleTime = record.getScheduleTime();
        if (scheduleTime.isEmpty()) {
            throw new ValidationException("Record " + id + " has no valid schedule time");
        }

        String handlerName = record.get(HANDLER_NAME);
        ScheduledJob.Builder builder = ScheduledJob.builder(id, scheduleTime.getAsLong(),
                        isEmpty(handlerName) ? DEFAULT_HANDLER : handlerName)
                .withData(decodeData(id, record.get(DATA)))
                .withRetryStrategy(decodeRetryStrategy(id, record.get(RETRY_STRATEGY)))
                .withCreatedAt(parseLong(record.get(CREATED_AT), System.currentTimeMillis()));

        if ("true".equals(record.get(RECURRING))) {
            String cron = record.get(CRON_EXPRESSION);
            Long interval = parseOptionalLong(record.get(INTERVAL_MS));
            if (!isEmpty(cron)) {
                builder.withCronExpression(cron);
            }
            if (interval != null && interval > 0) {
                builder.withIntervalMs(interval);
            }
        }

        ScheduledJob job = builder.build();
        job.setStatus(decodeStatus(id, record.get(STATUS)));
        job.setExecutedAt(parseOptionalLong(record.get(EXECUTED_AT)));
        job.setLastError(isEmpty(record.get(LAST_ERROR)) ? null : record.get(LAST_ERROR));
        job.setRetryCount(parseRetryCount(id, record.get(RETRY_COUNT)));
        return job;
    }

    private Map<String, Object> decodeData(String id, String json) {
        if (isEmpty(json)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> data = dataCodec.decodeFromString(json);
            return data == null ? Collections.emptyMap() : data;
        } catch (IllegalArgumentException e) {
            log.warn("Job {} has undecodable data, using empty payload: {}", id, json);
            return Collections.emptyMap();
        }
    }

    private RetryStrategy decodeRetryStrategy(String id, String json) {
        if (isEmpty(json) || "null".equals(json)) {
            return null;
        }
        try {
            return retryStrategyCodec.decodeFromString(json);
        } catch (IllegalArgumentException e) {
            log.warn("Job {} has undecodable retry strategy, ignoring it: {}", id, json);
            return null;
        }
    }

    private static Job.Status decodeStatus(String id, String value) {
        if (isEmpty(value)) {
            return Job.Status.PENDING;
        }
        try {
            return Job.Status.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Record " + id + " has unknown status: " + value, e);
        }
    }

    private static int parseRetryCount(String id, String value) {
        if (isEmpty(value)) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Job {} has invalid retry count, using 0: {}", id, value);
            return 0;
        }
    }

    private static long parseLong(String value, long fallback) {
        Long parsed = parseOptionalLong(value);
        return parsed == null ? fallback : parsed;
    }

    private static Long parseOptionalLong(String value) {
        if (isEmpty(value)) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
