package com.umitunal.cronlite.serialization;

import com.umitunal.cronlite.model.JobRecord;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Compact binary codec for job records using ByteBuffer.
 *
 * Binary format:
 * - format version (1 byte)
 * - field count (4 bytes)
 * - per field: name length (4 bytes) + name bytes (UTF-8),
 *   value length (4 bytes) + value bytes (UTF-8)
 */
public class JobRecordCodec implements PayloadCodec<JobRecord> {
    private static final byte FORMAT_VERSION = 1;

    @Override
    public byte[] encode(JobRecord record) {
        Map<String, String> fields = record.asMap();
        List<byte[]> parts = new ArrayList<>(fields.size() * 2);
        int totalSize = 1 + 4;

        for (Map.Entry<String, String> field : fields.entrySet()) {
            byte[] name = field.getKey().getBytes(UTF_8);
            byte[] value = field.getValue().getBytes(UTF_8);
            parts.add(name);
            parts.add(value);
            totalSize += 4 + name.length + 4 + value.length;
        }

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        buffer.putInt(fields.size());
        for (byte[] part : parts) {
            buffer.putInt(part.length);
            buffer.put(part);
        }
        return buffer.array();
    }

    @Override
    public JobRecord decode(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            byte version = buffer.get();
            if (version != FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported record format version: " + version);
            }

            int fieldCount = buffer.getInt();
            if (fieldCount < 0) {
                throw new IllegalArgumentException("Negative field count: " + fieldCount);
            }

            JobRecord record = new JobRecord();
            for (int i = 0; i < fieldCount; i++) {
                String name = readString(buffer);
                String value = readString(buffer);
                record.put(name, value);
            }

            if (buffer.hasRemaining()) {
                throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after record");
            }
            return record;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated job record", e);
        }
    }

    private static String readString(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("Invalid field length: " + length);
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }
}
