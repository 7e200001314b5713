package com.umitunal.cronlite.serialization;

import com.umitunal.cronlite.model.JobRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class JobRecordCodecTest {

    private final JobRecordCodec codec = new JobRecordCodec();

    @Test
    @DisplayName("Should preserve fields, empty values and unicode")
    void testEncodeDecode() {
        // Given
        JobRecord record = new JobRecord()
                .put(JobRecord.ID, "job-1")
                .put(JobRecord.SCHEDULE_TIME, "1700000000000")
                .put(JobRecord.DATA, "{\"city\":\"İstanbul\",\"emoji\":\"✓\"}")
                .put(JobRecord.LAST_ERROR, null);

        // When
        JobRecord decoded = codec.decode(codec.encode(record));

        // Then
        assertThat(decoded).isEqualTo(record);
        assertThat(decoded.get(JobRecord.LAST_ERROR)).isEmpty();
        assertThat(decoded.asMap().keySet())
                .containsExactly(JobRecord.ID, JobRecord.SCHEDULE_TIME, JobRecord.DATA, JobRecord.LAST_ERROR);
    }

    @Test
    @DisplayName("Should reject an unknown format version")
    void testBadVersion() {
        byte[] bytes = codec.encode(new JobRecord().put(JobRecord.ID, "a"));
        bytes[0] = 9;

        assertThatThrownBy(() -> codec.decode(bytes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Should reject truncated input")
    void testTruncated() {
        byte[] bytes = codec.encode(new JobRecord().put(JobRecord.ID, "job-truncated"));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

        assertThatThrownBy(() -> codec.decode(truncated))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject trailing bytes and negative counts")
    void testMalformed() {
        byte[] bytes = codec.encode(new JobRecord().put(JobRecord.ID, "a"));
        byte[] padded = Arrays.copyOf(bytes, bytes.length + 2);
        byte[] negative = ByteBuffer.allocate(5).put((byte) 1).putInt(-1).array();

        assertThatThrownBy(() -> codec.decode(padded)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode(negative)).isInstanceOf(IllegalArgumentException.class);
    }
}
