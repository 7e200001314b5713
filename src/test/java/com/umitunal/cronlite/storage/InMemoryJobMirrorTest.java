package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.error.PersistenceException;
import com.umitunal.cronlite.model.JobRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryJobMirrorTest {

    private InMemoryJobMirror mirror;

    @BeforeEach
    void setUp() {
        mirror = new InMemoryJobMirror();
        mirror.open();
    }

    private static JobRecord record(String id, long scheduleTime) {
        return new JobRecord()
                .put(JobRecord.ID, id)
                .put(JobRecord.SCHEDULE_TIME, Long.toString(scheduleTime));
    }

    @Test
    @DisplayName("Should store copies so later caller changes are not visible")
    void testStoresCopies() throws Exception {
        // Given
        JobRecord record = record("job", 100);
        mirror.put("job", record);

        // When
        record.put(JobRecord.STATUS, "running");

        // Then
        assertThat(mirror.get("job").get(JobRecord.STATUS)).isNull();
    }

    @Test
    @DisplayName("Should return due records sorted by schedule time")
    void testGetDue() throws Exception {
        mirror.put("b", record("b", 200));
        mirror.put("a", record("a", 100));
        mirror.put("c", record("c", 300));

        assertThat(mirror.getDue(200)).extracting(JobRecord::getId).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should update existing records and reject unknown ones")
    void testUpdateFields() throws Exception {
        mirror.put("job", record("job", 100));

        mirror.updateFields("job", Map.of(JobRecord.STATUS, "failed"));

        assertThat(mirror.get("job").get(JobRecord.STATUS)).isEqualTo("failed");
        assertThatThrownBy(() -> mirror.updateFields("ghost", Map.of()))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("Should keep records while closed and refuse access")
    void testCloseAndReopen() throws Exception {
        // Given
        mirror.put("job", record("job", 100));

        // When
        mirror.close();

        // Then
        assertThatThrownBy(() -> mirror.getAll()).isInstanceOf(PersistenceException.class);
        mirror.open();
        assertThat(mirror.getAll()).containsExactly(record("job", 100));
        mirror.delete("job");
        assertThat(mirror.size()).isZero();
    }
}
