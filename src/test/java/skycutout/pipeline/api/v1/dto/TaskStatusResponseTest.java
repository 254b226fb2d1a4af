package skycutout.pipeline.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import skycutout.pipeline.model.CatalogSummary;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.FailureKind;
import skycutout.pipeline.model.TaskCounters;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusResponseTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void fromCompletedSnapshot() throws Exception {
        TaskSnapshot snapshot = TaskSnapshot.builder()
                .id("task-1")
                .status(TaskStatus.COMPLETED)
                .progress(100)
                .counters(new TaskCounters(4, 1, 2, 1))
                .message("Completed with 1 errors")
                .catalogSummary(new CatalogSummary(2, 1, "RA", "DEC", "ID", 0, 1, 0, 1))
                .failedTargets(List.of(new FailedTarget("obj-1", "VIS", "BGSUB", FailureKind.PRODUCTION, "boom", true)))
                .bundlePath(Path.of("downloads/task-1/task-1.zip"))
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        TaskStatusResponse response = TaskStatusResponse.from(snapshot);

        assertEquals("task-1", response.taskId());
        assertEquals("COMPLETED", response.status());
        assertEquals(4, response.total());
        assertEquals(1, response.errors());
        assertEquals(Path.of("downloads/task-1/task-1.zip").toString(), response.bundle());
        assertEquals("RA", response.catalog().raColumn());
        assertEquals("PRODUCTION", response.failedTargets().get(0).kind());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));
        assertEquals("2024-01-01T00:00:00Z", json.get("createdAt").asText());
        assertTrue(json.get("failedTargets").get(0).get("transient").asBoolean());
        assertFalse(json.has("error"));
        assertFalse(json.has("startedAt"));
    }

    @Test
    void bundleHiddenUntilCompleted() {
        TaskSnapshot snapshot = TaskSnapshot.builder()
                .id("task-2")
                .status(TaskStatus.PROCESSING)
                .progress(40)
                .counters(new TaskCounters(5, 2, 0, 0))
                .bundlePath(Path.of("ignored.zip"))
                .build();

        TaskStatusResponse response = TaskStatusResponse.from(snapshot);

        assertNull(response.bundle());
        assertNull(response.failedTargets());
        assertNull(response.catalog());
    }

    @Test
    void failedTaskCarriesError() throws Exception {
        TaskSnapshot snapshot = TaskSnapshot.builder()
                .id("task-3")
                .status(TaskStatus.FAILED)
                .counters(TaskCounters.EMPTY)
                .error("Catalog contains no rows")
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(TaskStatusResponse.from(snapshot)));

        assertEquals("FAILED", json.get("status").asText());
        assertEquals("Catalog contains no rows", json.get("error").asText());
        assertFalse(json.has("bundle"));
    }

    @Test
    void compactDropsDetails() {
        TaskSnapshot snapshot = TaskSnapshot.builder()
                .id("task-4")
                .status(TaskStatus.COMPLETED)
                .counters(new TaskCounters(1, 1, 0, 0))
                .catalogSummary(new CatalogSummary(1, 0, "RA", "DEC", null, 0, 0, 0, 0))
                .bundlePath(Path.of("b.zip"))
                .build();

        TaskStatusResponse compact = TaskStatusResponse.from(snapshot).compact();

        assertNull(compact.catalog());
        assertEquals("b.zip", compact.bundle());
    }
}
