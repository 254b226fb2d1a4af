package skycutout.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skycutout.pipeline.model.CatalogSummary;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for task status.
 * The bundle location is only reported once the task completed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("message") String message,
        @JsonProperty("error") String error,
        @JsonProperty("total") int total,
        @JsonProperty("cachedHits") int cachedHits,
        @JsonProperty("newlyProduced") int newlyProduced,
        @JsonProperty("errors") int errors,
        @JsonProperty("catalog") CatalogInfo catalog,
        @JsonProperty("failedTargets") List<FailedTargetResponse> failedTargets,
        @JsonProperty("bundle") String bundle,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    /** Catalog shape as accepted by validation. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CatalogInfo(
            @JsonProperty("rows") int rows,
            @JsonProperty("rowsWithId") int rowsWithId,
            @JsonProperty("raColumn") String raColumn,
            @JsonProperty("decColumn") String decColumn,
            @JsonProperty("idColumn") String idColumn) {

        static CatalogInfo from(CatalogSummary summary) {
            return new CatalogInfo(summary.rows(), summary.rowsWithId(),
                    summary.longitudeColumn(), summary.latitudeColumn(), summary.idColumn());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FailedTargetResponse(
            @JsonProperty("targetKey") String targetKey,
            @JsonProperty("band") String band,
            @JsonProperty("productType") String productType,
            @JsonProperty("kind") String kind,
            @JsonProperty("message") String message,
            @JsonProperty("transient") boolean transientFailure) {

        static FailedTargetResponse from(FailedTarget failure) {
            return new FailedTargetResponse(failure.targetKey(), failure.band(), failure.productType(),
                    failure.kind().name(), failure.message(), failure.transientFailure());
        }
    }

    /** Create response from domain model */
    public static TaskStatusResponse from(TaskSnapshot snapshot) {
        List<FailedTargetResponse> failures = snapshot.failedTargets().isEmpty()
                ? null
                : snapshot.failedTargets().stream().map(FailedTargetResponse::from).toList();
        String bundle = snapshot.status() == TaskStatus.COMPLETED && snapshot.bundlePath() != null
                ? snapshot.bundlePath().toString()
                : null;

        return new TaskStatusResponse(
                snapshot.id(),
                snapshot.status().name(),
                snapshot.progress(),
                snapshot.message(),
                snapshot.error(),
                snapshot.counters().total(),
                snapshot.counters().cachedHits(),
                snapshot.counters().newlyProduced(),
                snapshot.counters().errors(),
                snapshot.catalogSummary() != null ? CatalogInfo.from(snapshot.catalogSummary()) : null,
                failures,
                bundle,
                snapshot.createdAt(),
                snapshot.startedAt(),
                snapshot.finishedAt());
    }

    /** Compact version for list responses */
    public TaskStatusResponse compact() {
        return new TaskStatusResponse(taskId, status, progress, message, error,
                total, cachedHits, newlyProduced, errors, null, null, bundle,
                createdAt, startedAt, finishedAt);
    }
}
