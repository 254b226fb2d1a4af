package skycutout.pipeline.service;

import skycutout.pipeline.model.TaskSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned for an accepted catalog submission.
 *
 * @param taskId     identifier for status queries
 * @param completion completes with the terminal snapshot once the task finished
 */
public record Submission(String taskId, CompletableFuture<TaskSnapshot> completion) {
}
