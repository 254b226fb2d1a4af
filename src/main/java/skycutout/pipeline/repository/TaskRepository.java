package skycutout.pipeline.repository;

import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.store.TaskRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Registry of tasks, shared by the pipeline and status queries.
 * Tasks stay registered after they finish; eviction is up to the caller.
 */
public interface TaskRepository {

    /**
     * Register a new QUEUED task.
     *
     * @param catalogPath the submitted catalog
     * @param request     what the submission asks for
     * @return the live record; the pipeline reports progress through it
     */
    TaskRecord create(String catalogPath, CutoutRequest request);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return a consistent snapshot if found
     */
    Optional<TaskSnapshot> findById(String taskId);

    /**
     * Apply several changes to one task atomically with respect to every other
     * reader and writer of that task.
     *
     * @param taskId   the task ID
     * @param mutation changes to apply
     * @throws java.util.NoSuchElementException if the task does not exist
     */
    void mutate(String taskId, Consumer<TaskRecord> mutation);

    /**
     * Get all tasks.
     *
     * @return snapshots, most recently created first
     */
    List<TaskSnapshot> findAll();

    /**
     * Number of registered tasks.
     */
    int count();
}
