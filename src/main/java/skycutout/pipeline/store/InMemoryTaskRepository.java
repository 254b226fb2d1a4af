package skycutout.pipeline.store;

import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Process-local task registry. The map is never exposed; callers only see
 * snapshots or go through {@link #mutate}.
 */
public final class InMemoryTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRepository.class);

    private final ConcurrentMap<String, TaskRecord> tasks = new ConcurrentHashMap<>();

    @Override
    public TaskRecord create(String catalogPath, CutoutRequest request) {
        String id = UUID.randomUUID().toString();
        TaskRecord record = new TaskRecord(id, catalogPath, request);
        if (tasks.putIfAbsent(id, record) != null) {
            throw new IllegalStateException("Duplicate task id " + id);
        }
        log.debug("Registered task {}", id);
        return record;
    }

    @Override
    public Optional<TaskSnapshot> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    @Override
    public void mutate(String taskId, Consumer<TaskRecord> mutation) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            throw new NoSuchElementException("Unknown task: " + taskId);
        }
        synchronized (record) {
            mutation.accept(record);
        }
    }

    @Override
    public List<TaskSnapshot> findAll() {
        return tasks.values().stream()
                .map(TaskRecord::snapshot)
                .sorted(Comparator.comparing(TaskSnapshot::createdAt).reversed())
                .toList();
    }

    @Override
    public int count() {
        return tasks.size();
    }
}
