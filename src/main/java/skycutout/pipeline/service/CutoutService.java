package skycutout.pipeline.service;

import skycutout.pipeline.cache.CacheResolution;
import skycutout.pipeline.cache.CacheResolver;
import skycutout.pipeline.catalog.CatalogReader;
import skycutout.pipeline.catalog.CatalogValidationException;
import skycutout.pipeline.catalog.CatalogValidator;
import skycutout.pipeline.catalog.ColumnBinding;
import skycutout.pipeline.catalog.ColumnResolver;
import skycutout.pipeline.catalog.RawCatalog;
import skycutout.pipeline.catalog.ValidatedCatalog;
import skycutout.pipeline.config.CutoutConfig;
import skycutout.pipeline.identity.TargetKeyDeriver;
import skycutout.pipeline.model.Band;
import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.ProducedArtifact;
import skycutout.pipeline.model.SkyPosition;
import skycutout.pipeline.model.Target;
import skycutout.pipeline.model.TargetKey;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.packaging.PackagingException;
import skycutout.pipeline.packaging.ResultPackager;
import skycutout.pipeline.repository.TaskRepository;
import skycutout.pipeline.scheduler.WorkScheduler;
import skycutout.pipeline.store.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs catalog submissions through the pipeline:
 * validate → derive keys → resolve against the cache → produce misses → package.
 *
 * <p>Several tasks may run at once (up to {@link CutoutConfig#taskRunners()}); each one gets
 * its own bounded worker pool from the {@link WorkScheduler}.
 */
public class CutoutService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CutoutService.class);

    private final TaskRepository taskRepository;
    private final CatalogReader catalogReader;
    private final CatalogValidator catalogValidator;
    private final CacheResolver cacheResolver;
    private final WorkScheduler workScheduler;
    private final ResultPackager resultPackager;
    private final CutoutConfig config;
    private final ExecutorService runners;

    public CutoutService(TaskRepository taskRepository,
            CatalogReader catalogReader,
            CacheResolver cacheResolver,
            WorkScheduler workScheduler,
            ResultPackager resultPackager,
            CutoutConfig config) {
        this.taskRepository = taskRepository;
        this.catalogReader = catalogReader;
        this.catalogValidator = new CatalogValidator(config.maxCatalogRows());
        this.cacheResolver = cacheResolver;
        this.workScheduler = workScheduler;
        this.resultPackager = resultPackager;
        this.config = config;

        AtomicInteger counter = new AtomicInteger();
        this.runners = Executors.newFixedThreadPool(config.taskRunners(), r -> {
            Thread t = new Thread(r, "cutout-task-runner-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Accept a catalog and process it in the background.
     *
     * @throws IllegalArgumentException if the worker count exceeds the configured maximum
     */
    public Submission submit(Path catalog, CutoutRequest request) {
        TaskRecord task = accept(catalog, request);
        CompletableFuture<TaskSnapshot> completion = CompletableFuture.supplyAsync(
                () -> execute(task, catalog), runners);
        return new Submission(task.id(), completion);
    }

    /**
     * Accept a catalog and process it on the calling thread.
     *
     * @return terminal snapshot of the task
     */
    public TaskSnapshot process(Path catalog, CutoutRequest request) {
        return execute(accept(catalog, request), catalog);
    }

    /**
     * Get a consistent view of a task.
     */
    public Optional<TaskSnapshot> status(String taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * Get all tasks, most recent first.
     */
    public List<TaskSnapshot> list() {
        return taskRepository.findAll();
    }

    private TaskRecord accept(Path catalog, CutoutRequest request) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog is required");
        }
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (request.workers() > config.maxWorkers()) {
            throw new IllegalArgumentException(
                    "workers must not exceed " + config.maxWorkers() + ": " + request.workers());
        }

        TaskRecord task = taskRepository.create(catalog.toString(), request);
        log.info("Created task {} for catalog {} with {}", task.id(), catalog.getFileName(), request);
        return task;
    }

    TaskSnapshot execute(TaskRecord task, Path catalogPath) {
        try {
            runPipeline(task, catalogPath);
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", task.id(), e);
            failIfRunning(task, "Unexpected error: " + e.getMessage());
        }
        return task.snapshot();
    }

    private void runPipeline(TaskRecord task, Path catalogPath) {
        CutoutRequest request = task.request();

        // 1. Validate request and catalog
        List<Band> bands;
        ValidatedCatalog catalog;
        try {
            bands = resolveBands(request);
            task.updateMessage("Validating catalog");
            RawCatalog raw = catalogReader.read(catalogPath);
            ColumnBinding binding = columnResolver(request).resolve(raw.columns());
            catalog = catalogValidator.validate(raw, binding);
        } catch (CatalogValidationException e) {
            log.warn("Task {} rejected: {}", task.id(), e.getMessage());
            task.fail(e.getMessage());
            return;
        }
        task.recordCatalog(catalog.summary());

        // 2. Derive target keys
        List<Target> targets = deriveTargets(task.id(), catalog.rows());

        // 3. Resolve against the cache
        task.updateMessage("Checking cache for " + targets.size() + " targets");
        CacheResolution resolution = cacheResolver.resolve(targets, bands, request.productTypes(), request.size());

        // 4. Produce misses
        task.startProcessing(resolution.total(), resolution.hits().size());
        List<ProducedArtifact> produced;
        try {
            produced = workScheduler.run(task, resolution.misses(), request.workers());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted while producing artifacts", task.id());
            task.fail("Interrupted while producing artifacts");
            return;
        }

        // 5. Package
        task.updateMessage("Packaging results");
        try {
            Path bundle = resultPackager.pack(task, resolution.hits(), produced);
            task.complete(bundle);
        } catch (PackagingException e) {
            log.error("Task {} packaging failed", task.id(), e);
            task.fail(e.getMessage());
            return;
        }

        TaskSnapshot done = task.snapshot();
        log.info("Task {} completed: total={}, cached={}, produced={}, errors={}",
                done.id(), done.counters().total(), done.counters().cachedHits(),
                done.counters().newlyProduced(), done.counters().errors());
    }

    private static List<Band> resolveBands(CutoutRequest request) throws CatalogValidationException {
        try {
            return request.resolveBands();
        } catch (IllegalArgumentException e) {
            throw new CatalogValidationException("Invalid band selection: " + e.getMessage(), e);
        }
    }

    private ColumnResolver columnResolver(CutoutRequest request) {
        return new ColumnResolver(
                config.longitudeColumns().preferring(request.longitudeColumn()),
                config.latitudeColumns().preferring(request.latitudeColumn()),
                config.idColumns().preferring(request.idColumn()));
    }

    private static List<Target> deriveTargets(String taskId, List<CatalogRow> rows) {
        List<Target> targets = new ArrayList<>(rows.size());
        Map<TargetKey, SkyPosition> seen = new HashMap<>();
        for (CatalogRow row : rows) {
            TargetKey key = TargetKeyDeriver.derive(row);
            SkyPosition first = seen.putIfAbsent(key, row.position());
            if (first != null && !first.equals(row.position())) {
                log.warn("Task {}: target {} appears at {} and {}; the first position is used",
                        taskId, key, first, row.position());
            }
            targets.add(new Target(key, row));
        }
        log.debug("Task {}: {} rows map to {} distinct targets", taskId, rows.size(), seen.size());
        return targets;
    }

    private void failIfRunning(TaskRecord task, String error) {
        taskRepository.mutate(task.id(), record -> {
            if (!record.status().isTerminal()) {
                record.fail(error);
            }
        });
    }

    @Override
    public void close() {
        runners.shutdown();
        try {
            if (!runners.awaitTermination(30, TimeUnit.SECONDS)) {
                runners.shutdownNow();
                log.warn("Task runners forcefully stopped");
            }
        } catch (InterruptedException e) {
            runners.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
