package skycutout.pipeline.config;

import skycutout.pipeline.cache.CacheLayout;
import skycutout.pipeline.cache.CacheResolver;
import skycutout.pipeline.cache.CutoutCache;
import skycutout.pipeline.catalog.CatalogReader;
import skycutout.pipeline.packaging.ResultPackager;
import skycutout.pipeline.producer.ArtifactProducer;
import skycutout.pipeline.repository.TaskRepository;
import skycutout.pipeline.scheduler.WorkScheduler;
import skycutout.pipeline.service.CutoutService;
import skycutout.pipeline.store.InMemoryTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Manual dependency injection container.
 * Wires the pipeline around an externally supplied {@link ArtifactProducer}.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(CutoutConfig.fromEnv(), producer)) {
 *     Submission submission = deps.cutoutService().submit(catalog, request);
 *     TaskSnapshot done = submission.completion().join();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CutoutConfig config;
    private final TaskRepository taskRepository;
    private final CutoutCache cutoutCache;
    private final CacheResolver cacheResolver;
    private final WorkScheduler workScheduler;
    private final ResultPackager resultPackager;
    private final CutoutService cutoutService;

    private Dependencies(CutoutConfig config, ArtifactProducer producer) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        this.taskRepository = new InMemoryTaskRepository();
        this.cutoutCache = new CutoutCache(new CacheLayout(config.cacheRoot()));

        // Pipeline stages
        this.cacheResolver = new CacheResolver(cutoutCache);
        this.workScheduler = new WorkScheduler(producer, cutoutCache);
        this.resultPackager = new ResultPackager(config.workRoot(), config.bundleRoot());

        // Service
        this.cutoutService = new CutoutService(taskRepository, new CatalogReader(), cacheResolver,
                workScheduler, resultPackager, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and artifact producer.
     */
    public static Dependencies create(CutoutConfig config, ArtifactProducer producer) {
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(producer, "producer is required");
        return new Dependencies(config, producer);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create(ArtifactProducer producer) {
        return create(CutoutConfig.fromEnv(), producer);
    }

    public CutoutConfig config() {
        return config;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public CutoutCache cutoutCache() {
        return cutoutCache;
    }

    public CacheResolver cacheResolver() {
        return cacheResolver;
    }

    public WorkScheduler workScheduler() {
        return workScheduler;
    }

    public ResultPackager resultPackager() {
        return resultPackager;
    }

    public CutoutService cutoutService() {
        return cutoutService;
    }

    @Override
    public void close() {
        log.info("Shutting down...");
        cutoutService.close();
        log.info("Shutdown complete");
    }
}
