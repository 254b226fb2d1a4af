package skycutout.pipeline.config;

import skycutout.pipeline.catalog.ColumnAliases;
import skycutout.pipeline.model.CutoutRequest;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration holder for the cutout pipeline.
 * All settings have sensible defaults.
 */
public final class CutoutConfig {

    // Storage
    private Path cacheRoot = Path.of("cache");
    private Path bundleRoot = Path.of("downloads");
    private Path workRoot = Path.of("tmp");

    // Limits
    private int maxCatalogRows = 10_000;
    private int defaultWorkers = CutoutRequest.DEFAULT_WORKERS;
    private int maxWorkers = CutoutRequest.MAX_WORKERS;
    private int defaultSize = 128;
    private int taskRunners = 4;

    // Catalog columns
    private ColumnAliases longitudeColumns = ColumnAliases.LONGITUDE;
    private ColumnAliases latitudeColumns = ColumnAliases.LATITUDE;
    private ColumnAliases idColumns = ColumnAliases.IDENTIFIER;

    private CutoutConfig() {
    }

    public static CutoutConfig defaults() {
        return new CutoutConfig();
    }

    public static CutoutConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static CutoutConfig fromEnv(Map<String, String> env) {
        CutoutConfig config = new CutoutConfig();

        String cacheDir = env.get("CUTOUT_CACHE_DIR");
        if (cacheDir != null && !cacheDir.isBlank()) {
            config.cacheRoot = Path.of(cacheDir);
        }

        String bundleDir = env.get("CUTOUT_BUNDLE_DIR");
        if (bundleDir != null && !bundleDir.isBlank()) {
            config.bundleRoot = Path.of(bundleDir);
        }

        String workDir = env.get("CUTOUT_WORK_DIR");
        if (workDir != null && !workDir.isBlank()) {
            config.workRoot = Path.of(workDir);
        }

        String maxRows = env.get("CUTOUT_MAX_ROWS");
        if (maxRows != null && !maxRows.isBlank()) {
            config.withMaxCatalogRows(Integer.parseInt(maxRows.trim()));
        }

        String workers = env.get("CUTOUT_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.withDefaultWorkers(Integer.parseInt(workers.trim()));
        }

        return config;
    }

    // Getters
    public Path cacheRoot() {
        return cacheRoot;
    }

    public Path bundleRoot() {
        return bundleRoot;
    }

    public Path workRoot() {
        return workRoot;
    }

    public int maxCatalogRows() {
        return maxCatalogRows;
    }

    public int defaultWorkers() {
        return defaultWorkers;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int defaultSize() {
        return defaultSize;
    }

    /** How many tasks may run at the same time. */
    public int taskRunners() {
        return taskRunners;
    }

    public ColumnAliases longitudeColumns() {
        return longitudeColumns;
    }

    public ColumnAliases latitudeColumns() {
        return latitudeColumns;
    }

    public ColumnAliases idColumns() {
        return idColumns;
    }

    // Fluent setters for testing/customization
    public CutoutConfig withCacheRoot(Path cacheRoot) {
        this.cacheRoot = cacheRoot;
        return this;
    }

    public CutoutConfig withBundleRoot(Path bundleRoot) {
        this.bundleRoot = bundleRoot;
        return this;
    }

    public CutoutConfig withWorkRoot(Path workRoot) {
        this.workRoot = workRoot;
        return this;
    }

    /** Put cache, bundles and staging under one directory. */
    public CutoutConfig withBaseDirectory(Path base) {
        return withCacheRoot(base.resolve("cache"))
                .withBundleRoot(base.resolve("downloads"))
                .withWorkRoot(base.resolve("tmp"));
    }

    public CutoutConfig withMaxCatalogRows(int maxCatalogRows) {
        if (maxCatalogRows <= 0) {
            throw new IllegalArgumentException("maxCatalogRows must be positive: " + maxCatalogRows);
        }
        this.maxCatalogRows = maxCatalogRows;
        return this;
    }

    public CutoutConfig withDefaultWorkers(int workers) {
        if (workers < 1 || workers > maxWorkers) {
            throw new IllegalArgumentException("defaultWorkers must be between 1 and " + maxWorkers + ": " + workers);
        }
        this.defaultWorkers = workers;
        return this;
    }

    public CutoutConfig withMaxWorkers(int maxWorkers) {
        if (maxWorkers < 1 || maxWorkers > CutoutRequest.MAX_WORKERS) {
            throw new IllegalArgumentException(
                    "maxWorkers must be between 1 and " + CutoutRequest.MAX_WORKERS + ": " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.defaultWorkers = Math.min(defaultWorkers, maxWorkers);
        return this;
    }

    public CutoutConfig withDefaultSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("defaultSize must be positive: " + size);
        }
        this.defaultSize = size;
        return this;
    }

    public CutoutConfig withTaskRunners(int taskRunners) {
        if (taskRunners <= 0) {
            throw new IllegalArgumentException("taskRunners must be positive: " + taskRunners);
        }
        this.taskRunners = taskRunners;
        return this;
    }

    public CutoutConfig withLongitudeColumns(ColumnAliases aliases) {
        this.longitudeColumns = aliases;
        return this;
    }

    public CutoutConfig withLatitudeColumns(ColumnAliases aliases) {
        this.latitudeColumns = aliases;
        return this;
    }

    public CutoutConfig withIdColumns(ColumnAliases aliases) {
        this.idColumns = aliases;
        return this;
    }

    @Override
    public String toString() {
        return "CutoutConfig{" +
                "cacheRoot=" + cacheRoot +
                ", bundleRoot=" + bundleRoot +
                ", workRoot=" + workRoot +
                ", maxCatalogRows=" + maxCatalogRows +
                ", defaultWorkers=" + defaultWorkers +
                ", maxWorkers=" + maxWorkers +
                ", taskRunners=" + taskRunners +
                '}';
    }
}
