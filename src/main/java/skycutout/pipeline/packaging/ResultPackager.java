package skycutout.pipeline.packaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import skycutout.pipeline.cache.CacheLayout;
import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.CacheEntry;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.FailureKind;
import skycutout.pipeline.model.ProducedArtifact;
import skycutout.pipeline.store.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Assembles cache hits and freshly produced artifacts into one zip bundle per task.
 *
 * <p>Artifacts are staged under {@code {work}/{task}/{PRODUCT}/{BAND}/} so the bundle mirrors
 * the cache grouping, a {@code manifest.json} is added, and the staging tree is zipped to
 * {@code {bundles}/{task}/{task}.zip}. Cached artifacts are copied from their cache files;
 * only artifacts the cache could not take are written from memory. Partial coverage is
 * fine: a cache entry that disappeared is moved to the task's errors and packaging goes on.
 */
public class ResultPackager {

    private static final Logger log = LoggerFactory.getLogger(ResultPackager.class);

    static final String MANIFEST = "manifest.json";

    private final Path workRoot;
    private final Path bundleRoot;
    private final ObjectMapper mapper;

    public ResultPackager(Path workRoot, Path bundleRoot) {
        this.workRoot = workRoot;
        this.bundleRoot = bundleRoot;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return location of the zip bundle
     * @throws PackagingException if the staging tree or the archive cannot be written
     */
    public Path pack(TaskRecord task, List<CacheEntry> hits, List<ProducedArtifact> produced)
            throws PackagingException {
        Path staging = workRoot.resolve(task.id());
        Path bundle = bundleRoot.resolve(task.id()).resolve(task.id() + ".zip");

        try {
            Files.createDirectories(staging);
            List<BundleManifest.Entry> entries = new ArrayList<>();
            Set<Path> written = new HashSet<>();

            for (CacheEntry hit : hits) {
                Path dest = stagingPath(staging, hit.request());
                if (written.contains(dest)) {
                    continue;
                }
                try {
                    Files.createDirectories(dest.getParent());
                    Files.copy(hit.path(), dest, StandardCopyOption.REPLACE_EXISTING);
                } catch (NoSuchFileException e) {
                    log.warn("Task {}: cached artifact {} vanished before packaging", task.id(), hit.path());
                    task.reclassifyHitAsError(FailedTarget.of(hit.request(), FailureKind.MISSING_HIT,
                            "cache entry disappeared: " + hit.path().getFileName(), true));
                    continue;
                }
                written.add(dest);
                entries.add(entry(staging, dest, hit.request(), BundleManifest.Source.CACHE));
            }

            for (ProducedArtifact artifact : produced) {
                Path dest = stagingPath(staging, artifact.request());
                Files.createDirectories(dest.getParent());
                if (artifact.cached()) {
                    try {
                        Files.copy(artifact.cachePath(), dest, StandardCopyOption.REPLACE_EXISTING);
                    } catch (NoSuchFileException e) {
                        log.warn("Task {}: produced artifact {} vanished from the cache before packaging",
                                task.id(), artifact.cachePath());
                        task.reclassifyProducedAsError(artifact.multiplicity(),
                                FailedTarget.of(artifact.request(), FailureKind.MISSING_HIT,
                                        "cache entry disappeared: " + artifact.cachePath().getFileName(), true));
                        continue;
                    }
                } else {
                    Files.write(dest, artifact.content());
                }
                if (written.add(dest)) {
                    entries.add(entry(staging, dest, artifact.request(), BundleManifest.Source.PRODUCED));
                }
            }

            BundleManifest manifest = BundleManifest.of(task.id(), task.snapshot().counters(), entries);
            mapper.writeValue(staging.resolve(MANIFEST).toFile(), manifest);

            zip(staging, bundle);
            log.info("Task {}: bundle written to {} ({} artifacts, {} bytes)",
                    task.id(), bundle, entries.size(), Files.size(bundle));
        } catch (IOException e) {
            deleteQuietly(bundle);
            throw new PackagingException("Cannot package results of task " + task.id() + ": " + e.getMessage(), e);
        } finally {
            cleanup(task.id(), staging);
        }
        return bundle;
    }

    private static Path stagingPath(Path staging, ArtifactRequest request) {
        return staging
                .resolve(request.productType().fileToken())
                .resolve(request.band().code())
                .resolve(CacheLayout.fileName(request));
    }

    private static BundleManifest.Entry entry(Path staging, Path dest, ArtifactRequest request,
            BundleManifest.Source source) {
        return new BundleManifest.Entry(
                request.targetKey().value(),
                request.instrument().name(),
                request.band().code(),
                request.productType().code(),
                request.size(),
                source,
                entryName(staging, dest));
    }

    private static void zip(Path staging, Path bundle) throws IOException {
        Files.createDirectories(bundle.getParent());
        List<Path> files;
        try (Stream<Path> walk = Files.walk(staging)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        }
        try (OutputStream out = Files.newOutputStream(bundle);
                ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (Path file : files) {
                zip.putNextEntry(new ZipEntry(entryName(staging, file)));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    private static String entryName(Path staging, Path file) {
        return staging.relativize(file).toString().replace('\\', '/');
    }

    private static void cleanup(String taskId, Path staging) {
        if (!Files.exists(staging)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(staging)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            log.warn("Task {}: failed to clean staging directory {}: {}", taskId, staging, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove partial bundle {}: {}", file, e.getMessage());
        }
    }
}
