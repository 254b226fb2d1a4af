package skycutout.pipeline.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import skycutout.pipeline.catalog.ColumnAliases;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Loads pipeline settings from an INI file on top of a base configuration.
 * Every section and key is optional.
 *
 * <pre>
 * [paths]
 * cache_dir  = /data/cutout-cache
 * bundle_dir = /data/downloads
 * work_dir   = /tmp/cutout
 *
 * [limits]
 * max_catalog_rows = 10000
 * default_workers  = 4
 * max_workers      = 16
 * default_size     = 128
 * task_runners     = 4
 *
 * [columns]
 * ra         = RA
 * ra_aliases = TARGET_RA, RA_DEG
 * dec        = DEC
 * dec_aliases = TARGET_DEC, DEC_DEG
 * id         = TARGETID
 * id_aliases = ID, SOURCE_ID
 * </pre>
 */
public final class IniConfigLoader {

    private IniConfigLoader() {
    }

    public static CutoutConfig load(Path file) throws IOException {
        return load(file, CutoutConfig.defaults());
    }

    /**
     * @throws IOException              if the file is missing or not valid INI
     * @throws IllegalArgumentException if a numeric value is malformed or out of range
     */
    public static CutoutConfig load(Path file, CutoutConfig base) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file does not exist: " + file);
        }
        Ini ini = new Ini(file.toFile());

        Profile.Section paths = ini.get("paths");
        if (paths != null) {
            String cache = opt(paths, "cache_dir");
            if (cache != null)
                base.withCacheRoot(Path.of(cache));
            String bundle = opt(paths, "bundle_dir");
            if (bundle != null)
                base.withBundleRoot(Path.of(bundle));
            String work = opt(paths, "work_dir");
            if (work != null)
                base.withWorkRoot(Path.of(work));
        }

        Profile.Section limits = ini.get("limits");
        if (limits != null) {
            // max_workers first: default_workers is checked against it
            Integer maxWorkers = optInt(limits, "max_workers");
            if (maxWorkers != null)
                base.withMaxWorkers(maxWorkers);
            Integer defaultWorkers = optInt(limits, "default_workers");
            if (defaultWorkers != null)
                base.withDefaultWorkers(defaultWorkers);
            Integer maxRows = optInt(limits, "max_catalog_rows");
            if (maxRows != null)
                base.withMaxCatalogRows(maxRows);
            Integer size = optInt(limits, "default_size");
            if (size != null)
                base.withDefaultSize(size);
            Integer runners = optInt(limits, "task_runners");
            if (runners != null)
                base.withTaskRunners(runners);
        }

        Profile.Section columns = ini.get("columns");
        if (columns != null) {
            base.withLongitudeColumns(aliases(columns, "ra", base.longitudeColumns()));
            base.withLatitudeColumns(aliases(columns, "dec", base.latitudeColumns()));
            base.withIdColumns(aliases(columns, "id", base.idColumns()));
        }

        return base;
    }

    private static ColumnAliases aliases(Profile.Section section, String key, ColumnAliases current) {
        String preferred = opt(section, key);
        String list = opt(section, key + "_aliases");
        ColumnAliases result = current;
        if (list != null) {
            List<String> names = Arrays.stream(list.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            result = new ColumnAliases(result.preferred(), names);
        }
        if (preferred != null) {
            result = result.preferring(preferred);
        }
        return result;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static Integer optInt(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) {
            return null;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("[" + s.getName() + "] " + key + " is not a number: " + v, e);
        }
    }
}
