package skycutout.pipeline.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads catalog files into a {@link RawCatalog}.
 * Supports CSV with a header row ({@code .csv}, {@code .txt}) and JSON arrays of
 * objects ({@code .json}).
 */
public class CatalogReader {

    private static final Logger log = LoggerFactory.getLogger(CatalogReader.class);

    private final CsvMapper csvMapper;
    private final ObjectMapper jsonMapper;

    public CatalogReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.jsonMapper = new ObjectMapper();
    }

    public RawCatalog read(Path path) throws CatalogValidationException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new CatalogValidationException("Catalog file does not exist: " + path);
        }

        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        RawCatalog catalog;
        try {
            if (name.endsWith(".csv") || name.endsWith(".txt")) {
                catalog = readCsv(path);
            } else if (name.endsWith(".json")) {
                catalog = readJson(path);
            } else {
                throw new CatalogValidationException("Unsupported catalog format: " + path.getFileName());
            }
        } catch (IOException | RuntimeException e) {
            throw new CatalogValidationException("Cannot read catalog " + path.getFileName() + ": " + e.getMessage(), e);
        }

        log.info("Loaded catalog {}: {} rows, columns {}", path.getFileName(), catalog.size(), catalog.columns());
        return catalog;
    }

    private RawCatalog readCsv(Path path) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> columns;

        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(path.toFile())) {
            boolean any = it.hasNextValue();
            columns = headerColumns(it);
            while (any) {
                rows.add(it.nextValue());
                any = it.hasNextValue();
            }
        }
        return new RawCatalog(columns, rows);
    }

    private static List<String> headerColumns(MappingIterator<?> it) {
        if (it.getParserSchema() instanceof CsvSchema csv) {
            return new ArrayList<>(csv.getColumnNames());
        }
        return List.of();
    }

    private RawCatalog readJson(Path path) throws IOException {
        JsonNode root = jsonMapper.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("expected a JSON array of row objects");
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> rows = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new IOException("row " + (rows.size() + 1) + " is not a JSON object");
            }
            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                columns.add(field.getKey());
                JsonNode value = field.getValue();
                row.put(field.getKey(), value.isNull() ? null : value.asText());
            }
            rows.add(row);
        }
        return new RawCatalog(new ArrayList<>(columns), rows);
    }
}
