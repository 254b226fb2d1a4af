package skycutout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import skycutout.pipeline.api.v1.dto.SubmitCatalogRequest;
import skycutout.pipeline.api.v1.dto.TaskStatusResponse;
import skycutout.pipeline.config.CutoutConfig;
import skycutout.pipeline.config.Dependencies;
import skycutout.pipeline.config.IniConfigLoader;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.model.TaskStatus;
import skycutout.pipeline.simulation.SimulatedArtifactProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * App &lt;catalog&gt; [--config file.ini] [--instruments VIS,NISP] [--bands NIR-Y,NIR-J]
 *     [--products BGSUB,RMS] [--size 128] [--workers 4]
 * </pre>
 *
 * Runs one catalog through the pipeline with the simulated producer and prints the
 * final task status as JSON.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        if (args.length == 0 || "--help".equals(args[0])) {
            System.err.println("Usage: App <catalog> [--config file.ini] [--instruments VIS,NISP] "
                    + "[--bands NIR-Y] [--products BGSUB] [--size 128] [--workers 4]");
            System.exit(2);
        }

        try {
            System.exit(run(args));
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            log.error("Run failed", e);
            System.exit(1);
        }
    }

    static int run(String[] args) throws Exception {
        Path catalog = Path.of(args[0]);
        String configFile = null;
        List<String> instruments = List.of("VIS");
        List<String> bands = null;
        List<String> products = List.of("BGSUB");
        Integer size = null;
        Integer workers = null;

        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--config" -> configFile = value;
                case "--instruments" -> instruments = splitList(value);
                case "--bands" -> bands = splitList(value);
                case "--products" -> products = splitList(value);
                case "--size" -> size = Integer.parseInt(value);
                case "--workers" -> workers = Integer.parseInt(value);
                default -> throw new IllegalArgumentException("unknown option " + flag);
            }
        }

        CutoutConfig config = configFile != null
                ? IniConfigLoader.load(Path.of(configFile), CutoutConfig.fromEnv())
                : CutoutConfig.fromEnv();

        SubmitCatalogRequest submit = new SubmitCatalogRequest(catalog.toString(), instruments, bands,
                products, size, workers, null, null, null);
        CutoutRequest request = submit.toCutoutRequest(config);

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        try (Dependencies deps = Dependencies.create(config, new SimulatedArtifactProducer(20, 120, 0.02))) {
            TaskSnapshot done = deps.cutoutService().process(catalog, request);
            System.out.println(mapper.writeValueAsString(TaskStatusResponse.from(done)));
            return done.status() == TaskStatus.COMPLETED ? 0 : 1;
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
