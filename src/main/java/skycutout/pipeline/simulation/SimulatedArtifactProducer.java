package skycutout.pipeline.simulation;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.producer.ArtifactProducer;
import skycutout.pipeline.producer.ArtifactProductionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for the archive cropping engine.
 * Sleeps for a random delay, then either fails (with probability {@code failRate}) or
 * returns a FITS-style header block built only from the request, so identical requests
 * always yield identical bytes.
 */
public final class SimulatedArtifactProducer implements ArtifactProducer {

    private static final Logger log = LoggerFactory.getLogger(SimulatedArtifactProducer.class);

    private static final int CARD_WIDTH = 80;
    private static final int BLOCK_SIZE = 2880;

    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;
    private final AtomicInteger calls = new AtomicInteger();

    public SimulatedArtifactProducer(int delayMinMs, int delayMaxMs, double failRate) {
        if (delayMinMs < 0 || delayMaxMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (failRate < 0.0 || failRate > 1.0) {
            throw new IllegalArgumentException("failRate must be between 0 and 1: " + failRate);
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    /** No delay, never fails. */
    public static SimulatedArtifactProducer instant() {
        return new SimulatedArtifactProducer(0, 0, 0.0);
    }

    @Override
    public byte[] produce(ArtifactRequest request) throws ArtifactProductionException {
        calls.incrementAndGet();

        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArtifactProductionException("Interrupted while producing " + request, true, e);
            }
        }

        boolean shouldFail = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
        if (shouldFail) {
            log.debug("Simulated failure for {}", request);
            throw new ArtifactProductionException("Simulated archive read failure", true);
        }
        return render(request);
    }

    /** Number of produce calls so far, including failed ones. */
    public int calls() {
        return calls.get();
    }

    static byte[] render(ArtifactRequest request) {
        StringBuilder header = new StringBuilder(BLOCK_SIZE);
        card(header, "SIMPLE", "T");
        card(header, "BITPIX", "-32");
        card(header, "NAXIS", "2");
        card(header, "NAXIS1", Integer.toString(request.size()));
        card(header, "NAXIS2", Integer.toString(request.size()));
        card(header, "OBJECT", quoted(request.targetKey().value()));
        card(header, "INSTRUME", quoted(request.instrument().name()));
        card(header, "FILTER", quoted(request.band().code()));
        card(header, "PRODTYPE", quoted(request.productType().code()));
        card(header, "CRVAL1", String.format(Locale.ROOT, "%.7f", request.position().longitude()));
        card(header, "CRVAL2", String.format(Locale.ROOT, "%.7f", request.position().latitude()));
        header.append(String.format(Locale.ROOT, "%-" + CARD_WIDTH + "s", "END"));
        while (header.length() % BLOCK_SIZE != 0) {
            header.append(' ');
        }
        return header.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private static void card(StringBuilder header, String keyword, String value) {
        String card = String.format(Locale.ROOT, "%-8s= %20s", keyword, value);
        header.append(String.format(Locale.ROOT, "%-" + CARD_WIDTH + "s", card));
    }

    private static String quoted(String value) {
        String safe = value.replace("'", "''");
        if (safe.length() > 68) {
            safe = safe.substring(0, 68);
        }
        return "'" + safe + "'";
    }
}
