package skycutout.pipeline.scheduler;

import skycutout.pipeline.model.ArtifactRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One distinct artifact to produce, and how many catalog rows of the task it satisfies.
 */
public record WorkItem(ArtifactRequest request, int multiplicity) {

    public WorkItem {
        Objects.requireNonNull(request, "request is required");
        if (multiplicity <= 0) {
            throw new IllegalArgumentException("multiplicity must be positive");
        }
    }

    /** Merge misses with the same artifact identity, keeping first-seen order. */
    public static List<WorkItem> group(List<ArtifactRequest> misses) {
        Map<ArtifactRequest, Integer> counts = new LinkedHashMap<>();
        for (ArtifactRequest miss : misses) {
            counts.merge(miss, 1, Integer::sum);
        }
        List<WorkItem> items = new ArrayList<>(counts.size());
        counts.forEach((request, count) -> items.add(new WorkItem(request, count)));
        return items;
    }
}
