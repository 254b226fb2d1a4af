package skycutout.pipeline.store;

import skycutout.pipeline.model.CatalogSummary;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.FailureKind;
import skycutout.pipeline.model.Instrument;
import skycutout.pipeline.model.ProductType;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TaskRecordTest {

    private static final CutoutRequest REQUEST = CutoutRequest.builder()
            .instrument(Instrument.VIS)
            .productType(ProductType.BGSUB)
            .build();

    private static final FailedTarget FAILURE =
            new FailedTarget("obj-1", "VIS", "BGSUB", FailureKind.PRODUCTION, "boom", false);

    @Test
    void newTaskIsQueued() {
        TaskSnapshot snapshot = newRecord().snapshot();

        assertEquals("task-1", snapshot.id());
        assertEquals(TaskStatus.QUEUED, snapshot.status());
        assertEquals(0, snapshot.progress());
        assertEquals(0, snapshot.counters().total());
        assertNotNull(snapshot.createdAt());
        assertNull(snapshot.startedAt());
        assertFalse(snapshot.isTerminal());
    }

    @Test
    void fullLifecycle() {
        TaskRecord record = newRecord();
        record.recordCatalog(new CatalogSummary(2, 0, "RA", "DEC", null, 1, 2, 3, 4));

        // 1. Start with one cached hit out of four
        record.startProcessing(4, 1);
        assertEquals(TaskStatus.PROCESSING, record.status());
        assertEquals(25, record.snapshot().progress());

        // 2. Workers report
        record.recordProduced(2);
        assertEquals(75, record.snapshot().progress());
        record.recordErrors(1, FAILURE);
        assertEquals(100, record.snapshot().progress());

        // 3. Complete
        record.complete(Path.of("downloads/task-1/task-1.zip"));
        TaskSnapshot done = record.snapshot();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(100, done.progress());
        assertEquals(1, done.counters().cachedHits());
        assertEquals(2, done.counters().newlyProduced());
        assertEquals(1, done.counters().errors());
        assertEquals(1, done.failedTargets().size());
        assertEquals(2, done.catalogSummary().rows());
        assertNotNull(done.startedAt());
        assertNotNull(done.finishedAt());
        assertTrue(done.message().contains("1 errors"));
    }

    @Test
    void emptyTaskIsImmediatelyAtFullProgress() {
        TaskRecord record = newRecord();
        record.startProcessing(0, 0);

        assertEquals(100, record.snapshot().progress());
    }

    @Test
    void progressNeverDecreasesOnReclassification() {
        TaskRecord record = newRecord();
        record.startProcessing(2, 2);
        assertEquals(100, record.snapshot().progress());

        record.reclassifyHitAsError(new FailedTarget("obj-1", "VIS", "BGSUB", FailureKind.MISSING_HIT, "gone", true));

        TaskSnapshot snapshot = record.snapshot();
        assertEquals(1, snapshot.counters().cachedHits());
        assertEquals(1, snapshot.counters().errors());
        assertEquals(100, snapshot.progress());
        assertEquals(FailureKind.MISSING_HIT, snapshot.failedTargets().get(0).kind());
    }

    @Test
    void countersCannotExceedTotal() {
        TaskRecord record = newRecord();
        record.startProcessing(2, 1);
        record.recordProduced(1);

        assertThrows(IllegalStateException.class, () -> record.recordProduced(1));
        assertThrows(IllegalStateException.class, () -> record.recordErrors(1, FAILURE));
    }

    @Test
    void countersOnlyMoveWhileProcessing() {
        TaskRecord record = newRecord();

        assertThrows(IllegalStateException.class, () -> record.recordProduced(1));
        assertThrows(IllegalStateException.class, () -> record.complete(Path.of("x.zip")));
    }

    @Test
    void invalidTransitionsAreRejected() {
        TaskRecord record = newRecord();
        record.fail("Catalog contains no rows");

        TaskSnapshot failed = record.snapshot();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals("Catalog contains no rows", failed.error());
        assertThrows(IllegalStateException.class, () -> record.startProcessing(1, 0));
        assertThrows(IllegalStateException.class, () -> record.fail("again"));
    }

    @Test
    void startProcessingValidatesTotals() {
        TaskRecord record = newRecord();

        assertThrows(IllegalArgumentException.class, () -> record.startProcessing(1, 2));
        assertThrows(IllegalArgumentException.class, () -> record.startProcessing(-1, 0));
    }

    @Test
    void snapshotIsDetachedFromRecord() {
        TaskRecord record = newRecord();
        record.startProcessing(3, 0);
        TaskSnapshot before = record.snapshot();

        record.recordErrors(1, FAILURE);

        assertTrue(before.failedTargets().isEmpty());
        assertEquals(0, before.counters().errors());
        assertEquals(1, record.snapshot().counters().errors());
    }

    private static TaskRecord newRecord() {
        return new TaskRecord("task-1", "targets.csv", REQUEST);
    }
}
