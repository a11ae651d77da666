package com.netlink.osp.splice;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.config.SessionPreferences;
import com.netlink.osp.network.Cable;
import com.netlink.osp.network.ElementType;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.NetworkGraph;
import com.netlink.osp.network.Tray;
import com.netlink.osp.store.InMemoryNetworkStore;
import com.netlink.osp.util.RecordingNetworkListener;

import static org.junit.Assert.*;

public class SpliceContinuityStoreTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private InMemoryNetworkStore store;
    private RecordingNetworkListener listener;
    private SpliceContinuityStore splices;
    private SessionPreferences prefs;
    private NetworkElement closure;
    private Tray tray;
    private Cable feeder;
    private Cable branch;

    @Before
    public void setUp() {
        store = new InMemoryNetworkStore();
        listener = new RecordingNetworkListener();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        NetworkGraph graph = new NetworkGraph(store, listener, clock);
        splices = new SpliceContinuityStore(store, listener, clock);
        prefs = SessionPreferences.forTechnician("Ana");

        NetworkElement olt = graph.createOlt("OLT-Central");
        closure = graph.createChild(olt.getId(), ElementType.OLT, ElementType.CLOSURE);
        tray = splices.addTray(closure.getId(), 24);
        feeder = Cable.of("FDR-01", 144);
        branch = Cable.of("BR-07", 144);
    }

    @Test
    public void testBatchGenerationIsDeterministic() {
        List<Splice> batch = splices.generateBatch(tray.getId(), feeder, branch, 1, 1, 12, SpliceType.FUSION, "Jane");
        assertEquals(12, batch.size());
        for (int i = 0; i < 12; i++) {
            Splice s = batch.get(i);
            assertEquals(i + 1, s.getFiberA());
            assertEquals(i + 1, s.getFiberB());
            assertEquals(SpliceStatus.PENDING, s.getStatus());
            assertEquals(SpliceType.FUSION, s.getSpliceType());
            assertEquals("Jane", s.getTechnicianName());
            assertEquals("Blue", s.getTubeAColor());
            assertEquals(com.netlink.osp.color.FiberColor.forPosition(i + 1).displayName(), s.getFiberBColor());
        }
        // Nothing persisted
        assertTrue(store.splicesOf(tray.getId()).isEmpty());
    }

    @Test
    public void testBatchStopsAtShorterCable() {
        Cable small = Cable.of("DROP-1", 12);
        List<Splice> batch = splices.generateBatch(tray.getId(), feeder, small, 5, 8, 12, SpliceType.FUSION, "Jane");
        assertEquals(5, batch.size());
        assertEquals(12, batch.get(4).getFiberB());
        assertEquals(9, batch.get(4).getFiberA());

        assertTrue(splices.generateBatch(tray.getId(), feeder, small, 1, 13, 4, SpliceType.FUSION, "Jane").isEmpty());
    }

    @Test
    public void testCommitBatchSkipsExistingPairs() {
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 1, branch, 1), prefs);
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 2, branch, 2).withLoss(0.05), prefs);

        BatchResult result = splices.commitBatch(
                new BatchSpliceRequest(tray.getId(), feeder, branch, 1, 1, 12, SpliceType.FUSION, "Jane"), prefs);

        assertEquals(10, result.created());
        assertEquals(2, result.skipped());
        assertEquals(SpliceOutcome.ALREADY_EXISTS, result.results().get(0).outcome());
        assertEquals(SpliceOutcome.CREATED, result.results().get(2).outcome());
        assertEquals(12, store.splicesOf(tray.getId()).size());
        // Existing splice is left as it was
        assertEquals(0.05, store.findSplice(tray.getId(), 2, 2).orElseThrow().getLoss(), 1e-9);
        assertEquals(1, listener.batches.size());

        BatchResult again = splices.commitBatch(
                new BatchSpliceRequest(tray.getId(), feeder, branch, 1, 1, 12, SpliceType.FUSION, "Jane"), prefs);
        assertEquals(0, again.created());
        assertEquals(12, store.splicesOf(tray.getId()).size());
    }

    @Test
    public void testCommitBatchUsesSessionDefaults() {
        prefs.setDefaultSpliceType(SpliceType.MECHANICAL);
        splices.commitBatch(new BatchSpliceRequest(tray.getId(), feeder, branch, 1, 1, 2, null, null), prefs);
        Splice s = store.findSplice(tray.getId(), 1, 1).orElseThrow();
        assertEquals(SpliceType.MECHANICAL, s.getSpliceType());
        assertEquals("Ana", s.getTechnicianName());
    }

    @Test
    public void testCommitBatchIsAllOrNothingWhenTrayFills() {
        Tray small = splices.addTray(closure.getId(), 4);
        try {
            splices.commitBatch(new BatchSpliceRequest(small.getId(), feeder, branch, 1, 1, 6, SpliceType.FUSION,
                    "Jane"), prefs);
            fail("Tray overflow should be rejected");
        } catch (ValidationException expected) {
            assertTrue(expected.getMessage().contains("full"));
        }
        assertTrue(store.splicesOf(small.getId()).isEmpty());
        assertTrue(listener.batches.isEmpty());
    }

    @Test
    public void testUpsertUpdatesSamePair() {
        SpliceResult first = splices.createOrUpdateSplice(
                SpliceRequest.of(tray.getId(), feeder, 13, branch, 25).withType(SpliceType.FUSION), prefs);
        assertEquals(SpliceOutcome.CREATED, first.outcome());
        assertEquals(SpliceStatus.PENDING, first.splice().getStatus());
        assertEquals("Orange", first.splice().getTubeAColor());
        assertEquals("Blue", first.splice().getFiberAColor());
        assertEquals("Green", first.splice().getTubeBColor());
        assertEquals(NOW, first.splice().getTimestamp());

        SpliceResult second = splices.createOrUpdateSplice(
                SpliceRequest.of(tray.getId(), feeder, 13, branch, 25).withLoss(0.07).withTechnician("Luis"), prefs);
        assertEquals(SpliceOutcome.UPDATED, second.outcome());
        assertEquals(first.splice().getId(), second.splice().getId());
        assertEquals(SpliceStatus.COMPLETED, second.splice().getStatus());
        assertEquals("Luis", second.splice().getTechnicianName());
        assertEquals(1, splices.splices(tray.getId()).size());
    }

    @Test
    public void testFanOutIsAllowedAndVisible() {
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 3, branch, 3), prefs);
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 3, branch, 4), prefs);
        assertEquals(2, splices.splicesForFiberA(tray.getId(), 3).size());
    }

    @Test(expected = ValidationException.class)
    public void testFiberOutsideCableRejected() {
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 145, branch, 1), prefs);
    }

    @Test(expected = ValidationException.class)
    public void testNegativeLossRejected() {
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 1, branch, 1).withLoss(-0.1), prefs);
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownTray() {
        splices.createOrUpdateSplice(SpliceRequest.of(9999, feeder, 1, branch, 1), prefs);
    }

    @Test
    public void testFullTrayStillAcceptsUpdates() {
        Tray tiny = splices.addTray(closure.getId(), 1);
        splices.createOrUpdateSplice(SpliceRequest.of(tiny.getId(), feeder, 1, branch, 1), prefs);
        try {
            splices.createOrUpdateSplice(SpliceRequest.of(tiny.getId(), feeder, 2, branch, 2), prefs);
            fail("Second pair should not fit");
        } catch (ValidationException expected) {
            // full
        }
        SpliceResult update = splices.createOrUpdateSplice(
                SpliceRequest.of(tiny.getId(), feeder, 1, branch, 1).withLoss(0.02), prefs);
        assertEquals(SpliceOutcome.UPDATED, update.outcome());
    }

    @Test
    public void testTrays() {
        Tray second = splices.addTray(closure.getId(), 12);
        assertEquals(1, tray.getNumber());
        assertEquals(2, second.getNumber());
        assertEquals(2, splices.traysOf(closure.getId()).size());

        splices.commitBatch(new BatchSpliceRequest(second.getId(), feeder, branch, 1, 1, 5, SpliceType.FUSION, "J"),
                prefs);
        assertEquals(5, splices.deleteTray(second.getId()));
        assertEquals(1, splices.traysOf(closure.getId()).size());
        assertTrue(store.splices().isEmpty());
    }

    @Test(expected = ValidationException.class)
    public void testOltCannotHoldTrays() {
        long oltId = store.elements().get(0).getId();
        splices.addTray(oltId, 12);
    }

    @Test
    public void testStatusUpdateAndDelete() {
        Splice s = splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 1, branch, 1), prefs).splice();
        assertEquals(SpliceStatus.NEEDS_REVIEW, splices.updateStatus(s.getId(), SpliceStatus.NEEDS_REVIEW).getStatus());
        splices.deleteSplice(s.getId());
        assertTrue(splices.splices(tray.getId()).isEmpty());
    }

    @Test
    public void testQueriesByCableAndMatrix() {
        feeder.setId(store.putCable(feeder));
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 1, branch, 2), prefs);
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), branch, 5, feeder, 6), prefs);
        assertEquals(2, splices.splicesByCable(feeder.getId()).size());

        SpliceMatrix m = splices.matrix(tray.getId(), feeder, branch);
        assertEquals(144, m.rowCount());
        assertTrue(m.cell(1, 2).orElseThrow().isSpliced());
        assertFalse(m.cell(1, 1).orElseThrow().isSpliced());
        assertFalse(m.cell(145, 1).isPresent());
        assertEquals(144, m.row(1).size());
        assertTrue(m.row(0).isEmpty());
        assertTrue(m.row(145).isEmpty());
    }

    @Test(expected = ValidationException.class)
    public void testNegativeBatchCountRejected() {
        new BatchSpliceRequest(tray.getId(), feeder, branch, 1, 1, -1, SpliceType.FUSION, "Jane");
    }
}
