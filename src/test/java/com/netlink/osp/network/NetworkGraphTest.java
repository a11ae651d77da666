package com.netlink.osp.network;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.netlink.osp.api.NotFoundException;
import com.netlink.osp.api.ValidationException;
import com.netlink.osp.config.SessionPreferences;
import com.netlink.osp.splice.BatchSpliceRequest;
import com.netlink.osp.splice.SpliceContinuityStore;
import com.netlink.osp.splice.SpliceRequest;
import com.netlink.osp.splice.SpliceType;
import com.netlink.osp.store.InMemoryNetworkStore;
import com.netlink.osp.util.RecordingNetworkListener;

import static org.junit.Assert.*;

public class NetworkGraphTest {
    private InMemoryNetworkStore store;
    private RecordingNetworkListener listener;
    private NetworkGraph graph;

    private NetworkElement olt, odf, closure, lcp, nap;

    @Before
    public void setUp() {
        store = new InMemoryNetworkStore();
        listener = new RecordingNetworkListener();
        graph = new NetworkGraph(store, listener, Clock.fixed(Instant.parse("2026-01-05T08:00:00Z"), ZoneOffset.UTC));
    }

    private void buildChain() {
        olt = graph.createOlt("OLT-A");
        odf = graph.createChild(olt.getId(), ElementType.OLT, ElementType.ODF);
        closure = graph.createChild(odf.getId(), ElementType.ODF, ElementType.CLOSURE);
        lcp = graph.createChild(closure.getId(), ElementType.CLOSURE, ElementType.LCP);
        nap = graph.createChild(lcp.getId(), ElementType.LCP, ElementType.NAP);
    }

    @Test
    public void testCreateChainLinksParents() {
        buildChain();
        assertEquals(5, store.elements().size());
        assertEquals(ElementType.ODF, closure.getParentType());
        assertEquals(Long.valueOf(odf.getId()), closure.getParentId());
        assertEquals(EnclosureKind.SPLICE_CLOSURE, closure.getKind());
        assertNull(odf.getKind());
        assertEquals(Instant.parse("2026-01-05T08:00:00Z"), nap.getCreatedAt());
        assertEquals(5, listener.created.size());
    }

    @Test
    public void testInstantCreateNames() {
        olt = graph.createOlt(null);
        NetworkElement c1 = graph.createChild(olt.getId(), ElementType.OLT, ElementType.CLOSURE);
        NetworkElement c2 = graph.createChild(c1.getId(), ElementType.CLOSURE, ElementType.CLOSURE, " ");
        NetworkElement named = graph.createChild(olt.getId(), null, ElementType.LCP, " LCP North ");
        assertEquals("OLT-1", olt.getName());
        assertEquals("CLOSURE-1", c1.getName());
        assertEquals("CLOSURE-2", c2.getName());
        assertEquals("LCP North", named.getName());
    }

    @Test
    public void testOdfWithoutOltIsRejectedBeforePersisting() {
        try {
            graph.createChild(null, null, ElementType.ODF);
            fail("ODF needs an OLT");
        } catch (ValidationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("no OLT exists"));
        }
        assertTrue(store.elements().isEmpty());
        assertTrue(listener.created.isEmpty());
    }

    @Test(expected = ValidationException.class)
    public void testMissingParentWhenCandidatesExist() {
        graph.createOlt("OLT-A");
        graph.createChild(null, null, ElementType.ODF);
    }

    @Test(expected = ValidationException.class)
    public void testOltCannotHaveParent() {
        olt = graph.createOlt("OLT-A");
        graph.createChild(olt.getId(), ElementType.OLT, ElementType.OLT);
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownParent() {
        graph.createChild(42L, ElementType.OLT, ElementType.ODF);
    }

    @Test
    public void testParentTypeMismatchAndDisallowedType() {
        buildChain();
        try {
            graph.createChild(odf.getId(), ElementType.OLT, ElementType.CLOSURE);
            fail("Declared parent type does not match");
        } catch (ValidationException expected) {
            // ODF is not an OLT
        }
        try {
            graph.createChild(odf.getId(), ElementType.ODF, ElementType.NAP);
            fail("NAP only hangs off an LCP");
        } catch (ValidationException expected) {
            // disallowed
        }
        assertEquals(5, store.elements().size());
    }

    @Test
    public void testCreateEnclosureOfKind() {
        buildChain();
        NetworkElement fat = graph.createEnclosure(lcp.getId(), EnclosureKind.FAT, "FAT-12", new Position(40, 60));
        assertEquals(ElementType.NAP, fat.getType());
        assertEquals(EnclosureKind.FAT, fat.getKind());
        assertEquals(Double.valueOf(40), fat.getCanvasX());
    }

    @Test
    public void testConnectRejectsDisallowedChild() {
        buildChain();
        ConnectResult result = graph.connect(lcp.getId(), odf.getId());
        assertTrue(result.isRejected());
        assertNotNull(result.reason());
        assertEquals(Long.valueOf(olt.getId()), graph.element(odf.getId()).getParentId());
        assertEquals(ElementType.OLT, graph.element(odf.getId()).getParentType());
        assertEquals(1, listener.connects.size());
        assertTrue(listener.connects.get(0).isRejected());
    }

    @Test
    public void testConnectMovesChild() {
        buildChain();
        NetworkElement other = graph.createChild(olt.getId(), ElementType.OLT, ElementType.CLOSURE);
        ConnectResult result = graph.connect(other.getId(), lcp.getId());
        assertEquals(ConnectResult.Status.CONNECTED, result.status());
        NetworkElement moved = graph.element(lcp.getId());
        assertEquals(Long.valueOf(other.getId()), moved.getParentId());
        assertEquals(ElementType.CLOSURE, moved.getParentType());
    }

    @Test
    public void testConnectExistingLinkIsUnchanged() {
        buildChain();
        assertEquals(ConnectResult.Status.UNCHANGED, graph.connect(olt.getId(), odf.getId()).status());
    }

    @Test
    public void testConnectRejectsSelfAndLoops() {
        olt = graph.createOlt("OLT-A");
        NetworkElement c1 = graph.createChild(olt.getId(), ElementType.OLT, ElementType.CLOSURE);
        NetworkElement c2 = graph.createChild(c1.getId(), ElementType.CLOSURE, ElementType.CLOSURE);
        NetworkElement c3 = graph.createChild(c2.getId(), ElementType.CLOSURE, ElementType.CLOSURE);

        assertTrue(graph.connect(c1.getId(), c1.getId()).isRejected());
        assertTrue(graph.connect(c3.getId(), c1.getId()).isRejected());
        assertEquals(Long.valueOf(olt.getId()), graph.element(c1.getId()).getParentId());
    }

    @Test(expected = NotFoundException.class)
    public void testConnectUnknownElement() {
        olt = graph.createOlt("OLT-A");
        graph.connect(olt.getId(), 999);
    }

    @Test
    public void testCascadeDeleteRemovesChain() {
        buildChain();
        SpliceContinuityStore splices = new SpliceContinuityStore(store, listener);
        Tray tray = splices.addTray(closure.getId(), 24);
        splices.commitBatch(new BatchSpliceRequest(tray.getId(), Cable.of("F", 48), Cable.of("D", 24), 1, 1, 6,
                SpliceType.FUSION, "Jane"), SessionPreferences.defaults());
        graph.addPorts(nap.getId(), 8);

        assertEquals(4, graph.descendantCount(olt.getId()));
        int removed = graph.deleteCascade(olt.getId());

        assertEquals(4, removed);
        assertTrue(store.elements().isEmpty());
        assertTrue(store.splices().isEmpty());
        assertTrue(store.traysOf(closure.getId()).isEmpty());
        assertTrue(store.portsOf(nap.getId()).isEmpty());
        assertEquals(List.of(olt.getId(), odf.getId(), closure.getId(), lcp.getId(), nap.getId()),
                listener.cascades.get(0));
    }

    @Test
    public void testCascadeDeleteOfSubtreeKeepsRest() {
        buildChain();
        NetworkElement sibling = graph.createChild(olt.getId(), ElementType.OLT, ElementType.LCP);
        assertEquals(2, graph.deleteCascade(closure.getId()));
        assertEquals(3, store.elements().size());
        assertTrue(graph.find(sibling.getId()).isPresent());
        assertFalse(graph.find(nap.getId()).isPresent());
    }

    @Test
    public void testCascadeDeleteRollsBackOnFailure() {
        FailingStore failing = new FailingStore();
        graph = new NetworkGraph(failing, listener);
        store = failing;
        buildChain();
        SpliceContinuityStore splices = new SpliceContinuityStore(store, listener);
        Tray tray = splices.addTray(closure.getId(), 12);
        splices.commitBatch(new BatchSpliceRequest(tray.getId(), Cable.of("F", 12), Cable.of("D", 12), 1, 1, 3,
                SpliceType.FUSION, "Jane"), SessionPreferences.defaults());

        failing.failOn = nap.getId();
        try {
            graph.deleteCascade(olt.getId());
            fail("Store failure should propagate");
        } catch (IllegalStateException expected) {
            // simulated
        }
        assertEquals(5, store.elements().size());
        assertEquals(3, store.splices().size());
        assertEquals(1, store.traysOf(closure.getId()).size());
        assertEquals(1, listener.rollbacks.size());
        assertTrue(listener.cascades.isEmpty());
    }

    @Test
    public void testDeepClosureChain() {
        olt = graph.createOlt("OLT-A");
        long parent = olt.getId();
        for (int i = 0; i < 500; i++)
            parent = graph.createChild(parent, null, ElementType.CLOSURE).getId();
        assertEquals(500, graph.deleteCascade(olt.getId()));
        assertTrue(store.elements().isEmpty());
    }

    @Test
    public void testSetPositionIsBestEffort() {
        buildChain();
        assertTrue(graph.setPosition(nap.getId(), 12.5, 80));
        assertEquals(Double.valueOf(12.5), graph.element(nap.getId()).getCanvasX());

        assertFalse(graph.setPosition(12345, 1, 1));
        assertEquals(List.of(12345L), listener.positionFailures);
    }

    @Test
    public void testAutoLayoutDoesNotTouchManualPositions() {
        buildChain();
        graph.setPosition(odf.getId(), 7, 7);
        Map<Long, Position> layout = graph.autoLayout();
        assertEquals(new Position(0, 0), layout.get(olt.getId()));
        assertEquals(new Position(250, 0), layout.get(odf.getId()));
        assertEquals(new Position(1000, 0), layout.get(nap.getId()));
        assertEquals(Double.valueOf(7), graph.element(odf.getId()).getCanvasX());

        graph.applyLayout(new LayoutOptions(100, 50));
        assertEquals(Double.valueOf(100), graph.element(odf.getId()).getCanvasX());
        assertEquals(Double.valueOf(400), graph.element(nap.getId()).getCanvasX());
    }

    @Test
    public void testEdgesCarryCableAndCategory() {
        buildChain();
        Cable cable = graph.attachCable(closure.getId(), Cable.of("FDR-144", 144));
        assertNotNull(cable.getId());

        List<GraphEdge> edges = graph.edges();
        assertEquals(4, edges.size());
        GraphEdge feeder = edges.stream().filter(e -> e.targetId() == closure.getId()).findFirst().orElseThrow();
        assertEquals(EdgeCategory.FEEDER, feeder.category());
        assertEquals("FDR-144", feeder.cableName());
        assertEquals(Integer.valueOf(144), feeder.fiberCount());
        assertEquals("e-odf-" + odf.getId() + "-closure-" + closure.getId(), feeder.id());

        GraphEdge drop = edges.stream().filter(e -> e.targetId() == nap.getId()).findFirst().orElseThrow();
        assertEquals(EdgeCategory.DROP, drop.category());
        assertNull(drop.cableName());
        GraphEdge distribution = edges.stream().filter(e -> e.targetId() == lcp.getId()).findFirst().orElseThrow();
        assertEquals(EdgeCategory.DISTRIBUTION, distribution.category());
    }

    @Test
    public void testQueriesAndDisconnect() {
        buildChain();
        assertEquals(List.of(olt.getId()), graph.roots().stream().map(NetworkElement::getId).toList());
        assertEquals(1, graph.children(olt.getId()).size());
        assertTrue(graph.orphans().isEmpty());

        assertTrue(graph.disconnect(lcp.getId()));
        assertFalse(graph.disconnect(lcp.getId()));
        assertEquals(1, graph.orphans(ElementType.LCP).size());
        assertEquals(List.of(nap.getId()), graph.descendants(lcp.getId()));
        assertEquals(0, graph.descendantCount(closure.getId()));
        assertEquals(2, graph.elementsOf(ElementType.CLOSURE).size() + graph.elementsOf(ElementType.ODF).size());
    }

    @Test
    public void testStatsAndPorts() {
        buildChain();
        Cable drop = graph.attachCable(nap.getId(), Cable.of("DROP", 12));
        graph.addPorts(nap.getId(), 8);
        graph.patchPort(nap.getId(), 3, drop.getId(), 3);
        graph.patchPort(nap.getId(), 4, drop.getId(), 4);
        new SpliceContinuityStore(store, listener).addTray(closure.getId(), 12);

        HierarchyStats stats = graph.stats(odf.getId());
        assertEquals(4, stats.elementCount());
        assertEquals(Integer.valueOf(1), stats.countByType().get(ElementType.NAP));
        assertNull(stats.countByType().get(ElementType.OLT));
        assertEquals(1, stats.trays());
        assertEquals(8, stats.ports());
        assertEquals(2, stats.connectedPorts());
        assertEquals(25.0, stats.portUtilization(), 1e-9);

        Port freed = graph.patchPort(nap.getId(), 3, null, null);
        assertEquals(PortStatus.AVAILABLE, freed.getStatus());
        assertNull(freed.getConnectedFiber());
    }

    @Test(expected = ValidationException.class)
    public void testPatchPortFiberOutsideCable() {
        buildChain();
        Cable drop = graph.attachCable(nap.getId(), Cable.of("DROP", 12));
        graph.addPorts(nap.getId(), 2);
        graph.patchPort(nap.getId(), 1, drop.getId(), 13);
    }

    @Test
    public void testSplitterAddsOutputPorts() {
        buildChain();
        Cable dist = graph.attachCable(lcp.getId(), Cable.of("DIST", 48));
        graph.addPorts(lcp.getId(), 2);
        Splitter splitter = graph.addSplitter(lcp.getId(), SplitterRatio.ONE_BY_4, null);

        assertEquals("SPL-01", splitter.getName());
        List<Port> legs = graph.splitterPorts(splitter.getId());
        assertEquals(4, legs.size());
        assertEquals(3, legs.get(0).getPortNumber());
        assertEquals(6, legs.get(3).getPortNumber());
        assertEquals(PortType.OUTPUT, legs.get(0).getType());
        assertEquals(Long.valueOf(splitter.getId()), legs.get(0).getSplitterId());
        assertEquals(6, graph.ports(lcp.getId()).size());

        graph.feedSplitter(splitter.getId(), dist.getId(), 5);
        assertTrue(graph.splitter(splitter.getId()).hasInput());

        assertEquals(4, graph.deleteSplitter(splitter.getId()));
        assertEquals(2, graph.ports(lcp.getId()).size());
        assertTrue(graph.splitters(lcp.getId()).isEmpty());
    }

    @Test
    public void testSplitterPlacementAndFeedChecked() {
        buildChain();
        try {
            graph.addSplitter(closure.getId(), SplitterRatio.ONE_BY_2, "S");
            fail("Closures hold no splitters");
        } catch (ValidationException expected) {
            assertTrue(expected.getMessage().contains("LCP or NAP"));
        }
        Cable dist = graph.attachCable(lcp.getId(), Cable.of("DIST", 12));
        Splitter splitter = graph.addSplitter(lcp.getId(), SplitterRatio.ONE_BY_2, " Main ");
        assertEquals("Main", splitter.getName());
        try {
            graph.feedSplitter(splitter.getId(), dist.getId(), 13);
            fail("Fiber 13 is outside a 12F cable");
        } catch (ValidationException expected) {
            assertFalse(graph.splitter(splitter.getId()).hasInput());
        }
    }

    @Test
    public void testPonPorts() {
        buildChain();
        List<PonPort> pon = graph.addPonPorts(olt.getId(), 4, 64);
        assertEquals("PON-01", pon.get(0).getLabel());
        assertEquals(4, pon.get(3).getPortNumber());
        assertEquals(PonPortStatus.AVAILABLE, pon.get(2).getStatus());

        PonPort active = graph.assignPonPort(lcp.getId(), 3);
        assertEquals(PonPortStatus.ACTIVE, active.getStatus());
        assertEquals(Long.valueOf(active.getId()), graph.element(lcp.getId()).getPonPortId());

        graph.assignPonPort(lcp.getId(), 1);
        assertEquals(PonPortStatus.AVAILABLE, graph.ponPorts(olt.getId()).get(2).getStatus());
        assertEquals(PonPortStatus.ACTIVE, graph.ponPorts(olt.getId()).get(0).getStatus());

        assertEquals(6, graph.addPonPorts(olt.getId(), 2, 128).get(1).getPortNumber());
    }

    @Test
    public void testPonPortRules() {
        buildChain();
        graph.addPonPorts(olt.getId(), 2, 64);
        expectRejected(() -> graph.assignPonPort(nap.getId(), 1));
        expectRejected(() -> graph.assignPonPort(lcp.getId(), 9));
        expectRejected(() -> graph.addPonPorts(odf.getId(), 2, 64));
        expectRejected(() -> graph.addPorts(olt.getId(), 2));

        graph.disconnect(closure.getId());
        expectRejected(() -> graph.assignPonPort(lcp.getId(), 1));
        assertEquals(4, graph.addPorts(odf.getId(), 4).size());
    }

    @Test
    public void testCascadeReleasesPonPortAndDropsUnusedFeedCables() {
        buildChain();
        SpliceContinuityStore splices = new SpliceContinuityStore(store, listener);
        Cable feeder = graph.attachCable(closure.getId(), Cable.of("FDR", 96));
        Cable dist = graph.attachCable(lcp.getId(), Cable.of("DIST", 48));
        Cable drop = graph.attachCable(nap.getId(), Cable.of("DROP", 12));
        Tray tray = splices.addTray(closure.getId(), 12);
        splices.createOrUpdateSplice(SpliceRequest.of(tray.getId(), feeder, 1, dist, 1),
                SessionPreferences.defaults());
        graph.addSplitter(lcp.getId(), SplitterRatio.ONE_BY_8, null);
        graph.addPonPorts(olt.getId(), 2, 64);
        graph.assignPonPort(lcp.getId(), 1);

        assertEquals(1, graph.deleteCascade(lcp.getId()));
        assertFalse(store.findCable(drop.getId()).isPresent());
        assertTrue("spliced in a surviving tray", store.findCable(dist.getId()).isPresent());
        assertTrue(store.findCable(feeder.getId()).isPresent());
        assertTrue(store.splittersOf(lcp.getId()).isEmpty());
        assertTrue(store.portsOf(lcp.getId()).isEmpty());
        assertEquals(PonPortStatus.AVAILABLE, graph.ponPorts(olt.getId()).get(0).getStatus());

        graph.deleteCascade(olt.getId());
        assertTrue(store.cables().isEmpty());
        assertTrue(store.ponPortsOf(olt.getId()).isEmpty());
    }

    private static void expectRejected(Runnable action) {
        try {
            action.run();
            fail("Expected a ValidationException");
        } catch (ValidationException expected) {
            // rejected
        }
    }

    @Test
    public void testAllowedChildTypes() {
        assertEquals(java.util.EnumSet.of(ElementType.ODF, ElementType.CLOSURE, ElementType.LCP),
                NetworkGraph.allowedChildTypes(ElementType.OLT));
        assertEquals(java.util.EnumSet.of(ElementType.NAP), NetworkGraph.allowedChildTypes(ElementType.LCP));
        assertTrue(NetworkGraph.allowedChildTypes(ElementType.NAP).isEmpty());
    }

    /** Store that fails removing one chosen element. */
    private static final class FailingStore extends InMemoryNetworkStore {
        long failOn = -1;

        @Override
        public void removeElement(long id) {
            if (id == failOn)
                throw new IllegalStateException("disk full");
            super.removeElement(id);
        }
    }
}
