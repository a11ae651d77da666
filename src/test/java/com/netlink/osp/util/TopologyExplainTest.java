package com.netlink.osp.util;

import org.junit.Before;
import org.junit.Test;

import com.netlink.osp.network.Cable;
import com.netlink.osp.network.ElementType;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.NetworkGraph;
import com.netlink.osp.store.InMemoryNetworkStore;

import static org.junit.Assert.*;

public class TopologyExplainTest {
    private NetworkGraph graph;
    private TopologyExplain explain;
    private NetworkElement olt, closure, lcp;

    @Before
    public void setUp() {
        graph = new NetworkGraph(new InMemoryNetworkStore(), new RecordingNetworkListener());
        explain = new TopologyExplain(graph);
        olt = graph.createOlt("OLT Main");
        closure = graph.createChild(olt.getId(), ElementType.OLT, ElementType.CLOSURE);
        lcp = graph.createChild(closure.getId(), ElementType.CLOSURE, ElementType.LCP);
        graph.attachCable(closure.getId(), Cable.of("FDR-1", 96));
    }

    @Test
    public void testDumpTopologyIndentsChildren() {
        String dump = explain.dumpTopology();
        assertTrue(dump.startsWith("Network (3 elements):\n"));
        assertTrue(dump.contains("  OLT Main [OLT]\n"));
        assertTrue(dump.contains("    CLOSURE-1 [CLOSURE]\n"));
        assertTrue(dump.contains("      LCP-1 [LCP]\n"));
    }

    @Test
    public void testOrphansAreMarked() {
        graph.disconnect(lcp.getId());
        assertTrue(explain.dumpTopology().contains("  LCP-1 [LCP] (ORPHAN)\n"));
    }

    @Test
    public void testMermaid() {
        String m = explain.toMermaid();
        assertTrue(m.startsWith("graph TD;\n"));
        assertTrue(m.contains("  n" + olt.getId() + "[\"OLT Main<br/><small>OLT</small>\"];\n"));
        assertTrue(m.contains("  n" + olt.getId() + " -- \"FDR-1 96F\" --> n" + closure.getId() + ";\n"));
        assertTrue(m.contains("  n" + closure.getId() + " --> n" + lcp.getId() + ";\n"));
    }

    @Test
    public void testUnnamedElementFallsBackToTypeAndId() {
        InMemoryNetworkStore store = new InMemoryNetworkStore();
        NetworkElement unnamed = new NetworkElement();
        unnamed.setType(ElementType.OLT);
        store.putElement(unnamed);
        TopologyExplain view = new TopologyExplain(new NetworkGraph(store, new RecordingNetworkListener()));

        String label = "OLT-" + unnamed.getId();
        assertTrue(view.toMermaid().contains("[\"" + label + "<br/><small>OLT</small>\"];"));
        assertTrue(view.dumpTopology().contains("  " + label + " [OLT]\n"));
        assertTrue(view.explainElement(unnamed.getId()).contains("Element: " + label));
    }

    @Test
    public void testExplainElement() {
        String text = explain.explainElement(closure.getId());
        assertTrue(text.contains("Element: CLOSURE-1"));
        assertTrue(text.contains("Type: CLOSURE (splice-closure)"));
        assertTrue(text.contains("Children (1): LCP-1"));
        assertTrue(text.contains("Subtree: 2 elements"));
    }
}
