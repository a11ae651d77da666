package com.netlink.osp.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.netlink.osp.network.GraphEdge;
import com.netlink.osp.network.HierarchyStats;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.NetworkGraph;

/**
 * Diagnostic text views of a {@link NetworkGraph}: an indented tree, a single
 * element summary and a Mermaid diagram for embedding in Markdown.
 * <p>
 * Reads the graph on every call; intended for logs and reports.
 */
public final class TopologyExplain {
    private final NetworkGraph graph;

    private record Line(NetworkElement element, int indent) {
    }

    public TopologyExplain(NetworkGraph graph) {
        this.graph = graph;
    }

    /** Summary of one element and the subtree below it. */
    public String explainElement(long id) {
        NetworkElement e = graph.element(id);
        HierarchyStats stats = graph.stats(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Element: ").append(e.displayName()).append('\n')
                .append("  Id: ").append(e.getId()).append('\n')
                .append("  Type: ").append(e.getType());
        if (e.getKind() != null)
            sb.append(" (").append(e.getKind().code()).append(')');
        sb.append('\n')
                .append("  Parent: ").append(e.hasParent() ? e.getParentType() + " " + e.getParentId() : "-")
                .append('\n');
        List<NetworkElement> children = graph.children(id);
        sb.append("  Children (").append(children.size()).append("): ");
        for (int i = 0; i < children.size(); i++) {
            sb.append(children.get(i).displayName());
            if (i < children.size() - 1)
                sb.append(", ");
        }
        sb.append('\n')
                .append("  Subtree: ").append(stats.elementCount()).append(" elements, ")
                .append(stats.trays()).append(" trays, ")
                .append(stats.connectedPorts()).append('/').append(stats.ports()).append(" ports in use\n");
        return sb.toString();
    }

    /**
     * Indented hierarchy, one element per line, roots first then orphans.
     * Children appear in id order below their parent.
     */
    public String dumpTopology() {
        List<NetworkElement> all = graph.elements();
        Map<Long, List<NetworkElement>> children = new LinkedHashMap<>();
        for (NetworkElement e : all) {
            if (e.hasParent())
                children.computeIfAbsent(e.getParentId(), k -> new ArrayList<>()).add(e);
        }

        StringBuilder sb = new StringBuilder(1024);
        sb.append("Network (").append(all.size()).append(" elements):\n");
        List<NetworkElement> orphans = graph.orphans();
        Set<Long> orphanIds = new HashSet<>();
        for (NetworkElement o : orphans)
            orphanIds.add(o.getId());
        List<NetworkElement> tops = new ArrayList<>(graph.roots());
        tops.addAll(orphans);
        Set<Long> printed = new HashSet<>();

        Deque<Line> stack = new ArrayDeque<>();
        for (int i = tops.size() - 1; i >= 0; i--)
            stack.push(new Line(tops.get(i), 1));
        while (!stack.isEmpty()) {
            Line line = stack.pop();
            NetworkElement e = line.element();
            if (!printed.add(e.getId()))
                continue;
            sb.append("  ".repeat(line.indent())).append(e.displayName()).append(" [").append(e.getType()).append(']');
            if (orphanIds.contains(e.getId()))
                sb.append(" (ORPHAN)");
            sb.append('\n');
            List<NetworkElement> kids = children.getOrDefault(e.getId(), List.of());
            for (int i = kids.size() - 1; i >= 0; i--)
                stack.push(new Line(kids.get(i), line.indent() + 1));
        }
        return sb.toString();
    }

    /** Mermaid flowchart; edges carrying a cable are labelled with its name and size. */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (NetworkElement e : graph.elements()) {
            sb.append("  ").append(nodeId(e.getId())).append("[\"").append(e.displayName().replace("\"", "'"))
                    .append("<br/><small>").append(e.getType().name()).append("</small>\"];\n");
        }
        for (GraphEdge edge : graph.edges()) {
            sb.append("  ").append(nodeId(edge.sourceId()));
            if (edge.cableName() != null) {
                sb.append(" -- \"").append(sanitize(edge.cableName()));
                if (edge.fiberCount() != null)
                    sb.append(' ').append(edge.fiberCount()).append('F');
                sb.append("\" -->");
            } else {
                sb.append(" -->");
            }
            sb.append(' ').append(nodeId(edge.targetId())).append(";\n");
        }
        return sb.toString();
    }

    private static String nodeId(long id) {
        return "n" + id;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_ .-]", "_");
    }
}
