package com.netlink.osp.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered layout of the element hierarchy.
 * <p>
 * Depth of a node is the longest path to it from any root; each depth is one
 * layout column. Inside a column nodes are ordered by the row of their
 * deepest parent, then by the order they were added, so siblings stay
 * together and follow their parent down the canvas.
 * <p>
 * Pure: the result depends only on the nodes and edges handed to the
 * {@link Builder}.
 */
public final class HierarchyLayout {
    private final long[] ids;
    private final int[] depth;
    private final int[] row;
    private final Map<Long, Integer> idToIndex;
    private final int columnCount;

    private HierarchyLayout(long[] ids, int[] depth, int[] row, Map<Long, Integer> idToIndex, int columnCount) {
        this.ids = ids;
        this.depth = depth;
        this.row = row;
        this.idToIndex = idToIndex;
        this.columnCount = columnCount;
    }

    /** Lays out the given elements along the given edges. */
    public static Map<Long, Position> compute(Collection<NetworkElement> nodes, Collection<GraphEdge> edges,
            LayoutOptions options) {
        Builder b = builder();
        for (NetworkElement e : nodes)
            b.addNode(e.getId());
        for (GraphEdge e : edges)
            b.addEdge(e.sourceId(), e.targetId());
        return b.build().positions(options);
    }

    public int nodeCount() {
        return ids.length;
    }

    public int columnCount() {
        return columnCount;
    }

    public int depth(long id) {
        return depth[index(id)];
    }

    public int row(long id) {
        return row[index(id)];
    }

    /** Canvas positions in node insertion order. */
    public Map<Long, Position> positions(LayoutOptions options) {
        Map<Long, Position> out = new LinkedHashMap<>(ids.length * 2);
        for (int i = 0; i < ids.length; i++)
            out.put(ids[i], new Position(depth[i] * options.columnWidth(), row[i] * options.rowHeight()));
        return out;
    }

    private int index(long id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects nodes and parent-to-child edges, then orders them with Kahn's
     * algorithm. Rejects duplicate nodes, self edges and cycles.
     */
    public static final class Builder {
        private final List<Long> nodes = new ArrayList<>();
        private final Map<Long, Integer> idToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();
        private final Map<Integer, List<Integer>> backEdges = new HashMap<>();

        public Builder addNode(long id) {
            if (idToIdx.containsKey(id))
                throw new IllegalArgumentException("Duplicate node: " + id);
            int idx = nodes.size();
            nodes.add(id);
            idToIdx.put(id, idx);
            forwardEdges.put(idx, new ArrayList<>());
            backEdges.put(idx, new ArrayList<>());
            return this;
        }

        public Builder addEdge(long parent, long child) {
            if (parent == child)
                throw new IllegalArgumentException("Self-edge not allowed: " + parent);
            int from = requireIndex(parent), to = requireIndex(child);
            forwardEdges.get(from).add(to);
            backEdges.get(to).add(from);
            return this;
        }

        private int requireIndex(long id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        public HierarchyLayout build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // Longest path: a node's depth is final once its last parent is processed
            int[] depth = new int[n];
            while (head < tail) {
                int curr = queue[head++];
                for (int child : forwardEdges.get(curr)) {
                    depth[child] = Math.max(depth[child], depth[curr] + 1);
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
                }
            }
            if (tail != n)
                throw new IllegalStateException("Cycle detected! Processed " + tail + " of " + n);

            int columns = 0;
            for (int d : depth)
                columns = Math.max(columns, d + 1);
            List<List<Integer>> byColumn = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++)
                byColumn.add(new ArrayList<>());
            for (int i = 0; i < n; i++)
                byColumn.get(depth[i]).add(i);

            int[] row = new int[n];
            for (List<Integer> column : byColumn) {
                column.sort(Comparator.comparingInt((Integer i) -> anchorRow(i, depth, row)).thenComparingInt(i -> i));
                for (int r = 0; r < column.size(); r++)
                    row[column.get(r)] = r;
            }

            long[] ids = new long[n];
            for (int i = 0; i < n; i++)
                ids[i] = nodes.get(i);
            return new HierarchyLayout(ids, depth, row, new HashMap<>(idToIdx), columns);
        }

        // Row of the first parent sitting in the column just left of the node; roots anchor at -1
        private int anchorRow(int node, int[] depth, int[] row) {
            for (int parent : backEdges.get(node)) {
                if (depth[parent] == depth[node] - 1)
                    return row[parent];
            }
            return -1;
        }
    }
}
