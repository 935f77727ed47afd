package tree.gst;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.BitSet;
import java.util.Collections;

/**
 * NodeArena
 *
 * Owns every node of the tree. A node is an index into parallel lists:
 *
 *   children[v]      = outgoing transitions keyed by first symbol, null until the first child
 *   suffixLinks[v]   = suffix link target, or NO_LINK
 *   leafStringIds[v] = string id of the suffix this leaf was created for, or NO_LEAF
 *   leafOffsets[v]   = start offset of that suffix
 *
 * Root and sink occupy the reserved indices 0 and 1 and link to each other. The sink has
 * no stored transitions; {@link #find(int, int)} synthesizes one back to the root for every
 * symbol.
 */
final class NodeArena {

    static final int ROOT = 0;
    static final int SINK = 1;
    static final int NO_LINK = -1;
    static final int NO_LEAF = -1;

    // Sink transitions consume exactly one symbol and land on the root.
    private final Edge sinkEdge = new Edge(0, 0, 0, ROOT);

    private final ObjectArrayList<Int2ObjectOpenHashMap<Edge>> children;
    private final IntArrayList suffixLinks;
    private final IntArrayList leafStringIds;
    private final IntArrayList leafOffsets;

    NodeArena(int initialCapacity) {
        int capacity = Math.max(2, initialCapacity);
        this.children = new ObjectArrayList<>(capacity);
        this.suffixLinks = new IntArrayList(capacity);
        this.leafStringIds = new IntArrayList(capacity);
        this.leafOffsets = new IntArrayList(capacity);
        wireAnchors();
    }

    private void wireAnchors() {
        allocate(NO_LEAF, 0);
        allocate(NO_LEAF, 0);
        suffixLinks.set(ROOT, SINK);
        suffixLinks.set(SINK, ROOT);
    }

    private int allocate(int stringId, int offset) {
        int id = children.size();
        children.add(null);
        suffixLinks.add(NO_LINK);
        leafStringIds.add(stringId);
        leafOffsets.add(offset);
        return id;
    }

    int newNode() {
        return allocate(NO_LEAF, 0);
    }

    int newLeaf(int stringId, int offset) {
        return allocate(stringId, offset);
    }

    int size() {
        return children.size();
    }

    boolean contains(int node) {
        return node >= 0 && node < children.size();
    }

    /**
     * Return the transition of {@code node} whose label starts with {@code symbol}, or null.
     * Total for the sink.
     */
    Edge find(int node, int symbol) {
        if (node == SINK) {
            return sinkEdge;
        }
        Int2ObjectOpenHashMap<Edge> map = children.get(node);
        return map == null ? null : map.get(symbol);
    }

    /**
     * Insert or replace the transition keyed by {@code symbol}.
     */
    void put(int node, int symbol, Edge edge) {
        if (node == SINK) {
            throw new IllegalStateException("the sink cannot own transitions");
        }
        Int2ObjectOpenHashMap<Edge> map = children.get(node);
        if (map == null) {
            map = new Int2ObjectOpenHashMap<>(2);
            children.set(node, map);
        }
        map.put(symbol, edge);
    }

    Iterable<Edge> edges(int node) {
        Int2ObjectOpenHashMap<Edge> map = node == SINK ? null : children.get(node);
        if (map == null) {
            return Collections.emptyList();
        }
        return map.values();
    }

    Iterable<Int2ObjectMap.Entry<Edge>> keyedEdges(int node) {
        Int2ObjectOpenHashMap<Edge> map = node == SINK ? null : children.get(node);
        if (map == null) {
            return Collections.emptyList();
        }
        return map.int2ObjectEntrySet();
    }

    int childCount(int node) {
        Int2ObjectOpenHashMap<Edge> map = children.get(node);
        return map == null ? 0 : map.size();
    }

    int suffixLink(int node) {
        return suffixLinks.getInt(node);
    }

    void setSuffixLink(int node, int link) {
        if (node == ROOT || node == SINK) {
            throw new IllegalStateException("anchor suffix links are fixed");
        }
        suffixLinks.set(node, link);
    }

    int leafStringId(int node) {
        return leafStringIds.getInt(node);
    }

    int leafOffset(int node) {
        return leafOffsets.getInt(node);
    }

    /**
     * Release every node reachable from the root through transitions, breadth first with an
     * explicit worklist so deep trees do not grow the call stack. Suffix links are never
     * followed. The root and sink survive and are re-wired; everything else is dropped.
     *
     * @return the number of released nodes, the root excluded
     */
    int release() {
        BitSet seen = new BitSet(children.size());
        IntArrayFIFOQueue work = new IntArrayFIFOQueue();
        work.enqueue(ROOT);
        seen.set(ROOT);
        int released = 0;

        while (!work.isEmpty()) {
            int current = work.dequeueInt();
            Int2ObjectOpenHashMap<Edge> map = children.get(current);
            if (map != null) {
                for (Edge edge : map.values()) {
                    int target = edge.getTarget();
                    if (seen.get(target)) {
                        throw new IllegalStateException("node " + target + " is reachable twice");
                    }
                    seen.set(target);
                    work.enqueue(target);
                }
                map.clear();
                children.set(current, null);
            }
            if (current != ROOT) {
                released++;
            }
        }

        children.clear();
        suffixLinks.clear();
        leafStringIds.clear();
        leafOffsets.clear();
        wireAnchors();
        return released;
    }
}
