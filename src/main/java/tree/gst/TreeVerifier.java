package tree.gst;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Structural checks over a {@link GeneralizedSuffixTree}. Verifies:
 * - every node except the sink is reached exactly once from the root through transitions
 * - every edge is keyed by the first symbol of its label and its label lies inside its string
 * - the path label of every node occurs in the string of each outgoing edge, right before
 *   the edge label (edges of one node agree on the symbols above them)
 * - nodes that are not leaves carry a suffix link, and a suffix link goes to a reachable node
 *   whose string depth is one less
 * - a leaf sits at the string depth of the suffix it records
 */
public final class TreeVerifier {

    private static final int MAX_REPORTED = 8;

    private TreeVerifier() {
    }

    public static List<String> verify(GeneralizedSuffixTree tree) {
        NodeArena arena = tree.arena();
        int n = arena.size();
        List<String> problems = new ArrayList<>();

        if (arena.suffixLink(NodeArena.ROOT) != NodeArena.SINK || arena.suffixLink(NodeArena.SINK) != NodeArena.ROOT) {
            problems.add("root and sink are not linked to each other");
        }

        // For every reached node: string depth, plus one occurrence of its path label as
        // (string id, exclusive end).
        int[] depth = new int[n];
        int[] labelString = new int[n];
        int[] labelEnd = new int[n];
        Arrays.fill(labelString, -1);

        BitSet seen = new BitSet(n);
        IntArrayFIFOQueue work = new IntArrayFIFOQueue();
        seen.set(NodeArena.ROOT);
        work.enqueue(NodeArena.ROOT);

        while (!work.isEmpty()) {
            int parent = work.dequeueInt();
            for (Int2ObjectMap.Entry<Edge> entry : arena.keyedEdges(parent)) {
                Edge edge = entry.getValue();
                int target = edge.getTarget();
                if (!checkEdge(tree, parent, entry.getIntKey(), edge, depth[parent], problems)) {
                    continue;
                }
                if (labelString[parent] >= 0
                        && !sameSymbols(tree, labelString[parent], labelEnd[parent] - depth[parent],
                                        edge.getStringId(), edge.getStart() - depth[parent], depth[parent])) {
                    problems.add("edge " + edge + " below node " + parent + " disagrees with the path above it");
                }
                if (target == NodeArena.SINK || !arena.contains(target)) {
                    problems.add("edge " + edge + " below node " + parent + " has an invalid target");
                    continue;
                }
                if (seen.get(target)) {
                    problems.add("node " + target + " is reachable twice");
                    continue;
                }
                seen.set(target);
                depth[target] = depth[parent] + tree.edgeLength(edge);
                labelString[target] = edge.getStringId();
                labelEnd[target] = tree.effectiveEnd(edge) + 1;
                work.enqueue(target);
            }
        }

        for (int v = 0; v < n; v++) {
            if (v == NodeArena.SINK || v == NodeArena.ROOT) {
                continue;
            }
            if (!seen.get(v)) {
                problems.add("node " + v + " is not reachable from the root");
                continue;
            }
            checkSuffixLink(arena, v, seen, depth, problems);
            checkLeaf(tree, arena, v, depth, problems);
        }
        return problems;
    }

    /**
     * Throw {@link IllegalStateException} listing the first violations, if any.
     */
    public static void checkValid(GeneralizedSuffixTree tree) {
        List<String> problems = verify(tree);
        if (problems.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("suffix tree invariants violated (")
                .append(problems.size()).append("):");
        for (int i = 0; i < Math.min(MAX_REPORTED, problems.size()); i++) {
            sb.append("\n  ").append(problems.get(i));
        }
        throw new IllegalStateException(sb.toString());
    }

    private static boolean checkEdge(GeneralizedSuffixTree tree, int parent, int key, Edge edge,
                                     int parentDepth, List<String> problems) {
        if (!tree.containsString(edge.getStringId())) {
            problems.add("edge " + edge + " below node " + parent + " references an unknown string");
            return false;
        }
        int length = tree.stringLength(edge.getStringId());
        int end = tree.effectiveEnd(edge);
        if (edge.getStart() < 0 || edge.getStart() > end || end >= length) {
            problems.add("edge " + edge + " below node " + parent + " has an empty or out-of-range label");
            return false;
        }
        if (edge.getStart() - parentDepth < 0) {
            problems.add("edge " + edge + " below node " + parent + " starts before its path label");
            return false;
        }
        if (tree.symbolAt(edge.getStringId(), edge.getStart()) != key) {
            problems.add("edge " + edge + " below node " + parent + " is keyed by " + key);
            return false;
        }
        return true;
    }

    private static boolean sameSymbols(GeneralizedSuffixTree tree, int a, int aStart, int b, int bStart, int length) {
        for (int i = 0; i < length; i++) {
            if (tree.symbolAt(a, aStart + i) != tree.symbolAt(b, bStart + i)) {
                return false;
            }
        }
        return true;
    }

    private static void checkSuffixLink(NodeArena arena, int v, BitSet seen, int[] depth, List<String> problems) {
        int link = arena.suffixLink(v);
        if (link == NodeArena.NO_LINK) {
            if (arena.leafStringId(v) == NodeArena.NO_LEAF) {
                problems.add("internal node " + v + " has no suffix link");
            }
            return;
        }
        if (!arena.contains(link) || !seen.get(link)) {
            problems.add("suffix link of node " + v + " points to unreachable node " + link);
            return;
        }
        if (depth[link] != depth[v] - 1) {
            problems.add("suffix link of node " + v + " (depth " + depth[v] + ") points to node "
                    + link + " at depth " + depth[link]);
        }
    }

    private static void checkLeaf(GeneralizedSuffixTree tree, NodeArena arena, int v, int[] depth, List<String> problems) {
        int stringId = arena.leafStringId(v);
        if (stringId == NodeArena.NO_LEAF) {
            return;
        }
        if (!tree.containsString(stringId)) {
            problems.add("leaf " + v + " records unknown string " + stringId);
            return;
        }
        int suffixLength = tree.stringLength(stringId) - arena.leafOffset(v);
        if (depth[v] != suffixLength) {
            problems.add("leaf " + v + " for suffix " + stringId + ":" + arena.leafOffset(v)
                    + " sits at depth " + depth[v] + " instead of " + suffixLength);
        }
    }
}
