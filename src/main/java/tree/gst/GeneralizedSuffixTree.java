package tree.gst;

import org.openjdk.jol.info.GraphLayout;
import utilities.GSTLogger;

import java.util.Arrays;
import java.util.Objects;

/**
 * GeneralizedSuffixTree
 *
 * Suffix tree over a growing collection of integer strings, built online with Ukkonen's
 * algorithm and shared by every string inserted so far.
 * Insertion pipeline for a new string w:
 *   1. Register w under the next id; edges reference it as (id, left, right).
 *   2. Fast-forward: walk w down the existing tree until it diverges. Every suffix of the
 *      matched prefix is already a path, so Ukkonen resumes at the divergence with the whole
 *      prefix as active point.
 *   3. For each remaining position i, update() extends every open suffix with w[i], then the
 *      active point is canonized.
 * A string that ends inside existing structure adds nothing; it is rejected with
 * {@link #NO_ID} and its registry entry is rolled back.
 *
 * Nodes live in a {@link NodeArena}. The root links to the sink, whose lookup answers every
 * symbol with a one-symbol transition back to the root, so the first character of the first
 * string goes through the same code path as every other.
 *
 * Not thread-safe. Leaves record the (string id, offset) of the suffix they were created for;
 * suffixes that are still implicit when their string ends are paths without a leaf.
 */
public final class GeneralizedSuffixTree {

    /** Returned by addString when the string is already fully represented. */
    public static final int NO_ID = -1;

    // Fast-forward outcome: the new string ended inside existing structure.
    private static final int RAN_OUT = Integer.MAX_VALUE;

    // test-and-split outcome: the point already continues with the required symbol.
    private static final int ENDPOINT = -1;

    private final SuffixTreeConfiguration config;
    private final NodeArena arena;
    private final StringRegistry registry;
    private final SuffixTreeStats stats;
    private boolean released = false;

    // Active point (activeNode, activeLeft) for the string being inserted. The matched
    // substring runs from activeLeft to the position before the current phase.
    private int activeNode;
    private int activeLeft;

    // Start offset of the longest suffix of the current string that has no leaf yet.
    private int suffixStart;

    public GeneralizedSuffixTree() {
        this(SuffixTreeConfiguration.defaults());
    }

    public GeneralizedSuffixTree(SuffixTreeConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.arena = new NodeArena(config.initialNodeCapacity());
        this.registry = new StringRegistry(config.expectedStrings());
        this.stats = new SuffixTreeStats(config.collectStats());
    }

    /**
     * Insert a string given as UTF-16 code units.
     */
    public int addString(CharSequence text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return addString(text.chars().toArray());
    }

    /**
     * Insert a string and return its id (1, 2, ...), or {@link #NO_ID} when the string is
     * already represented in full by the tree, the empty string included. A rejected string
     * does not consume an id.
     */
    public int addString(int[] symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        if (released) {
            throw new IllegalStateException("tree has been released");
        }

        long startNanos = stats.isCollecting() ? System.nanoTime() : 0L;
        int id = registry.register(symbols);
        int resumedAt;
        try {
            resumedAt = deploySuffixes(id);
        } catch (RuntimeException e) {
            GSTLogger.error("Construction failed while inserting string " + id, e);
            throw e;
        }

        if (resumedAt == RAN_OUT) {
            registry.rollback(id);
            stats.recordRejected();
            GSTLogger.debug("Rejected string of length " + symbols.length + ": no divergence from the tree");
            return NO_ID;
        }

        if (stats.isCollecting()) {
            stats.recordAccepted(resumedAt, System.nanoTime() - startNanos);
        }
        GSTLogger.debug("Inserted string " + id + " of length " + symbols.length
                + ", resumed at " + resumedAt + ", nodes=" + arena.size());
        if (config.verifyInvariants()) {
            try {
                TreeVerifier.checkValid(this);
            } catch (IllegalStateException e) {
                GSTLogger.error("Invariant violation after inserting string " + id, e);
                throw e;
            }
        }
        return id;
    }

    /**
     * Run Ukkonen's algorithm for the registered string {@code id}.
     *
     * @return the position construction resumed at, or RAN_OUT if nothing was inserted
     */
    private int deploySuffixes(int id) {
        int[] w = registry.text(id);
        activeNode = NodeArena.ROOT;
        activeLeft = 0;
        suffixStart = 0;

        int resumedAt = fastForward(w);
        if (resumedAt == RAN_OUT) {
            return RAN_OUT;
        }
        for (int i = resumedAt; i < w.length; i++) {
            update(id, w, i);
            canonize(activeNode, w, activeLeft, i);
        }
        return resumedAt;
    }

    /**
     * Walk w from the root for as long as the tree already spells it. Leaves the active
     * point at the divergence and returns the first position Ukkonen must process, or
     * RAN_OUT when w ends inside the tree.
     */
    private int fastForward(int[] w) {
        int node = NodeArena.ROOT;
        int k = 0;
        while (k < w.length) {
            Edge edge = arena.find(node, w[k]);
            if (edge == null) {
                activeNode = node;
                activeLeft = k;
                return k;
            }
            int[] label = registry.text(edge.getStringId());
            int span = effectiveEnd(edge) - edge.getStart();
            for (int m = 1; m <= span; m++) {
                if (k + m >= w.length) {
                    return RAN_OUT;
                }
                if (w[k + m] != label[edge.getStart() + m]) {
                    // Diverges inside the edge; (node, w[k .. k+m-1]) is canonical.
                    activeNode = node;
                    activeLeft = k;
                    return k + m;
                }
            }
            node = edge.getTarget();
            k += span + 1;
        }
        return RAN_OUT;
    }

    /**
     * Add w[i] to every suffix that still needs an explicit extension, starting from the
     * active point and stopping at the first endpoint. Leaves the endpoint as active point.
     */
    private void update(int id, int[] w, int i) {
        int s = activeNode;
        int k = activeLeft;
        int t = w[i];
        int oldr = NodeArena.ROOT;

        int r;
        while ((r = testAndSplit(s, w, k, i - 1, t)) != ENDPOINT) {
            int leaf = arena.newLeaf(id, suffixStart);
            arena.put(r, t, new Edge(id, i, Edge.OPEN_END, leaf));
            stats.recordLeaf();
            if (oldr != NodeArena.ROOT) {
                arena.setSuffixLink(oldr, r);
            }
            oldr = r;
            suffixStart++;

            int link = arena.suffixLink(s);
            if (link == NodeArena.NO_LINK) {
                // A leaf of an earlier string turned branch point has no link; rescan instead.
                stats.recordRescan();
                canonize(NodeArena.ROOT, w, suffixStart, i - 1);
            } else {
                canonize(link, w, k, i - 1);
            }
            s = activeNode;
            k = activeLeft;
        }

        // Only an explicit endpoint can be a link target.
        if (oldr != NodeArena.ROOT && k > i - 1) {
            arena.setSuffixLink(oldr, s);
        }
        activeNode = s;
        activeLeft = k;
    }

    /**
     * Decide whether the point (n, w[left .. right]) already continues with t. If it does not
     * and the point lies inside an edge, split the edge there.
     *
     * @return ENDPOINT, or the explicit node the new leaf must hang from
     */
    private int testAndSplit(int n, int[] w, int left, int right, int t) {
        if (left <= right) {
            int tk = w[left];
            Edge edge = requireEdge(n, tk);
            int delta = right - left;
            int[] label = registry.text(edge.getStringId());
            if (label[edge.getStart() + delta + 1] == t) {
                return ENDPOINT;
            }

            int mid = arena.newNode();
            Edge tail = new Edge(edge.getStringId(), edge.getStart() + delta + 1, edge.getEnd(), edge.getTarget());
            arena.put(mid, label[tail.getStart()], tail);
            arena.put(n, tk, new Edge(edge.getStringId(), edge.getStart(), edge.getStart() + delta, mid));
            stats.recordSplit();
            return mid;
        }
        return arena.find(n, t) != null ? ENDPOINT : n;
    }

    /**
     * Skip/count down from s along w[left .. right] while whole edges fit, and store the
     * canonical result as the active point.
     */
    private void canonize(int s, int[] w, int left, int right) {
        if (right < left) {
            activeNode = s;
            activeLeft = left;
            return;
        }
        Edge edge = requireEdge(s, w[left]);
        int span;
        while ((span = effectiveEnd(edge) - edge.getStart()) <= right - left) {
            left += span + 1;
            s = edge.getTarget();
            if (left <= right) {
                edge = requireEdge(s, w[left]);
            }
        }
        activeNode = s;
        activeLeft = left;
    }

    private Edge requireEdge(int node, int symbol) {
        Edge edge = arena.find(node, symbol);
        if (edge == null) {
            throw new IllegalStateException("missing transition for symbol " + symbol + " at node " + node);
        }
        return edge;
    }

    /**
     * Return the inclusive end of the edge label, resolving {@link Edge#OPEN_END} against the
     * length of the referenced string.
     */
    public int effectiveEnd(Edge edge) {
        if (edge.isOpen()) {
            return registry.length(edge.getStringId()) - 1;
        }
        return edge.getEnd();
    }

    public int edgeLength(Edge edge) {
        return effectiveEnd(edge) - edge.getStart() + 1;
    }

    public int root() {
        return NodeArena.ROOT;
    }

    public int sink() {
        return NodeArena.SINK;
    }

    /**
     * Return the edge leaving {@code node} that starts with {@code symbol}, or null. The sink
     * answers every symbol with a transition to the root.
     */
    public Edge getEdge(int node, int symbol) {
        requireNode(node);
        return arena.find(node, symbol);
    }

    public Iterable<Edge> edgesIterable(int node) {
        requireNode(node);
        return arena.edges(node);
    }

    public int childCount(int node) {
        requireNode(node);
        return node == NodeArena.SINK ? 0 : arena.childCount(node);
    }

    /**
     * Return the suffix link of {@code node}, or -1 when it has none.
     */
    public int suffixLink(int node) {
        requireNode(node);
        return arena.suffixLink(node);
    }

    public boolean isLeaf(int node) {
        requireNode(node);
        return arena.leafStringId(node) != NodeArena.NO_LEAF;
    }

    /**
     * Return the id of the string whose suffix created this leaf, or -1 for other nodes.
     */
    public int leafStringId(int node) {
        requireNode(node);
        return arena.leafStringId(node);
    }

    /**
     * Return the start offset of the suffix that created this leaf, or -1 for other nodes.
     */
    public int leafOffset(int node) {
        return isLeaf(node) ? arena.leafOffset(node) : -1;
    }

    public int symbolAt(int stringId, int position) {
        return registeredText(stringId)[position];
    }

    public int stringLength(int stringId) {
        return registeredText(stringId).length;
    }

    /**
     * Return a copy of the string registered under {@code stringId}.
     */
    public int[] getString(int stringId) {
        int[] text = registeredText(stringId);
        return Arrays.copyOf(text, text.length);
    }

    public boolean containsString(int stringId) {
        return registry.contains(stringId);
    }

    public int stringCount() {
        return registry.size();
    }

    /**
     * Return the number of allocated nodes, root and sink included.
     */
    public int nodeCount() {
        return arena.size();
    }

    public SuffixTreeStats stats() {
        return stats;
    }

    public SuffixTreeConfiguration configuration() {
        return config;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Retained size of the node arena and string registry as measured by JOL.
     */
    public long estimateMemoryBytes() {
        try {
            return GraphLayout.parseInstance(arena, registry).totalSize();
        } catch (IllegalArgumentException e) {
            GSTLogger.warning("JOL could not walk the tree, falling back to a per-node estimate: " + e.getMessage());
            return (long) arena.size() * 64L;
        }
    }

    /**
     * Release every node and string. The tree cannot be used for insertion afterwards.
     * Safe to call multiple times.
     *
     * @return the number of nodes released by this call, the root excluded
     */
    public int release() {
        if (released) {
            return 0;
        }
        released = true;
        int count = arena.release();
        registry.clear();
        GSTLogger.info("Released suffix tree: " + count + " nodes");
        return count;
    }

    NodeArena arena() {
        return arena;
    }

    private int[] registeredText(int stringId) {
        if (!registry.contains(stringId)) {
            throw new IllegalArgumentException("unknown string id " + stringId);
        }
        return registry.text(stringId);
    }

    private void requireNode(int node) {
        if (!arena.contains(node)) {
            throw new IllegalArgumentException("unknown node " + node);
        }
    }
}
