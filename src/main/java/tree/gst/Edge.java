package tree.gst;

/**
 * A transition g(s, (k, p)) = s' of the generalized suffix tree. The label is the
 * inclusive range [start, end] of the string registered under {@code stringId}. We do not
 * copy substrings.
 *
 * An end of {@link #OPEN_END} marks a leaf edge that runs through the end of its string as
 * currently known. Readers must clamp it with {@link GeneralizedSuffixTree#effectiveEnd(Edge)}.
 */
public final class Edge {

    public static final int OPEN_END = Integer.MAX_VALUE;

    private final int stringId;
    private final int start;
    private final int end;
    private final int target;

    Edge(int stringId, int start, int end, int target) {
        this.stringId = stringId;
        this.start = start;
        this.end = end;
        this.target = target;
    }

    public int getStringId() {
        return stringId;
    }

    public int getStart() {
        return start;
    }

    /**
     * Return the raw inclusive end, possibly {@link #OPEN_END}.
     */
    public int getEnd() {
        return end;
    }

    public int getTarget() {
        return target;
    }

    public boolean isOpen() {
        return end == OPEN_END;
    }

    @Override
    public String toString() {
        return "Edge{" + stringId + ":[" + start + ", " + (isOpen() ? "open" : String.valueOf(end))
                + "] -> " + target + "}";
    }
}
