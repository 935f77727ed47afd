package tree.gst;

import utilities.AlphabetMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Generalized suffix tree over an arbitrary symbol type. Symbols are mapped to dense codes
 * (1, 2, ...) by an {@link AlphabetMapper} and the integer tree does the rest, so T only
 * needs consistent equals and hashCode.
 *
 * Symbols first seen in a rejected string stay in the mapper.
 */
public final class TypedSuffixTree<T> {

    private final GeneralizedSuffixTree tree;
    private final AlphabetMapper<T> alphabet;

    public TypedSuffixTree() {
        this(SuffixTreeConfiguration.defaults(), 64);
    }

    public TypedSuffixTree(SuffixTreeConfiguration config, int expectedAlphabetSize) {
        this.tree = new GeneralizedSuffixTree(config);
        this.alphabet = new AlphabetMapper<>(expectedAlphabetSize);
    }

    /**
     * Insert a string and return its id, or {@link GeneralizedSuffixTree#NO_ID} when the tree
     * already represents it in full.
     */
    public int addString(List<? extends T> symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        return tree.addString(encode(symbols));
    }

    @SafeVarargs
    public final int addString(T... symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        return addString(Arrays.asList(symbols));
    }

    /**
     * Map symbols to their codes, registering unseen ones.
     */
    public int[] encode(List<? extends T> symbols) {
        int[] codes = new int[symbols.size()];
        int i = 0;
        for (T symbol : symbols) {
            codes[i++] = alphabet.getId(Objects.requireNonNull(symbol, "symbol"));
        }
        return codes;
    }

    /**
     * Return the symbols of the string registered under {@code stringId}.
     */
    public List<T> decode(int stringId) {
        int[] codes = tree.getString(stringId);
        List<T> symbols = new ArrayList<>(codes.length);
        for (int code : codes) {
            symbols.add(alphabet.symbolOf(code));
        }
        return symbols;
    }

    public GeneralizedSuffixTree tree() {
        return tree;
    }

    public AlphabetMapper<T> alphabet() {
        return alphabet;
    }

    public int release() {
        int released = tree.release();
        alphabet.clear();
        return released;
    }
}
