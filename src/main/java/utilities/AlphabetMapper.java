package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

// Dense integer codes for an arbitrary symbol type, in order of first appearance.
public class AlphabetMapper<T> {
    public static final int UNKNOWN = -1;

    // 0 is reserved, codes start at 1
    int nextId = 1;
    float loadFactor = 0.75f;

    // Primitive map to avoid boxing on the hot path
    private final Object2IntOpenHashMap<T> symbolToId;
    private final ObjectArrayList<T> idToSymbol;

    int capacity;

    public AlphabetMapper(int capacity) {
        this.capacity = Math.max(1, capacity);

        // Pre-size to the expected alphabet size to avoid rehashing.
        this.symbolToId = new Object2IntOpenHashMap<>(this.capacity, loadFactor);
        // Use -1 as the default return to distinguish from valid ids (>=1) and the reserved 0.
        this.symbolToId.defaultReturnValue(UNKNOWN);
        this.idToSymbol = new ObjectArrayList<>(this.capacity + 1);
        this.idToSymbol.add(null);
    }

    public int getSize() {
        return symbolToId.size();
    }

    public int getCapacity() {
        return capacity;
    }

    // Insert-on-miss mapping
    public int getId(T symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        int id = symbolToId.getInt(symbol);
        if (id == UNKNOWN) {
            id = nextId++;
            symbolToId.put(symbol, id);
            idToSymbol.add(symbol);
        }
        return id;
    }

    // Mapping without insertion; UNKNOWN for symbols never seen.
    public int lookup(T symbol) {
        return symbol == null ? UNKNOWN : symbolToId.getInt(symbol);
    }

    public T symbolOf(int id) {
        if (id <= 0 || id >= nextId) {
            throw new IllegalArgumentException("unknown symbol id " + id);
        }
        return idToSymbol.get(id);
    }

    public void clear() {
        symbolToId.clear();
        idToSymbol.clear();
        idToSymbol.add(null);
        nextId = 1; // keep 0 reserved
    }
}
