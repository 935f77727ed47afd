package tree.gst;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.Arrays;

// Text of every inserted string, keyed by its sequential id. Edges reference it by id.
final class StringRegistry {

    private final Int2ObjectOpenHashMap<int[]> texts;
    private int lastId;

    StringRegistry(int expectedStrings) {
        this.texts = new Int2ObjectOpenHashMap<>(Math.max(4, expectedStrings));
        this.lastId = 0; // 0 is reserved for the sink's synthetic transition
    }

    int register(int[] symbols) {
        int id = ++lastId;
        texts.put(id, Arrays.copyOf(symbols, symbols.length));
        return id;
    }

    // Drop the most recent entry and hand its id back.
    void rollback(int id) {
        if (id != lastId) {
            throw new IllegalStateException("only the latest string can be rolled back, got " + id
                    + " while latest is " + lastId);
        }
        texts.remove(id);
        lastId--;
    }

    int[] text(int id) {
        int[] text = texts.get(id);
        if (text == null) {
            throw new IllegalStateException("no string registered under id " + id);
        }
        return text;
    }

    boolean contains(int id) {
        return texts.containsKey(id);
    }

    int length(int id) {
        return text(id).length;
    }

    int symbolAt(int id, int position) {
        return text(id)[position];
    }

    int size() {
        return texts.size();
    }

    int lastId() {
        return lastId;
    }

    void clear() {
        texts.clear();
        lastId = 0;
    }
}
