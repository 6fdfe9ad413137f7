package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Dense id assignment for arbitrary tokens. Ids start at 1; 0 is never handed out so it can
 * serve as the suffix tree terminator.
 */
public class AlphabetMapper<T> {
    public static final int RESERVED_ID = 0;
    public static final int UNKNOWN = -1;

    private int nextId = 1;
    private final Object2IntOpenHashMap<T> tokenToId;

    public AlphabetMapper(int expectedSize) {
        // Pre-size to the expected alphabet size to avoid rehashing.
        this.tokenToId = new Object2IntOpenHashMap<>(Math.max(1, expectedSize), 0.75f);
        this.tokenToId.defaultReturnValue(UNKNOWN);
    }

    public int size() {
        return tokenToId.size();
    }

    // Insert-on-miss mapping
    public int getId(T token) {
        int id = tokenToId.getInt(token);
        if (id == UNKNOWN) {
            id = nextId++;
            tokenToId.put(token, id);
        }
        return id;
    }

    /** Id of {@code token}, or {@link #UNKNOWN} if it was never mapped. Never inserts. */
    public int lookup(T token) {
        return tokenToId.getInt(token);
    }
}
