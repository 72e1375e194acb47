package org.termgraph.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Name-to-id translation backed by the FastUtil library.
 * <p>
 * Ids are dense and 0-indexed in the order names are supplied. This class is
 * immutable and thread-safe for concurrent reads.
 * </p>
 */
public class FastUtilIDMapper implements IDMapper {

    // fastutil map for String -> int (forward lookup)
    private final Object2IntOpenHashMap<String> forward;
    // int -> String (reverse lookup), zero allocation read
    private final String[] reverse;

    /**
     * Constructs the mapper from an ordered list of distinct names.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("Ids cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(ABSENT);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String key = orderedIds.get(i);
            if (key == null) {
                throw new IllegalArgumentException("Null id at position " + i);
            }
            if (forward.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate id detected in input list: " + key);
            }
            forward.put(key, i);
            reverse[i] = key;
        }

        this.forward.trim();
    }

    @Override
    public int indexOf(String externalId) {
        if (externalId == null) {
            return ABSENT;
        }
        // getInt avoids boxing
        return forward.getInt(externalId);
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
