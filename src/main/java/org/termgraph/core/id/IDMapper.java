package org.termgraph.core.id;

import java.util.List;

/**
 * Bidirectional mapping contract between term names and internal dense integer ids.
 *
 * <p>Internal ids follow the order in which names were first registered, so id order
 * doubles as the deterministic discovery order used by graph traversals.</p>
 */
public interface IDMapper {

    /** Sentinel returned by {@link #indexOf(String)} for unmapped names. */
    int ABSENT = -1;

    /**
     * Converts a term name to its internal index without throwing.
     *
     * @param externalId term name, may be null.
     * @return internal index, or {@link #ABSENT} when the name is not mapped.
     */
    int indexOf(String externalId);

    /**
     * Converts an internal integer index back to its term name.
     * @param internalId The internal index.
     * @return The term name.
     * @throws IndexOutOfBoundsException If the internal ID is invalid.
     */
    String toExternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param orderedIds distinct names; the position of each name becomes its internal id.
     * @return An immutable IDMapper instance.
     */
    static IDMapper createImmutable(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
