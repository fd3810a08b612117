package ch.so.arp.vectorsearch;

import java.util.List;
import java.util.Map;

/**
 * One element of a batch passed to {@link SimilaritySearch#indexVectors(List)}.
 * The metadata must carry an {@code id} entry; all other entries are ignored by
 * the search backends.
 */
public record VectorRecord(List<? extends Number> vector, Map<String, ?> metadata) {

    public static VectorRecord of(String id, List<? extends Number> vector) {
        return new VectorRecord(vector, Map.of(Vectors.ID_FIELD, id));
    }
}
