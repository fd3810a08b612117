package ch.so.arp.vectorsearch;

import java.util.List;
import java.util.Map;

/**
 * Storage agnostic contract for persisting embedding vectors and retrieving
 * the records most similar to a query vector.
 * <p>
 * Implementations are synchronous and do not retry: every storage failure is
 * reported immediately as a {@link StorageException}. Thread safety of the
 * underlying connection is whatever the store client provides.
 */
public interface SimilaritySearch extends AutoCloseable {

    /**
     * Persist one vector under the identifier found in the metadata.
     *
     * @param vector   non-empty sequence of finite numbers
     * @param metadata record metadata, must contain an {@code id} entry
     * @throws ValidationException if the vector or the metadata is malformed
     * @throws StorageException    if the store fails to persist the record
     */
    void indexVector(List<? extends Number> vector, Map<String, ?> metadata);

    /**
     * Index every record of the batch in order. Stops at the first failure;
     * records written before the failing one stay written and the remaining
     * ones are not attempted.
     *
     * @param batch the records to index
     */
    default void indexVectors(List<VectorRecord> batch) {
        for (VectorRecord record : batch) {
            indexVector(record.vector(), record.metadata());
        }
    }

    /**
     * Find the records closest to the query vector.
     *
     * @param vector the query vector
     * @param topK   the maximum amount of results; non-positive values yield an
     *               empty result
     * @return at most {@code topK} results, best match first, never {@code null}
     * @throws ValidationException if the query vector is malformed
     * @throws StorageException    if the store fails to return the candidates
     */
    List<ScoredResult> querySimilar(List<? extends Number> vector, int topK);

    /**
     * Release the connection or session held by this backend.
     */
    @Override
    void close();
}
