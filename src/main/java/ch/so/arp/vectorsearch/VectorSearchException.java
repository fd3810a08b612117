package ch.so.arp.vectorsearch;

/**
 * Base type of the errors raised by {@link SimilaritySearch} implementations.
 */
public class VectorSearchException extends RuntimeException {

    public VectorSearchException(String message) {
        super(message);
    }

    public VectorSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
