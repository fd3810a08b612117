package ch.so.arp.vectorsearch;

/**
 * Raised before any I/O when a vector or its metadata does not have the
 * expected shape.
 */
public class ValidationException extends VectorSearchException {

    public ValidationException(String message) {
        super(message);
    }
}
