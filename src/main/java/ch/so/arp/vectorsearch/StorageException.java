package ch.so.arp.vectorsearch;

/**
 * Raised when the backing store rejects or fails a statement. The original
 * failure is kept as the cause and its message is part of this message.
 */
public class StorageException extends VectorSearchException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
