package ch.so.arp.vectorsearch;

/**
 * Strategy abstraction used to compute embeddings for texts. Implementations
 * can either call a remote embedding API or provide deterministic placeholders
 * that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding, or an empty array if the embedding could not be
     *         computed
     */
    float[] embed(String text);
}
