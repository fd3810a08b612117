package ch.so.arp.vectorsearch;

/**
 * Payload for a similarity query by text or by vector.
 */
public record SearchRequest(String text, Object vector, Integer topK) {

    static final int DEFAULT_TOP_K = 5;

    int topKOrDefault() {
        return topK == null ? DEFAULT_TOP_K : topK;
    }
}
