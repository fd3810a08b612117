package ch.so.arp.vectorsearch;

/**
 * How {@link WideColumnSimilaritySearch} orders the candidates returned by the
 * store's approximate nearest neighbour query.
 */
public enum AnnRankingPolicy {

    /**
     * Re-sort the candidates by the client-side metric. Needed when the
     * store's index uses a different similarity function.
     */
    RERANK,

    /**
     * Keep the order produced by the store and only attach client-side scores.
     */
    STORE_ORDER
}
