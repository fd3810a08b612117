package ch.so.arp.vectorsearch;

/**
 * A stored record's identifier together with its score against a query
 * vector. Whether a higher score means closer depends on the
 * {@link SimilarityMetric} that produced it.
 */
public record ScoredResult(String id, double score) {
}
