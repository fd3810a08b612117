package ch.so.arp.vectorsearch;

/**
 * Strategy computing the score of a stored vector against a query vector.
 * Both vectors passed to {@link #score(double[], double[])} have the same
 * length.
 */
public interface SimilarityMetric {

    double score(double[] query, double[] candidate);

    /**
     * @return {@code true} for similarities (higher is closer), {@code false}
     *         for distances (lower is closer)
     */
    boolean higherIsCloser();
}
