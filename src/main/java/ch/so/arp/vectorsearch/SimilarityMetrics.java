package ch.so.arp.vectorsearch;

/**
 * Built-in {@link SimilarityMetric metrics}.
 */
public enum SimilarityMetrics implements SimilarityMetric {

    /**
     * Cosine similarity in [-1, 1]. Both vectors are divided by their largest
     * absolute element first, so that the sums neither overflow nor underflow,
     * and the score is computed as {@code dot(a, b) / sqrt(|a|^2 * |b|^2)}. A
     * vector compared with itself scores exactly 1. A zero vector yields NaN.
     */
    COSINE(true) {
        @Override
        public double score(double[] query, double[] candidate) {
            double scale = Math.max(maxAbs(query), maxAbs(candidate));
            double dot = 0.0d;
            double queryNorm = 0.0d;
            double candidateNorm = 0.0d;
            for (int i = 0; i < query.length; i++) {
                double q = query[i] / scale;
                double c = candidate[i] / scale;
                dot += q * c;
                queryNorm += q * q;
                candidateNorm += c * c;
            }
            return dot / Math.sqrt(queryNorm * candidateNorm);
        }
    },

    DOT_PRODUCT(true) {
        @Override
        public double score(double[] query, double[] candidate) {
            double dot = 0.0d;
            for (int i = 0; i < query.length; i++) {
                dot += query[i] * candidate[i];
            }
            return dot;
        }
    },

    /**
     * Euclidean distance, lower is closer.
     */
    EUCLIDEAN(false) {
        @Override
        public double score(double[] query, double[] candidate) {
            double sum = 0.0d;
            for (int i = 0; i < query.length; i++) {
                double diff = query[i] - candidate[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    };

    private final boolean higherIsCloser;

    SimilarityMetrics(boolean higherIsCloser) {
        this.higherIsCloser = higherIsCloser;
    }

    @Override
    public boolean higherIsCloser() {
        return higherIsCloser;
    }

    private static double maxAbs(double[] values) {
        double max = 0.0d;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }
}
