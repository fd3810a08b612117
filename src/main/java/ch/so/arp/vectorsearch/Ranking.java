package ch.so.arp.vectorsearch;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores candidates with a {@link SimilarityMetric} and selects the top-k.
 * <p>
 * Order: best score first according to the metric direction, NaN scores last,
 * equal scores by ascending identifier. The sort is stable, so candidates
 * that share score and identifier keep their retrieval order.
 */
final class Ranking {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ranking.class);

    private final SimilarityMetric metric;
    private final Comparator<ScoredResult> comparator;

    Ranking(SimilarityMetric metric) {
        this.metric = Objects.requireNonNull(metric, "metric");
        this.comparator = comparator(metric);
    }

    SimilarityMetric metric() {
        return metric;
    }

    /**
     * Score one stored vector. Vectors whose dimension differs from the query
     * cannot be compared and are skipped.
     */
    Optional<ScoredResult> score(double[] query, String id, double[] stored) {
        if (stored.length != query.length) {
            LOGGER.warn("Skipping record '{}': dimension {} does not match query dimension {}", id, stored.length,
                    query.length);
            return Optional.empty();
        }
        return Optional.of(new ScoredResult(id, metric.score(query, stored)));
    }

    List<ScoredResult> topK(List<ScoredResult> candidates, int topK) {
        return candidates.stream()
                .sorted(comparator)
                .limit(Math.max(topK, 0))
                .toList();
    }

    /**
     * Keep the given order and only truncate to {@code topK}.
     */
    List<ScoredResult> firstK(List<ScoredResult> candidates, int topK) {
        return candidates.stream()
                .limit(Math.max(topK, 0))
                .toList();
    }

    static Comparator<ScoredResult> comparator(SimilarityMetric metric) {
        Comparator<ScoredResult> byScore = (left, right) -> {
            boolean leftNaN = Double.isNaN(left.score());
            boolean rightNaN = Double.isNaN(right.score());
            if (leftNaN || rightNaN) {
                return Boolean.compare(leftNaN, rightNaN);
            }
            return metric.higherIsCloser()
                    ? Double.compare(right.score(), left.score())
                    : Double.compare(left.score(), right.score());
        };
        return byScore.thenComparing(ScoredResult::id);
    }
}
