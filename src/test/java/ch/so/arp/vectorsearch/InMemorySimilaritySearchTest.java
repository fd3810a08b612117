package ch.so.arp.vectorsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySimilaritySearchTest {

    private InMemorySimilaritySearch search;

    @BeforeEach
    void setUp() {
        search = new InMemorySimilaritySearch(SimilarityMetrics.COSINE);
    }

    @Test
    void returnsSelfWithSimilarityOne() {
        search.indexVector(List.of(0.1d, 0.2d, 0.3d), Map.of("id", "sample_id"));

        assertThat(search.querySimilar(List.of(0.1d, 0.2d, 0.3d), 1))
                .containsExactly(new ScoredResult("sample_id", 1.0d));
    }

    @Test
    void returnsSelfWithSimilarityOneForExtremeMagnitudes() {
        search.indexVector(List.of(1e200d, 1e200d), Map.of("id", "big"));
        search.indexVector(List.of(1e-200d, 0.0d), Map.of("id", "small"));

        assertThat(search.querySimilar(List.of(1e200d, 1e200d), 1)).containsExactly(new ScoredResult("big", 1.0d));
        assertThat(search.querySimilar(List.of(1e-200d, 0.0d), 1)).containsExactly(new ScoredResult("small", 1.0d));
    }

    @Test
    void emptyStoreYieldsEmptyResult() {
        assertThat(search.querySimilar(List.of(1.0d), 5)).isEmpty();
    }

    @Test
    void ranksTiesByIdentifier() {
        search.indexVectors(List.of(
                VectorRecord.of("C", List.of(1, 0)),
                VectorRecord.of("B", List.of(0, 1)),
                VectorRecord.of("A", List.of(1, 0))));

        assertThat(search.querySimilar(List.of(1, 0), 2))
                .containsExactly(new ScoredResult("A", 1.0d), new ScoredResult("C", 1.0d));
        assertThat(search.querySimilar(List.of(1, 0), 3))
                .extracting(ScoredResult::id)
                .containsExactly("A", "C", "B");
    }

    @Test
    void nonPositiveTopKReturnsEmptyResult() {
        search.indexVector(List.of(1, 0), Map.of("id", "A"));

        assertThat(search.querySimilar(List.of(1, 0), 0)).isEmpty();
        assertThat(search.querySimilar(List.of(1, 0), -1)).isEmpty();
    }

    @Test
    void repeatedQueriesReturnIdenticalResults() {
        search.indexVectors(List.of(
                VectorRecord.of("x", List.of(0.3d, 0.1d)),
                VectorRecord.of("y", List.of(0.1d, 0.3d)),
                VectorRecord.of("z", List.of(0.2d, 0.2d))));

        List<ScoredResult> first = search.querySimilar(List.of(0.25d, 0.15d), 3);
        List<ScoredResult> second = search.querySimilar(List.of(0.25d, 0.15d), 3);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void duplicateIdentifiersCoexist() {
        search.indexVector(List.of(1, 0), Map.of("id", "dup"));
        search.indexVector(List.of(0, 1), Map.of("id", "dup"));

        assertThat(search.querySimilar(List.of(1, 0), 5))
                .containsExactly(new ScoredResult("dup", 1.0d), new ScoredResult("dup", 0.0d));
    }

    @Test
    void batchStopsAtFirstInvalidRecord() {
        List<VectorRecord> batch = List.of(
                VectorRecord.of("1", List.of(1, 0)),
                VectorRecord.of("2", List.of(0, 1)),
                VectorRecord.of("3", List.of()),
                VectorRecord.of("4", List.of(1, 1)));

        assertThatThrownBy(() -> search.indexVectors(batch)).isInstanceOf(ValidationException.class);

        assertThat(search.size()).isEqualTo(2);
        assertThat(search.querySimilar(List.of(1, 1), 10)).extracting(ScoredResult::id).containsExactly("1", "2");
    }

    @Test
    void rejectsMetadataWithoutId() {
        assertThatThrownBy(() -> search.indexVector(List.of(0.1d), Map.of("name", "no id")))
                .isInstanceOf(ValidationException.class);
        assertThat(search.size()).isZero();
    }

    @SuppressWarnings({ "rawtypes", "unchecked" })
    @Test
    void rejectsNonNumericElementsSmuggledPastGenerics() {
        List raw = List.of(0.1d, 0.2d, "a");

        assertThatThrownBy(() -> search.indexVector(raw, Map.of("id", "x"))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> search.querySimilar(raw, 1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void skipsRecordsWithOtherDimension() {
        search.indexVector(List.of(1, 0, 0), Map.of("id", "3d"));
        search.indexVector(List.of(1, 0), Map.of("id", "2d"));

        assertThat(search.querySimilar(List.of(1, 0), 5)).containsExactly(new ScoredResult("2d", 1.0d));
    }

    @Test
    void usesConfiguredMetric() {
        InMemorySimilaritySearch euclidean = new InMemorySimilaritySearch(SimilarityMetrics.EUCLIDEAN);
        euclidean.indexVectors(List.of(
                VectorRecord.of("far", List.of(0.7d, 0.8d, 0.9d)),
                VectorRecord.of("same", List.of(0.1d, 0.2d, 0.3d))));

        assertThat(euclidean.querySimilar(List.of(0.1d, 0.2d, 0.3d), 5))
                .extracting(ScoredResult::id)
                .containsExactly("same", "far");
    }
}
