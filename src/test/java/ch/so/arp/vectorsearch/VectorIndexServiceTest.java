package ch.so.arp.vectorsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class VectorIndexServiceTest {

    private final InMemorySimilaritySearch search = new InMemorySimilaritySearch(SimilarityMetrics.COSINE);

    @Test
    void indexesAndFindsTextByItsEmbedding() {
        VectorIndexService service = new VectorIndexService(new DeterministicEmbeddingProvider(32), search);

        service.indexText("first", "Sample text 1.", Map.of());
        service.indexText("second", "Sample text 2.", Map.of());

        List<ScoredResult> results = service.searchText("Sample text 1.", 1);
        assertThat(results).containsExactly(new ScoredResult("first", 1.0d));
    }

    @Test
    void embedsWithProviderAndPassesMetadataWithId() {
        EmbeddingProvider provider = text -> new float[] { 0.1f, 0.2f, 0.3f };
        SimilaritySearch backend = mock(SimilaritySearch.class);
        VectorIndexService service = new VectorIndexService(provider, backend);

        List<Float> embedding = service.indexText("sample_id", "This is a sample text for embedding.",
                Map.of("source", "unit-test"));

        assertThat(embedding).containsExactly(0.1f, 0.2f, 0.3f);
        verify(backend).indexVector(List.of(0.1f, 0.2f, 0.3f), Map.of("source", "unit-test", "id", "sample_id"));
    }

    @Test
    void searchPassesTopKThrough() {
        SimilaritySearch backend = mock(SimilaritySearch.class);
        VectorIndexService service = new VectorIndexService(text -> new float[] { 1.0f }, backend);

        service.searchText("query", 0);

        verify(backend).querySimilar(anyList(), eq(0));
    }

    @Test
    void failedEmbeddingIsRejectedAsInvalidVector() {
        VectorIndexService service = new VectorIndexService(text -> new float[0], search);

        assertThatThrownBy(() -> service.indexText("x", "text", Map.of())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.searchText("text", 3)).isInstanceOf(ValidationException.class);
        assertThat(search.size()).isZero();
    }
}
