package ch.so.arp.vectorsearch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates the embedding of texts and delegates storage and retrieval to
 * the configured {@link SimilaritySearch} backend.
 */
@Service
public class VectorIndexService {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorIndexService.class);

    private final EmbeddingProvider embeddingProvider;
    private final SimilaritySearch similaritySearch;

    public VectorIndexService(EmbeddingProvider embeddingProvider, SimilaritySearch similaritySearch) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.similaritySearch = Objects.requireNonNull(similaritySearch, "similaritySearch");
    }

    /**
     * Embed the text and index the embedding under the given identifier.
     *
     * @param id       the record identifier
     * @param text     the text to embed
     * @param metadata additional metadata, may be empty
     * @return the indexed embedding
     */
    public List<Float> indexText(String id, String text, Map<String, ?> metadata) {
        List<Float> embedding = Vectors.toList(embeddingProvider.embed(text));
        Map<String, Object> recordMetadata = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        recordMetadata.put(Vectors.ID_FIELD, id);
        similaritySearch.indexVector(embedding, recordMetadata);
        LOGGER.debug("Indexed text '{}' as {} dimensional embedding", id, embedding.size());
        return embedding;
    }

    public void indexVector(List<? extends Number> vector, Map<String, ?> metadata) {
        similaritySearch.indexVector(vector, metadata);
    }

    public void indexVectors(List<VectorRecord> batch) {
        similaritySearch.indexVectors(batch);
    }

    /**
     * Embed the text and return the stored records most similar to it.
     */
    public List<ScoredResult> searchText(String text, int topK) {
        return similaritySearch.querySimilar(Vectors.toList(embeddingProvider.embed(text)), topK);
    }

    public List<ScoredResult> search(List<? extends Number> vector, int topK) {
        return similaritySearch.querySimilar(vector, topK);
    }
}
