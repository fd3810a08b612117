package ch.so.arp.vectorsearch;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SimilaritySearch} keeping all records in memory. Used for local
 * development and tests where no database is running. Records with the same
 * identifier coexist.
 */
class InMemorySimilaritySearch implements SimilaritySearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySimilaritySearch.class);

    private final List<StoredVector> records = new CopyOnWriteArrayList<>();
    private final Ranking ranking;

    InMemorySimilaritySearch(SimilarityMetric metric) {
        this.ranking = new Ranking(metric);
    }

    @Override
    public void indexVector(List<? extends Number> vector, Map<String, ?> metadata) {
        double[] values = Vectors.requireVector(vector);
        String id = Vectors.requireId(metadata);
        records.add(new StoredVector(id, values));
    }

    @Override
    public List<ScoredResult> querySimilar(List<? extends Number> vector, int topK) {
        double[] query = Vectors.requireVector(vector);
        List<ScoredResult> scored = records.stream()
                .map(record -> ranking.score(query, record.id(), record.values()))
                .flatMap(Optional::stream)
                .toList();
        LOGGER.debug("Scored {} in-memory records (topK={})", scored.size(), topK);
        return ranking.topK(scored, topK);
    }

    int size() {
        return records.size();
    }

    @Override
    public void close() {
        records.clear();
    }

    private record StoredVector(String id, double[] values) {
    }
}
