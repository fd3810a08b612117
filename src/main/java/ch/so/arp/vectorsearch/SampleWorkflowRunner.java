package ch.so.arp.vectorsearch;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Embeds a sample text at startup, indexes it and logs the most similar
 * records. Useful to check a freshly configured backend end to end.
 */
class SampleWorkflowRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SampleWorkflowRunner.class);

    private final VectorIndexService indexService;
    private final VectorSearchProperties.Sample sample;

    SampleWorkflowRunner(VectorIndexService indexService, VectorSearchProperties.Sample sample) {
        this.indexService = indexService;
        this.sample = sample;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            List<Float> embedding = indexService.indexText(sample.getId(), sample.getText(), Map.of());
            LOGGER.info("Indexed sample '{}' with {} dimensions", sample.getId(), embedding.size());
            List<ScoredResult> results = indexService.search(embedding, sample.getTopK());
            LOGGER.info("Top {} similar vectors: {}", sample.getTopK(), results);
        } catch (VectorSearchException ex) {
            LOGGER.error("Sample workflow failed: {}", ex.getMessage(), ex);
        }
    }
}
