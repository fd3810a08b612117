package ch.so.arp.vectorsearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

/**
 * Central configuration wiring the embedding provider and the similarity
 * search backend. The backend is chosen with {@code vector-search.backend}
 * (bound leniently, so {@code wide-column} and {@code WIDE_COLUMN} select the same one);
 * without configuration an in-memory store and deterministic embeddings are
 * used so the application runs without infrastructure.
 */
@Configuration
@EnableConfigurationProperties(VectorSearchProperties.class)
public class VectorSearchConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorSearchConfiguration.class);

    @Bean
    public EmbeddingProvider embeddingProvider(VectorSearchProperties properties) {
        VectorSearchProperties.Embedding embedding = properties.getEmbedding();
        return switch (embedding.getProvider()) {
            case DETERMINISTIC -> new DeterministicEmbeddingProvider(embedding.getDimensions());
            case OPENAI -> new OpenAiEmbeddingProvider(RestClient.builder(), embedding);
        };
    }

    @Bean(destroyMethod = "close")
    public SimilaritySearch similaritySearch(VectorSearchProperties properties, ObjectProvider<JdbcClient> jdbcClient,
            ObjectProvider<PlatformTransactionManager> transactionManager) {
        LOGGER.info("Using {} similarity search backend", properties.getBackend());
        switch (properties.getBackend()) {
            case RELATIONAL:
                VectorSearchProperties.Relational relational = properties.getRelational();
                return new RelationalSimilaritySearch(jdbcClient.getObject(),
                        new TransactionTemplate(transactionManager.getObject()), relational.getTable(),
                        relational.getVectorType(), properties.getMetric());
            case WIDE_COLUMN:
                VectorSearchProperties.WideColumn wideColumn = properties.getWideColumn();
                return new WideColumnSimilaritySearch(new CqlSessionFactory(wideColumn).open(),
                        wideColumn.getKeyspace(), wideColumn.getTable(), wideColumn.isAnnEnabled(),
                        wideColumn.getRankingPolicy(), properties.getMetric());
            case IN_MEMORY:
            default:
                return new InMemorySimilaritySearch(properties.getMetric());
        }
    }

    @Bean
    @ConditionalOnProperty(name = "vector-search.sample.enabled", havingValue = "true")
    public SampleWorkflowRunner sampleWorkflowRunner(VectorIndexService indexService,
            VectorSearchProperties properties) {
        return new SampleWorkflowRunner(indexService, properties.getSample());
    }
}
