package ch.so.arp.vectorsearch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the similarity search backends and the embedding provider.
 * Values come from {@code application.yml}; environment variables override
 * them.
 */
@ConfigurationProperties(prefix = "vector-search")
public class VectorSearchProperties {

    /**
     * Backend storing the vectors.
     */
    private Backend backend = Backend.IN_MEMORY;

    /**
     * Metric used to score and rank stored vectors against a query.
     */
    private SimilarityMetrics metric = SimilarityMetrics.COSINE;

    private final Embedding embedding = new Embedding();

    private final WideColumn wideColumn = new WideColumn();

    private final Relational relational = new Relational();

    private final Sample sample = new Sample();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public SimilarityMetrics getMetric() {
        return metric;
    }

    public void setMetric(SimilarityMetrics metric) {
        this.metric = metric;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public WideColumn getWideColumn() {
        return wideColumn;
    }

    public Relational getRelational() {
        return relational;
    }

    public Sample getSample() {
        return sample;
    }

    public enum Backend {
        IN_MEMORY, RELATIONAL, WIDE_COLUMN
    }

    public enum EmbeddingService {
        DETERMINISTIC, OPENAI
    }

    public static class Embedding {

        private EmbeddingService provider = EmbeddingService.DETERMINISTIC;

        /**
         * API key that authorises requests against the OpenAI service.
         */
        private String apiKey;

        /**
         * Base URL for the API. Defaults to the public OpenAI endpoint.
         */
        private String baseUrl = "https://api.openai.com/v1";

        private String model = "text-embedding-ada-002";

        /**
         * Dimension of the deterministic embeddings.
         */
        private int dimensions = 1536;

        public EmbeddingService getProvider() {
            return provider;
        }

        public void setProvider(EmbeddingService provider) {
            this.provider = provider;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class WideColumn {

        private String keyspace = "vector_embedding";

        private String table = "embeddings";

        private String username;

        private String password;

        /**
         * Path of the secure connect bundle. Used instead of host and port when
         * the file exists.
         */
        private String secureConnectBundle;

        private String host = "localhost";

        private int port = 9042;

        private String localDatacenter = "datacenter1";

        /**
         * Whether the store supports {@code ORDER BY ... ANN OF}. Without it
         * every query scans the whole table.
         */
        private boolean annEnabled = true;

        private AnnRankingPolicy rankingPolicy = AnnRankingPolicy.RERANK;

        public String getKeyspace() {
            return keyspace;
        }

        public void setKeyspace(String keyspace) {
            this.keyspace = keyspace;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getSecureConnectBundle() {
            return secureConnectBundle;
        }

        public void setSecureConnectBundle(String secureConnectBundle) {
            this.secureConnectBundle = secureConnectBundle;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getLocalDatacenter() {
            return localDatacenter;
        }

        public void setLocalDatacenter(String localDatacenter) {
            this.localDatacenter = localDatacenter;
        }

        public boolean isAnnEnabled() {
            return annEnabled;
        }

        public void setAnnEnabled(boolean annEnabled) {
            this.annEnabled = annEnabled;
        }

        public AnnRankingPolicy getRankingPolicy() {
            return rankingPolicy;
        }

        public void setRankingPolicy(AnnRankingPolicy rankingPolicy) {
            this.rankingPolicy = rankingPolicy;
        }
    }

    public static class Relational {

        private String table = "embeddings";

        /**
         * SQL type the vector literal is cast to on insert.
         */
        private String vectorType = "vector";

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getVectorType() {
            return vectorType;
        }

        public void setVectorType(String vectorType) {
            this.vectorType = vectorType;
        }
    }

    public static class Sample {

        private boolean enabled;

        private String text = "This is a sample text for embedding.";

        private String id = "sample_id";

        private int topK = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }
}
