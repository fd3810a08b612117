package ch.so.arp.vectorsearch;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link EmbeddingProvider} calling the OpenAI embeddings endpoint. The API key
 * is bound to this instance's client. Failures are logged and reported as an
 * empty embedding, which the search backends reject as invalid input.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;

    OpenAiEmbeddingProvider(RestClient.Builder restClientBuilder, VectorSearchProperties.Embedding properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'vector-search.embedding.api-key' must be provided for the OpenAI embedding provider");
        }
        this.model = properties.getModel();
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public float[] embed(String text) {
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EmbeddingRequest(model, text))
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientException ex) {
            LOGGER.warn("Embedding request with model {} failed: {}", model, ex.getMessage(), ex);
            return new float[0];
        }
        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            LOGGER.warn("Embedding response with model {} contained no embedding", model);
            return new float[0];
        }
        float[] embedding = response.data().get(0).embedding();
        LOGGER.debug("Received embedding with {} dimensions from model {}", embedding.length, model);
        return embedding;
    }

    record EmbeddingRequest(String model, String input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
