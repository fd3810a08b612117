package ch.so.arp.vectorsearch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint for indexing texts or vectors and querying similar records.
 */
@RestController
@RequestMapping(path = "/api/vectors", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class VectorController {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorController.class);

    private final VectorIndexService indexService;

    public VectorController(VectorIndexService indexService) {
        this.indexService = indexService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> index(@Valid @RequestBody IndexRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>(request.metadata() == null ? Map.of() : request.metadata());
        metadata.put(Vectors.ID_FIELD, request.id());
        int dimensions;
        if (request.vector() != null) {
            List<Double> vector = Vectors.coerce(request.vector());
            indexService.indexVector(vector, metadata);
            dimensions = vector.size();
        } else if (request.text() != null) {
            dimensions = indexService.indexText(request.id(), request.text(), metadata).size();
        } else {
            throw new ValidationException("Either 'text' or 'vector' must be provided");
        }
        return Map.of(Vectors.ID_FIELD, request.id(), "dimensions", dimensions);
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<ScoredResult> search(@RequestBody SearchRequest request) {
        if (request.vector() != null) {
            return indexService.search(Vectors.coerce(request.vector()), request.topKOrDefault());
        }
        if (request.text() != null) {
            return indexService.searchText(request.text(), request.topKOrDefault());
        }
        throw new ValidationException("Either 'text' or 'vector' must be provided");
    }

    @ExceptionHandler(ValidationException.class)
    ProblemDetail handleValidation(ValidationException ex) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    ProblemDetail handleStorage(StorageException ex) {
        LOGGER.error("Storage failure: {}", ex.getMessage(), ex);
        return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }
}
