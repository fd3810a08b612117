package ch.so.arp.vectorsearch;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

/**
 * Payload for indexing either a text, which is embedded first, or a
 * precomputed vector. The vector is kept untyped so that malformed input is
 * reported as a validation error of the search contract.
 */
public record IndexRequest(@NotBlank String id, String text, Object vector, Map<String, Object> metadata) {
}
