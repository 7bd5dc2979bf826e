package com.seqweb.results.domain;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

public record RetrievalRequest(List<String> sequenceIds, List<String> databases) {

    public RetrievalRequest {
        sequenceIds = List.copyOf(new LinkedHashSet<>(sequenceIds));
        databases = List.copyOf(databases);
    }

    /**
     * Builds a request from whitespace separated parameter values, as found in a fetch-all link.
     */
    public static RetrievalRequest parse(String idParam, String dbParam) {
        return new RetrievalRequest(tokens(idParam), tokens(dbParam));
    }

    private static List<String> tokens(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.asList(value.trim().split("\\s+"));
    }
}
