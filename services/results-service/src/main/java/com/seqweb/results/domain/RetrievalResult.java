package com.seqweb.results.domain;

import java.util.Objects;

public record RetrievalResult(String sequences, int foundCount) {

    public RetrievalResult {
        Objects.requireNonNull(sequences, "sequences");
    }

    public static RetrievalResult of(String sequences) {
        return new RetrievalResult(sequences, countHeaders(sequences));
    }

    public boolean matches(RetrievalRequest request) {
        return foundCount == request.sequenceIds().size();
    }

    static int countHeaders(String fasta) {
        return (int) fasta.lines()
            .filter(line -> line.startsWith(">"))
            .count();
    }
}
