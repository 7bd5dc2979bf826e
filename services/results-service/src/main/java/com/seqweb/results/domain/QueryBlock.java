package com.seqweb.results.domain;

import java.util.Objects;

public record QueryBlock(int ordinal, String label) {

    public QueryBlock {
        if (ordinal < 1) {
            throw new IllegalArgumentException("query ordinal must be >= 1: " + ordinal);
        }
        Objects.requireNonNull(label, "label");
    }

    public QueryBlock next(String nextLabel) {
        return new QueryBlock(ordinal + 1, nextLabel);
    }
}
