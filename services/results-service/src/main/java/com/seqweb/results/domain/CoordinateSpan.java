package com.seqweb.results.domain;

public record CoordinateSpan(int min, int max) {

    public CoordinateSpan {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
    }

    public CoordinateSpan include(int value) {
        return new CoordinateSpan(Math.min(min, value), Math.max(max, value));
    }

    public static CoordinateSpan of(int a, int b) {
        return new CoordinateSpan(Math.min(a, b), Math.max(a, b));
    }
}
