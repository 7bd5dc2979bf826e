package com.seqweb.results.service;

public class AlignmentRunFailedException extends RuntimeException {

    private final int status;

    public AlignmentRunFailedException(int status, String message) {
        super(message == null || message.isBlank() ? "alignment run failed" : message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
