package com.callstt.processing.service;

public class TranscriptionException extends RuntimeException {

    private final Integer statusCode;

    public TranscriptionException(Integer statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public TranscriptionException(Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
