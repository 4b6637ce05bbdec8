package com.callstt.processing.service;

public record TranscriptionFailure(
        FailureClassification classification,
        Integer statusCode,
        String message
) {

    public static TranscriptionFailure from(Exception exception) {
        String message = exception.getMessage() == null
                ? exception.getClass().getSimpleName()
                : exception.getMessage();

        if (exception instanceof TranscriptionException transcriptionException) {
            Integer statusCode = transcriptionException.getStatusCode();
            FailureClassification classification = statusCode != null && statusCode >= 400 && statusCode < 500
                    ? FailureClassification.CLIENT_ERROR
                    : FailureClassification.TRANSIENT_ERROR;
            return new TranscriptionFailure(classification, statusCode, message);
        }
        return new TranscriptionFailure(FailureClassification.UNEXPECTED, null, message);
    }

    public String describe() {
        return statusCode == null ? message : statusCode + ": " + message;
    }
}
