package com.callstt.processing.service;

public enum FailureClassification {
    CLIENT_ERROR,
    TRANSIENT_ERROR,
    UNEXPECTED
}
