package com.example.auditchain.service;

/**
 * Boundary to the free-text PII detector. Implementations live outside this service (regex or
 * ML-assisted classifiers); only the returned metadata reaches the audit trail, under
 * {@code request.pii_detection}.
 */
public interface PiiDetector {

    PiiDetection detect(String text, String language);
}
