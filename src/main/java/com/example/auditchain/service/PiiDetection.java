package com.example.auditchain.service;

import java.util.Map;

/**
 * Result of one detector call. {@code maskedText} is for the caller's own use and is never
 * written to the audit trail.
 */
public record PiiDetection(String maskedText, Map<String, Object> metadata) { }
