package com.example.auditchain.models;

/**
 * What the audit trail keeps about a response: status, content hash and size/usage figures.
 */
public record ResponseMetadata(Object status, String contentHash, Long contentLength, Long tokens) { }
