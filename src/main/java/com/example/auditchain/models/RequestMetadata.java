package com.example.auditchain.models;

/**
 * What the audit trail keeps about an inbound prompt: never the text, only its hash.
 */
public record RequestMetadata(String method, String model, String bodyHash) { }
