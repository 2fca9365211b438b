package com.example.auditchain.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VerificationResponse(
        @JsonProperty("id") String id,
        @JsonProperty("signature_valid") boolean signatureValid,
        @JsonProperty("content_valid") boolean contentValid
) { }
