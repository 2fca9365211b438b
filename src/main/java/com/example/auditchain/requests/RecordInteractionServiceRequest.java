package com.example.auditchain.requests;

import java.util.Objects;

/**
 * Service-layer command built from {@link RecordInteractionHttpRequest} plus the trace id resolved
 * by the HTTP filter. Carries the raw prompt, response and attachment; none of them outlive the
 * call except as hashes and an encrypted evidence artifact.
 */
public record RecordInteractionServiceRequest(
        String traceId,
        String method,
        String model,
        String language,
        String prompt,
        String response,
        Object status,
        Long tokens,
        byte[] attachment
) {
    public RecordInteractionServiceRequest {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(method, "method");
        if (method.isBlank()) {
            throw new IllegalArgumentException("method must be non-blank");
        }
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(response, "response");

        language = (language == null || language.isBlank()) ? "en" : language;
        status = status == null ? "success" : status;
    }
}
