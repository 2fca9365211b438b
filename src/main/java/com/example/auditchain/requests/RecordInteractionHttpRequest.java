package com.example.auditchain.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * HTTP-layer payload for POST /interactions. The attachment, when present, is base64 encoded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordInteractionHttpRequest(
        @JsonProperty("method") @NotBlank String method,
        @JsonProperty("model") String model,
        @JsonProperty("language") String language,
        @JsonProperty("prompt") @NotNull String prompt,
        @JsonProperty("response") @NotNull String response,
        @JsonProperty("status") Object status,
        @JsonProperty("tokens") Long tokens,
        @JsonProperty("attachment_base64") String attachmentBase64
) {}
