package com.example.auditchain.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of checking a whole chain. {@code firstInvalidIndex} and {@code reason} are only set
 * when {@code valid} is false.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("entries_checked") int entriesChecked,
        @JsonProperty("first_invalid_index") Integer firstInvalidIndex,
        @JsonProperty("reason") String reason
) {

    static ChainVerificationResult intact(int entriesChecked) {
        return new ChainVerificationResult(true, entriesChecked, null, null);
    }

    static ChainVerificationResult broken(int entriesChecked, int index, String reason) {
        return new ChainVerificationResult(false, entriesChecked, index, reason);
    }
}
