package com.example.auditchain.models;

import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Merged request/response/evidence content handed to the chain logger. The logger adds the
 * timestamp and the integrity block.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
public class AuditPayload {

    @NonNull private String id;
    @NonNull private Map<String, Object> request;
    @NonNull private Map<String, Object> response;

    private EvidenceRecord evidence;
}
