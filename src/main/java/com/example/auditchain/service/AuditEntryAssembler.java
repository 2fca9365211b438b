package com.example.auditchain.service;

import com.example.auditchain.models.AuditPayload;
import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.models.RequestMetadata;
import com.example.auditchain.models.ResponseMetadata;
import com.example.auditchain.util.Digests;
import com.example.auditchain.util.TraceIds;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Merges request/response metadata, PII-detection metadata and an optional evidence reference
 * into the payload shape the chain logger signs. Stateless and free of I/O.
 */
@Component
public class AuditEntryAssembler {

    public AuditPayload assemble(String traceId,
                                 RequestMetadata request,
                                 ResponseMetadata response,
                                 Map<String, Object> piiDetection,
                                 EvidenceRecord evidence) {
        List<String> violations = new ArrayList<>();

        if (traceId == null || traceId.isBlank()) {
            violations.add("trace id is required");
        } else if (!TraceIds.isValid(traceId)) {
            violations.add("trace id must be <uuid>:<ISO-8601 UTC timestamp>");
        }

        if (request == null) {
            violations.add("request metadata is required");
        } else {
            if (isBlank(request.method())) {
                violations.add("request.method is required");
            }
            if (!Digests.isSha256Hex(request.bodyHash())) {
                violations.add("request.body_hash must be a hex SHA-256 digest");
            }
        }

        if (response == null) {
            violations.add("response metadata is required");
        } else {
            if (response.status() == null || response.status() instanceof String s && s.isBlank()) {
                violations.add("response.status is required");
            }
            if (!Digests.isSha256Hex(response.contentHash())) {
                violations.add("response.content_hash must be a hex SHA-256 digest");
            }
        }

        if (!violations.isEmpty()) {
            throw AuditChainException.invalidPayload(violations);
        }

        Map<String, Object> requestBlock = new LinkedHashMap<>();
        requestBlock.put("method", request.method());
        putIfPresent(requestBlock, "model", request.model());
        requestBlock.put("body_hash", request.bodyHash().toLowerCase());
        putIfPresent(requestBlock, "pii_detection", piiDetection);

        Map<String, Object> responseBlock = new LinkedHashMap<>();
        responseBlock.put("status", response.status());
        responseBlock.put("content_hash", response.contentHash().toLowerCase());
        putIfPresent(responseBlock, "content_length", response.contentLength());
        putIfPresent(responseBlock, "tokens", response.tokens());

        return AuditPayload.builder()
                .id(traceId)
                .request(requestBlock)
                .response(responseBlock)
                .evidence(evidence)
                .build();
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
