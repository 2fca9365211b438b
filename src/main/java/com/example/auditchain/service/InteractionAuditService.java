package com.example.auditchain.service;

import com.example.auditchain.evidence.EncryptedEvidenceStore;
import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.models.AuditPayload;
import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.models.RequestMetadata;
import com.example.auditchain.models.ResponseMetadata;
import com.example.auditchain.requests.RecordInteractionServiceRequest;
import com.example.auditchain.util.Digests;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records one prompt/response interaction: hashes the texts, keeps only the PII detector's
 * metadata, encrypts the optional attachment into the evidence store, and appends the assembled
 * entry to the chain.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionAuditService {

    private final PiiDetector piiDetector;
    private final EncryptedEvidenceStore evidenceStore;
    private final AuditEntryAssembler assembler;
    private final HashChainAuditLogger auditLogger;

    public AuditEntry recordInteraction(RecordInteractionServiceRequest request) {
        PiiDetection detection = piiDetector.detect(request.prompt(), request.language());
        Map<String, Object> piiMetadata = detection == null ? null : detection.metadata();

        byte[] responseBytes = request.response().getBytes(StandardCharsets.UTF_8);
        RequestMetadata requestMetadata = new RequestMetadata(
                request.method(),
                request.model(),
                Digests.sha256Hex(request.prompt()));
        ResponseMetadata responseMetadata = new ResponseMetadata(
                request.status(),
                Digests.sha256Hex(responseBytes),
                (long) responseBytes.length,
                request.tokens());

        // Validate before touching the evidence store so a rejected request leaves no artifact.
        AuditPayload payload = assembler.assemble(request.traceId(), requestMetadata, responseMetadata,
                piiMetadata, null);

        if (request.attachment() != null) {
            EvidenceRecord evidence = evidenceStore.store(request.attachment());
            payload = payload.toBuilder().evidence(evidence).build();
        }

        AuditEntry entry = auditLogger.append(payload);
        log.info("Recorded interaction {} (method={}, evidence={})",
                entry.getId(), request.method(), entry.getEvidence() != null);
        return entry;
    }

    public EvidenceRecord storeEvidence(byte[] content) {
        return evidenceStore.store(content);
    }
}
