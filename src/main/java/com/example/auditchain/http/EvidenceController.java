package com.example.auditchain.http;

import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.service.InteractionAuditService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts raw attachments for encrypted storage. Only the reference record is ever returned;
 * there is deliberately no plaintext download endpoint.
 */
@RestController
public class EvidenceController {

    private final InteractionAuditService interactionAuditService;

    public EvidenceController(InteractionAuditService interactionAuditService) {
        this.interactionAuditService = interactionAuditService;
    }

    @PostMapping(value = "/evidence", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<EvidenceRecord> storeEvidence(@RequestBody byte[] content) {
        return ResponseEntity.ok(interactionAuditService.storeEvidence(content));
    }
}
