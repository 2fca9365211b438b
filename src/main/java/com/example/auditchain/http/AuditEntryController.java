package com.example.auditchain.http;

import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.service.ChainVerificationResult;
import com.example.auditchain.service.HashChainAuditLogger;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read and verification access to the audit chain, for compliance review and tamper checks.
 */
@RestController
public class AuditEntryController {

    private final HashChainAuditLogger auditLogger;

    public AuditEntryController(HashChainAuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @GetMapping("/audit-entries")
    public ResponseEntity<List<AuditEntry>> getAuditEntries() {
        return ResponseEntity.ok(auditLogger.history());
    }

    @PostMapping("/audit-entries/verify")
    public ResponseEntity<VerificationResponse> verifyEntry(@RequestBody AuditEntry entry) {
        boolean signatureValid = auditLogger.verify(entry);
        boolean contentValid = signatureValid && auditLogger.verifyFull(entry);
        return ResponseEntity.ok(new VerificationResponse(entry.getId(), signatureValid, contentValid));
    }

    @GetMapping("/audit-entries/verification")
    public ResponseEntity<ChainVerificationResult> verifyChain() {
        return ResponseEntity.ok(auditLogger.verifyChain(auditLogger.history()));
    }
}
