package com.example.auditchain.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auditchain.TestKeys;
import com.example.auditchain.config.AuditChainProperties;
import com.example.auditchain.evidence.EncryptedEvidenceStore;
import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.requests.RecordInteractionServiceRequest;
import com.example.auditchain.util.CanonicalJson;
import com.example.auditchain.util.Digests;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InteractionAuditServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-20T03:47:14Z"), ZoneOffset.UTC);
    private static final String TRACE_ID = "3f2a9c1e-8b7d-4e6f-a5c4-1d2e3f4a5b6c:2025-11-20T03:47:14Z";
    private static final String PROMPT = "My email is jane@example.com, summarise my order";
    private static final String RESPONSE = "Your order ships tomorrow.";

    @Mock
    private PiiDetector piiDetector;

    @Mock
    private EncryptedEvidenceStore evidenceStore;

    private HashChainAuditLogger auditLogger;
    private InteractionAuditService service;

    @BeforeEach
    void setUp() {
        AuditChainProperties properties = new AuditChainProperties();
        auditLogger = new HashChainAuditLogger(new InMemoryAuditLogAccess(), TestKeys.material(), properties, CLOCK);
        service = new InteractionAuditService(piiDetector, evidenceStore, new AuditEntryAssembler(), auditLogger);
    }

    @Test
    @DisplayName("records hashes and detector metadata, never the raw texts")
    void recordsInteractionWithoutRawText() {
        when(piiDetector.detect(PROMPT, "en")).thenReturn(new PiiDetection(
                "My email is [EMAIL], summarise my order",
                Map.of("method", "regex", "total_masked", 1)));

        AuditEntry entry = service.recordInteraction(new RecordInteractionServiceRequest(
                TRACE_ID, "generate", "llama-3", null, PROMPT, RESPONSE, null, 17L, null));

        assertEquals(TRACE_ID, entry.getId());
        assertEquals(Digests.sha256Hex(PROMPT), entry.getRequest().get("body_hash"));
        assertEquals(Map.of("method", "regex", "total_masked", 1), entry.getRequest().get("pii_detection"));
        assertEquals("success", entry.getResponse().get("status"));
        assertEquals(Digests.sha256Hex(RESPONSE), entry.getResponse().get("content_hash"));
        assertEquals(RESPONSE.getBytes(StandardCharsets.UTF_8).length,
                ((Number) entry.getResponse().get("content_length")).intValue());
        assertEquals(17, ((Number) entry.getResponse().get("tokens")).intValue());
        assertNull(entry.getEvidence());
        assertTrue(auditLogger.verifyFull(entry));

        String json = CanonicalJson.stringify(entry);
        assertFalse(json.contains("jane@example.com"));
        assertFalse(json.contains("[EMAIL]"));
        assertFalse(json.contains(RESPONSE));
        verify(evidenceStore, never()).store(any(byte[].class));
    }

    @Test
    @DisplayName("an attachment is stored first and referenced from the signed entry")
    void storesAttachment() {
        byte[] attachment = "invoice.pdf bytes".getBytes(StandardCharsets.UTF_8);
        EvidenceRecord record = EvidenceRecord.builder()
                .contentHash(Digests.sha256Hex(attachment))
                .storagePath("/var/evidence/ab/ab.enc")
                .encryptionAlgorithm(EvidenceRecord.AES_256_GCM)
                .createdAt(CLOCK.instant())
                .expiresAt(CLOCK.instant().plusSeconds(7 * 86400))
                .build();
        when(piiDetector.detect(PROMPT, "de")).thenReturn(new PiiDetection(PROMPT, Map.of("method", "none")));
        when(evidenceStore.store(attachment)).thenReturn(record);

        AuditEntry entry = service.recordInteraction(new RecordInteractionServiceRequest(
                TRACE_ID, "generate", null, "de", PROMPT, RESPONSE, "success", null, attachment));

        assertEquals(record.getContentHash(), entry.getEvidence().getContentHash());
        assertEquals(record.getStoragePath(), entry.getEvidence().getStoragePath());
        assertEquals(record.getExpiresAt(), entry.getEvidence().getExpiresAt());
        assertTrue(auditLogger.verifyFull(entry));
        assertEquals(1, auditLogger.length());
    }

    @Test
    @DisplayName("an invalid trace id is rejected before anything is stored or appended")
    void invalidRequestLeavesNoTrace() {
        when(piiDetector.detect(PROMPT, "en")).thenReturn(null);

        AuditChainException ex = assertThrows(AuditChainException.class, () -> service.recordInteraction(
                new RecordInteractionServiceRequest("bogus", "generate", null, null, PROMPT, RESPONSE, null, null,
                        new byte[] {1, 2, 3})));

        assertEquals(AuditChainException.Code.INVALID_PAYLOAD, ex.getCode());
        verify(evidenceStore, never()).store(any(byte[].class));
        assertEquals(0, auditLogger.length());
    }

    @Test
    @DisplayName("storeEvidence delegates to the encrypted store")
    void storeEvidenceDelegates() {
        byte[] content = {9, 8, 7};
        EvidenceRecord record = EvidenceRecord.builder()
                .contentHash(Digests.sha256Hex(content))
                .storagePath("/p")
                .encryptionAlgorithm(EvidenceRecord.AES_256_GCM)
                .createdAt(CLOCK.instant())
                .expiresAt(CLOCK.instant())
                .build();
        when(evidenceStore.store(content)).thenReturn(record);

        assertSame(record, service.storeEvidence(content));
    }
}
