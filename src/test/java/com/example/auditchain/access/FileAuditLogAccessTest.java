package com.example.auditchain.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.auditchain.TestKeys;
import com.example.auditchain.config.AuditChainProperties;
import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.models.AuditLogItem;
import com.example.auditchain.models.AuditPayload;
import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.service.AuditChainException;
import com.example.auditchain.service.HashChainAuditLogger;
import com.example.auditchain.util.Digests;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileAuditLogAccessTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-20T03:47:14Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private AuditChainProperties properties;
    private FileAuditLogAccess access;

    @BeforeEach
    void setUp() {
        properties = new AuditChainProperties();
        properties.setId("primary");
        properties.setLogDirectory(tempDir.resolve("audit").toString());
        access = new FileAuditLogAccess(properties);
    }

    @Test
    @DisplayName("entries read back from disk still verify, including evidence references")
    void persistedEntriesVerify() {
        HashChainAuditLogger logger = new HashChainAuditLogger(access, TestKeys.material(), properties, CLOCK);
        logger.append(payload("req-1", null));
        logger.append(payload("req-2", EvidenceRecord.builder()
                .contentHash(Digests.sha256Hex("pdf"))
                .storagePath("/evidence/ab/ab.enc")
                .encryptionAlgorithm(EvidenceRecord.AES_256_GCM)
                .createdAt(CLOCK.instant())
                .expiresAt(CLOCK.instant().plusSeconds(604800))
                .build()));

        List<AuditEntry> reloaded = new FileAuditLogAccess(tempDir.resolve("audit")).findAllByChainId("primary")
                .stream().map(AuditLogItem::getEntry).toList();

        assertEquals(2, reloaded.size());
        assertTrue(logger.verifyFull(reloaded.get(0)));
        assertTrue(logger.verifyFull(reloaded.get(1)));
        assertTrue(logger.verifyChain(reloaded).valid());
    }

    @Test
    @DisplayName("findLatest returns the last appended link, empty for unknown chains")
    void findLatest() {
        HashChainAuditLogger logger = new HashChainAuditLogger(access, TestKeys.material(), properties, CLOCK);
        logger.append(payload("req-1", null));
        AuditEntry last = logger.append(payload("req-2", null));

        AuditLogItem head = access.findLatest("primary").orElseThrow();
        assertEquals(1L, head.getSequence());
        assertEquals(last.getIntegrity().getLogHash(), head.getLogHash());
        assertEquals("req-2", head.getTraceId());
        assertTrue(access.findLatest("other").isEmpty());
        assertTrue(access.findAllByChainId("other").isEmpty());
    }

    @Test
    @DisplayName("chains are kept in separate files")
    void chainsAreIsolated() {
        AuditChainProperties second = new AuditChainProperties();
        second.setId("secondary");
        new HashChainAuditLogger(access, TestKeys.material(), properties, CLOCK).append(payload("a", null));
        new HashChainAuditLogger(access, TestKeys.material(), second, CLOCK).append(payload("b", null));

        assertTrue(Files.exists(tempDir.resolve("audit").resolve("primary.jsonl")));
        assertTrue(Files.exists(tempDir.resolve("audit").resolve("secondary.jsonl")));
        assertEquals(1, access.findAllByChainId("primary").size());
        assertEquals("b", access.findAllByChainId("secondary").get(0).getTraceId());
    }

    @Test
    @DisplayName("chain ids that would escape the log directory are rejected")
    void rejectsPathTraversal() {
        assertThrows(IllegalArgumentException.class, () -> access.findAllByChainId("../etc"));
        assertThrows(IllegalArgumentException.class, () -> access.findAllByChainId("a/b"));
        assertThrows(IllegalArgumentException.class, () -> access.findAllByChainId(" "));
    }

    @Test
    @DisplayName("a corrupt line is reported with its line number")
    void corruptLine() throws Exception {
        new HashChainAuditLogger(access, TestKeys.material(), properties, CLOCK).append(payload("req-1", null));
        Files.writeString(tempDir.resolve("audit").resolve("primary.jsonl"), "{not json\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> access.findAllByChainId("primary"));
        assertTrue(ex.getMessage().contains("line 2"));
    }

    @Test
    @DisplayName("a write that fails midway leaves no fragment, so later links stay readable")
    void failedWriteIsRolledBack() throws Exception {
        Path directory = tempDir.resolve("audit");
        FailingOnceAccess failing = new FailingOnceAccess(directory);
        HashChainAuditLogger logger = new HashChainAuditLogger(failing, TestKeys.material(), properties, CLOCK);
        AuditEntry first = logger.append(payload("req-1", null));
        long sizeAfterFirst = Files.size(directory.resolve("primary.jsonl"));

        failing.failNextWrite = true;
        AuditChainException ex = assertThrows(AuditChainException.class, () -> logger.append(payload("req-2", null)));
        assertEquals(AuditChainException.Code.AUDIT_PERSISTENCE_FAILED, ex.getCode());
        assertEquals(sizeAfterFirst, Files.size(directory.resolve("primary.jsonl")));

        AuditEntry retried = logger.append(payload("req-2", null));
        assertEquals(first.getIntegrity().getLogHash(), retried.getIntegrity().getPreviousHash());

        List<AuditLogItem> items = new FileAuditLogAccess(directory).findAllByChainId("primary");
        assertEquals(2, items.size());
        assertTrue(logger.verifyChain(items.stream().map(AuditLogItem::getEntry).toList()).valid());
    }

    @Test
    @DisplayName("decimal PII metadata still verifies after a reload from disk")
    void decimalMetadataSurvivesReload() {
        HashChainAuditLogger logger = new HashChainAuditLogger(access, TestKeys.material(), properties, CLOCK);
        logger.append(AuditPayload.builder()
                .id("req-decimal")
                .request(Map.of("method", "generate", "body_hash", Digests.sha256Hex("p"),
                        "pii_detection", Map.of("method", "ml", "score", new BigDecimal("0.50"))))
                .response(Map.of("status", "success", "content_hash", Digests.sha256Hex("r")))
                .build());

        AuditEntry reloaded = new FileAuditLogAccess(tempDir.resolve("audit")).findAllByChainId("primary")
                .get(0).getEntry();
        assertTrue(logger.verifyFull(reloaded));
    }

    private static final class FailingOnceAccess extends FileAuditLogAccess {
        boolean failNextWrite;

        FailingOnceAccess(Path directory) {
            super(directory);
        }

        @Override
        void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
            if (failNextWrite) {
                failNextWrite = false;
                buffer.limit(buffer.limit() / 2);
                super.writeFully(channel, buffer);
                throw new IOException("No space left on device");
            }
            super.writeFully(channel, buffer);
        }
    }

    private static AuditPayload payload(String id, EvidenceRecord evidence) {
        return AuditPayload.builder()
                .id(id)
                .request(Map.of("method", "generate", "body_hash", Digests.sha256Hex(id)))
                .response(Map.of("status", "success", "content_hash", Digests.sha256Hex("r" + id),
                        "content_length", 12L))
                .evidence(evidence)
                .build();
    }
}
