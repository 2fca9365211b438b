package com.example.auditchain.service;

import com.example.auditchain.access.AuditLogAccess;
import com.example.auditchain.config.AuditChainProperties;
import com.example.auditchain.keys.KeyMaterial;
import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.models.AuditLogItem;
import com.example.auditchain.models.AuditPayload;
import com.example.auditchain.models.Integrity;
import com.example.auditchain.util.CanonicalJson;
import com.example.auditchain.util.Digests;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Appends signed, hash-linked entries to one audit chain and verifies them.
 *
 * <p>Each entry's {@code log_hash} covers its canonical content; its {@code previous_hash} is the
 * prior entry's {@code log_hash} (64 zeros for the first link), and the signature covers
 * {@code log_hash + ":" + previous_hash} with RSASSA-PSS over SHA-256. The chain cursor is the only
 * shared mutable state, so {@link #append} runs under a fair lock and the chain order equals the
 * order in which appends complete.
 */
@Service
@Slf4j
public class HashChainAuditLogger {

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String SIGNATURE_ALGORITHM = "RSASSA-PSS-SHA256";

    private static final int SHA256_BYTES = 32;

    private final AuditLogAccess auditLogAccess;
    private final Clock clock;
    private final String chainId;
    private final PrivateKey signingKey;
    private final PublicKey verificationKey;
    private final PSSParameterSpec pssSpec;

    private final ReentrantLock appendLock = new ReentrantLock(true);
    private String previousHash;
    private long nextSequence;

    public HashChainAuditLogger(AuditLogAccess auditLogAccess,
                                KeyMaterial keyMaterial,
                                AuditChainProperties properties,
                                Clock clock) {
        this.auditLogAccess = auditLogAccess;
        this.clock = clock;
        this.signingKey = keyMaterial.signingKey();
        this.verificationKey = keyMaterial.verificationKey();
        this.pssSpec = pssSpec(((RSAKey) verificationKey).getModulus().bitLength());

        Optional<AuditLogItem> head = auditLogAccess.findLatest(properties.getId());
        if (head.isPresent() && properties.isResumeFromStore()) {
            this.chainId = properties.getId();
            this.previousHash = head.get().getLogHash();
            this.nextSequence = head.get().getSequence() + 1;
            log.info("Resuming audit chain {} at sequence {} (head {})", chainId, nextSequence, previousHash);
        } else {
            // A chain id that already holds links is never restarted at genesis.
            this.chainId = head.isPresent() ? freshChainId(properties.getId()) : properties.getId();
            this.previousHash = GENESIS_HASH;
            this.nextSequence = 0;
            log.info("Starting audit chain {} at genesis", chainId);
        }
    }

    /**
     * Finalizes, persists and returns the next chain entry. The cursor only advances once the
     * entry is signed and stored; any failure leaves the chain exactly as it was.
     */
    public AuditEntry append(AuditPayload payload) {
        appendLock.lock();
        try {
            AuditEntry content = AuditEntry.builder()
                    .id(payload.getId())
                    .timestamp(DateTimeFormatter.ISO_INSTANT.format(clock.instant()))
                    .request(payload.getRequest())
                    .response(payload.getResponse())
                    .evidence(payload.getEvidence())
                    .build();
            // Hash the persisted shape, not the caller's Java types.
            content = CanonicalJson.normalize(content, AuditEntry.class);

            String logHash = AuditEntry.computeLogHash(content);
            String signature = sign(logHash + ":" + previousHash);

            AuditEntry entry = content.toBuilder()
                    .integrity(Integrity.builder()
                            .logHash(logHash)
                            .previousHash(previousHash)
                            .signature(signature)
                            .signatureAlgorithm(SIGNATURE_ALGORITHM)
                            .build())
                    .build();

            try {
                auditLogAccess.put(AuditLogItem.of(chainId, nextSequence, clock.millis(), entry));
            } catch (RuntimeException ex) {
                log.error("Failed to persist audit entry {} at sequence {}: {}",
                        payload.getId(), nextSequence, ex.getMessage());
                throw AuditChainException.persistenceFailed(chainId, ex);
            }

            log.debug("Appended audit entry {} at sequence {} (log_hash {})", entry.getId(), nextSequence, logHash);
            previousHash = logHash;
            nextSequence++;
            return entry;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Checks the signature over the stored {@code log_hash}/{@code previous_hash} pair only. An
     * entry whose content and {@code log_hash} were rewritten together still passes; use
     * {@link #verifyFull} to bind the signature to the content.
     */
    public boolean verify(AuditEntry entry) {
        try {
            Integrity integrity = entry.getIntegrity();
            if (integrity == null || integrity.getLogHash() == null
                    || integrity.getPreviousHash() == null || integrity.getSignature() == null) {
                return false;
            }
            Signature verifier = newSignature();
            verifier.initVerify(verificationKey);
            verifier.update((integrity.getLogHash() + ":" + integrity.getPreviousHash())
                    .getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Digests.fromHex(integrity.getSignature()));
        } catch (GeneralSecurityException | RuntimeException e) {
            log.debug("Audit entry signature rejected: {}", e.toString());
            return false;
        }
    }

    /**
     * {@link #verify} plus a recomputation of {@code log_hash} from the entry's own content.
     */
    public boolean verifyFull(AuditEntry entry) {
        if (!verify(entry)) {
            return false;
        }
        try {
            return AuditEntry.computeLogHash(entry).equals(entry.getIntegrity().getLogHash());
        } catch (RuntimeException e) {
            log.debug("Audit entry content could not be canonicalized: {}", e.toString());
            return false;
        }
    }

    /**
     * Verifies every entry and every link of a chain given in append order.
     */
    public ChainVerificationResult verifyChain(List<AuditEntry> entries) {
        String expectedPrevious = GENESIS_HASH;
        for (int i = 0; i < entries.size(); i++) {
            AuditEntry entry = entries.get(i);
            if (!verifyFull(entry)) {
                return ChainVerificationResult.broken(i + 1, i, "signature or content hash mismatch");
            }
            if (!expectedPrevious.equals(entry.getIntegrity().getPreviousHash())) {
                return ChainVerificationResult.broken(i + 1, i, "previous_hash does not match preceding log_hash");
            }
            expectedPrevious = entry.getIntegrity().getLogHash();
        }
        return ChainVerificationResult.intact(entries.size());
    }

    public List<AuditEntry> history() {
        return auditLogAccess.findAllByChainId(chainId).stream()
                .map(AuditLogItem::getEntry)
                .toList();
    }

    public String chainId() {
        return chainId;
    }

    public String headHash() {
        appendLock.lock();
        try {
            return previousHash;
        } finally {
            appendLock.unlock();
        }
    }

    public long length() {
        appendLock.lock();
        try {
            return nextSequence;
        } finally {
            appendLock.unlock();
        }
    }

    private String freshChainId(String baseId) {
        String candidate = baseId + "." + clock.millis();
        for (int i = 1; auditLogAccess.findLatest(candidate).isPresent(); i++) {
            candidate = baseId + "." + clock.millis() + "-" + i;
        }
        return candidate;
    }

    private String sign(String data) {
        try {
            Signature signer = newSignature();
            signer.initSign(signingKey);
            signer.update(data.getBytes(StandardCharsets.UTF_8));
            return Digests.toHex(signer.sign());
        } catch (GeneralSecurityException e) {
            throw AuditChainException.signingFailed(e);
        }
    }

    private Signature newSignature() throws GeneralSecurityException {
        Signature signature = Signature.getInstance("RSASSA-PSS");
        signature.setParameter(pssSpec);
        return signature;
    }

    /**
     * PSS with the largest salt the modulus allows: emLen - hLen - 2.
     */
    static PSSParameterSpec pssSpec(int modulusBits) {
        int emLen = (modulusBits - 1 + 7) / 8;
        int saltLength = emLen - SHA256_BYTES - 2;
        return new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, saltLength,
                PSSParameterSpec.TRAILER_FIELD_BC);
    }
}
