package com.example.auditchain.service;

import java.util.List;
import lombok.Getter;

public class AuditChainException extends RuntimeException {

    public enum Code {
        KEY_STORAGE_FAILED,
        KEY_FORMAT_INVALID,
        EVIDENCE_STORAGE_FAILED,
        EVIDENCE_NOT_FOUND,
        EVIDENCE_INTEGRITY_FAILED,
        SIGNING_FAILED,
        AUDIT_PERSISTENCE_FAILED,
        INVALID_PAYLOAD,
        UNKNOWN
    }

    @Getter
    private final Code code;

    @Getter
    private final List<String> violations;

    private AuditChainException(Code code, String message, Throwable cause, List<String> violations) {
        super(message, cause);
        this.code = code;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    private AuditChainException(Code code, String message, Throwable cause) {
        this(code, message, cause, null);
    }

    public static AuditChainException keyStorageFailed(String path, Throwable cause) {
        return new AuditChainException(Code.KEY_STORAGE_FAILED,
                "Key material at " + path + " could not be written", cause);
    }

    public static AuditChainException keyFormatInvalid(String path, String reason, Throwable cause) {
        return new AuditChainException(Code.KEY_FORMAT_INVALID,
                "Key material at " + path + " is unusable: " + reason, cause);
    }

    public static AuditChainException evidenceStorageFailed(String contentHash, Throwable cause) {
        String target = contentHash == null ? "attachment" : "artifact " + contentHash;
        return new AuditChainException(Code.EVIDENCE_STORAGE_FAILED,
                "Failed to store evidence " + target, cause);
    }

    public static AuditChainException evidenceNotFound(String storagePath) {
        return new AuditChainException(Code.EVIDENCE_NOT_FOUND,
                "Evidence artifact " + storagePath + " does not exist", null);
    }

    public static AuditChainException evidenceIntegrityFailed(String contentHash, Throwable cause) {
        return new AuditChainException(Code.EVIDENCE_INTEGRITY_FAILED,
                "Evidence artifact " + contentHash + " failed authentication", cause);
    }

    public static AuditChainException signingFailed(Throwable cause) {
        return new AuditChainException(Code.SIGNING_FAILED, "Failed to sign audit entry", cause);
    }

    public static AuditChainException persistenceFailed(String chainId, Throwable cause) {
        return new AuditChainException(Code.AUDIT_PERSISTENCE_FAILED,
                "Failed to persist audit entry for chain " + chainId, cause);
    }

    public static AuditChainException invalidPayload(List<String> violations) {
        return new AuditChainException(Code.INVALID_PAYLOAD,
                "Audit payload is invalid: " + String.join("; ", violations), null, violations);
    }
}
