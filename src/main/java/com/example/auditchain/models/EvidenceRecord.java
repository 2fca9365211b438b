package com.example.auditchain.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;

/**
 * Reference to one encrypted attachment. Write-once: the store never changes an artifact after
 * handing out its record, and callers never see plaintext through it.
 */
@JsonInclude(Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class EvidenceRecord {

    public static final String AES_256_GCM = "AES-256-GCM";

    @NonNull @JsonProperty("content_hash") private String contentHash;
    @NonNull @JsonProperty("storage_path") private String storagePath;
    @NonNull @JsonProperty("encryption_algorithm") private String encryptionAlgorithm;
    @NonNull @JsonProperty("created_at") private Instant createdAt;
    @NonNull @JsonProperty("expires_at") private Instant expiresAt;
}
