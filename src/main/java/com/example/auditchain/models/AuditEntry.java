package com.example.auditchain.models;

import com.example.auditchain.util.CanonicalJson;
import com.example.auditchain.util.Digests;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One link of the signed audit chain, in its wire/persisted JSON shape.
 */
@JsonInclude(Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditEntry {

    @JsonProperty("id") private String id;
    @JsonProperty("timestamp") private String timestamp;
    @JsonProperty("request") private Map<String, Object> request;
    @JsonProperty("response") private Map<String, Object> response;
    @JsonProperty("evidence") private EvidenceRecord evidence;
    @JsonProperty("integrity") private Integrity integrity;

    /**
     * SHA-256 over the canonical JSON of everything except the integrity block.
     */
    public static String computeLogHash(AuditEntry e) {
        AuditEntry content = e.toBuilder().integrity(null).build();
        return Digests.sha256Hex(CanonicalJson.stringify(content));
    }
}
