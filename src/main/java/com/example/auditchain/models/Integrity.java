package com.example.auditchain.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@JsonInclude(Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Integrity {

    @JsonProperty("log_hash") private String logHash;
    @JsonProperty("previous_hash") private String previousHash;
    @JsonProperty("signature") private String signature;
    @JsonProperty("signature_algorithm") private String signatureAlgorithm;
}
