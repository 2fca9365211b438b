package com.example.auditchain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for persisted key material.
 * These values are bound from application.yml (audit.keys.*).
 * The directory is created on first start if it does not exist.
 */
@Component
@ConfigurationProperties(prefix = "audit.keys")
@Data
public class KeyMaterialProperties {

    private String directory = "./keys";
    private int rsaKeySize = 2048;
    private String symmetricKeyFile = "evidence_encryption_key.bin";
    private String privateKeyFile = "audit_private_key.pem";
    private String publicKeyFile = "audit_public_key.pem";
}
