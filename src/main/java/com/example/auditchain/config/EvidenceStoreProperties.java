package com.example.auditchain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the encrypted evidence store (evidence.store.*).
 */
@Component
@ConfigurationProperties(prefix = "evidence.store")
@Data
public class EvidenceStoreProperties {

    private String root = "./logs/evidence";
    private int ttlDays = 7;
}
