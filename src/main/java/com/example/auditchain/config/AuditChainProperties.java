package com.example.auditchain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the signed audit chain (audit.chain.*).
 * {@code store} selects where finalized entries are persisted: {@code file} (JSON Lines under
 * {@code logDirectory}) or {@code dynamo} (the {@code dynamoTable} table).
 */
@Component
@ConfigurationProperties(prefix = "audit.chain")
@Data
public class AuditChainProperties {

    private String id = "default";
    private String store = "file";
    private String logDirectory = "./logs/audit";
    private String dynamoTable = "audit_log";
    private boolean resumeFromStore = true;
}
