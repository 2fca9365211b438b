package com.example.auditchain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the evidence TTL sweeper job.
 * These values are bound from application.yml (evidence.sweeper.*).
 * To enable the sweeper, set evidence.sweeper.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "evidence.sweeper")
@Data
public class EvidenceSweeperProperties {

    private boolean enabled = false;
    private String schedule = "0 0 * * * *";  // Hourly by default
}
