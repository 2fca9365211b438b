package com.example.auditchain.health;

import com.example.auditchain.service.HashChainAuditLogger;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final HashChainAuditLogger auditLogger;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            HashChainAuditLogger auditLogger) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.auditLogger = auditLogger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now().toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "audit-chain",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "chain", Map.of(
                        "id", auditLogger.chainId(),
                        "length", auditLogger.length(),
                        "head", auditLogger.headHash())
        ));
    }
}
