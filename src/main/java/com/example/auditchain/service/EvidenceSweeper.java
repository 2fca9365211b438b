package com.example.auditchain.service;

import com.example.auditchain.config.EvidenceSweeperProperties;
import com.example.auditchain.evidence.EncryptedEvidenceStore;
import com.example.auditchain.evidence.SweepResult;
import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that enforces the evidence TTL.
 * Walks the evidence store and deletes encrypted artifacts whose age in whole days has reached
 * {@code evidence.store.ttl-days}. Deletion failures are counted and logged; the next run retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "evidence.sweeper.enabled", havingValue = "true")
public class EvidenceSweeper {

    private final Clock clock;
    private final EvidenceSweeperProperties properties;
    private final EncryptedEvidenceStore evidenceStore;

    @Scheduled(cron = "${evidence.sweeper.schedule:0 0 * * * *}")
    public void sweepExpiredEvidence() {
        long startTime = clock.millis();
        String jobRequestId = "evidence-sweep-" + UUID.randomUUID();

        log.info("[{}] Starting evidence sweep at {} (schedule: {})",
                jobRequestId, clock.instant(), properties.getSchedule());

        SweepResult result;
        try {
            result = evidenceStore.sweepExpired(clock.instant());
        } catch (RuntimeException ex) {
            log.error("[{}] Evidence sweep failed: {}", jobRequestId, ex.getMessage(), ex);
            return;
        }

        long duration = clock.millis() - startTime;
        if (result.failed() > 0) {
            log.warn("[{}] Completed evidence sweep in {}ms with failures: scanned={}, deleted={}, failed={}",
                    jobRequestId, duration, result.scanned(), result.deleted(), result.failed());
        } else {
            log.info("[{}] Completed evidence sweep in {}ms: scanned={}, deleted={}",
                    jobRequestId, duration, result.scanned(), result.deleted());
        }
    }
}
