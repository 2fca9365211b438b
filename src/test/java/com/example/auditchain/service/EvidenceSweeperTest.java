package com.example.auditchain.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auditchain.config.EvidenceSweeperProperties;
import com.example.auditchain.evidence.EncryptedEvidenceStore;
import com.example.auditchain.evidence.SweepResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EvidenceSweeperTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-27T04:00:00Z"), ZoneOffset.UTC);

    @Mock
    private EncryptedEvidenceStore evidenceStore;

    private EvidenceSweeper sweeper;

    @BeforeEach
    void setUp() {
        EvidenceSweeperProperties properties = new EvidenceSweeperProperties();
        properties.setEnabled(true);
        properties.setSchedule("0 0 * * * *");
        sweeper = new EvidenceSweeper(CLOCK, properties, evidenceStore);
    }

    @Test
    @DisplayName("sweeps with the current clock instant")
    void sweepsAtNow() {
        when(evidenceStore.sweepExpired(CLOCK.instant())).thenReturn(new SweepResult(3, 1, 0));

        sweeper.sweepExpiredEvidence();

        verify(evidenceStore).sweepExpired(CLOCK.instant());
    }

    @Test
    @DisplayName("partial failures do not escape the scheduled job")
    void toleratesFailures() {
        when(evidenceStore.sweepExpired(CLOCK.instant())).thenReturn(new SweepResult(5, 2, 3));

        sweeper.sweepExpiredEvidence();

        verify(evidenceStore).sweepExpired(CLOCK.instant());
    }

    @Test
    @DisplayName("an unexpected store error is logged, not rethrown into the scheduler")
    void swallowsStoreErrorsAfterLogging() {
        when(evidenceStore.sweepExpired(CLOCK.instant())).thenThrow(new IllegalStateException("root vanished"));

        assertDoesNotThrow(() -> sweeper.sweepExpiredEvidence());
    }
}
