package com.apsentinel.detection.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.model.Vendor;
import com.apsentinel.detection.repository.AnomalyRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnomalyRecorderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private AnomalyRepository anomalyRepository;

    private AnomalyRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new AnomalyRecorder(anomalyRepository);
    }

    @Test
    void storesNewFinding() {
        Anomaly candidate = roundNumber(UUID.randomUUID());
        when(anomalyRepository.existsByTenantIdAndBillIdAndKind(candidate.tenantId(), candidate.billId(), AnomalyKind.ROUND_NUMBER))
                .thenReturn(false);
        when(anomalyRepository.insertIfAbsent(candidate)).thenReturn(true);

        assertThat(recorder.record(candidate)).isTrue();
    }

    @Test
    void existingFindingSkipsInsert() {
        Anomaly candidate = roundNumber(UUID.randomUUID());
        when(anomalyRepository.existsByTenantIdAndBillIdAndKind(candidate.tenantId(), candidate.billId(), AnomalyKind.ROUND_NUMBER))
                .thenReturn(true);

        assertThat(recorder.record(candidate)).isFalse();
        verify(anomalyRepository, never()).insertIfAbsent(any());
    }

    @Test
    void concurrentWriterWinningTheInsertIsNotAnError() {
        Anomaly candidate = roundNumber(UUID.randomUUID());
        when(anomalyRepository.existsByTenantIdAndBillIdAndKind(candidate.tenantId(), candidate.billId(), AnomalyKind.ROUND_NUMBER))
                .thenReturn(false);
        when(anomalyRepository.insertIfAbsent(candidate)).thenReturn(false);

        assertThat(recorder.record(candidate)).isFalse();
    }

    @Test
    void detectorKeepsGoingWhenInsertsLoseTheRace() {
        EngineFixture fixture = new EngineFixture();
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 2));
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 3));
        when(anomalyRepository.existsByTenantIdAndBillIdAndKind(any(), any(), any())).thenReturn(false);
        when(anomalyRepository.insertIfAbsent(any())).thenReturn(true, false, false);
        DuplicateDetector detector = new DuplicateDetector(fixture.bills, recorder, fixture.properties);

        int created = detector.detect(new DetectionContext(fixture.tenantId, LocalDate.of(2024, 6, 1), NOW, List.of()));

        assertThat(created).isEqualTo(1);
        verify(anomalyRepository, times(3)).insertIfAbsent(any());
    }

    private Anomaly roundNumber(UUID billId) {
        BigDecimal amount = new BigDecimal("1500.00");
        return Anomaly.open(UUID.randomUUID(), billId, Severity.LOW, amount, 0.6, "Round number",
                new AnomalyMetadata.RoundNumber(amount), true, NOW);
    }
}
