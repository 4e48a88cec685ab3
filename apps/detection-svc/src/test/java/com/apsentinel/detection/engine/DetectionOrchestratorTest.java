package com.apsentinel.detection.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.Vendor;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class DetectionOrchestratorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private EngineFixture fixture;
    private DetectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        BaselineCalculator calculator = new BaselineCalculator(fixture.bills, fixture.baselines, fixture.properties);
        orchestrator = new DetectionOrchestrator(calculator, List.of(
                new DuplicateDetector(fixture.bills, fixture.recorder, fixture.properties),
                new PriceOutlierDetector(fixture.bills, fixture.recorder, fixture.properties),
                new RoundNumberDetector(fixture.bills, fixture.recorder, fixture.properties)
        ), clock);
    }

    @Test
    void runsBaselinesThenEveryDetector() {
        seedVendorWithSpike();

        DetectionRunResult result = orchestrator.run(fixture.tenantId);

        assertThat(result.baselinesComputed()).isEqualTo(1);
        assertThat(result.createdByKind()).containsExactly(
                entry(AnomalyKind.DUPLICATE, 0),
                entry(AnomalyKind.PRICE_CREEP, 1),
                entry(AnomalyKind.ROUND_NUMBER, 1)
        );
        assertThat(result.totalCreated()).isEqualTo(2);
        assertThat(fixture.storedAnomalies())
                .extracting(Anomaly::createdAt)
                .containsOnly(clock.instant());
    }

    @Test
    void secondRunFindsNothingNew() {
        seedVendorWithSpike();
        Vendor globex = fixture.vendor("Globex");
        fixture.bill(globex, "3000.00", LocalDate.of(2024, 5, 20));
        fixture.bill(globex, "3000.00", LocalDate.of(2024, 5, 22));

        int first = orchestrator.run(fixture.tenantId).totalCreated();
        int second = orchestrator.run(fixture.tenantId).totalCreated();

        assertThat(first).isPositive();
        assertThat(second).isZero();
        assertThat(fixture.storedAnomalies()).hasSize(first);
        assertThat(fixture.baselines.findAll()).hasSize(2);
    }

    @Test
    void tenantWithoutBillsYieldsEmptyRun() {
        DetectionRunResult result = orchestrator.run(UUID.randomUUID());

        assertThat(result.baselinesComputed()).isZero();
        assertThat(result.totalCreated()).isZero();
    }

    @Test
    void invokesDetectorsInRegistrationOrderWithSharedContext() {
        BaselineCalculator calculator = mock(BaselineCalculator.class);
        AnomalyDetector first = mock(AnomalyDetector.class);
        AnomalyDetector second = mock(AnomalyDetector.class);
        when(first.kind()).thenReturn(AnomalyKind.ROUND_NUMBER);
        when(second.kind()).thenReturn(AnomalyKind.DUPLICATE);
        when(calculator.computeBaselines(any(), any(), any())).thenReturn(List.of());
        when(first.detect(any())).thenReturn(2);
        when(second.detect(any())).thenReturn(3);
        UUID tenantId = UUID.randomUUID();

        DetectionRunResult result = new DetectionOrchestrator(calculator, List.of(first, second), clock).run(tenantId);

        InOrder order = inOrder(calculator, first, second);
        order.verify(calculator).computeBaselines(tenantId, LocalDate.of(2024, 6, 1), clock.instant());
        ArgumentCaptor<DetectionContext> context = ArgumentCaptor.forClass(DetectionContext.class);
        order.verify(first).detect(context.capture());
        order.verify(second).detect(context.capture());
        assertThat(context.getAllValues()).allSatisfy(captured -> {
            assertThat(captured.tenantId()).isEqualTo(tenantId);
            assertThat(captured.startedAt()).isEqualTo(clock.instant());
        });
        assertThat(result.createdByKind().keySet()).containsExactly(AnomalyKind.ROUND_NUMBER, AnomalyKind.DUPLICATE);
        assertThat(result.totalCreated()).isEqualTo(5);
    }

    @Test
    void requiresAtLeastOneDetector() {
        BaselineCalculator calculator = new BaselineCalculator(fixture.bills, fixture.baselines, fixture.properties);

        assertThatThrownBy(() -> new DetectionOrchestrator(calculator, List.of(), clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detector");
    }

    private void seedVendorWithSpike() {
        Vendor acme = fixture.vendor("Acme");
        fixture.itemizedBill(acme, "1000.00", LocalDate.of(2024, 4, 5));
        fixture.itemizedBill(acme, "1010.00", LocalDate.of(2024, 4, 15));
        fixture.itemizedBill(acme, "990.00", LocalDate.of(2024, 4, 25));
        fixture.itemizedBill(acme, "1000.00", LocalDate.of(2024, 5, 5));
        fixture.itemizedBill(acme, "1005.00", LocalDate.of(2024, 5, 15));
        fixture.itemizedBill(acme, "995.00", LocalDate.of(2024, 5, 20));
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 28));
    }
}
