package com.apsentinel.detection.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.model.Vendor;
import com.apsentinel.detection.model.VendorBaseline;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PriceOutlierDetectorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private EngineFixture fixture;
    private PriceOutlierDetector detector;
    private Vendor acme;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        detector = new PriceOutlierDetector(fixture.bills, fixture.recorder, fixture.properties);
        acme = fixture.vendor("Acme");
    }

    @Test
    void flagsOnlyAmountsStrictlyAboveThreshold() {
        fixture.bill(acme, "1200.00", TODAY.minusDays(2));
        fixture.bill(acme, "1201.00", TODAY.minusDays(1));

        int created = detector.detect(context(baseline(acme, 1000.0, 100.0)));

        assertThat(created).isEqualTo(1);
        assertThat(fixture.storedAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.kind()).isEqualTo(AnomalyKind.PRICE_CREEP);
            assertThat(anomaly.amount()).isEqualByComparingTo("1201.00");
            assertThat(anomaly.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(anomaly.confidenceScore()).isCloseTo(0.701, within(1e-9));
            assertThat(anomaly.shouldAlert()).isTrue();
            assertThat(anomaly.description()).isEqualTo("Amount 1201.00 is 2.0σ above vendor baseline (1000.00)");
            assertThat(anomaly.metadata()).isInstanceOfSatisfying(AnomalyMetadata.PriceCreep.class, metadata -> {
                assertThat(metadata.zScore()).isCloseTo(2.01, within(1e-9));
                assertThat(metadata.baselineMean()).isEqualTo(1000.0);
                assertThat(metadata.baselineStdDev()).isEqualTo(100.0);
            });
        });
    }

    @Test
    void highSeverityFromThreeSigmaAndConfidenceIsCapped() {
        fixture.bill(acme, "1300.00", TODAY.minusDays(3));
        fixture.bill(acme, "1700.00", TODAY.minusDays(2));

        detector.detect(context(baseline(acme, 1000.0, 100.0)));

        List<Anomaly> stored = fixture.storedAnomalies().stream()
                .sorted(Comparator.comparing(Anomaly::amount))
                .toList();
        assertThat(stored).hasSize(2)
                .allSatisfy(anomaly -> assertThat(anomaly.severity()).isEqualTo(Severity.HIGH));
        assertThat(stored.get(0).confidenceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(stored.get(1).confidenceScore()).isEqualTo(0.99);
    }

    @Test
    void vendorWithoutSpreadIsNeverFlagged() {
        fixture.bill(acme, "100000.00", TODAY.minusDays(1));

        assertThat(detector.detect(context(baseline(acme, 500.0, 0.0)))).isZero();
    }

    @Test
    void vendorsWithoutBaselineAreSkipped() {
        Vendor globex = fixture.vendor("Globex");
        fixture.bill(globex, "99999.00", TODAY.minusDays(1));
        fixture.bill(acme, "1000.00", TODAY.minusDays(1));

        assertThat(detector.detect(context(baseline(acme, 1000.0, 100.0)))).isZero();
    }

    @Test
    void examinesBillsOutsideBaselineWindow() {
        fixture.bill(acme, "2000.00", TODAY.minusDays(400));

        assertThat(detector.detect(context(baseline(acme, 1000.0, 100.0)))).isEqualTo(1);
    }

    @Test
    void rerunCreatesNothingNew() {
        fixture.bill(acme, "1500.00", TODAY.minusDays(1));
        DetectionContext context = context(baseline(acme, 1000.0, 100.0));
        detector.detect(context);

        assertThat(detector.detect(context)).isZero();
    }

    @Test
    void confidenceFollowsZScore() {
        assertThat(PriceOutlierDetector.confidenceFor(2.0)).isCloseTo(0.7, within(1e-9));
        assertThat(PriceOutlierDetector.confidenceFor(4.9)).isCloseTo(0.99, within(1e-9));
        assertThat(PriceOutlierDetector.confidenceFor(12.0)).isEqualTo(0.99);
    }

    private DetectionContext context(VendorBaseline baseline) {
        return new DetectionContext(fixture.tenantId, TODAY, NOW, List.of(baseline));
    }

    private VendorBaseline baseline(Vendor vendor, double mean, double stdDev) {
        return new VendorBaseline(UUID.randomUUID(), vendor.id(), TODAY.minusDays(90), TODAY, 10, mean, stdDev,
                BigDecimal.valueOf(mean), BigDecimal.valueOf(mean), NOW);
    }
}
