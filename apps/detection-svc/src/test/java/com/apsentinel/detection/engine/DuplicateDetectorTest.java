package com.apsentinel.detection.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.AnomalyStatus;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.model.Vendor;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DuplicateDetectorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private EngineFixture fixture;
    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        detector = new DuplicateDetector(fixture.bills, fixture.recorder, fixture.properties);
    }

    @Test
    void flagsEarlierBillOfPairWithinWindow() {
        Vendor acme = fixture.vendor("Acme");
        Bill first = fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 10));
        Bill second = fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 13));

        int created = detector.detect(context());

        assertThat(created).isEqualTo(1);
        assertThat(fixture.storedAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.kind()).isEqualTo(AnomalyKind.DUPLICATE);
            assertThat(anomaly.billId()).isEqualTo(first.id());
            assertThat(anomaly.severity()).isEqualTo(Severity.HIGH);
            assertThat(anomaly.confidenceScore()).isEqualTo(0.95);
            assertThat(anomaly.amount()).isEqualByComparingTo("5000.00");
            assertThat(anomaly.shouldAlert()).isTrue();
            assertThat(anomaly.status()).isEqualTo(AnomalyStatus.OPEN);
            assertThat(anomaly.createdAt()).isEqualTo(NOW);
            assertThat(anomaly.description()).isEqualTo("Possible duplicate: same vendor and amount within 7 days");
            assertThat(anomaly.metadata()).isEqualTo(new AnomalyMetadata.Duplicate(second.id(), first.id()));
        });
    }

    @Test
    void windowBoundaryIsInclusive() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "740.00", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "740.00", LocalDate.of(2024, 5, 8));

        assertThat(detector.detect(context())).isEqualTo(1);
    }

    @Test
    void ignoresPairsOutsideWindow() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 9));

        assertThat(detector.detect(context())).isZero();
        assertThat(fixture.storedAnomalies()).isEmpty();
    }

    @Test
    void ignoresSameAmountAcrossVendors() {
        fixture.bill(fixture.vendor("Acme"), "5000.00", LocalDate.of(2024, 5, 1));
        fixture.bill(fixture.vendor("Globex"), "5000.00", LocalDate.of(2024, 5, 2));

        assertThat(detector.detect(context())).isZero();
    }

    @Test
    void matchesAmountsToTheCent() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "812.5", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "812.50", LocalDate.of(2024, 5, 2));
        fixture.bill(acme, "812.51", LocalDate.of(2024, 5, 3));

        assertThat(detector.detect(context())).isEqualTo(1);
    }

    @Test
    void smallDuplicatesAreMediumAndDoNotAlert() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "120.00", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "120.00", LocalDate.of(2024, 5, 2));

        detector.detect(context());

        assertThat(fixture.storedAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(anomaly.shouldAlert()).isFalse();
        });
    }

    @Test
    void severityThresholdIsOneThousand() {
        assertThat(DuplicateDetector.severityFor(new BigDecimal("1000.00"))).isEqualTo(Severity.HIGH);
        assertThat(DuplicateDetector.severityFor(new BigDecimal("999.99"))).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void clusterFlagsEachBillAtMostOnce() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 1));
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 2));
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 3));
        fixture.bill(acme, "2500.00", LocalDate.of(2024, 5, 4));

        int created = detector.detect(context());

        List<Anomaly> stored = fixture.storedAnomalies();
        assertThat(created).isPositive().isEqualTo(stored.size());
        assertThat(stored).extracting(Anomaly::billId).doesNotHaveDuplicates();
    }

    @Test
    void rerunCreatesNothingNew() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 10));
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 12));
        detector.detect(context());

        assertThat(detector.detect(context())).isZero();
        assertThat(fixture.storedAnomalies()).hasSize(1);
    }

    @Test
    void onlyReadsRequestedTenant() {
        Vendor acme = fixture.vendor("Acme");
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 10));
        fixture.bill(acme, "5000.00", LocalDate.of(2024, 5, 12));

        int created = detector.detect(new DetectionContext(UUID.randomUUID(), TODAY, NOW, List.of()));

        assertThat(created).isZero();
    }

    private DetectionContext context() {
        return new DetectionContext(fixture.tenantId, TODAY, NOW, List.of());
    }
}
