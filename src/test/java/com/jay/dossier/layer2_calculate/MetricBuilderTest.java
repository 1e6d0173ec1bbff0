package com.jay.dossier.layer2_calculate;

import com.jay.dossier.TestFixtures;
import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer1_normalize.StatementNormalizer;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.Metric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MetricBuilderTest {

    private DossierConfig config;
    private StatementNormalizer normalizer;
    private MetricBuilder builder;

    @BeforeEach
    void setUp() {
        config = new DossierConfig();
        normalizer = new StatementNormalizer(config);
        builder = new MetricBuilder(config, new CalculatorRegistry(config));
    }

    private CompanyQuarter latest() {
        List<CompanyQuarter> history = normalizer.normalizeHistory(TestFixtures.history());
        return history.get(history.size() - 1);
    }

    private static Map<String, Metric> byName(List<Metric> metrics) {
        return metrics.stream().collect(Collectors.toMap(Metric::getName, Function.identity()));
    }

    @Test
    @DisplayName("Flow metrics use TTM values and carry the TTM period key")
    void flowMetricsUseTtm() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        Metric revenue = metrics.get(MetricNames.REVENUE);
        assertEquals(19.4e9, revenue.numeric().getAsDouble(), 1e-2);
        assertEquals("TTM-2024Q4", revenue.getPeriod());
        assertEquals("USD", revenue.getUnit());

        Metric fcf = metrics.get(MetricNames.FCF);
        assertEquals(5.051e9, fcf.numeric().getAsDouble(), 1e-2);
        assertEquals("TTM-2024Q4", fcf.getPeriod());
    }

    @Test
    @DisplayName("Point-in-time metrics are keyed to the quarter")
    void balanceMetricsUseQuarter() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        Metric netDebt = metrics.get(MetricNames.NET_DEBT);
        assertEquals(9.0e9, netDebt.numeric().getAsDouble(), 1e-2);
        assertEquals("2024-Q4", netDebt.getPeriod());
        assertEquals(9.0 / 9.2, metrics.get(MetricNames.NET_LEVERAGE).numeric().getAsDouble(), 1e-9);
        assertEquals(-0.03, metrics.get(MetricNames.ACCRUALS_RATIO).numeric().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("A single quarter annualizes leverage so it matches the TTM figure")
    void singleQuarterLeverageAnnualized() {
        CompanyQuarter quarter = normalizer.normalize(TestFixtures.filing(2024, 4, 5000));

        Map<String, Metric> metrics = byName(builder.build(quarter, TestFixtures.catalog()));

        assertEquals(9.0 / 9.2, metrics.get(MetricNames.NET_LEVERAGE).numeric().getAsDouble(), 1e-9);
        assertEquals("2024-Q4", metrics.get(MetricNames.REVENUE).getPeriod());
    }

    @Test
    @DisplayName("Missing inputs give an explicit NA metric, never a gap")
    void missingInputsAreNa() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        Metric takeRate = metrics.get(MetricNames.TAKE_RATE);
        assertNotNull(takeRate);
        assertTrue(takeRate.getValue().isNa());
        assertTrue(metrics.get(MetricNames.RUNWAY_MONTHS).getValue().isNa(), "cash-generative business has no runway");
    }

    @Test
    @DisplayName("Segment margins are computed per disclosed segment on reported revenue")
    void segmentMargins() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        Metric cloud = metrics.get(MetricNames.SEGMENT_MARGIN_PREFIX + "Cloud");
        assertEquals(1100.0 / 3000.0, cloud.numeric().getAsDouble(), 1e-12);
        assertTrue(cloud.getInputs().contains(MetricNames.SEGMENT_REVENUE_PREFIX + "Cloud"));
        assertEquals(0.4, metrics.get(MetricNames.SEGMENT_MARGIN_PREFIX + "Devices").numeric().getAsDouble(), 1e-12);
    }

    @Test
    @DisplayName("Derived metrics cite their first cited input")
    void provenanceFallsBackToInputs() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        assertEquals(TestFixtures.catalog().lookup("Revenue").orElseThrow(),
            metrics.get(MetricNames.GROSS_MARGIN).getProvenance());
        assertEquals(TestFixtures.catalog().lookup("Net Income").orElseThrow(),
            metrics.get(MetricNames.ACCRUALS_RATIO).getProvenance());
    }

    @Test
    @DisplayName("Without any citation a metric carries the system-derived marker")
    void uncitedMetricsAreSystemDerived() {
        Map<String, Metric> metrics = byName(builder.build(latest(), ProvenanceCatalog.empty()));

        Metric revenue = metrics.get(MetricNames.REVENUE);
        assertEquals("SYSTEM-DERIVED", revenue.getProvenance().documentId());
        assertEquals("https://localhost/system", revenue.getProvenance().url());
    }

    @Test
    @DisplayName("Ratio formulas refuse meaningless denominators")
    void ratioGuards() {
        assertTrue(FinancialRatios.ratio(1, 0).isEmpty());
        assertTrue(FinancialRatios.roic(100, 0.21, -50, 10, 10).isEmpty());
        assertTrue(FinancialRatios.runwayMonths(1_000, 50).isEmpty());
        assertEquals(6.0, FinancialRatios.runwayMonths(1_000, -500).getAsDouble(), 1e-12);
    }

    @Test
    @DisplayName("Relative error is measured against the expected value, absolute against zero")
    void relativeErrorAgainstExpected() {
        assertEquals(0.5, FinancialRatios.relativeError(50, 100), 1e-12);
        assertEquals(1.0, FinancialRatios.relativeError(100, 50), 1e-12);
        assertEquals(0.0101, FinancialRatios.relativeError(1.0101, 1.0), 1e-12);
        assertEquals(0.25, FinancialRatios.relativeError(-0.25, 0), 1e-12);
    }

    @Test
    @DisplayName("Segment count reflects the segment note and cites it")
    void segmentCount() {
        Map<String, Metric> metrics = byName(builder.build(latest(), TestFixtures.catalog()));

        Metric count = metrics.get(MetricNames.SEGMENT_COUNT);
        assertEquals(2.0, count.numeric().getAsDouble());
        assertEquals("count", count.getUnit());
        assertEquals(TestFixtures.FILING_ID, count.getProvenance().documentId());
    }

    @Test
    @DisplayName("A filing without a segment note has a segment count of zero")
    void noSegmentsCountsZero() {
        CompanyQuarter bare = normalizer.normalizeHistory(
            List.of(TestFixtures.filingBuilder(2024, 4, 5000).clearSegments().build())).get(0);

        Map<String, Metric> metrics = byName(builder.build(bare, TestFixtures.catalog()));

        assertEquals(0.0, metrics.get(MetricNames.SEGMENT_COUNT).numeric().getAsDouble());
        assertTrue(metrics.keySet().stream().noneMatch(MetricNames::isSegmentMargin));
    }
}
