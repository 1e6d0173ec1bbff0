package com.jay.dossier.layer6_verify;

import com.jay.dossier.TestFixtures;
import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer1_normalize.StatementNormalizer;
import com.jay.dossier.layer2_calculate.CalculatorRegistry;
import com.jay.dossier.layer2_calculate.MetricBuilder;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.layer3_valuation.HurdleCalculator;
import com.jay.dossier.layer3_valuation.IrrSolver;
import com.jay.dossier.layer3_valuation.ReverseDcfEngine;
import com.jay.dossier.layer3_valuation.TerminalGrowthCalculator;
import com.jay.dossier.layer3_valuation.ValuationEngine;
import com.jay.dossier.layer3_valuation.ValuationInputs;
import com.jay.dossier.layer3_valuation.WaccCalculator;
import com.jay.dossier.layer4_gates.GateContext;
import com.jay.dossier.layer4_gates.GateEngine;
import com.jay.dossier.layer4_gates.PathSelector;
import com.jay.dossier.layer4_gates.StageZeroGates;
import com.jay.dossier.layer5_provenance.DocumentLookup;
import com.jay.dossier.layer5_provenance.ProvenanceValidator;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.LineItem;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricValue;
import com.jay.dossier.model.ProvenanceIssue;
import com.jay.dossier.model.QAResult;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.enums.AnalysisPath;
import com.jay.dossier.model.enums.BusinessModel;
import com.jay.dossier.model.enums.GateResult;
import com.jay.dossier.model.enums.QaStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class VerifierTest {

    private DossierConfig config;
    private CalculatorRegistry registry;
    private ValuationEngine valuationEngine;
    private CompanyQuarter latest;
    private ValuationInputs inputs;
    private ValuationBlock valuation;
    private List<Metric> metrics;
    private List<GateRow> hardGates;
    private List<ProvenanceIssue> issues;
    private Verifier verifier;

    @BeforeEach
    void setUp() {
        config = new DossierConfig();
        registry = new CalculatorRegistry(config);
        MetricBuilder metricBuilder = new MetricBuilder(config, registry);
        valuationEngine = new ValuationEngine(new WaccCalculator(config), new TerminalGrowthCalculator(config),
            new HurdleCalculator(config), new ReverseDcfEngine(config, new IrrSolver(config)), metricBuilder);

        List<CompanyQuarter> history = new StatementNormalizer(config).normalizeHistory(TestFixtures.history());
        latest = history.get(history.size() - 1);
        inputs = TestFixtures.valuationInputs();
        valuation = valuationEngine.value(inputs, latest);

        metrics = new ArrayList<>(metricBuilder.build(latest, TestFixtures.catalog()));
        metrics.addAll(valuationEngine.metrics(valuation, inputs, latest.periodKey()));
        hardGates = new GateEngine(config).evaluate(
            GateContext.of(metrics, TestFixtures.AS_OF, BusinessModel.INDUSTRIAL, Map.of()),
            new PathSelector.PathDecision(AnalysisPath.Mature, List.of())).hardGates();
        issues = new ProvenanceValidator(config).validate(metrics, DocumentLookup.of(TestFixtures.documents()));
        verifier = new Verifier(config, registry);
    }

    private VerificationRequest.VerificationRequestBuilder request(List<Metric> metricSet) {
        return VerificationRequest.builder()
            .metrics(metricSet)
            .hardGates(hardGates)
            .provenanceIssues(issues)
            .latestQuarter(latest)
            .valuation(valuation)
            .valuationInputs(inputs)
            .businessModel(BusinessModel.INDUSTRIAL);
    }

    private List<Metric> replacing(String name, UnaryOperator<Metric> change) {
        List<Metric> out = new ArrayList<>();
        metrics.forEach(m -> out.add(m.getName().equals(name) ? change.apply(m) : m));
        return out;
    }

    @Test
    @DisplayName("A consistent, fully cited dossier passes QA")
    void consistentDossierPasses() {
        QAResult result = verifier.verify(request(metrics).build());

        assertEquals(List.of(), result.reasons());
        assertEquals(QaStatus.PASS, result.status());
    }

    @Test
    @DisplayName("Revenue reported 3% away from the re-derived value is a blocker quoting both figures")
    void revenueMismatchBlocks() {
        // Arrange: sample every derived metric so Revenue is always checked
        config.verifier().setSampleSize(100);
        List<Metric> tampered = replacing(MetricNames.REVENUE, m -> m.toBuilder().value(MetricValue.of(20.0e9)).build());

        // Act
        QAResult result = verifier.verify(request(tampered).build());

        // Assert
        assertEquals(QaStatus.BLOCKER, result.status());
        String reason = result.reasons().stream().filter(r -> r.contains("Revenue")).findFirst().orElseThrow();
        assertTrue(reason.contains("20000000000"), reason);
        assertTrue(reason.contains("19400000000"), reason);
    }

    @Test
    @DisplayName("Differences within 1% are tolerated")
    void smallDifferenceTolerated() {
        config.verifier().setSampleSize(100);
        List<Metric> nudged = replacing(MetricNames.REVENUE, m -> m.toBuilder().value(MetricValue.of(19.45e9)).build());

        assertTrue(verifier.verify(request(nudged).build()).passed());
    }

    @Test
    @DisplayName("Just over 1% above the re-derived value is a blocker, measured against the re-derived figure")
    void justOverToleranceBlocks() {
        // Arrange: 1.01% above 19.4e9 is still under 1% of the larger, reported figure
        config.verifier().setSampleSize(100);
        List<Metric> inflated = replacing(MetricNames.REVENUE, m -> m.toBuilder().value(MetricValue.of(19.4e9 * 1.0101)).build());

        // Act
        QAResult result = verifier.verify(request(inflated).build());

        // Assert
        assertEquals(QaStatus.BLOCKER, result.status());
        assertTrue(result.reasons().stream().anyMatch(r -> r.startsWith("Metric Revenue mismatch")), result.reasons().toString());
    }

    @Test
    @DisplayName("A hard gate without a verdict is a blocker")
    void naHardGateBlocks() {
        List<GateRow> gates = new ArrayList<>();
        hardGates.forEach(g -> gates.add(g.getGateId().equals(StageZeroGates.VALUATION)
            ? GateRow.builder().gateId(g.getGateId()).hardness(g.getHardness()).result(GateResult.NA).rule(g.getRule()).build()
            : g));

        QAResult result = verifier.verify(request(metrics).clearHardGates().hardGates(gates).build());

        assertEquals(QaStatus.BLOCKER, result.status());
        assertTrue(result.reasons().contains("Missing Valuation verdict"));
    }

    @Test
    @DisplayName("A failed hard gate is a verdict, not a QA problem")
    void hardFailIsNotBlocker() {
        List<GateRow> gates = new ArrayList<>();
        hardGates.forEach(g -> gates.add(g.getGateId().equals(StageZeroGates.FRAUD_CONTROLS)
            ? GateRow.builder().gateId(g.getGateId()).hardness(g.getHardness()).result(GateResult.FAIL).rule(g.getRule()).build()
            : g));

        assertTrue(verifier.verify(request(metrics).clearHardGates().hardGates(gates).build()).passed());
    }

    @Test
    @DisplayName("Sources outside the allowlist are blockers")
    void unlistedSourceBlocks() {
        List<Metric> withBlog = new ArrayList<>(metrics);
        withBlog.add(Metric.builder()
            .name("Market Share")
            .value(MetricValue.of(0.3))
            .provenance(new com.jay.dossier.model.Provenance("BLOG-1", "para 2", "ACME holds 30%", "https://example.com/acme"))
            .build());

        QAResult result = verifier.verify(request(withBlog).build());

        assertTrue(result.reasons().contains(
            "Source URL for Market Share is not on the allowlist: https://example.com/acme"));
    }

    @Test
    @DisplayName("Subscription metrics on a non-subscription business are blockers")
    void subscriptionMetricBlocks() {
        List<Metric> withNrr = replacing(MetricNames.NRR, m -> m.toBuilder().value(MetricValue.of(1.1)).build());

        QAResult result = verifier.verify(request(withNrr).build());

        assertTrue(result.reasons().contains("Subscription metric NRR reported for INDUSTRIAL business model"));
        assertFalse(verifier.verify(request(withNrr).businessModel(BusinessModel.SUBSCRIPTION).build()).reasons()
            .contains("Subscription metric NRR reported for SUBSCRIPTION business model"));
    }

    @Test
    @DisplayName("Reverse-DCF shares must equal the latest reported diluted shares")
    void sharesMismatchBlocks() {
        ValuationBlock offShares = valuationEngine.value(
            TestFixtures.valuationBuilder().sharesDiluted(2.0e9).build(), latest);

        QAResult result = verifier.verify(request(metrics).valuation(offShares).build());

        assertTrue(result.reasons().stream().anyMatch(r -> r.startsWith("Reverse-DCF diluted shares 2000000000")),
            result.reasons().toString());
    }

    @Test
    @DisplayName("Hurdle must recompute from the business attributes")
    void hurdleMismatchBlocks() {
        ValuationBlock emergent = valuationEngine.value(
            TestFixtures.valuationBuilder().clearBusinessAttributes().businessAttribute("emergent").build(), latest);

        QAResult result = verifier.verify(request(metrics).valuation(emergent).build());

        assertTrue(result.reasons().stream()
                .anyMatch(r -> r.startsWith("Hurdle IRR 0.1") && r.contains("does not match recomputed 0.1")),
            result.reasons().toString());
    }

    @Test
    @DisplayName("Debt due in 24 months must reconcile with the maturity footnote")
    void debtFootnoteMismatchBlocks() {
        CompanyQuarter offFootnote = latest.toBuilder()
            .footnote(StatementLines.DEBT_DUE_24M, new LineItem(3.0e9, "USD"))
            .build();

        QAResult result = verifier.verify(request(metrics).latestQuarter(offFootnote).build());

        assertTrue(result.reasons().stream().anyMatch(r -> r.contains("does not reconcile with footnote figure 3000000000")),
            result.reasons().toString());
    }

    @Test
    @DisplayName("Segment margins on adjusted revenue are blockers")
    void adjustedSegmentMarginBlocks() {
        String cloud = MetricNames.SEGMENT_MARGIN_PREFIX + "Cloud";
        List<Metric> adjusted = replacing(cloud, m -> m.toBuilder()
            .clearInputs()
            .input(MetricNames.SEGMENT_OPERATING_PREFIX + "Cloud")
            .input(MetricNames.SEGMENT_ADJUSTED_PREFIX + "Cloud")
            .build());

        QAResult result = verifier.verify(request(adjusted).build());

        assertTrue(result.reasons().stream().anyMatch(r -> r.startsWith("Segment margin " + cloud + " is not computed on reported revenue")));
    }

    @Test
    @DisplayName("Coverage ratios must reference the same period")
    void coveragePeriodMismatchBlocks() {
        List<Metric> shifted = replacing(MetricNames.FCF_INTEREST, m -> m.toBuilder().period("2024-Q4").build());

        QAResult result = verifier.verify(request(shifted).build());

        assertTrue(result.reasons().stream().anyMatch(r -> r.startsWith("Coverage ratios reference different periods")));
    }

    @Test
    @DisplayName("Upstream provenance problems are carried into the QA reasons")
    void provenanceIssuesBlock() {
        QAResult result = verifier.verify(request(metrics)
            .provenanceIssue(new ProvenanceIssue(MetricNames.REVENUE, "quote not found in source document X"))
            .build());

        assertEquals(QaStatus.BLOCKER, result.status());
        assertTrue(result.reasons().contains("Provenance issue for Revenue: quote not found in source document X"));
    }

    @Test
    @DisplayName("Independent re-derivation covers statement and valuation metrics")
    void recomputeTable() {
        VerificationRequest request = request(metrics).build();

        assertEquals(0.09, verifier.recompute(MetricNames.WACC, request).orElseThrow().value().getAsDouble(), 1e-12);
        assertEquals("ratio", verifier.recompute(MetricNames.TERMINAL_GROWTH, request).orElseThrow().unit());
        assertTrue(verifier.recompute("Market Share", request).isEmpty());
    }
}
