package com.jay.dossier.layer3_valuation;

import com.jay.dossier.layer2_calculate.MetricBuilder;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.layer2_calculate.ProvenanceCatalog;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.HurdleRate;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricValue;
import com.jay.dossier.model.Provenance;
import com.jay.dossier.model.Scenario;
import com.jay.dossier.model.SensitivityGrid;
import com.jay.dossier.model.TerminalGrowth;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.ValuationInput;
import com.jay.dossier.model.WaccEstimate;
import com.jay.dossier.model.enums.ScenarioName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Layer 3 - Valuation Engine.
 * Cost of capital, terminal growth, hurdle rate, the three reverse-DCF scenarios and the
 * sensitivity grid for one ticker. Solver failures surface as NA cells, never as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationEngine {

    private final WaccCalculator waccCalculator;
    private final TerminalGrowthCalculator terminalGrowthCalculator;
    private final HurdleCalculator hurdleCalculator;
    private final ReverseDcfEngine reverseDcf;
    private final MetricBuilder metricBuilder;

    public ValuationBlock value(ValuationInputs in, CompanyQuarter latest) {
        WaccEstimate wacc = waccCalculator.compute(in, latest);
        TerminalGrowth growth = terminalGrowthCalculator.compute(in.getInflation(), in.getRealGrowth(), wacc.point());
        if (growth.capped()) {
            log.info("{}: terminal growth {} capped at {} below WACC {}",
                latest.getTicker(), growth.inflation() + growth.realGrowth(), growth.value(), wacc.point());
        }
        HurdleRate hurdle = hurdleCalculator.compute(in.getBusinessAttributes());

        ReverseDcfEngine.Market market = new ReverseDcfEngine.Market(
            in.getPrice(), resolveShares(in, latest), resolveNetDebt(in, latest), resolveTtmFcf(in, latest));

        Map<ScenarioName, Scenario> scenarios =
            reverseDcf.scenarios(in.getGrowthSchedules(), market, wacc.point(), growth.value());
        SensitivityGrid grid =
            reverseDcf.sensitivity(scenarios.get(ScenarioName.Base), market, wacc.point(), growth.value());

        scenarios.values().stream()
            .filter(s -> s.irr() == null)
            .forEach(s -> log.warn("{}: {} scenario IRR is NA", latest.getTicker(), s.name()));
        log.info("{}: WACC {} [{} - {}], g {}, base IRR {}", latest.getTicker(),
            pct(wacc.point()), pct(wacc.lower()), pct(wacc.upper()), pct(growth.value()),
            scenarios.get(ScenarioName.Base).irr() == null ? "NA" : pct(scenarios.get(ScenarioName.Base).irr()));

        return ValuationBlock.builder()
            .wacc(wacc)
            .terminalGrowth(growth)
            .hurdle(hurdle)
            .scenarios(scenarios)
            .sensitivity(grid)
            .price(in.getPrice())
            .sharesDiluted(market.shares())
            .netDebt(market.netDebt())
            .ttmFcf(market.ttmFcf())
            .build();
    }

    /**
     * Metrics the dossier cites for the valuation: the observed market inputs and the two derived rates.
     * All are flagged as market inputs because their evidence is macro or market material.
     */
    public List<Metric> metrics(ValuationBlock block, ValuationInputs in, String period) {
        Map<String, ValuationInput> observed = new LinkedHashMap<>(block.getWacc().inputs());
        observed.putAll(block.getTerminalGrowth().inputs());

        Map<String, Provenance> cited = new LinkedHashMap<>();
        observed.forEach((name, input) -> {
            if (input != null && input.provenance() != null) cited.put(name, input.provenance());
        });
        ProvenanceCatalog catalog = ProvenanceCatalog.of(cited);

        List<Metric> metrics = new ArrayList<>();
        observed.forEach((name, input) -> {
            if (input == null) return;
            metrics.add(valuationMetric(name, input.value(), period, List.of(), catalog));
        });
        metrics.add(valuationMetric(MetricNames.WACC, block.getWacc().point(), period,
            List.of(MetricNames.RISK_FREE_RATE, MetricNames.EQUITY_RISK_PREMIUM, MetricNames.BETA, MetricNames.COST_OF_DEBT),
            catalog));
        metrics.add(valuationMetric(MetricNames.TERMINAL_GROWTH, block.getTerminalGrowth().value(), period,
            List.of(MetricNames.INFLATION, MetricNames.REAL_GROWTH), catalog));
        return metrics;
    }

    private Metric valuationMetric(String name, double value, String period, List<String> inputs,
                                   ProvenanceCatalog catalog) {
        return Metric.builder()
            .name(name)
            .value(MetricValue.of(value))
            .unit(MetricNames.BETA.equals(name) ? "x" : "ratio")
            .period(period)
            .provenance(metricBuilder.provenanceFor(name, inputs, catalog))
            .inputs(inputs)
            .marketInput(true)
            .build();
    }

    // ── Input resolution ─────────────────────────────────────────────────────

    static Double resolveShares(ValuationInputs in, CompanyQuarter latest) {
        if (in.getSharesDiluted() != null) return in.getSharesDiluted();
        return WaccCalculator.boxed(latest.item(StatementLines.DILUTED_SHARES));
    }

    static Double resolveNetDebt(ValuationInputs in, CompanyQuarter latest) {
        if (in.getNetDebt() != null) return in.getNetDebt();
        OptionalDouble debt = latest.item(StatementLines.TOTAL_DEBT);
        OptionalDouble cash = latest.item(StatementLines.CASH);
        if (debt.isEmpty() && cash.isEmpty()) return null;
        return debt.orElse(0) - cash.orElse(0);
    }

    /** Supplied TTM free cash flow, else CFO less CapEx over the trailing four quarters. */
    static Double resolveTtmFcf(ValuationInputs in, CompanyQuarter latest) {
        if (in.getTtmFcf() != null) return in.getTtmFcf();
        if (!latest.hasTtm(StatementLines.CFO) || !latest.hasTtm(StatementLines.CAPEX)) return null;
        return latest.flow(StatementLines.CFO).getAsDouble() - Math.abs(latest.flow(StatementLines.CAPEX).getAsDouble());
    }

    private static String pct(double v) {
        return String.format("%.2f%%", v * 100);
    }
}
