package com.jay.dossier.layer3_valuation;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.Scenario;
import com.jay.dossier.model.SensitivityGrid;
import com.jay.dossier.model.enums.ScenarioName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Reverse DCF: the IRR an investor earns buying one share at today's price and receiving the
 * scenario's free cash flow per share, plus in the final year the Gordon terminal value net of debt.
 */
@Component
@RequiredArgsConstructor
public class ReverseDcfEngine {

    private final DossierConfig config;
    private final IrrSolver solver;

    /** Inputs held fixed across scenarios and sensitivity cells. */
    public record Market(double price, Double shares, Double netDebt, Double ttmFcf) {
    }

    public Map<ScenarioName, Scenario> scenarios(Map<ScenarioName, List<Double>> schedules, Market market,
                                                 double wacc, double growth) {
        validateSchedules(schedules);
        Map<ScenarioName, Scenario> out = new EnumMap<>(ScenarioName.class);
        for (ScenarioName name : ScenarioName.values()) {
            List<Double> schedule = schedules.get(name);
            List<Double> path = market.ttmFcf() == null ? List.of() : fcfPath(market.ttmFcf(), schedule);
            out.put(name, new Scenario(name, schedule, path, irr(path, market, wacc, growth)));
        }

        Double previous = null;
        for (ScenarioName name : ScenarioName.values()) {
            Double irr = out.get(name).irr();
            if (irr == null) continue;
            if (previous != null && irr < previous - tolerance()) {
                throw new IllegalStateException(String.format(
                    "Scenario IRR order violated: %s %.6f below preceding scenario %.6f", name, irr, previous));
            }
            previous = irr;
        }
        return out;
    }

    public SensitivityGrid sensitivity(Scenario base, Market market, double wacc, double growth) {
        DossierConfig.Sensitivity cfg = config.valuation().getSensitivity();
        double dw = cfg.getWaccShiftBps() / 10_000.0;
        double dg = cfg.getGrowthShiftBps() / 10_000.0;
        List<Double> path = base.fcfPath();
        return new SensitivityGrid(cfg.getWaccShiftBps(), cfg.getGrowthShiftBps(),
            base.irr(),
            irr(path, market, wacc + dw, growth),
            irr(path, market, wacc - dw, growth),
            irr(path, market, wacc, growth + dg),
            irr(path, market, wacc, growth - dg),
            tolerance());
    }

    /** fcf[t] = fcf[t-1] * (1 + growth[t]), starting from trailing-twelve-month free cash flow. */
    public static List<Double> fcfPath(double ttmFcf, List<Double> schedule) {
        List<Double> path = new ArrayList<>(schedule.size());
        double fcf = ttmFcf;
        for (double g : schedule) {
            fcf = fcf * (1 + g);
            path.add(fcf);
        }
        return path;
    }

    /** Per-share IRR for a cash-flow path, or null (NA) when no meaningful root exists. */
    public Double irr(List<Double> path, Market market, double wacc, double growth) {
        if (path.isEmpty() || market.shares() == null || market.shares() <= 0
            || market.netDebt() == null || market.price() <= 0 || wacc - growth <= 0) {
            return null;
        }
        double shares = market.shares();
        double[] flows = new double[path.size() + 1];
        flows[0] = -market.price();
        for (int t = 0; t < path.size(); t++) {
            flows[t + 1] = path.get(t) / shares;
        }
        double finalFcf = path.get(path.size() - 1);
        double terminalValue = finalFcf * (1 + growth) / (wacc - growth);
        flows[path.size()] += (terminalValue - market.netDebt()) / shares;

        OptionalDouble irr = solver.solve(flows);
        return irr.isPresent() ? irr.getAsDouble() : null;
    }

    private void validateSchedules(Map<ScenarioName, List<Double>> schedules) {
        int years = config.valuation().getForecastYears();
        for (ScenarioName name : ScenarioName.values()) {
            List<Double> s = schedules.get(name);
            if (s == null || s.size() != years) {
                throw new IllegalArgumentException(String.format(
                    "%s growth schedule must have %d entries, got %s", name, years, s == null ? "none" : s.size()));
            }
        }
        List<Double> bear = schedules.get(ScenarioName.Bear);
        List<Double> base = schedules.get(ScenarioName.Base);
        List<Double> bull = schedules.get(ScenarioName.Bull);
        for (int t = 0; t < years; t++) {
            if (bear.get(t) > base.get(t) || base.get(t) > bull.get(t)) {
                throw new IllegalArgumentException(String.format(
                    "Growth schedules must be ordered Bear <= Base <= Bull; year %d has %.4f / %.4f / %.4f",
                    t + 1, bear.get(t), base.get(t), bull.get(t)));
            }
        }
    }

    // Bisection stops within epsilon of the root, so comparisons between solved rates allow for that.
    private double tolerance() {
        return 2 * config.valuation().getSolver().getEpsilon();
    }
}
