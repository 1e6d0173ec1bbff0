package com.jay.dossier.layer3_valuation;

import com.jay.dossier.config.DossierConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Bounded bisection for the rate that zeroes the NPV of a cash-flow series.
 *
 * Only conventional series are solved: one outflow at t0 followed by non-negative inflows with a
 * positive final inflow. For those the NPV falls strictly as the rate rises, so the root is unique
 * and grows with every inflow. Anything else, a bracket without a sign change, or running out of
 * iterations or time gives an empty result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IrrSolver {

    private final DossierConfig config;

    public OptionalDouble solve(double[] cashFlows) {
        if (!isConventional(cashFlows)) {
            log.debug("IRR not solved: cash flows are not conventional");
            return OptionalDouble.empty();
        }
        DossierConfig.Solver cfg = config.valuation().getSolver();
        long deadline = System.nanoTime() + cfg.getTimeBudgetMillis() * 1_000_000L;

        double lo = cfg.getLowerBound();
        double hi = cfg.getUpperBound();
        double npvLo = npv(cashFlows, lo);
        double npvHi = npv(cashFlows, hi);
        if (npvLo == 0) return OptionalDouble.of(lo);
        if (npvHi == 0) return OptionalDouble.of(hi);
        if (Math.signum(npvLo) == Math.signum(npvHi)) {
            log.debug("IRR not solved: no sign change on [{}, {}]", lo, hi);
            return OptionalDouble.empty();
        }

        for (int i = 0; i < cfg.getMaxIterations(); i++) {
            if (System.nanoTime() > deadline) {
                log.warn("IRR solver exceeded its {} ms budget after {} iterations", cfg.getTimeBudgetMillis(), i);
                return OptionalDouble.empty();
            }
            double mid = (lo + hi) / 2;
            double npvMid = npv(cashFlows, mid);
            if (Math.abs(npvMid) < cfg.getEpsilon() || (hi - lo) / 2 < cfg.getEpsilon()) {
                return OptionalDouble.of(mid);
            }
            if (Math.signum(npvMid) == Math.signum(npvLo)) {
                lo = mid;
                npvLo = npvMid;
            } else {
                hi = mid;
            }
        }
        log.warn("IRR solver did not converge within {} iterations", cfg.getMaxIterations());
        return OptionalDouble.empty();
    }

    public static double npv(double[] cashFlows, double rate) {
        double total = 0;
        double discount = 1;
        for (double cf : cashFlows) {
            total += cf / discount;
            discount *= 1 + rate;
        }
        return total;
    }

    static boolean isConventional(double[] cashFlows) {
        if (cashFlows.length < 2 || !(cashFlows[0] < 0)) return false;
        for (int t = 1; t < cashFlows.length; t++) {
            if (!Double.isFinite(cashFlows[t]) || cashFlows[t] < 0) return false;
        }
        return cashFlows[cashFlows.length - 1] > 0;
    }
}
