package com.jay.dossier.layer2_calculate;

import com.jay.dossier.model.CompanyQuarter;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * A named pure function over one normalized quarter.
 * Flow inputs are read trailing-twelve-month when available; the metric is keyed to the TTM
 * period only when every flow input had a TTM value.
 */
public record MetricCalculator(String name,
                               UnitKind unit,
                               List<String> flowInputs,
                               List<String> pointInputs,
                               Function<CompanyQuarter, OptionalDouble> formula) {

    public MetricCalculator {
        flowInputs = List.copyOf(flowInputs);
        pointInputs = List.copyOf(pointInputs);
    }

    public OptionalDouble apply(CompanyQuarter quarter) {
        return formula.apply(quarter);
    }

    public List<String> inputs() {
        List<String> all = new ArrayList<>(flowInputs);
        all.addAll(pointInputs);
        return all;
    }

    public String periodFor(CompanyQuarter quarter) {
        boolean ttm = !flowInputs.isEmpty() && flowInputs.stream().allMatch(quarter::hasTtm);
        return ttm ? quarter.ttmKey() : quarter.periodKey();
    }

    public String unitFor(CompanyQuarter quarter) {
        return unit.label(quarter.getCurrency());
    }
}
