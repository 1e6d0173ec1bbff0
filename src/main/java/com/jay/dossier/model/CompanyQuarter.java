package com.jay.dossier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * One normalized reporting period. Statement maps hold base-unit values keyed by canonical
 * line-item name; {@code ttm} holds trailing-twelve-month sums for flow items that could be computed.
 */
@Value
@Builder(toBuilder = true)
public class CompanyQuarter {
    String ticker;
    FiscalPeriod period;
    LocalDate periodEnd;
    String currency;
    @Singular("income") Map<String, LineItem> incomeStatement;
    @Singular("balance") Map<String, LineItem> balanceSheet;
    @Singular("cashFlow") Map<String, LineItem> cashFlow;
    /** segment name -> line item name -> value */
    @Singular Map<String, Map<String, Double>> segments;
    @Singular Map<String, LineItem> footnotes;
    @Singular("ttmItem") Map<String, LineItem> ttm;
    /** Operating KPIs supplied alongside the filing (gross bookings, retention), already in base units. */
    @Singular("kpi") Map<String, Double> kpis;

    public String periodKey() {
        return period.key();
    }

    public String ttmKey() {
        return period.ttmKey();
    }

    /** Quarterly value from any of the three statements. */
    public OptionalDouble item(String name) {
        return Stream.of(incomeStatement, balanceSheet, cashFlow)
            .map(m -> m.get(name))
            .filter(Objects::nonNull)
            .mapToDouble(LineItem::value)
            .findFirst();
    }

    public OptionalDouble footnote(String name) {
        LineItem li = footnotes.get(name);
        return li == null ? OptionalDouble.empty() : OptionalDouble.of(li.value());
    }

    public OptionalDouble kpi(String name) {
        Double v = kpis.get(name);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public boolean hasTtm(String name) {
        return ttm.containsKey(name);
    }

    /** Trailing-twelve-month value when available, otherwise the quarterly value. */
    public OptionalDouble flow(String name) {
        LineItem t = ttm.get(name);
        return t != null ? OptionalDouble.of(t.value()) : item(name);
    }

    @JsonIgnore
    public boolean hasSegmentDisclosure() {
        return !segments.isEmpty();
    }
}
