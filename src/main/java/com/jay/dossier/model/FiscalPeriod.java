package com.jay.dossier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Fiscal quarter keyed as {@code YYYY-Q#}; trailing twelve months ending here are keyed {@code TTM-YYYYQ#}. */
public record FiscalPeriod(int year, int quarter) implements Comparable<FiscalPeriod> {

    private static final Pattern KEY = Pattern.compile("(\\d{4})-Q([1-4])");

    public FiscalPeriod {
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("Fiscal quarter must be 1-4, got " + quarter);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FiscalPeriod parse(String key) {
        Matcher m = KEY.matcher(key == null ? "" : key.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed fiscal period key: " + key);
        }
        return new FiscalPeriod(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    @JsonValue
    public String key() {
        return year + "-Q" + quarter;
    }

    public String ttmKey() {
        return "TTM-" + year + "Q" + quarter;
    }

    public FiscalPeriod previous() {
        return quarter == 1 ? new FiscalPeriod(year - 1, 4) : new FiscalPeriod(year, quarter - 1);
    }

    public FiscalPeriod minusYears(int years) {
        return new FiscalPeriod(year - years, quarter);
    }

    @Override
    public int compareTo(FiscalPeriod other) {
        return year != other.year ? Integer.compare(year, other.year) : Integer.compare(quarter, other.quarter);
    }

    @Override
    public String toString() {
        return key();
    }
}
