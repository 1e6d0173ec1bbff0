package com.jay.dossier.layer2_calculate;

import java.util.OptionalDouble;

/**
 * Pure ratio formulas. Every function answers empty when an input is missing or a denominator
 * makes the ratio meaningless, so callers never divide by zero.
 */
public final class FinancialRatios {

    public static final double DAYS_PER_YEAR = 365.0;

    private FinancialRatios() {}

    @FunctionalInterface
    public interface Formula {
        OptionalDouble apply(double[] v);
    }

    /** Applies the formula only when every argument is present. */
    public static OptionalDouble using(Formula formula, OptionalDouble... args) {
        double[] values = new double[args.length];
        for (int i = 0; i < args.length; i++) {
            if (args[i].isEmpty()) return OptionalDouble.empty();
            values[i] = args[i].getAsDouble();
        }
        OptionalDouble result = formula.apply(values);
        return result.isPresent() && Double.isFinite(result.getAsDouble()) ? result : OptionalDouble.empty();
    }

    public static OptionalDouble ratio(double numerator, double denominator) {
        return denominator == 0 ? OptionalDouble.empty() : OptionalDouble.of(numerator / denominator);
    }

    public static OptionalDouble grossProfit(double revenue, double costOfRevenue) {
        return OptionalDouble.of(revenue - Math.abs(costOfRevenue));
    }

    /** CapEx is subtracted whichever sign the filing uses for it. */
    public static OptionalDouble freeCashFlow(double cfo, double capex) {
        return OptionalDouble.of(cfo - Math.abs(capex));
    }

    /** Balance outstanding expressed in days of the flow it turns over against. */
    public static OptionalDouble daysOutstanding(double balance, double flow, double periodDays) {
        return flow == 0 ? OptionalDouble.empty() : OptionalDouble.of(balance / Math.abs(flow) * periodDays);
    }

    public static OptionalDouble accrualsRatio(double netIncome, double cfo, double totalAssets) {
        return totalAssets == 0 ? OptionalDouble.empty() : OptionalDouble.of((netIncome - cfo) / totalAssets);
    }

    public static OptionalDouble netDebt(double totalDebt, double cash) {
        return OptionalDouble.of(totalDebt - cash);
    }

    /** NOPAT over invested capital (equity + debt - cash); undefined for non-positive capital. */
    public static OptionalDouble roic(double ebit, double taxRate, double equity, double debt, double cash) {
        double invested = equity + debt - cash;
        return invested <= 0 ? OptionalDouble.empty() : OptionalDouble.of(ebit * (1 - taxRate) / invested);
    }

    public static OptionalDouble interestCoverage(double numerator, double interest) {
        return interest == 0 ? OptionalDouble.empty() : OptionalDouble.of(numerator / Math.abs(interest));
    }

    /** Cash, undrawn revolver and two years of free cash flow against debt maturing within 24 months. */
    public static OptionalDouble debtCoverage24m(double cash, double revolver, double annualFcf, double debtDue) {
        return debtDue <= 0 ? OptionalDouble.empty()
            : OptionalDouble.of((cash + revolver + 2 * annualFcf) / debtDue);
    }

    /** Months of cash at the current quarterly burn; undefined when the business is not burning cash. */
    public static OptionalDouble runwayMonths(double cash, double quarterlyFcf) {
        return quarterlyFcf >= 0 ? OptionalDouble.empty() : OptionalDouble.of(cash / (Math.abs(quarterlyFcf) / 3.0));
    }

    /**
     * Error of a reported figure relative to the independently derived one.
     * Against a zero expectation the absolute difference is returned instead.
     */
    public static double relativeError(double reported, double expected) {
        double diff = Math.abs(reported - expected);
        return expected == 0 ? diff : diff / Math.abs(expected);
    }
}
