package com.jay.dossier.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base-scenario IRR re-solved with WACC and terminal growth shifted one at a time.
 * The constructor enforces the direction of every populated cell against the base:
 * a higher WACC never raises the IRR and a higher growth rate never lowers it.
 */
public final class SensitivityGrid {

    private final int waccShiftBps;
    private final int growthShiftBps;
    private final Double base;
    private final Double waccUp;
    private final Double waccDown;
    private final Double growthUp;
    private final Double growthDown;

    public SensitivityGrid(int waccShiftBps, int growthShiftBps, Double base,
                           Double waccUp, Double waccDown, Double growthUp, Double growthDown,
                           double tolerance) {
        this.waccShiftBps = waccShiftBps;
        this.growthShiftBps = growthShiftBps;
        this.base = base;
        this.waccUp = waccUp;
        this.waccDown = waccDown;
        this.growthUp = growthUp;
        this.growthDown = growthDown;

        requireOrder(waccUp, base, tolerance, waccKey(+1));
        requireOrder(base, waccDown, tolerance, waccKey(-1));
        requireOrder(waccUp, waccDown, tolerance, waccKey(+1) + " vs " + waccKey(-1));
        requireOrder(growthDown, base, tolerance, growthKey(-1));
        requireOrder(base, growthUp, tolerance, growthKey(+1));
        requireOrder(growthDown, growthUp, tolerance, growthKey(-1) + " vs " + growthKey(+1));
    }

    private static void requireOrder(Double lower, Double higher, double tolerance, String cell) {
        if (lower != null && higher != null && lower > higher + tolerance) {
            throw new IllegalStateException(String.format(
                "Sensitivity direction violated at %s: %.6f > %.6f", cell, lower, higher));
        }
    }

    public String waccKey(int sign) {
        return "wacc" + (sign > 0 ? "+" : "-") + waccShiftBps + "bps";
    }

    public String growthKey(int sign) {
        return "g" + (sign > 0 ? "+" : "-") + growthShiftBps + "bps";
    }

    @JsonValue
    public Map<String, Double> cells() {
        Map<String, Double> cells = new LinkedHashMap<>();
        cells.put("base", base);
        cells.put(waccKey(+1), waccUp);
        cells.put(waccKey(-1), waccDown);
        cells.put(growthKey(+1), growthUp);
        cells.put(growthKey(-1), growthDown);
        return cells;
    }

    public Double get(String key) {
        return cells().get(key);
    }

    public Double base()       { return base; }
    public Double waccUp()     { return waccUp; }
    public Double waccDown()   { return waccDown; }
    public Double growthUp()   { return growthUp; }
    public Double growthDown() { return growthDown; }
}
