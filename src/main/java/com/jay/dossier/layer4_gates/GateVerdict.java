package com.jay.dossier.layer4_gates;

import com.jay.dossier.model.enums.GateResult;

/** Outcome of one gate rule; a Soft-Pass names the condition that would flip it. */
public record GateVerdict(GateResult result, String flipCondition) {

    public static GateVerdict pass()                     { return new GateVerdict(GateResult.PASS, null); }
    public static GateVerdict fail()                     { return new GateVerdict(GateResult.FAIL, null); }
    public static GateVerdict na()                       { return new GateVerdict(GateResult.NA, null); }
    public static GateVerdict softPass(String condition) { return new GateVerdict(GateResult.SOFT_PASS, condition); }
}
