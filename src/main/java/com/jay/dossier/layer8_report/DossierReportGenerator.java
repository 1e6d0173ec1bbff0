package com.jay.dossier.layer8_report;

import com.jay.dossier.model.DeltaEntry;
import com.jay.dossier.model.DossierReport;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.HurdleRate;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.Scenario;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.enums.ScenarioName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Layer 8 - Dossier Report Generator.
 * Renders a committed dossier as plain text for review. The QA verdict always comes first;
 * a blocked dossier still shows every section so the reviewer can see what was flagged.
 */
@Component
public class DossierReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    public String render(DossierReport report) {
        DossierReport.Analyst analyst = report.getAnalyst();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("DOSSIER  %s  %s  (as of %s)%n", report.getTicker(), analyst.getPeriod(), report.getAsOf()));
        sb.append(DIVIDER).append("\n");

        // QA first
        if (report.getVerifier().passed()) {
            sb.append("QA STATUS         :  PASS\n");
        } else {
            sb.append("QA STATUS         :  BLOCKER\n");
            report.getVerifier().reasons().forEach(r -> sb.append("   • ").append(r).append("\n"));
        }
        sb.append(DIVIDER).append("\n");

        sb.append(String.format("ANALYSIS PATH     :  %s%n", analyst.getPath()));
        analyst.getPathReasons().forEach(r -> sb.append("   - ").append(r).append("\n"));
        sb.append(String.format("OVERALL           :  %s%n", analyst.getOverall()));
        sb.append(DIVIDER).append("\n");

        sb.append("METRICS\n");
        for (Metric m : analyst.getMetrics()) {
            sb.append(String.format("   %-34s %16s %-10s [%s]%n",
                m.getName(), m.getValue(), m.getUnit() == null ? "" : m.getUnit(),
                m.getProvenance().documentId()));
        }
        sb.append(DIVIDER).append("\n");

        sb.append("HARD GATES\n");
        analyst.getHardGates().forEach(g -> appendGate(sb, g));
        sb.append("SOFT GATES\n");
        analyst.getSoftGates().forEach(g -> appendGate(sb, g));
        sb.append(DIVIDER).append("\n");

        appendValuation(sb, analyst.getValuation());
        sb.append(DIVIDER).append("\n");

        if (!analyst.getProvenanceIssues().isEmpty()) {
            sb.append("PROVENANCE ISSUES\n");
            analyst.getProvenanceIssues().forEach(i ->
                sb.append(String.format("   • %s: %s%n", i.metric(), i.reason())));
            sb.append(DIVIDER).append("\n");
        }

        sb.append("DELTA\n");
        for (DeltaEntry d : report.getDelta().values()) {
            sb.append(String.format("   %-20s %14s  QoQ %10s (%s)  YoY %10s (%s)%n",
                d.metric(), num(d.current()), num(d.qoqAbsolute()), pct(d.qoqPercent()),
                num(d.yoyAbsolute()), pct(d.yoyPercent())));
        }
        sb.append(DIVIDER).append("\n");

        sb.append(renderAlerts(report.getTriggers()));
        sb.append("─────────────────────────────────────────────────────────\n");
        return sb.toString();
    }

    /** Trigger section on its own, also used for the daily sweep log. */
    public String renderAlerts(List<TriggerAlert> alerts) {
        if (alerts.isEmpty()) {
            return "TRIGGERS          :  none firing\n";
        }
        StringBuilder sb = new StringBuilder("TRIGGERS\n");
        for (TriggerAlert a : alerts) {
            sb.append(String.format("   %-8s %s (%d day(s) to %s)%n",
                a.status(), a.message(), a.daysRemaining(), a.trigger().deadline()));
        }
        return sb.toString();
    }

    private static void appendGate(StringBuilder sb, GateRow g) {
        sb.append(String.format("   %-24s %-10s %s%n", g.getGateId(), g.getResult(), g.getRule() == null ? "" : g.getRule()));
        if (g.getFlipTrigger() != null) {
            sb.append(String.format("      flip: %s by %s%n", g.getFlipTrigger().description(), g.getFlipTrigger().deadline()));
        }
        g.getEvidence().forEach(e -> sb.append(String.format("      \"%s\" (%s)%n", e.quote(), e.documentId())));
    }

    private static void appendValuation(StringBuilder sb, ValuationBlock v) {
        if (v == null) {
            sb.append("VALUATION         :  no market inputs supplied\n");
            return;
        }
        sb.append(String.format("WACC              :  %s  (band %s to %s)%n",
            pct(v.getWacc().point()), pct(v.getWacc().lower()), pct(v.getWacc().upper())));
        sb.append(String.format("TERMINAL GROWTH   :  %s%s%n",
            pct(v.getTerminalGrowth().value()), v.getTerminalGrowth().capped() ? "  (capped)" : ""));
        HurdleRate hurdle = v.getHurdle();
        sb.append(String.format("HURDLE IRR        :  %s%n", pct(hurdle.value())));
        hurdle.adjustments().forEach(a -> sb.append(String.format("   %+d bps  %s%n", a.bps(), a.name())));
        sb.append(String.format("PRICE             :  %.2f   SHARES %s   NET DEBT %s%n",
            v.getPrice(), num(v.getSharesDiluted()), num(v.getNetDebt())));
        for (ScenarioName name : ScenarioName.values()) {
            Scenario s = v.scenario(name);
            if (s != null) {
                sb.append(String.format("   %-5s IRR %s%n", name, pct(s.irr())));
            }
        }
        if (v.getSensitivity() != null) {
            sb.append("SENSITIVITY\n");
            for (Map.Entry<String, Double> cell : v.getSensitivity().cells().entrySet()) {
                sb.append(String.format("   %-14s %s%n", cell.getKey(), pct(cell.getValue())));
            }
        }
    }

    private static String num(Double value) {
        return value == null ? "NA" : String.format("%,.2f", value);
    }

    private static String pct(Double value) {
        return value == null ? "NA" : String.format("%.2f%%", value * 100);
    }
}
