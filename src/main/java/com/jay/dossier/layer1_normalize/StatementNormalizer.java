package com.jay.dossier.layer1_normalize;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.FiscalPeriod;
import com.jay.dossier.model.LineItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Layer 1 - Statement Normalizer.
 * Rescales raw statements to base currency units, checks that the three statements describe the
 * same period, and builds trailing-twelve-month sums for flow items when four contiguous quarters exist.
 *
 * The raw extraction is never modified; every call returns fresh immutable quarters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementNormalizer {

    private final DossierConfig config;

    /**
     * Normalizes one filing without TTM values.
     * Throws NormalizationException when the statements are misaligned or a currency cannot be converted.
     */
    public CompanyQuarter normalize(RawFiling filing) {
        DossierConfig.Normalization cfg = config.normalization();
        FiscalPeriod period;
        try {
            period = new FiscalPeriod(filing.getFiscalYear(), filing.getFiscalQuarter());
        } catch (IllegalArgumentException e) {
            throw new NormalizationException(filing.getTicker() + ": " + e.getMessage());
        }
        RawStatement income = require(filing.getIncomeStatement(), "income statement", filing);
        RawStatement balance = require(filing.getBalanceSheet(), "balance sheet", filing);
        RawStatement cash    = require(filing.getCashFlow(), "cash flow statement", filing);

        // ── Period alignment ─────────────────────────────────────────────────
        LocalDate periodEnd = income.getPeriodEnd();
        for (RawStatement other : List.of(balance, cash)) {
            long gap = Math.abs(ChronoUnit.DAYS.between(periodEnd, other.getPeriodEnd()));
            if (gap > cfg.getPeriodToleranceDays()) {
                throw new NormalizationException(String.format(
                    "%s %s: statement period ends %s and %s differ by %d days (tolerance %d)",
                    filing.getTicker(), period.key(), periodEnd, other.getPeriodEnd(),
                    gap, cfg.getPeriodToleranceDays()));
            }
        }

        String base = cfg.getBaseCurrency();
        CompanyQuarter.CompanyQuarterBuilder q = CompanyQuarter.builder()
            .ticker(filing.getTicker())
            .period(period)
            .periodEnd(periodEnd)
            .currency(base)
            .incomeStatement(scaleStatement(income, filing))
            .balanceSheet(scaleStatement(balance, filing))
            .cashFlow(scaleStatement(cash, filing));

        // ── Segments and footnotes ───────────────────────────────────────────
        double segmentFactor = factor(
            firstNonBlank(filing.getSegmentScaleHint(), income.getScaleHint()), income.getCurrency(), filing);
        Map<String, Map<String, Double>> segments = new TreeMap<>();
        filing.getSegments().forEach((segment, lines) -> {
            Map<String, Double> scaled = new TreeMap<>();
            lines.forEach((line, value) -> scaled.put(line, value * segmentFactor));
            segments.put(segment, Map.copyOf(scaled));
        });
        q.segments(segments);

        double footnoteFactor = factor(
            firstNonBlank(filing.getFootnoteScaleHint(), balance.getScaleHint()), balance.getCurrency(), filing);
        filing.getFootnotes().forEach((name, value) ->
            q.footnote(name, new LineItem(value * footnoteFactor, base)));

        q.kpis(filing.getKpis());
        return q.build();
    }

    /**
     * Normalizes an ordered run of filings and fills TTM values on every quarter that closes
     * four contiguous reported quarters. Missing or non-contiguous windows leave TTM absent.
     */
    public List<CompanyQuarter> normalizeHistory(List<RawFiling> filings) {
        List<CompanyQuarter> quarters = new ArrayList<>();
        Set<FiscalPeriod> seen = new HashSet<>();
        for (RawFiling filing : filings) {
            CompanyQuarter q = normalize(filing);
            if (!seen.add(q.getPeriod())) {
                throw new NormalizationException(
                    "Duplicate filing for " + q.getTicker() + " " + q.periodKey());
            }
            quarters.add(q);
        }
        quarters.sort(Comparator.comparing(CompanyQuarter::getPeriod));

        List<CompanyQuarter> result = new ArrayList<>(quarters.size());
        for (int i = 0; i < quarters.size(); i++) {
            CompanyQuarter current = quarters.get(i);
            if (i < 3 || !contiguous(quarters.subList(i - 3, i + 1))) {
                result.add(current);
                continue;
            }
            result.add(current.toBuilder().ttm(trailingSums(quarters.subList(i - 3, i + 1))).build());
        }
        log.debug("Normalized {} quarters, {} with TTM values",
            result.size(), result.stream().filter(q -> !q.getTtm().isEmpty()).count());
        return List.copyOf(result);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Map<String, LineItem> scaleStatement(RawStatement statement, RawFiling filing) {
        DossierConfig.Normalization cfg = config.normalization();
        double scale = ScaleDetector.detect(statement.getScaleHint());
        double fx = fxRate(statement.getCurrency(), filing);
        String base = cfg.getBaseCurrency();

        Map<String, LineItem> out = new LinkedHashMap<>();
        statement.getItems().forEach((name, value) -> {
            if (cfg.getPerShareItems().contains(name)) {
                out.put(name, new LineItem(value * fx, base + "/share"));
            } else if (cfg.getShareCountItems().contains(name)) {
                out.put(name, new LineItem(value * scale, "shares"));
            } else {
                out.put(name, new LineItem(value * scale * fx, base));
            }
        });
        return out;
    }

    private double factor(String scaleHint, String currency, RawFiling filing) {
        return ScaleDetector.detect(scaleHint) * fxRate(currency, filing);
    }

    private double fxRate(String currency, RawFiling filing) {
        String base = config.normalization().getBaseCurrency();
        if (currency == null || currency.equalsIgnoreCase(base)) return 1.0;
        Double rate = filing.getFxRates().get(currency.toUpperCase());
        if (rate == null || !Double.isFinite(rate) || rate <= 0) {
            throw new NormalizationException(String.format(
                "%s %d-Q%d: no conversion rate from %s to %s",
                filing.getTicker(), filing.getFiscalYear(), filing.getFiscalQuarter(), currency, base));
        }
        return rate;
    }

    private static boolean contiguous(List<CompanyQuarter> window) {
        for (int i = 1; i < window.size(); i++) {
            if (!window.get(i).getPeriod().previous().equals(window.get(i - 1).getPeriod())) {
                return false;
            }
        }
        return true;
    }

    /** Sums flow items reported in all four quarters. Share counts and per-share items are never summed. */
    private Map<String, LineItem> trailingSums(List<CompanyQuarter> window) {
        DossierConfig.Normalization cfg = config.normalization();
        CompanyQuarter latest = window.get(window.size() - 1);
        Map<String, LineItem> latestFlows = new LinkedHashMap<>(latest.getIncomeStatement());
        latestFlows.putAll(latest.getCashFlow());

        Set<String> excluded = new LinkedHashSet<>(cfg.getShareCountItems());
        excluded.addAll(cfg.getPerShareItems());

        Map<String, LineItem> sums = new TreeMap<>();
        latestFlows.forEach((name, item) -> {
            if (excluded.contains(name)) return;
            double total = 0;
            for (CompanyQuarter q : window) {
                LineItem li = flowItem(q, name);
                if (li == null) return;
                total += li.value();
            }
            sums.put(name, new LineItem(total, item.unit()));
        });
        return sums;
    }

    private static LineItem flowItem(CompanyQuarter q, String name) {
        return Stream.of(q.getIncomeStatement(), q.getCashFlow())
            .map(m -> m.get(name))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
    }

    private static RawStatement require(RawStatement statement, String what, RawFiling filing) {
        if (statement == null || statement.getPeriodEnd() == null) {
            throw new NormalizationException(String.format("%s %d-Q%d: missing %s",
                filing.getTicker(), filing.getFiscalYear(), filing.getFiscalQuarter(), what));
        }
        return statement;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
