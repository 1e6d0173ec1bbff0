package com.jay.dossier.layer1_normalize;

import com.jay.dossier.TestFixtures;
import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.FiscalPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementNormalizerTest {

    private StatementNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new StatementNormalizer(new DossierConfig());
    }

    @Test
    @DisplayName("Statements in millions are rescaled to units; shares and per-share items keep their own units")
    void rescalesToBaseUnits() {
        CompanyQuarter q = normalizer.normalize(TestFixtures.filing(2024, 4, 5000));

        assertEquals(5.0e9, q.item(StatementLines.REVENUE).getAsDouble(), 1e-3);
        assertEquals("USD", q.getIncomeStatement().get(StatementLines.REVENUE).unit());
        assertEquals(2.1e9, q.item(StatementLines.DILUTED_SHARES).getAsDouble(), 1e-3);
        assertEquals("shares", q.getIncomeStatement().get(StatementLines.DILUTED_SHARES).unit());
        assertEquals(0.69, q.item("EPS Diluted").getAsDouble(), 1e-12);
        assertEquals("USD/share", q.getIncomeStatement().get("EPS Diluted").unit());
    }

    @Test
    @DisplayName("Segments fall back to the income scale, footnotes to the balance-sheet scale")
    void segmentAndFootnoteScaling() {
        CompanyQuarter q = normalizer.normalize(TestFixtures.filingBuilder(2024, 4, 5000)
            .footnoteScaleHint("(in thousands)")
            .build());

        assertEquals(3.0e9, q.getSegments().get("Cloud").get(StatementLines.SEGMENT_REVENUE), 1e-3);
        assertEquals(1.0e6, q.footnote(StatementLines.DEBT_MATURITY_Y1).getAsDouble(), 1e-6);
    }

    @Test
    @DisplayName("Foreign-currency statements are converted at the supplied rate")
    void convertsForeignCurrency() {
        RawFiling base = TestFixtures.filing(2024, 4, 5000);
        RawFiling eur = RawFiling.builder()
            .ticker(base.getTicker())
            .fiscalYear(2024)
            .fiscalQuarter(4)
            .incomeStatement(RawStatement.builder()
                .periodEnd(base.getIncomeStatement().getPeriodEnd())
                .currency("EUR")
                .scaleHint("in millions")
                .item(StatementLines.REVENUE, 100.0)
                .build())
            .balanceSheet(base.getBalanceSheet())
            .cashFlow(base.getCashFlow())
            .fxRate("EUR", 1.1)
            .build();

        CompanyQuarter q = normalizer.normalize(eur);

        assertEquals(110.0e6, q.item(StatementLines.REVENUE).getAsDouble(), 1e-3);
    }

    @Test
    @DisplayName("A currency without a conversion rate is rejected")
    void missingFxRateThrows() {
        RawFiling base = TestFixtures.filing(2024, 4, 5000);
        RawFiling gbp = RawFiling.builder()
            .ticker(base.getTicker())
            .fiscalYear(2024)
            .fiscalQuarter(4)
            .incomeStatement(RawStatement.builder()
                .periodEnd(base.getIncomeStatement().getPeriodEnd())
                .currency("GBP")
                .item(StatementLines.REVENUE, 100.0)
                .build())
            .balanceSheet(base.getBalanceSheet())
            .cashFlow(base.getCashFlow())
            .build();

        NormalizationException e = assertThrows(NormalizationException.class, () -> normalizer.normalize(gbp));
        assertTrue(e.getMessage().contains("GBP"));
    }

    @Test
    @DisplayName("Statements more than a week apart are a fatal misalignment")
    void misalignedPeriodsThrow() {
        RawFiling base = TestFixtures.filing(2024, 4, 5000);
        RawFiling misaligned = RawFiling.builder()
            .ticker(base.getTicker())
            .fiscalYear(2024)
            .fiscalQuarter(4)
            .incomeStatement(base.getIncomeStatement())
            .balanceSheet(RawStatement.builder()
                .periodEnd(base.getIncomeStatement().getPeriodEnd().minusDays(30))
                .currency("USD")
                .item(StatementLines.CASH, 1.0)
                .build())
            .cashFlow(base.getCashFlow())
            .build();

        assertThrows(NormalizationException.class, () -> normalizer.normalize(misaligned));
    }

    @Test
    @DisplayName("Four contiguous quarters produce TTM sums keyed to the last quarter")
    void ttmFromFourContiguousQuarters() {
        List<CompanyQuarter> history = normalizer.normalizeHistory(TestFixtures.history());

        CompanyQuarter latest = history.get(history.size() - 1);
        assertEquals(new FiscalPeriod(2024, 4), latest.getPeriod());
        assertEquals("TTM-2024Q4", latest.ttmKey());
        // 4,700 + 4,800 + 4,900 + 5,000
        assertEquals(19.4e9, latest.getTtm().get(StatementLines.REVENUE).value(), 1e-2);
        assertEquals(6.4e9, latest.getTtm().get(StatementLines.CFO).value(), 1e-2);
        assertFalse(latest.hasTtm(StatementLines.DILUTED_SHARES), "share counts are never summed");
        assertFalse(latest.hasTtm("EPS Diluted"));
        assertTrue(history.get(2).getTtm().isEmpty(), "fewer than four quarters has no TTM");
    }

    @Test
    @DisplayName("A gap in the quarter sequence leaves TTM absent")
    void nonContiguousQuartersHaveNoTtm() {
        List<RawFiling> filings = new ArrayList<>(TestFixtures.history());
        filings.removeIf(f -> f.getFiscalYear() == 2024 && f.getFiscalQuarter() == 2);

        List<CompanyQuarter> history = normalizer.normalizeHistory(filings);

        CompanyQuarter latest = history.get(history.size() - 1);
        assertTrue(latest.getTtm().isEmpty());
        assertEquals(5.0e9, latest.flow(StatementLines.REVENUE).getAsDouble(), 1e-3,
            "flow falls back to the quarterly value");
    }

    @Test
    @DisplayName("Duplicate periods are rejected")
    void duplicatePeriodThrows() {
        List<RawFiling> filings = new ArrayList<>(TestFixtures.history());
        filings.add(TestFixtures.filing(2024, 4, 5100));

        assertThrows(NormalizationException.class, () -> normalizer.normalizeHistory(filings));
    }

    @Test
    @DisplayName("Input filings are not modified by normalization")
    void rawInputUntouched() {
        RawFiling filing = TestFixtures.filing(2024, 4, 5000);

        normalizer.normalize(filing);

        assertEquals(5000.0, filing.getIncomeStatement().getItems().get(StatementLines.REVENUE));
    }
}
