package com.jay.dossier.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes all engine thresholds from dossier.yaml.
 * Values are read once at startup. A freshly constructed instance carries the built-in defaults,
 * which is what the engines use when they are created outside the Spring context.
 */
@Slf4j
@Component
public class DossierConfig {

    @Value("${dossier.config-file:dossier.yaml}")
    private String configFile = "dossier.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Normalization normalization = new Normalization();
    private Valuation valuation = new Valuation();
    private Gates gates = new Gates();
    private Provenance provenance = new Provenance();
    private Verifier verifier = new Verifier();
    private Monitor monitor = new Monitor();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            try (is) {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                if (root.getNormalization() != null) this.normalization = root.getNormalization();
                if (root.getValuation() != null)     this.valuation     = root.getValuation();
                if (root.getGates() != null)         this.gates         = root.getGates();
                if (root.getProvenance() != null)    this.provenance    = root.getProvenance();
                if (root.getVerifier() != null)      this.verifier      = root.getVerifier();
                if (root.getMonitor() != null)       this.monitor       = root.getMonitor();
            }
            log.info("DossierConfig loaded from '{}'. Base currency: {}, verifier seed: {}",
                configFile, normalization.getBaseCurrency(), verifier.getSampleSeed());
        } catch (Exception e) {
            log.error("Failed to load {}, engines will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Normalization normalization() { return normalization; }
    public Valuation valuation()         { return valuation; }
    public Gates gates()                 { return gates; }
    public Provenance provenance()       { return provenance; }
    public Verifier verifier()           { return verifier; }
    public Monitor monitor()             { return monitor; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Normalization normalization = new Normalization();
        private Valuation valuation = new Valuation();
        private Gates gates = new Gates();
        private Provenance provenance = new Provenance();
        private Verifier verifier = new Verifier();
        private Monitor monitor = new Monitor();
    }

    @Data public static class Normalization {
        private String baseCurrency = "USD";
        private int periodToleranceDays = 7;
        // Scaled with the statement but never currency-converted or summed into TTM
        private List<String> shareCountItems = List.of("Diluted Shares", "Basic Shares", "Shares Outstanding");
        // Left unscaled, only currency-converted
        private List<String> perShareItems = List.of("EPS Basic", "EPS Diluted", "Dividends Per Share");
    }

    @Data public static class Valuation {
        private int waccBandBps = 100;
        private int maxEquityAdjustmentBps = 150;
        private double terminalGrowthCapSpread = 0.005;
        private double defaultInflation = 0.02;
        private double defaultRealGrowth = 0.01;
        private double defaultTaxRate = 0.21;
        private int forecastYears = 5;
        private Solver solver = new Solver();
        private Sensitivity sensitivity = new Sensitivity();
        private Hurdle hurdle = new Hurdle();
    }

    @Data public static class Solver {
        private int maxIterations = 200;
        private double epsilon = 1e-7;
        private double lowerBound = -0.99;
        private double upperBound = 10.0;
        private long timeBudgetMillis = 250;
    }

    @Data public static class Sensitivity {
        private int waccShiftBps = 100;
        private int growthShiftBps = 50;
    }

    @Data public static class Hurdle {
        private double base = 0.15;
        private Map<String, Integer> adjustmentsBps = new LinkedHashMap<>(Map.of(
            "mature", -100,
            "marketplace", -50,
            "subscription", -50,
            "emergent", 200));
    }

    @Data public static class Gates {
        private int flipTriggerHorizonDays = 90;
        private double accrualsHardBound = 0.10;
        private double accrualsSoftBound = 0.15;
        private double maxSolvencyLeverage = 4.0;
        private double minTakeRate = 0.10;
        private double minNetRevenueRetention = 1.0;
        private double matureMaxLeverage = 1.0;
        private int segmentHistoryQuarters = 8;
    }

    @Data public static class Provenance {
        private int maxQuoteWords = 30;
        private String systemDocumentId = "SYSTEM-DERIVED";
        private String systemUrl = "https://localhost/system";
        private String systemQuote = "Derived from normalized statements";
    }

    @Data public static class Verifier {
        private int sampleSize = 5;
        private long sampleSeed = 42L;
        private double relativeTolerance = 0.01;
        private List<String> allowedDomains = List.of(
            "sec.gov", "federalreserve.gov", "fred.stlouisfed.org", "treasury.gov", "bls.gov");
    }

    @Data public static class Monitor {
        private double eqTolerance = 1e-9;
    }
}
