package com.jay.dossier.layer5_provenance;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.Document;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.Provenance;
import com.jay.dossier.model.ProvenanceIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Layer 5 - Provenance Validator.
 * Checks each cited number against its source: the quote must appear in the stored document
 * text (ignoring case and whitespace runs), stay within the word limit, and come from a primary
 * filing unless the metric is a flagged macro or market input.
 *
 * Problems are collected, never thrown; the verifier decides what they mean for the dossier.
 * NA metrics are checked too, unless they carry nothing but the system-derived marker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProvenanceValidator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DossierConfig config;

    public List<ProvenanceIssue> validate(Collection<Metric> metrics, DocumentLookup documents) {
        List<ProvenanceIssue> issues = new ArrayList<>();
        for (Metric metric : metrics) {
            if (uncited(metric)) continue;
            issues.addAll(check(metric, documents));
        }
        if (!issues.isEmpty()) {
            log.warn("Provenance validation found {} issue(s)", issues.size());
        }
        return issues;
    }

    public List<ProvenanceIssue> check(Metric metric, DocumentLookup documents) {
        List<ProvenanceIssue> issues = new ArrayList<>();
        String name = metric.getName();
        Provenance p = metric.getProvenance();

        if (isBlank(p.documentId()) || isBlank(p.pageOrSection()) || isBlank(p.quote()) || isBlank(p.url())) {
            issues.add(new ProvenanceIssue(name, "missing provenance fields"));
            if (isBlank(p.documentId()) || isBlank(p.quote())) return issues;
        }

        int words = WHITESPACE.split(p.quote().trim()).length;
        if (words > config.provenance().getMaxQuoteWords()) {
            issues.add(new ProvenanceIssue(name, String.format("quote has %d words (max %d)",
                words, config.provenance().getMaxQuoteWords())));
        }

        Optional<Document> document = documents.find(p.documentId());
        if (document.isEmpty()) {
            issues.add(new ProvenanceIssue(name, "unable to load source document " + p.documentId()));
            return issues;
        }
        Document doc = document.get();

        if (doc.getSourceType() == null) {
            issues.add(new ProvenanceIssue(name, "source document has no source type"));
        } else if (!doc.getSourceType().isPrimary() && !metric.isMarketInput()) {
            issues.add(new ProvenanceIssue(name, String.format(
                "source type %s is only permitted for macro/market inputs", doc.getSourceType().label())));
        }

        if (doc.getText() == null || !normalize(doc.getText()).contains(normalize(p.quote()))) {
            issues.add(new ProvenanceIssue(name, "quote not found in source document " + doc.getId()));
        }
        return issues;
    }

    /**
     * An NA metric that only carries the system-derived marker has no number and no source to
     * check. Any other citation is validated, whatever the value.
     */
    public boolean uncited(Metric metric) {
        return metric.getValue().isNa()
            && config.provenance().getSystemDocumentId().equals(metric.getProvenance().documentId());
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
