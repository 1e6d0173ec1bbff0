package com.jay.dossier.layer6_verify;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/** Accepts http(s) URLs whose host is an allowed domain or a subdomain of one. */
public final class SourceAllowlist {

    private final List<String> domains;

    public SourceAllowlist(List<String> domains) {
        this.domains = domains.stream().map(d -> d.trim().toLowerCase(Locale.ROOT)).toList();
    }

    public boolean permits(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) return false;
            if (!scheme.equalsIgnoreCase("https") && !scheme.equalsIgnoreCase("http")) return false;
            String h = host.toLowerCase(Locale.ROOT);
            return domains.stream().anyMatch(d -> h.equals(d) || h.endsWith("." + d));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
