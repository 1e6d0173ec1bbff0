package com.jay.dossier.layer6_verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceAllowlistTest {

    private final SourceAllowlist allowlist = new SourceAllowlist(List.of("sec.gov", "fred.stlouisfed.org"));

    @Test
    @DisplayName("Listed hosts and their subdomains are permitted")
    void permitsListedHosts() {
        assertTrue(allowlist.permits("https://www.sec.gov/Archives/edgar/data/1/x.htm"));
        assertTrue(allowlist.permits("http://fred.stlouisfed.org/series/DGS10"));
    }

    @Test
    @DisplayName("Look-alike hosts, other schemes and junk are rejected")
    void rejectsEverythingElse() {
        assertFalse(allowlist.permits("https://notsec.gov/x"));
        assertFalse(allowlist.permits("https://sec.gov.example.com/x"));
        assertFalse(allowlist.permits("ftp://www.sec.gov/x"));
        assertFalse(allowlist.permits("not a url"));
        assertFalse(allowlist.permits(null));
    }
}
