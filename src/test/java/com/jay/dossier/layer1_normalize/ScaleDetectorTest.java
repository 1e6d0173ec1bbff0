package com.jay.dossier.layer1_normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScaleDetectorTest {

    @Test
    @DisplayName("Header markers map to their multipliers")
    void detectsScaleFromHeader() {
        assertEquals(1e6, ScaleDetector.detect("(in millions, except per share data)"));
        assertEquals(1e3, ScaleDetector.detect("In thousands of U.S. dollars"));
        assertEquals(1e9, ScaleDetector.detect("USD billions"));
        assertEquals(1e6, ScaleDetector.detect("$m"));
    }

    @Test
    @DisplayName("Missing or unmarked headers mean plain units")
    void unmarkedHeaderIsUnits() {
        assertEquals(1.0, ScaleDetector.detect(null));
        assertEquals(1.0, ScaleDetector.detect("  "));
        assertEquals(1.0, ScaleDetector.detect("Consolidated Statements of Operations"));
    }
}
