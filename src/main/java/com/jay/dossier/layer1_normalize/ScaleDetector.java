package com.jay.dossier.layer1_normalize;

import java.util.regex.Pattern;

/**
 * Reads the reporting scale from statement header text. Unmarked statements are in units.
 */
public final class ScaleDetector {

    private static final Pattern BILLIONS  = Pattern.compile("billion|\\bbn\\b|\\$\\s?b\\b");
    private static final Pattern MILLIONS  = Pattern.compile("million|\\bmm\\b|\\bmn\\b|\\$\\s?m\\b");
    private static final Pattern THOUSANDS = Pattern.compile("thousand|\\b000s\\b|\\b000's\\b|\\$\\s?k\\b");

    private ScaleDetector() {}

    public static double detect(String hint) {
        if (hint == null || hint.isBlank()) return 1.0;
        String h = hint.toLowerCase();
        if (BILLIONS.matcher(h).find())  return 1e9;
        if (MILLIONS.matcher(h).find())  return 1e6;
        if (THOUSANDS.matcher(h).find()) return 1e3;
        return 1.0;
    }
}
