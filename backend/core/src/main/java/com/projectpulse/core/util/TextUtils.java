package com.projectpulse.core.util;

import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    /**
     * Collapses every whitespace run to a single space and trims the ends. Case is preserved.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} characters, preferring a word boundary and ending with an
     * ellipsis. A non-positive limit means unlimited.
     */
    public static String truncate(String text, int maxLength) {
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return text.substring(0, maxLength);
        }
        String cut = text.substring(0, maxLength - 3);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > maxLength * 0.8) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + "...";
    }
}
