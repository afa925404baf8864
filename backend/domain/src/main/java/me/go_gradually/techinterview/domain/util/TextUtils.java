package me.go_gradually.techinterview.domain.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

public final class TextUtils {
    public static final String ELLIPSIS = "...";

    private TextUtils() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim();
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /**
     * Cuts {@code text} to {@code maxChars} characters and marks the cut with an ellipsis.
     * Text that already fits is returned trimmed and unmarked.
     */
    public static String truncateWithEllipsis(String text, int maxChars) {
        String normalized = normalize(text);
        if (maxChars <= 0 || normalized.codePointCount(0, normalized.length()) <= maxChars) {
            return normalized;
        }
        int cut = normalized.offsetByCodePoints(0, maxChars);
        return normalized.substring(0, cut).trim() + ELLIPSIS;
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    /**
     * Appends every non-blank value of {@code incoming} that {@code target} does not already hold.
     */
    public static void appendDistinct(List<String> target, Collection<String> incoming) {
        if (incoming == null) {
            return;
        }
        for (String value : incoming) {
            if (isBlank(value)) {
                continue;
            }
            String normalized = value.trim();
            if (!target.contains(normalized)) {
                target.add(normalized);
            }
        }
    }

    public static List<String> cleanList(Collection<String> values) {
        List<String> cleaned = new ArrayList<>();
        appendDistinct(cleaned, values);
        return cleaned;
    }
}
