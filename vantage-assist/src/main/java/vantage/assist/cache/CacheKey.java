package vantage.assist.cache;

import java.util.Locale;
import java.util.regex.Pattern;

public record CacheKey(String tool, String contextFingerprint, String question) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static CacheKey of(String tool, String contextFingerprint, String question) {
        return new CacheKey(
                tool == null ? "" : tool,
                contextFingerprint == null ? "" : contextFingerprint,
                normalizeQuestion(question)
        );
    }

    static String normalizeQuestion(String question) {
        if (question == null) {
            return "";
        }
        return WHITESPACE.matcher(question.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
