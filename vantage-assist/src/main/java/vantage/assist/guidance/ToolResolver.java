package vantage.assist.guidance;

import java.util.Locale;
import java.util.Optional;

public class ToolResolver {
    private static final int NAME_SCORE = 3;
    private static final int KEYWORD_SCORE = 1;

    private final GuidanceCatalog catalog;

    public ToolResolver(GuidanceCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<String> resolve(String question, String toolHint) {
        String hint = toolHint == null ? "" : toolHint.trim().toLowerCase(Locale.ROOT);
        if (!hint.isEmpty() && catalog.contains(hint)) {
            return Optional.of(hint);
        }

        String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
        String best = null;
        int bestScore = 0;
        for (ToolGuidance guidance : catalog.all()) {
            int score = score(guidance, text);
            if (score > bestScore) {
                bestScore = score;
                best = guidance.name();
            }
        }
        return Optional.ofNullable(best);
    }

    static int score(ToolGuidance guidance, String lowercaseText) {
        int score = 0;
        if (lowercaseText.contains(guidance.name())) {
            score += NAME_SCORE;
        }
        for (String keyword : guidance.keywords()) {
            if (lowercaseText.contains(keyword)) {
                score += KEYWORD_SCORE;
            }
        }
        return score;
    }
}
