package com.agora.engine;

import com.agora.config.DebateSettings;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Per-word delay for the streaming effect. The whole message should take roughly the display
 * budget, less the time already spent generating it, within the configured per-word bounds
 * and never longer than the gap between automatic turns.
 */
public class WordPacer {

    private final Duration displayBudget;
    private final Duration minDisplayBudget;
    private final Duration minWordDelay;
    private final Duration maxWordDelay;
    private final Duration turnGap;

    public WordPacer(DebateSettings settings) {
        this.displayBudget = settings.getDisplayBudget();
        this.minDisplayBudget = settings.getMinDisplayBudget();
        this.minWordDelay = settings.getMinWordDelay();
        this.maxWordDelay = settings.getMaxWordDelay();
        this.turnGap = settings.getAutoTurnGap();
    }

    public Duration delayPerWord(int wordCount, Duration generationTime) {
        int words = Math.max(wordCount, 1);
        Duration budget = displayBudget.minus(generationTime);
        if (budget.compareTo(minDisplayBudget) < 0) {
            budget = minDisplayBudget;
        }
        long delayMillis = budget.toMillis() / words;
        delayMillis = Math.min(delayMillis, turnGap.toMillis() / words);
        delayMillis = Math.max(minWordDelay.toMillis(), Math.min(delayMillis, maxWordDelay.toMillis()));
        return Duration.ofMillis(delayMillis);
    }

    public static List<String> tokenize(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
