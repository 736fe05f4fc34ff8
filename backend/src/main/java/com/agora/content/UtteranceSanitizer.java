package com.agora.content;

import com.agora.exception.TransientContentException;
import com.agora.model.Persona;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans model output before it is accepted as an utterance.
 */
public class UtteranceSanitizer {

    // "Name:" or "Name —" or "Name - "; a hyphen glued to the word ("Well-being") is not a separator
    private static final Pattern WORD_PREFIX = Pattern.compile("^\\w+(\\s*[:—]|\\s+-(?=\\s))\\s*");
    private static final String QUOTES = "\"'“”‘’";

    private final int maxWords;

    public UtteranceSanitizer(int maxWords) {
        this.maxWords = maxWords;
    }

    public String clean(String raw, Persona speaker) {
        if (raw == null) {
            throw new TransientContentException("No content returned");
        }
        String text = raw.strip();
        text = stripSpeakerPrefix(text, speaker);
        text = stripQuotes(text);

        List<String> words = List.of(text.isEmpty() ? new String[0] : text.split("\\s+"));
        if (words.isEmpty()) {
            throw new TransientContentException("Empty utterance after cleanup");
        }
        if (words.size() > maxWords) {
            words = words.subList(0, maxWords);
        }
        return String.join(" ", words);
    }

    private String stripSpeakerPrefix(String text, Persona speaker) {
        if (speaker != null) {
            for (String prefix : new String[]{speaker.getAvatar() + " " + speaker.getName(), speaker.getName()}) {
                if (prefix != null && text.regionMatches(true, 0, prefix, 0, prefix.length())) {
                    String after = text.substring(prefix.length());
                    String rest = after.stripLeading();
                    if (isSeparator(rest, rest.length() < after.length())) {
                        return rest.substring(1).strip();
                    }
                }
            }
        }
        return WORD_PREFIX.matcher(text).replaceFirst("").strip();
    }

    private static boolean isSeparator(String rest, boolean spaced) {
        if (rest.isEmpty()) {
            return false;
        }
        char c = rest.charAt(0);
        if (c == ':' || c == '—') {
            return true;
        }
        return c == '-' && spaced && (rest.length() == 1 || Character.isWhitespace(rest.charAt(1)));
    }

    private String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && QUOTES.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTES.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end).strip();
    }
}
