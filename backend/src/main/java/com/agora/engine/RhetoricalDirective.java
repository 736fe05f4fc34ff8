package com.agora.engine;

/**
 * Ways to answer the opponent's latest point on a non-opening automatic turn.
 * Templates take the opponent's name and their last utterance.
 */
public enum RhetoricalDirective {
    DIRECT_CHALLENGE("Respond to %s: \"%s\"\nPush back on their weakest point."),
    REAL_WORLD_EVIDENCE("%s said: \"%s\"\nGive a real-world example that counters this."),
    ACKNOWLEDGE_THEN_REBUT("%s said: \"%s\"\nAcknowledge something right, then hit harder."),
    PROBING_QUESTION("%s said: \"%s\"\nAsk a sharp question they'd struggle with."),
    EXPOSE_ASSUMPTION("%s said: \"%s\"\nExpose the assumption behind their argument."),
    NEW_ANGLE("%s said: \"%s\"\nBring up something nobody has mentioned yet."),
    PERSONAL_STAKES("%s said: \"%s\"\nWhy does this topic matter to someone like you?"),
    COMMON_GROUND("%s said: \"%s\"\nWhere do you both agree vs truly disagree?");

    private final String template;

    RhetoricalDirective(String template) {
        this.template = template;
    }

    public String apply(String opponentName, String lastUtterance) {
        return String.format(template, opponentName, lastUtterance);
    }
}
