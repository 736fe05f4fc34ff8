package com.agora.engine;

import com.agora.content.ContentRequest;
import com.agora.model.HistoryEntry;
import com.agora.model.Message;
import com.agora.model.MessageType;
import com.agora.model.Persona;
import com.agora.model.Topic;

import java.util.ArrayList;
import java.util.List;

public class PromptComposer {

    private static final int CHAT_LINES = 5;

    private final int maxWords;

    public PromptComposer(int maxWords) {
        this.maxWords = maxWords;
    }

    /**
     * Prompt for an automatic AI-to-AI turn.
     *
     * @param turnOnTopic   zero-based position of this utterance within the topic
     * @param lastOpponent  the opponent's latest utterance, ignored on the opening turn
     * @param directive     how to engage the opponent, ignored on the opening turn
     * @param humanMention  a recent human message to optionally reference, or null
     */
    public ContentRequest autoTurn(Persona speaker, Persona opponent, Topic topic, int turnOnTopic,
                                   boolean humansPresent, List<HistoryEntry> history,
                                   String lastOpponent, RhetoricalDirective directive, Message humanMention) {
        String system = String.format("""
                You are %s, %s.
                Personality: %s.
                Style: %s.
                Debating "%s" with %s (%s).
                %s
                Under %d words. Sharp, direct, conversational.
                Don't start with your name. No quotes. Engage their points.
                Message %d of ongoing conversation, keep it flowing.
                Don't repeat yourself.""",
                speaker.getName(), speaker.getRole(), speaker.getPersonality(), speaker.getStyle(),
                topic.getText(), opponent.getName(), opponent.getRole(),
                humansPresent ? "There are humans watching and participating, acknowledge them occasionally." : "",
                maxWords, turnOnTopic + 1);

        StringBuilder instruction = new StringBuilder();
        instruction.append("Topic: \"").append(topic.getText()).append("\"\n");
        if (turnOnTopic == 0 || lastOpponent == null) {
            instruction.append("You go first. Opening thought.");
        } else {
            instruction.append(directive.apply(opponent.getName(), lastOpponent));
        }
        instruction.append("\nUnder ").append(maxWords).append(" words.");
        if (humanMention != null && turnOnTopic > 0) {
            instruction.append("\n(Also, a human named ").append(humanMention.getSpeakerName())
                    .append(" recently said: \"").append(humanMention.getText())
                    .append("\". You may briefly reference this.)");
        }

        return ContentRequest.builder()
                .persona(speaker)
                .systemPrompt(system)
                .history(history)
                .instruction(instruction.toString())
                .build();
    }

    /**
     * Prompt for answering a human. {@code recent} is the tail of the message log, oldest first.
     */
    public ContentRequest humanReply(Persona speaker, Persona opponent, Topic topic, List<HistoryEntry> history,
                                     List<Message> recent, Message addressed) {
        String system = String.format("""
                You are %s, %s.
                Personality: %s.
                Style: %s.
                You're in a live group debate about "%s" with %s (%s) and human participants.
                A human has joined and said something. Respond to them directly, use their name.
                Be warm but stay in character. Under %d words. Be conversational.""",
                speaker.getName(), speaker.getRole(), speaker.getPersonality(), speaker.getStyle(),
                topic.getText(), opponent.getName(), opponent.getRole(), maxWords);

        String instruction = "Topic: \"" + topic.getText() + "\"\n"
                + "Recent chat:\n" + chatLines(recent) + "\n\n"
                + addressed.getSpeakerName() + " said: \"" + addressed.getText() + "\"\n"
                + "Respond to " + addressed.getSpeakerName() + "'s message. Under " + maxWords + " words.";

        return ContentRequest.builder()
                .persona(speaker)
                .systemPrompt(system)
                .history(history)
                .instruction(instruction)
                .build();
    }

    private String chatLines(List<Message> recent) {
        List<String> lines = new ArrayList<>();
        for (Message m : recent) {
            if (m.getType() == MessageType.HUMAN || m.getType() == MessageType.AI) {
                lines.add(m.getSpeakerName() + ": " + m.getText());
            }
        }
        if (lines.size() > CHAT_LINES) {
            lines = lines.subList(lines.size() - CHAT_LINES, lines.size());
        }
        return String.join("\n", lines);
    }
}
