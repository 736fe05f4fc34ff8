package com.agora.session;

import com.agora.model.HistoryEntry;
import com.agora.model.HistoryRole;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Trailing window of AI utterances, rendered per persona: its own turns become
 * {@link HistoryRole#SELF}, the opponent's {@link HistoryRole#PEER}.
 * Only touched by the engine thread.
 */
public class ConversationHistory {

    private final int window;
    private final Deque<Utterance> utterances = new ArrayDeque<>();

    public ConversationHistory(int window) {
        this.window = window;
    }

    public void record(String speakerId, String text) {
        utterances.addLast(new Utterance(speakerId, text));
        while (utterances.size() > window) {
            utterances.removeFirst();
        }
    }

    public List<HistoryEntry> viewFor(String personaId) {
        List<HistoryEntry> view = new ArrayList<>(utterances.size());
        for (Utterance u : utterances) {
            HistoryRole role = u.speakerId.equals(personaId) ? HistoryRole.SELF : HistoryRole.PEER;
            view.add(new HistoryEntry(role, u.text));
        }
        return view;
    }

    public void truncate(int keep) {
        while (utterances.size() > keep) {
            utterances.removeFirst();
        }
    }

    public int size() {
        return utterances.size();
    }

    private static final class Utterance {
        private final String speakerId;
        private final String text;

        private Utterance(String speakerId, String text) {
            this.speakerId = speakerId;
            this.text = text;
        }
    }
}
