package com.agora.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the debate session, resolved once from {@code app.*} properties.
 */
@Value
@Builder(toBuilder = true)
public class DebateSettings {
    Duration maxUptime;
    Duration shutdownThreshold;

    Duration autoTurnGap;
    Duration firstTurnDelay;
    Duration topicChangeDelay;
    Duration humanCooldown;
    Duration settleMin;
    Duration settleMax;
    Duration pollTimeout;
    Duration failureBackoff;

    int minTurnsPerTopic;
    int maxTurnsPerTopic;
    int historyWindow;
    int historyKeptOnRotation;

    Duration displayBudget;
    Duration minDisplayBudget;
    Duration minWordDelay;
    Duration maxWordDelay;
    int maxWords;

    int nameMaxLength;
    int textMaxLength;
    int snapshotWindow;
    int inboxCapacity;
    Duration pingInterval;
    List<String> palette;
}
