package com.agora.testsupport;

import com.agora.config.DebateSettings;
import com.agora.model.Persona;

import java.time.Duration;
import java.util.List;

public final class TestSettings {

    private TestSettings() {
    }

    /**
     * Production defaults, except for a 1 ms inbound poll so idle iterations return at once.
     */
    public static DebateSettings.DebateSettingsBuilder defaults() {
        return DebateSettings.builder()
                .maxUptime(Duration.ofSeconds(21300))
                .shutdownThreshold(Duration.ofSeconds(60))
                .autoTurnGap(Duration.ofSeconds(25))
                .firstTurnDelay(Duration.ofSeconds(6))
                .topicChangeDelay(Duration.ofSeconds(5))
                .humanCooldown(Duration.ofSeconds(15))
                .settleMin(Duration.ofSeconds(3))
                .settleMax(Duration.ofSeconds(6))
                .pollTimeout(Duration.ofMillis(1))
                .failureBackoff(Duration.ofSeconds(5))
                .minTurnsPerTopic(20)
                .maxTurnsPerTopic(30)
                .historyWindow(16)
                .historyKeptOnRotation(6)
                .displayBudget(Duration.ofSeconds(18))
                .minDisplayBudget(Duration.ofSeconds(6))
                .minWordDelay(Duration.ofMillis(60))
                .maxWordDelay(Duration.ofMillis(500))
                .maxWords(80)
                .nameMaxLength(20)
                .textMaxLength(500)
                .snapshotWindow(120)
                .inboxCapacity(400)
                .pingInterval(Duration.ofSeconds(25))
                .palette(List.of("#ff9800", "#e91e63", "#9c27b0", "#03a9f4"));
    }

    public static Persona persona(String id, String name) {
        return Persona.builder()
                .id(id)
                .name(name)
                .avatar("*")
                .color("#000000")
                .role(name + "'s role")
                .personality("stubborn")
                .style("terse")
                .build();
    }
}
