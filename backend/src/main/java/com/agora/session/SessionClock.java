package com.agora.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Session lifetime: boot instant, uptime budget and the terminal shutdown flag.
 */
public class SessionClock {

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Instant boot;
    private final Duration maxUptime;
    private volatile boolean shutdown;

    public SessionClock(Clock clock, Duration maxUptime) {
        this.clock = clock;
        this.boot = clock.instant();
        this.maxUptime = maxUptime;
    }

    public Instant getBoot() {
        return boot;
    }

    public Duration getMaxUptime() {
        return maxUptime;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Wall-clock time as shown next to messages (UTC, HH:mm).
     */
    public String displayTime() {
        return DISPLAY_TIME.format(clock.instant());
    }

    public Duration timeRemaining() {
        Duration left = maxUptime.minus(Duration.between(boot, clock.instant()));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public long secondsRemaining() {
        return timeRemaining().getSeconds();
    }

    /**
     * True once whole seconds remaining have dropped to the safety threshold.
     */
    public boolean isExpiring(Duration threshold) {
        return secondsRemaining() <= threshold.getSeconds();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public void markShutdown() {
        this.shutdown = true;
    }
}
