package com.agora.session;

import java.util.Random;

/**
 * Utterances produced on the current topic against a budget drawn from [min, max] at each rotation.
 */
public class TurnCounter {

    private final int minTurns;
    private final int maxTurns;
    private final Random random;
    private int count;
    private int budget;

    public TurnCounter(int minTurns, int maxTurns, Random random) {
        if (minTurns < 1 || maxTurns < minTurns) {
            throw new IllegalArgumentException("Invalid turn bounds [" + minTurns + ", " + maxTurns + "]");
        }
        this.minTurns = minTurns;
        this.maxTurns = maxTurns;
        this.random = random;
        reset();
    }

    public void reset() {
        count = 0;
        budget = minTurns + random.nextInt(maxTurns - minTurns + 1);
    }

    public void advance() {
        count++;
    }

    public boolean budgetReached() {
        return count >= budget;
    }

    public int getCount() {
        return count;
    }

    public int getBudget() {
        return budget;
    }
}
