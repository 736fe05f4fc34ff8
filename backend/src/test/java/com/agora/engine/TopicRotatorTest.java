package com.agora.engine;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicRotatorTest {

    private static final List<String> POOL = List.of("a", "b", "c", "d", "e", "f", "g");

    @Test
    void coversWholePoolBeforeRepeating() {
        for (long seed = 0; seed < 25; seed++) {
            TopicRotator rotator = new TopicRotator(POOL, new Random(seed));
            for (int cycle = 0; cycle < 3; cycle++) {
                Set<String> seen = new HashSet<>();
                for (int i = 0; i < POOL.size(); i++) {
                    assertThat(seen.add(rotator.pick())).as("seed %d cycle %d pick %d", seed, cycle, i).isTrue();
                }
                assertThat(seen).containsExactlyInAnyOrderElementsOf(POOL);
            }
        }
    }

    @Test
    void singleTopicPoolRepeatsForever() {
        TopicRotator rotator = new TopicRotator(List.of("only"), new Random(1));
        assertThat(rotator.pick()).isEqualTo("only");
        assertThat(rotator.pick()).isEqualTo("only");
    }

    @Test
    void duplicatesInPoolAreCollapsed() {
        TopicRotator rotator = new TopicRotator(List.of("x", "x", "y"), new Random(3));
        assertThat(rotator.poolSize()).isEqualTo(2);
    }

    @Test
    void rejectsEmptyPool() {
        assertThatThrownBy(() -> new TopicRotator(List.of(), new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
