package org.parable.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void sameSeedGivesSameSequence() {
        SeededRandomProvider a = new SeededRandomProvider(99L);
        SeededRandomProvider b = new SeededRandomProvider(99L);

        for (int i = 0; i < 50; i++) {
            assertThat(a.nextInt(1000)).isEqualTo(b.nextInt(1000));
        }
        assertThat(a.getSeed()).isEqualTo(99L);
    }

    @Test
    void valuesStayWithinBound() {
        SeededRandomProvider random = new SeededRandomProvider(5L);

        for (int i = 0; i < 200; i++) {
            assertThat(random.nextInt(3)).isBetween(0, 2);
        }
    }

    @Test
    void differentSeedsGiveDifferentSequences() {
        SeededRandomProvider a = new SeededRandomProvider(1L);
        SeededRandomProvider b = new SeededRandomProvider(2L);

        int[] first = new int[10];
        int[] second = new int[10];
        for (int i = 0; i < 10; i++) {
            first[i] = a.nextInt(Integer.MAX_VALUE);
            second[i] = b.nextInt(Integer.MAX_VALUE);
        }
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new SeededRandomProvider(1L).nextInt(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
