package org.parable.runtime.store;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChunkTest {

    @Test
    void symbolsArePackedMostSignificantBitFirst() {
        // 000001 000010 000011 000100 -> 0x04 0x20 0xC4
        Chunk chunk = Chunk.pack(3, 1, 2, 3, 4);

        assertThat(chunk.toByteArray()).containsExactly(0x04, 0x20, 0xC4);
        assertThat(chunk.symbolAt(0)).isEqualTo(1);
        assertThat(chunk.symbolAt(3)).isEqualTo(4);
    }

    @Test
    void fullChunkHoldsEightSymbols() {
        Chunk chunk = Chunk.pack(6, 63, 0, 63, 0, 33, 12, 1, 62);

        assertThat(chunk.symbolCount()).isEqualTo(8);
        for (int i = 0; i < 8; i++) {
            assertThat(chunk.symbolAt(i)).isEqualTo(new int[]{63, 0, 63, 0, 33, 12, 1, 62}[i]);
        }
    }

    @Test
    void missingSymbolsAreZero() {
        Chunk chunk = Chunk.pack(6, 5);

        assertThat(chunk.symbolAt(0)).isEqualTo(5);
        assertThat(chunk.symbolAt(7)).isZero();
    }

    @Test
    void rejectsTooManySymbols() {
        assertThatThrownBy(() -> Chunk.pack(3, 1, 2, 3, 4, 5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityFollowsContent() {
        assertThat(Chunk.pack(6, 1, 2)).isEqualTo(new Chunk(Chunk.pack(6, 1, 2).toByteArray()));
        assertThat(Chunk.pack(6, 1, 2)).isNotEqualTo(Chunk.pack(6, 2, 1));
        assertThat(Chunk.pack(3, 1, 2, 3, 4)).hasToString("Chunk[1 2 3 4]");
    }
}
