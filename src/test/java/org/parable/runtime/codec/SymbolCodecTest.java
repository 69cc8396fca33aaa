package org.parable.runtime.codec;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SymbolCodecTest {

    @Test
    void lettersUseTheStrideSevenLayout() {
        assertThat(SymbolCodec.decode(0)).isEqualTo('a');
        assertThat(SymbolCodec.decode(7)).isEqualTo('b');
        assertThat(SymbolCodec.decode(23)).isEqualTo('h');
        assertThat(SymbolCodec.decode(4)).isEqualTo('i');
        assertThat(SymbolCodec.decode(19)).isEqualTo('z');
    }

    @Test
    void fixedAndDigitSymbols() {
        assertThat(SymbolCodec.decode(26)).isEqualTo(' ');
        assertThat(SymbolCodec.decode(33)).isEqualTo('@');
        assertThat(SymbolCodec.decode(35)).isEqualTo('.');
        assertThat(SymbolCodec.decode(47)).isEqualTo('\\');
        assertThat(SymbolCodec.decode(52)).isEqualTo('0');
        assertThat(SymbolCodec.decode(61)).isEqualTo('9');
    }

    @Test
    void unassignedSymbolsDecodeToNul() {
        for (int nip : new int[]{48, 49, 50, 51, 62, 63}) {
            assertThat(SymbolCodec.decode(nip)).as("symbol %d", nip).isEqualTo(SymbolCodec.NUL);
            assertThat(SymbolCodec.isAssigned(nip)).isFalse();
        }
    }

    @Test
    void everyAssignedSymbolRoundTrips() {
        Set<Character> seen = new HashSet<>();
        for (int nip = 0; nip < SymbolCodec.SYMBOL_COUNT; nip++) {
            char ch = SymbolCodec.decode(nip);
            if (ch != SymbolCodec.NUL) {
                assertThat(SymbolCodec.encode(ch)).as("symbol %d ('%s')", nip, ch).isEqualTo(nip);
                assertThat(seen.add(ch)).as("duplicate character '%s'", ch).isTrue();
            }
        }
        assertThat(seen).hasSize(58);
    }

    @Test
    void uppercaseFoldsToLowercase() {
        for (char ch = 'A'; ch <= 'Z'; ch++) {
            assertThat(SymbolCodec.encode(ch)).isEqualTo(SymbolCodec.encode(Character.toLowerCase(ch)));
        }
    }

    @Test
    void unmappedCharactersEncodeToEndSym() {
        assertThat(SymbolCodec.encode('~')).isEqualTo(SymbolCodec.END_SYMBOL);
        assertThat(SymbolCodec.encode('\n')).isEqualTo(SymbolCodec.END_SYMBOL);
        assertThat(SymbolCodec.encode('é')).isEqualTo(SymbolCodec.END_SYMBOL);
    }

    @Test
    void encodesStrings() {
        assertThat(SymbolCodec.encode("Hi.")).containsExactly(23, 4, 35);
    }

    @Test
    void controlMarkersAreNotPrintable() {
        for (ControlCode code : ControlCode.values()) {
            assertThat(SymbolCodec.isPrintable(code.symbol())).as(code.name()).isFalse();
            assertThat(ControlCode.fromChar(SymbolCodec.decode(code.symbol()))).contains(code);
        }
        assertThat(SymbolCodec.isPrintable(SymbolCodec.encode('#'))).isTrue();
        assertThat(ControlCode.END.symbol()).isEqualTo(SymbolCodec.END_SYMBOL);
    }
}
