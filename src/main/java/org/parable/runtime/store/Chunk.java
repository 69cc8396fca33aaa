package org.parable.runtime.store;

import org.parable.runtime.Config;

import java.util.Arrays;

/**
 * A group of 6-bit symbols packed big-endian into bytes: symbol 0 occupies the six most
 * significant bits of byte 0, symbol 1 the next six bits, and so on.
 */
public final class Chunk {

    private final byte[] data;

    /**
     * Wraps a copy of the packed bytes.
     *
     * @param data the packed bytes
     */
    public Chunk(byte[] data) {
        this.data = data.clone();
    }

    /**
     * Packs symbols into a chunk of the given width. Missing symbols are zero.
     *
     * @param width   chunk width in bytes
     * @param symbols the symbols to pack
     * @return the packed chunk
     */
    public static Chunk pack(int width, int... symbols) {
        byte[] bytes = new byte[width];
        int capacity = width * 8 / Config.SYMBOL_BITS;
        if (symbols.length > capacity) {
            throw new IllegalArgumentException("A chunk of " + width + " bytes holds " + capacity + " symbols, got " + symbols.length);
        }
        for (int i = 0; i < symbols.length; i++) {
            writeSymbol(bytes, i, symbols[i]);
        }
        return new Chunk(bytes);
    }

    /**
     * @param index the symbol index within the chunk
     * @return the symbol value in [0, 63]
     */
    public int symbolAt(int index) {
        int bit = index * Config.SYMBOL_BITS;
        int value = 0;
        for (int i = 0; i < Config.SYMBOL_BITS; i++, bit++) {
            int b = data[bit >> 3] & 0xFF;
            value = (value << 1) | ((b >> (7 - (bit & 7))) & 1);
        }
        return value;
    }

    /**
     * @return the number of symbols held by this chunk
     */
    public int symbolCount() {
        return data.length * 8 / Config.SYMBOL_BITS;
    }

    /**
     * @return a copy of the packed bytes
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    private static void writeSymbol(byte[] bytes, int index, int symbol) {
        int bit = index * Config.SYMBOL_BITS;
        for (int i = Config.SYMBOL_BITS - 1; i >= 0; i--, bit++) {
            int mask = 1 << (7 - (bit & 7));
            if (((symbol >> i) & 1) != 0) {
                bytes[bit >> 3] |= (byte) mask;
            } else {
                bytes[bit >> 3] &= (byte) ~mask;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Chunk other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Chunk[");
        for (int i = 0; i < symbolCount(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(symbolAt(i));
        }
        return sb.append(']').toString();
    }
}
