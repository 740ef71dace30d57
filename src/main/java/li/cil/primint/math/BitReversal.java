package li.cil.primint.math;

import li.cil.primint.api.Bitwise;

/**
 * Bit reversal for word types without a native instruction for it.
 * <p>
 * The byte order is reversed first, after which every byte only needs its own bits reversed.
 * Since bytes are always eight bits wide, that takes three fixed swap rounds (nibbles, bit
 * pairs, single bits) independent of the width of the word. The masks for the rounds are built
 * from the literal one by shifting and or-ing, so no width specific constants are needed.
 */
public final class BitReversal {
    /**
     * Builds a value with the lowest bit of every byte set, e.g. {@code 0x01010101} for 32 bit
     * wide words.
     *
     * @param type the word type to build the value for.
     * @param <W>  the Java type holding values of the word type.
     * @return the repeated {@code 0x01} pattern.
     */
    public static <W> W onePerByte(final Bitwise<W> type) {
        W value = type.one();
        int shift = 8;
        int remaining = type.countZeros(value) >>> 3;
        while (remaining != 0) {
            value = type.or(type.shl(value, shift), value);
            shift <<= 1;
            remaining >>>= 1;
        }
        return value;
    }

    public static <W> W reverseBitsFallback(final Bitwise<W> type, final W word) {
        final W rep01 = onePerByte(type);
        final W rep03 = type.or(type.shl(rep01, 1), rep01);
        final W rep05 = type.or(type.shl(rep01, 2), rep01);
        final W rep0f = type.or(type.shl(rep03, 2), rep03);
        final W rep33 = type.or(type.shl(rep03, 4), rep03);
        final W rep55 = type.or(type.shl(rep05, 4), rep05);

        W result = type.swapBytes(word);
        result = swap(type, result, rep0f, 4);
        result = swap(type, result, rep33, 2);
        result = swap(type, result, rep55, 1);
        return result;
    }

    // Exchanges each group of bits selected by the mask with its neighbour `shift` bits up.
    private static <W> W swap(final Bitwise<W> type, final W value, final W mask, final int shift) {
        return type.or(
                type.shl(type.and(value, mask), shift),
                type.and(type.shr(value, shift), mask));
    }

    private BitReversal() {
    }
}
