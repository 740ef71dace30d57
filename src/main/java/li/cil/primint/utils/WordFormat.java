package li.cil.primint.utils;

import li.cil.primint.api.Bitwise;
import org.apache.commons.lang3.StringUtils;

/**
 * Fixed-width text renderings of word values, always showing every bit of the word.
 */
public final class WordFormat {
    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    public static <W> String toBinaryString(final Bitwise<W> type, final W value) {
        final StringBuilder sb = new StringBuilder(type.getBits());
        for (int i = highestSetBit(type, value); i >= 0; i--) {
            sb.append(testBit(type, value, i) ? '1' : '0');
        }
        return StringUtils.leftPad(sb.toString(), type.getBits(), '0');
    }

    public static <W> String toHexString(final Bitwise<W> type, final W value) {
        final StringBuilder sb = new StringBuilder(type.getBits() / 4);
        final int highest = highestSetBit(type, value);
        if (highest >= 0) {
            for (int nibble = highest >> 2; nibble >= 0; nibble--) {
                int digit = 0;
                for (int i = 0; i < 4; i++) {
                    if (testBit(type, value, nibble * 4 + i)) {
                        digit |= 1 << i;
                    }
                }
                sb.append(HEX_DIGITS[digit]);
            }
        }
        return StringUtils.leftPad(sb.toString(), type.getBits() / 4, '0');
    }

    private static <W> int highestSetBit(final Bitwise<W> type, final W value) {
        for (int i = type.getBits() - 1; i >= 0; i--) {
            if (testBit(type, value, i)) {
                return i;
            }
        }
        return -1;
    }

    private static <W> boolean testBit(final Bitwise<W> type, final W value, final int bit) {
        return type.countOnes(type.and(value, type.shl(type.one(), bit))) != 0;
    }

    private WordFormat() {
    }
}
