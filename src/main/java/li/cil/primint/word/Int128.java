package li.cil.primint.word;

import li.cil.primint.utils.MathUtils;

import javax.annotation.Nonnull;
import java.math.BigInteger;
import java.util.Objects;

/**
 * An immutable 128 bit two's complement value made up of two longs.
 * <p>
 * Whether the value is interpreted as signed or unsigned is up to the caller, the same way
 * it is for the primitive Java types. Signed interpretations are used by {@link #compareTo(Int128)}
 * and {@link #toString()}.
 */
public final class Int128 implements Comparable<Int128> {
    public static final Int128 ZERO = new Int128(0, 0);
    public static final Int128 ONE = new Int128(0, 1);
    public static final Int128 MINUS_ONE = new Int128(-1, -1);
    public static final Int128 MIN_VALUE = new Int128(Long.MIN_VALUE, 0);
    public static final Int128 MAX_VALUE = new Int128(Long.MAX_VALUE, -1);

    private static final BigInteger UNSIGNED_LONG_MASK = BigInteger.ONE.shiftLeft(Long.SIZE).subtract(BigInteger.ONE);

    private final long high;
    private final long low;

    private Int128(final long high, final long low) {
        this.high = high;
        this.low = low;
    }

    public static Int128 of(final long high, final long low) {
        return new Int128(high, low);
    }

    public static Int128 valueOf(final long value) {
        return new Int128(value >> 63, value);
    }

    public static Int128 ofUnsigned(final long value) {
        return new Int128(0, value);
    }

    /**
     * Keeps the low 128 bits of the two's complement representation of the given value.
     */
    public static Int128 fromBigInteger(final BigInteger value) {
        return new Int128(value.shiftRight(Long.SIZE).longValue(), value.longValue());
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    public boolean isNegative() {
        return high < 0;
    }

    public Int128 add(final Int128 other) {
        final long sum = low + other.low;
        final long carry = Long.compareUnsigned(sum, low) < 0 ? 1 : 0;
        return new Int128(high + other.high + carry, sum);
    }

    public Int128 subtract(final Int128 other) {
        final long difference = low - other.low;
        final long borrow = Long.compareUnsigned(low, other.low) < 0 ? 1 : 0;
        return new Int128(high - other.high - borrow, difference);
    }

    /**
     * The low 128 bits of the product; identical for signed and unsigned interpretations.
     */
    public Int128 multiply(final Int128 other) {
        final long productHigh = MathUtils.multiplyHighUnsigned(low, other.low)
                                 + high * other.low
                                 + low * other.high;
        return new Int128(productHigh, low * other.low);
    }

    public Int128 negate() {
        return not().add(ONE);
    }

    public Int128 and(final Int128 other) {
        return new Int128(high & other.high, low & other.low);
    }

    public Int128 or(final Int128 other) {
        return new Int128(high | other.high, low | other.low);
    }

    public Int128 xor(final Int128 other) {
        return new Int128(high ^ other.high, low ^ other.low);
    }

    public Int128 not() {
        return new Int128(~high, ~low);
    }

    public Int128 shiftLeft(final int n) {
        if (n == 0) {
            return this;
        } else if (n < Long.SIZE) {
            return new Int128((high << n) | (low >>> (Long.SIZE - n)), low << n);
        } else {
            return new Int128(low << (n - Long.SIZE), 0);
        }
    }

    public Int128 shiftRight(final int n) {
        if (n == 0) {
            return this;
        } else if (n < Long.SIZE) {
            return new Int128(high >> n, (low >>> n) | (high << (Long.SIZE - n)));
        } else {
            return new Int128(high >> 63, high >> (n - Long.SIZE));
        }
    }

    public Int128 shiftRightUnsigned(final int n) {
        if (n == 0) {
            return this;
        } else if (n < Long.SIZE) {
            return new Int128(high >>> n, (low >>> n) | (high << (Long.SIZE - n)));
        } else {
            return new Int128(0, high >>> (n - Long.SIZE));
        }
    }

    public Int128 reverseBytes() {
        return new Int128(Long.reverseBytes(low), Long.reverseBytes(high));
    }

    public int bitCount() {
        return Long.bitCount(high) + Long.bitCount(low);
    }

    public int numberOfLeadingZeros() {
        return high != 0 ? Long.numberOfLeadingZeros(high) : Long.SIZE + Long.numberOfLeadingZeros(low);
    }

    public int numberOfTrailingZeros() {
        return low != 0 ? Long.numberOfTrailingZeros(low) : Long.SIZE + Long.numberOfTrailingZeros(high);
    }

    public boolean testBit(final int n) {
        return n < Long.SIZE ? ((low >>> n) & 1) != 0 : ((high >>> (n - Long.SIZE)) & 1) != 0;
    }

    public static int compareUnsigned(final Int128 a, final Int128 b) {
        final int result = Long.compareUnsigned(a.high, b.high);
        return result != 0 ? result : Long.compareUnsigned(a.low, b.low);
    }

    public static Int128 divideUnsigned(final Int128 dividend, final Int128 divisor) {
        return divideAndRemainderUnsigned(dividend, divisor)[0];
    }

    public static Int128 remainderUnsigned(final Int128 dividend, final Int128 divisor) {
        return divideAndRemainderUnsigned(dividend, divisor)[1];
    }

    /**
     * Unsigned division, returning the quotient followed by the remainder.
     *
     * @throws ArithmeticException if the divisor is zero.
     */
    static Int128[] divideAndRemainderUnsigned(final Int128 dividend, final Int128 divisor) {
        if (divisor.high == 0 && divisor.low == 0) {
            throw new ArithmeticException("/ by zero");
        }

        if (compareUnsigned(dividend, divisor) < 0) {
            return new Int128[]{ZERO, dividend};
        }

        if (dividend.high == 0 && divisor.high == 0) {
            return new Int128[]{
                    ofUnsigned(Long.divideUnsigned(dividend.low, divisor.low)),
                    ofUnsigned(Long.remainderUnsigned(dividend.low, divisor.low))
            };
        }

        // Plain shift-subtract long division, starting at the highest set bit of the dividend.
        Int128 quotient = ZERO;
        Int128 remainder = ZERO;
        for (int i = 127 - dividend.numberOfLeadingZeros(); i >= 0; i--) {
            // A remainder with its top bit set is at least 2^128 after the shift, so larger than any divisor.
            final boolean carry = remainder.isNegative();
            remainder = remainder.shiftLeft(1);
            if (dividend.testBit(i)) {
                remainder = remainder.or(ONE);
            }
            if (carry || compareUnsigned(remainder, divisor) >= 0) {
                remainder = remainder.subtract(divisor);
                quotient = quotient.or(ONE.shiftLeft(i));
            }
        }

        return new Int128[]{quotient, remainder};
    }

    public BigInteger toBigInteger(final boolean signed) {
        final BigInteger highPart = signed ? BigInteger.valueOf(high) : BigInteger.valueOf(high).and(UNSIGNED_LONG_MASK);
        return highPart.shiftLeft(Long.SIZE).or(BigInteger.valueOf(low).and(UNSIGNED_LONG_MASK));
    }

    public String toUnsignedString() {
        return toBigInteger(false).toString();
    }

    @Override
    public int compareTo(@Nonnull final Int128 other) {
        final int result = Long.compare(high, other.high);
        return result != 0 ? result : Long.compareUnsigned(low, other.low);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Int128 that = (Int128) o;
        return high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return Objects.hash(high, low);
    }

    @Override
    public String toString() {
        return toBigInteger(true).toString();
    }
}
