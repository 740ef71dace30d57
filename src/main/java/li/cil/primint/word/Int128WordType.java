package li.cil.primint.word;

import li.cil.primint.api.Sizes;
import li.cil.primint.utils.MathUtils;

import java.util.Optional;

/**
 * The signed and unsigned 128 bit word types, held in {@link Int128} values.
 * <p>
 * There is no native bit reversal for 128 bit values, so this type uses the generic fallback.
 */
public final class Int128WordType extends AbstractPrimitiveWordType<Int128> {
    private static final Int128 UNSIGNED_MAX = Int128.MINUS_ONE;

    public Int128WordType(final String name, final boolean signed) {
        super(name, Sizes.SIZE_128, signed);
    }

    @Override
    public Int128 zero() {
        return Int128.ZERO;
    }

    @Override
    public Int128 one() {
        return Int128.ONE;
    }

    @Override
    public Int128 min() {
        return signed ? Int128.MIN_VALUE : Int128.ZERO;
    }

    @Override
    public Int128 max() {
        return signed ? Int128.MAX_VALUE : UNSIGNED_MAX;
    }

    @Override
    public int compare(final Int128 a, final Int128 b) {
        return signed ? a.compareTo(b) : Int128.compareUnsigned(a, b);
    }

    @Override
    public Int128 mul(final Int128 a, final Int128 b) {
        return a.multiply(b);
    }

    @Override
    public Optional<Int128> checkedMul(final Int128 a, final Int128 b) {
        if (!signed) {
            return multiplyExactUnsigned(a, b);
        }

        final boolean negative = a.isNegative() != b.isNegative();
        final Optional<Int128> magnitude = multiplyExactUnsigned(abs(a), abs(b));
        if (magnitude.isEmpty()) {
            return magnitude;
        }

        final Int128 value = magnitude.get();
        if (negative) {
            // The magnitude of MIN_VALUE is 2^127, which is still representable when negated.
            return Int128.compareUnsigned(value, Int128.MIN_VALUE) <= 0 ? Optional.of(value.negate()) : Optional.empty();
        } else {
            return value.isNegative() ? Optional.empty() : Optional.of(value);
        }
    }

    @Override
    public Int128 and(final Int128 a, final Int128 b) {
        return a.and(b);
    }

    @Override
    public Int128 or(final Int128 a, final Int128 b) {
        return a.or(b);
    }

    @Override
    public Int128 xor(final Int128 a, final Int128 b) {
        return a.xor(b);
    }

    @Override
    public Int128 not(final Int128 a) {
        return a.not();
    }

    @Override
    public Int128 shl(final Int128 a, final int n) {
        checkShift(n);
        return a.shiftLeft(n);
    }

    @Override
    public Int128 shr(final Int128 a, final int n) {
        checkShift(n);
        return signed ? a.shiftRight(n) : a.shiftRightUnsigned(n);
    }

    @Override
    public Int128 signedShr(final Int128 a, final int n) {
        checkShift(n);
        return a.shiftRight(n);
    }

    @Override
    public Int128 unsignedShr(final Int128 a, final int n) {
        checkShift(n);
        return a.shiftRightUnsigned(n);
    }

    @Override
    public Int128 swapBytes(final Int128 a) {
        return a.reverseBytes();
    }

    @Override
    public int countOnes(final Int128 a) {
        return a.bitCount();
    }

    @Override
    public int leadingZeros(final Int128 a) {
        return a.numberOfLeadingZeros();
    }

    @Override
    public int trailingZeros(final Int128 a) {
        return a.numberOfTrailingZeros();
    }

    @Override
    public Int128 add(final Int128 a, final Int128 b) {
        return a.add(b);
    }

    @Override
    public Int128 sub(final Int128 a, final Int128 b) {
        return a.subtract(b);
    }

    @Override
    public Int128 neg(final Int128 a) {
        return a.negate();
    }

    @Override
    public Int128 div(final Int128 a, final Int128 b) {
        if (!signed) {
            return Int128.divideUnsigned(a, b);
        }

        final Int128 quotient = Int128.divideUnsigned(abs(a), abs(b));
        return a.isNegative() != b.isNegative() ? quotient.negate() : quotient;
    }

    @Override
    public Int128 rem(final Int128 a, final Int128 b) {
        if (!signed) {
            return Int128.remainderUnsigned(a, b);
        }

        // The remainder takes the sign of the dividend, like Java's own remainder operator.
        final Int128 remainder = Int128.remainderUnsigned(abs(a), abs(b));
        return a.isNegative() ? remainder.negate() : remainder;
    }

    @Override
    public Optional<Int128> checkedAdd(final Int128 a, final Int128 b) {
        final Int128 result = a.add(b);
        final boolean overflow = signed
                ? ((a.getHigh() ^ result.getHigh()) & (b.getHigh() ^ result.getHigh())) < 0
                : Int128.compareUnsigned(result, a) < 0;
        return overflow ? Optional.empty() : Optional.of(result);
    }

    @Override
    public Optional<Int128> checkedSub(final Int128 a, final Int128 b) {
        final Int128 result = a.subtract(b);
        final boolean overflow = signed
                ? ((a.getHigh() ^ b.getHigh()) & (a.getHigh() ^ result.getHigh())) < 0
                : Int128.compareUnsigned(a, b) < 0;
        return overflow ? Optional.empty() : Optional.of(result);
    }

    @Override
    public Optional<Int128> checkedDiv(final Int128 a, final Int128 b) {
        if (!isValidDivision(a, b)) {
            return Optional.empty();
        }
        return Optional.of(div(a, b));
    }

    @Override
    public Optional<Int128> checkedRem(final Int128 a, final Int128 b) {
        if (!isValidDivision(a, b)) {
            return Optional.empty();
        }
        return Optional.of(rem(a, b));
    }

    @Override
    public Optional<Int128> checkedNeg(final Int128 a) {
        if (signed ? a.equals(Int128.MIN_VALUE) : !a.equals(Int128.ZERO)) {
            return Optional.empty();
        }
        return Optional.of(a.negate());
    }

    private boolean isValidDivision(final Int128 a, final Int128 b) {
        return !b.equals(Int128.ZERO) && !(signed && a.equals(Int128.MIN_VALUE) && b.equals(Int128.MINUS_ONE));
    }

    // Magnitude of a signed value as an unsigned value; MIN_VALUE maps to 2^127.
    private static Int128 abs(final Int128 a) {
        return a.isNegative() ? a.negate() : a;
    }

    private static Optional<Int128> multiplyExactUnsigned(final Int128 a, final Int128 b) {
        // Both factors at least 2^64 means the product is at least 2^128.
        if (a.getHigh() != 0 && b.getHigh() != 0) {
            return Optional.empty();
        }

        final Int128 wide = a.getHigh() != 0 ? a : b;
        final long narrow = a.getHigh() != 0 ? b.getLow() : a.getLow();

        // narrow * wide = narrow * wide.low + (narrow * wide.high) << 64
        final long crossHigh = MathUtils.multiplyHighUnsigned(narrow, wide.getHigh());
        if (crossHigh != 0) {
            return Optional.empty();
        }
        final long crossLow = narrow * wide.getHigh();

        final long productLow = narrow * wide.getLow();
        final long productHigh = MathUtils.multiplyHighUnsigned(narrow, wide.getLow());
        final long high = productHigh + crossLow;
        if (Long.compareUnsigned(high, productHigh) < 0) {
            return Optional.empty();
        }

        return Optional.of(Int128.of(high, productLow));
    }
}
