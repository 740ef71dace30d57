package li.cil.primint.word;

import li.cil.primint.api.Sizes;
import li.cil.primint.utils.MathUtils;

import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Word types of up to 64 bits, held in the boxed Java integer types.
 * <p>
 * Values are widened to a {@code long} for computation, sign-extended for signed types and
 * zero-extended for unsigned types, so that the widened value always equals the value of the
 * word. Results are narrowed again by truncation.
 *
 * @param <W> the boxed Java type used to hold values of this word type.
 */
public final class LongBackedWordType<W extends Number> extends AbstractPrimitiveWordType<W> {
    private final LongFunction<W> narrow;
    private final long mask;
    private final long minValue;
    private final long maxValue;

    private final W zero;
    private final W one;
    private final W min;
    private final W max;

    /**
     * @param name   the name of the type.
     * @param bits   the bit width of the type, at most 64.
     * @param signed whether the type is signed.
     * @param narrow converts a {@code long} to the boxed type, keeping only the low bits.
     */
    public LongBackedWordType(final String name, final int bits, final boolean signed, final LongFunction<W> narrow) {
        super(name, bits, signed);
        if (!Sizes.isSupported(bits) || bits > Sizes.SIZE_64) {
            throw new IllegalArgumentException("Unsupported bit width [" + bits + "] for " + name);
        }

        this.narrow = narrow;
        this.mask = bits == Sizes.SIZE_64 ? -1L : (1L << bits) - 1;
        if (signed) {
            this.minValue = Long.MIN_VALUE >> (Sizes.SIZE_64 - bits);
            this.maxValue = Long.MAX_VALUE >>> (Sizes.SIZE_64 - bits);
        } else {
            this.minValue = 0;
            this.maxValue = mask;
        }

        this.zero = narrow.apply(0);
        this.one = narrow.apply(1);
        this.min = narrow.apply(minValue);
        this.max = narrow.apply(maxValue);
    }

    public long toLong(final W a) {
        return signed ? a.longValue() : a.longValue() & mask;
    }

    public W fromLong(final long value) {
        return narrow.apply(value);
    }

    @Override
    public W zero() {
        return zero;
    }

    @Override
    public W one() {
        return one;
    }

    @Override
    public W min() {
        return min;
    }

    @Override
    public W max() {
        return max;
    }

    @Override
    public int compare(final W a, final W b) {
        return signed ? Long.compare(toLong(a), toLong(b)) : Long.compareUnsigned(toLong(a), toLong(b));
    }

    @Override
    public W mul(final W a, final W b) {
        return fromLong(toLong(a) * toLong(b));
    }

    @Override
    public Optional<W> checkedMul(final W a, final W b) {
        final long x = toLong(a);
        final long y = toLong(b);
        final long low = x * y;
        final long high = signed ? Math.multiplyHigh(x, y) : MathUtils.multiplyHighUnsigned(x, y);

        // The 128 bit product has to collapse into the low half without changing its value first.
        final boolean fits64 = signed ? high == (low >> 63) : high == 0;
        if (!fits64 || !inRange(low)) {
            return Optional.empty();
        }
        return Optional.of(fromLong(low));
    }

    @Override
    public W and(final W a, final W b) {
        return fromLong(toLong(a) & toLong(b));
    }

    @Override
    public W or(final W a, final W b) {
        return fromLong(toLong(a) | toLong(b));
    }

    @Override
    public W xor(final W a, final W b) {
        return fromLong(toLong(a) ^ toLong(b));
    }

    @Override
    public W not(final W a) {
        return fromLong(~toLong(a));
    }

    @Override
    public W shl(final W a, final int n) {
        checkShift(n);
        return fromLong(toLong(a) << n);
    }

    @Override
    public W shr(final W a, final int n) {
        checkShift(n);
        return fromLong(signed ? toLong(a) >> n : toLong(a) >>> n);
    }

    @Override
    public W signedShr(final W a, final int n) {
        checkShift(n);
        final int unused = Sizes.SIZE_64 - bits;
        return fromLong(((toLong(a) << unused) >> unused) >> n);
    }

    @Override
    public W unsignedShr(final W a, final int n) {
        checkShift(n);
        return fromLong((toLong(a) & mask) >>> n);
    }

    @Override
    public W swapBytes(final W a) {
        return fromLong(Long.reverseBytes(toLong(a)) >>> (Sizes.SIZE_64 - bits));
    }

    @Override
    public int countOnes(final W a) {
        return Long.bitCount(toLong(a) & mask);
    }

    @Override
    public int leadingZeros(final W a) {
        return Long.numberOfLeadingZeros(toLong(a) & mask) - (Sizes.SIZE_64 - bits);
    }

    @Override
    public int trailingZeros(final W a) {
        return Math.min(Long.numberOfTrailingZeros(toLong(a)), bits);
    }

    @Override
    public W reverseBits(final W a) {
        switch (bits) {
            case Sizes.SIZE_32:
                return fromLong(Integer.reverse((int) toLong(a)));
            case Sizes.SIZE_64:
                return fromLong(Long.reverse(toLong(a)));
            default:
                return super.reverseBits(a);
        }
    }

    @Override
    public W add(final W a, final W b) {
        return fromLong(toLong(a) + toLong(b));
    }

    @Override
    public W sub(final W a, final W b) {
        return fromLong(toLong(a) - toLong(b));
    }

    @Override
    public W neg(final W a) {
        return fromLong(-toLong(a));
    }

    @Override
    public W div(final W a, final W b) {
        final long x = toLong(a);
        final long y = checkDivisor(toLong(b));
        return fromLong(signed ? x / y : Long.divideUnsigned(x, y));
    }

    @Override
    public W rem(final W a, final W b) {
        final long x = toLong(a);
        final long y = checkDivisor(toLong(b));
        return fromLong(signed ? x % y : Long.remainderUnsigned(x, y));
    }

    @Override
    public Optional<W> checkedAdd(final W a, final W b) {
        final long x = toLong(a);
        final long y = toLong(b);
        final long result = x + y;
        if (bits < Sizes.SIZE_64) {
            return inRange(result) ? Optional.of(fromLong(result)) : Optional.empty();
        }

        final boolean overflow = signed
                ? ((x ^ result) & (y ^ result)) < 0
                : Long.compareUnsigned(result, x) < 0;
        return overflow ? Optional.empty() : Optional.of(fromLong(result));
    }

    @Override
    public Optional<W> checkedSub(final W a, final W b) {
        final long x = toLong(a);
        final long y = toLong(b);
        final long result = x - y;
        if (bits < Sizes.SIZE_64) {
            return inRange(result) ? Optional.of(fromLong(result)) : Optional.empty();
        }

        final boolean overflow = signed
                ? ((x ^ y) & (x ^ result)) < 0
                : Long.compareUnsigned(x, y) < 0;
        return overflow ? Optional.empty() : Optional.of(fromLong(result));
    }

    @Override
    public Optional<W> checkedDiv(final W a, final W b) {
        if (!isValidDivision(toLong(a), toLong(b))) {
            return Optional.empty();
        }
        return Optional.of(div(a, b));
    }

    @Override
    public Optional<W> checkedRem(final W a, final W b) {
        if (!isValidDivision(toLong(a), toLong(b))) {
            return Optional.empty();
        }
        return Optional.of(rem(a, b));
    }

    @Override
    public Optional<W> checkedNeg(final W a) {
        final long x = toLong(a);
        if (signed ? x == minValue : x != 0) {
            return Optional.empty();
        }
        return Optional.of(fromLong(-x));
    }

    private boolean inRange(final long value) {
        if (bits == Sizes.SIZE_64) {
            return true;
        }
        return value >= minValue && value <= maxValue;
    }

    private boolean isValidDivision(final long x, final long y) {
        return y != 0 && !(signed && x == minValue && y == -1);
    }

    private static long checkDivisor(final long y) {
        if (y == 0) {
            throw new ArithmeticException("/ by zero");
        }
        return y;
    }
}
