package li.cil.primint.word;

import li.cil.primint.api.PrimitiveWordType;
import li.cil.primint.math.BitReversal;
import li.cil.primint.math.Power;

import java.nio.ByteOrder;
import java.util.Optional;

/**
 * Base class for word types, implementing all operations that can be expressed in terms of
 * the representation specific primitives.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public abstract class AbstractPrimitiveWordType<W> implements PrimitiveWordType<W> {
    private static final boolean IS_BIG_ENDIAN = ByteOrder.nativeOrder() == ByteOrder.BIG_ENDIAN;

    protected final String name;
    protected final int bits;
    protected final boolean signed;

    protected AbstractPrimitiveWordType(final String name, final int bits, final boolean signed) {
        this.name = name;
        this.bits = bits;
        this.signed = signed;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getBits() {
        return bits;
    }

    @Override
    public boolean isSigned() {
        return signed;
    }

    @Override
    public int leadingOnes(final W a) {
        return leadingZeros(not(a));
    }

    @Override
    public int trailingOnes(final W a) {
        return trailingZeros(not(a));
    }

    @Override
    public W rotateLeft(final W a, final int n) {
        final int shift = n & (bits - 1);
        if (shift == 0) {
            return a;
        }
        return or(shl(a, shift), unsignedShr(a, bits - shift));
    }

    @Override
    public W rotateRight(final W a, final int n) {
        final int shift = n & (bits - 1);
        if (shift == 0) {
            return a;
        }
        return or(unsignedShr(a, shift), shl(a, bits - shift));
    }

    @Override
    public W signedShl(final W a, final int n) {
        return shl(a, n);
    }

    @Override
    public W unsignedShl(final W a, final int n) {
        return shl(a, n);
    }

    @Override
    public W reverseBits(final W a) {
        return BitReversal.reverseBitsFallback(this, a);
    }

    @Override
    public W fromBe(final W a) {
        return toBe(a);
    }

    @Override
    public W fromLe(final W a) {
        return toLe(a);
    }

    @Override
    public W toBe(final W a) {
        return IS_BIG_ENDIAN ? a : swapBytes(a);
    }

    @Override
    public W toLe(final W a) {
        return IS_BIG_ENDIAN ? swapBytes(a) : a;
    }

    @Override
    public W pow(final W base, final long exponent) {
        return Power.pow(this, base, exponent);
    }

    @Override
    public Optional<W> checkedPow(final W base, final long exponent) {
        return Power.checkedPow(this, base, exponent);
    }

    @Override
    public W wrappingAdd(final W a, final W b) {
        return add(a, b);
    }

    @Override
    public W wrappingSub(final W a, final W b) {
        return sub(a, b);
    }

    @Override
    public W wrappingMul(final W a, final W b) {
        return mul(a, b);
    }

    @Override
    public W wrappingNeg(final W a) {
        return neg(a);
    }

    @Override
    public W wrappingShl(final W a, final int n) {
        return shl(a, n & (bits - 1));
    }

    @Override
    public W wrappingShr(final W a, final int n) {
        return shr(a, n & (bits - 1));
    }

    @Override
    public Optional<W> checkedShl(final W a, final int n) {
        if (n < 0 || n >= bits) {
            return Optional.empty();
        }
        return Optional.of(shl(a, n));
    }

    @Override
    public Optional<W> checkedShr(final W a, final int n) {
        if (n < 0 || n >= bits) {
            return Optional.empty();
        }
        return Optional.of(shr(a, n));
    }

    @Override
    public W divEuclid(final W a, final W b) {
        final W quotient = div(a, b);
        if (isNegative(rem(a, b))) {
            return isNegative(b) ? add(quotient, one()) : sub(quotient, one());
        }
        return quotient;
    }

    @Override
    public W remEuclid(final W a, final W b) {
        final W remainder = rem(a, b);
        if (isNegative(remainder)) {
            return isNegative(b) ? sub(remainder, b) : add(remainder, b);
        }
        return remainder;
    }

    @Override
    public Optional<W> checkedDivEuclid(final W a, final W b) {
        if (checkedDiv(a, b).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(divEuclid(a, b));
    }

    @Override
    public Optional<W> checkedRemEuclid(final W a, final W b) {
        if (checkedRem(a, b).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(remEuclid(a, b));
    }

    @Override
    public W saturatingAdd(final W a, final W b) {
        return checkedAdd(a, b).orElseGet(() -> isNegative(b) ? min() : max());
    }

    @Override
    public W saturatingSub(final W a, final W b) {
        return checkedSub(a, b).orElseGet(() -> isNegative(b) ? max() : min());
    }

    @Override
    public W saturatingMul(final W a, final W b) {
        return checkedMul(a, b).orElseGet(() -> isNegative(a) != isNegative(b) ? min() : max());
    }

    @Override
    public String toString() {
        return name;
    }

    protected boolean isNegative(final W a) {
        return signed && compare(a, zero()) < 0;
    }

    protected void checkShift(final int n) {
        if (n < 0 || n >= bits) {
            throw new IllegalArgumentException("Shift amount [" + n + "] out of range for " + name);
        }
    }
}
