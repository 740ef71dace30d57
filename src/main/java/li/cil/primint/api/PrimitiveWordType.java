package li.cil.primint.api;

import java.util.Comparator;
import java.util.Optional;

/**
 * The full set of operations available on primitive fixed-width integer types.
 * <p>
 * Plain arithmetic ({@link #add(Object, Object)}, {@link #sub(Object, Object)},
 * {@link #mul(Object, Object)}, {@link #neg(Object)}) wraps around on overflow. The
 * {@code checked} variants report overflow as an empty result instead, the {@code saturating}
 * variants clamp to {@link #min()} and {@link #max()}.
 * <p>
 * Ordering via {@link #compare(Object, Object)} respects the signedness of the type.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public interface PrimitiveWordType<W> extends Multiplicative<W>, Bitwise<W>, Comparator<W> {
    int leadingZeros(W a);

    int trailingZeros(W a);

    int leadingOnes(W a);

    int trailingOnes(W a);

    /**
     * Rotates the bits of a value to the left.
     *
     * @param a the value to rotate.
     * @param n the rotation amount, taken modulo the bit width.
     * @return the rotated value.
     */
    W rotateLeft(W a, int n);

    /**
     * Rotates the bits of a value to the right.
     *
     * @param a the value to rotate.
     * @param n the rotation amount, taken modulo the bit width.
     * @return the rotated value.
     */
    W rotateRight(W a, int n);

    /**
     * Shifts left as if the value were signed. Identical to {@link #shl(Object, int)}, provided
     * for symmetry with {@link #signedShr(Object, int)}.
     */
    W signedShl(W a, int n);

    /**
     * Shifts right filling with the sign bit, regardless of the signedness of this type.
     */
    W signedShr(W a, int n);

    /**
     * Shifts left as if the value were unsigned. Identical to {@link #shl(Object, int)}.
     */
    W unsignedShl(W a, int n);

    /**
     * Shifts right filling with zeroes, regardless of the signedness of this type.
     */
    W unsignedShr(W a, int n);

    /**
     * Reverses the order of the bits in a value.
     * <p>
     * Bit {@code i} of the result is bit {@code getBits() - 1 - i} of the input.
     *
     * @param a the value to reverse.
     * @return the reversed value.
     */
    W reverseBits(W a);

    W fromBe(W a);

    W fromLe(W a);

    W toBe(W a);

    W toLe(W a);

    /**
     * Raises a value to a power by repeated squaring, wrapping on overflow.
     *
     * @param base     the base.
     * @param exponent the exponent, must not be negative.
     * @return {@code base} raised to {@code exponent}; {@code 0^0} is one.
     */
    W pow(W base, long exponent);

    /**
     * Raises a value to a power by repeated squaring.
     *
     * @param base     the base.
     * @param exponent the exponent, must not be negative.
     * @return {@code base} raised to {@code exponent}, or empty if the result does not fit.
     */
    Optional<W> checkedPow(W base, long exponent);

    W add(W a, W b);

    W sub(W a, W b);

    W neg(W a);

    /**
     * Divides two values, truncating towards zero. {@code min() / -1} wraps to {@code min()}.
     *
     * @throws ArithmeticException if {@code b} is zero.
     */
    W div(W a, W b);

    /**
     * The remainder of a truncating division. {@code min() % -1} is zero.
     *
     * @throws ArithmeticException if {@code b} is zero.
     */
    W rem(W a, W b);

    /**
     * Euclidean division: the quotient {@code q} such that {@code a = b * q + r} with
     * {@code 0 <= r < |b|}. Equal to {@link #div(Object, Object)} for unsigned types.
     * {@code min() / -1} wraps to {@code min()}.
     *
     * @throws ArithmeticException if {@code b} is zero.
     */
    W divEuclid(W a, W b);

    /**
     * The least non-negative remainder of a Euclidean division.
     *
     * @throws ArithmeticException if {@code b} is zero.
     */
    W remEuclid(W a, W b);

    W wrappingAdd(W a, W b);

    W wrappingSub(W a, W b);

    W wrappingMul(W a, W b);

    W wrappingNeg(W a);

    /**
     * Shifts left by {@code n} masked to the bit width, so this never fails.
     */
    W wrappingShl(W a, int n);

    /**
     * Shifts right by {@code n} masked to the bit width, so this never fails.
     */
    W wrappingShr(W a, int n);

    Optional<W> checkedAdd(W a, W b);

    Optional<W> checkedSub(W a, W b);

    Optional<W> checkedDiv(W a, W b);

    Optional<W> checkedRem(W a, W b);

    Optional<W> checkedDivEuclid(W a, W b);

    Optional<W> checkedRemEuclid(W a, W b);

    /**
     * Negates a value. For unsigned types only zero can be negated.
     */
    Optional<W> checkedNeg(W a);

    Optional<W> checkedShl(W a, int n);

    Optional<W> checkedShr(W a, int n);

    W saturatingAdd(W a, W b);

    W saturatingSub(W a, W b);

    W saturatingMul(W a, W b);
}
