package li.cil.primint.api;

/**
 * Word types supporting bitwise operations.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public interface Bitwise<W> extends WordType<W> {
    W and(W a, W b);

    W or(W a, W b);

    W xor(W a, W b);

    W not(W a);

    /**
     * Shifts a value to the left, filling with zeroes.
     *
     * @param a the value to shift.
     * @param n the shift amount, in {@code [0, getBits())}.
     * @return the shifted value.
     * @throws IllegalArgumentException if the shift amount is out of range.
     */
    W shl(W a, int n);

    /**
     * Shifts a value to the right.
     * <p>
     * Signed types fill with the sign bit, unsigned types fill with zeroes.
     *
     * @param a the value to shift.
     * @param n the shift amount, in {@code [0, getBits())}.
     * @return the shifted value.
     * @throws IllegalArgumentException if the shift amount is out of range.
     */
    W shr(W a, int n);

    /**
     * Reverses the byte order of a value.
     *
     * @param a the value to swap.
     * @return the value with its bytes in reverse order.
     */
    W swapBytes(W a);

    int countOnes(W a);

    default int countZeros(final W a) {
        return getBits() - countOnes(a);
    }
}
