package li.cil.primint.utils;

public final class MathUtils {
    /**
     * Computes the high 64 bits of the unsigned 128 bit product of two longs.
     *
     * @param x the first factor, interpreted as unsigned.
     * @param y the second factor, interpreted as unsigned.
     * @return the upper half of the product.
     */
    public static long multiplyHighUnsigned(final long x, final long y) {
        // Math.multiplyHigh is signed; each negative factor contributes the other factor once too few.
        return Math.multiplyHigh(x, y) + ((x >> 63) & y) + ((y >> 63) & x);
    }

    private MathUtils() {
    }
}
