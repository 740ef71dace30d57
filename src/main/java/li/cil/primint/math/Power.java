package li.cil.primint.math;

import li.cil.primint.api.Multiplicative;

import java.util.Optional;

/**
 * Exponentiation by squaring over any {@link Multiplicative} word type.
 * <p>
 * Both variants first consume the trailing zero bits of the exponent by squaring the base, then
 * square and conditionally accumulate for the remaining bits. This takes {@code O(log n)}
 * multiplications.
 */
public final class Power {
    public static <W> W pow(final Multiplicative<W> type, W base, long exponent) {
        checkExponent(exponent);

        if (exponent == 0) {
            return type.one();
        }

        while ((exponent & 1) == 0) {
            base = type.mul(base, base);
            exponent >>>= 1;
        }

        if (exponent == 1) {
            return base;
        }

        W accumulator = base;
        while (exponent > 1) {
            exponent >>>= 1;
            base = type.mul(base, base);
            if ((exponent & 1) == 1) {
                accumulator = type.mul(accumulator, base);
            }
        }

        return accumulator;
    }

    public static <W> Optional<W> checkedPow(final Multiplicative<W> type, W base, long exponent) {
        checkExponent(exponent);

        if (exponent == 0) {
            return Optional.of(type.one());
        }

        while ((exponent & 1) == 0) {
            final Optional<W> square = type.checkedMul(base, base);
            if (square.isEmpty()) {
                return square;
            }
            base = square.get();
            exponent >>>= 1;
        }

        if (exponent == 1) {
            return Optional.of(base);
        }

        W accumulator = base;
        while (exponent > 1) {
            exponent >>>= 1;

            final Optional<W> square = type.checkedMul(base, base);
            if (square.isEmpty()) {
                return square;
            }
            base = square.get();

            if ((exponent & 1) == 1) {
                final Optional<W> product = type.checkedMul(accumulator, base);
                if (product.isEmpty()) {
                    return product;
                }
                accumulator = product.get();
            }
        }

        return Optional.of(accumulator);
    }

    private static void checkExponent(final long exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Exponent must be >= 0, was " + exponent);
        }
    }

    private Power() {
    }
}
