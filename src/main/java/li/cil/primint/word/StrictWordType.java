package li.cil.primint.word;

import li.cil.primint.api.Multiplicative;

import java.util.Optional;

/**
 * Wraps a word type so that multiplication fails loudly instead of wrapping around.
 * <p>
 * Any algorithm multiplying through this type, such as exponentiation, inherits the behavior
 * without having to know about it.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public final class StrictWordType<W> implements Multiplicative<W> {
    private final Multiplicative<W> type;

    public StrictWordType(final Multiplicative<W> type) {
        this.type = type;
    }

    @Override
    public String getName() {
        return type.getName();
    }

    @Override
    public int getBits() {
        return type.getBits();
    }

    @Override
    public boolean isSigned() {
        return type.isSigned();
    }

    @Override
    public W zero() {
        return type.zero();
    }

    @Override
    public W one() {
        return type.one();
    }

    @Override
    public W min() {
        return type.min();
    }

    @Override
    public W max() {
        return type.max();
    }

    /**
     * @throws ArithmeticException if the product does not fit into the wrapped type.
     */
    @Override
    public W mul(final W a, final W b) {
        return type.checkedMul(a, b).orElseThrow(() ->
                new ArithmeticException("Multiplication overflow for " + type.getName() + ": " + a + " * " + b));
    }

    @Override
    public Optional<W> checkedMul(final W a, final W b) {
        return type.checkedMul(a, b);
    }

    @Override
    public String toString() {
        return "strict " + type.getName();
    }
}
