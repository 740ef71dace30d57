package li.cil.primint.api;

import java.util.Optional;

/**
 * Word types supporting multiplication.
 * <p>
 * What {@link #mul(Object, Object)} does when the exact product does not fit is up to the
 * implementation: the primitive word types wrap, strict types throw. Algorithms built on top
 * of this interface must not make any assumptions about it.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public interface Multiplicative<W> extends WordType<W> {
    /**
     * Multiplies two values.
     *
     * @param a the first factor.
     * @param b the second factor.
     * @return the product, with the overflow behavior of this type.
     */
    W mul(W a, W b);

    /**
     * Multiplies two values, detecting overflow.
     *
     * @param a the first factor.
     * @param b the second factor.
     * @return the product, or empty if the exact product does not fit into this type.
     */
    Optional<W> checkedMul(W a, W b);
}
