package li.cil.primint.api;

/**
 * Describes a fixed-width binary integer type.
 * <p>
 * Word types are stateless interpreters for values of the Java type {@code W}. The same Java
 * type may be interpreted by more than one word type, e.g. {@link Byte} values are read as
 * two's complement by the signed 8-bit type and as plain binary by the unsigned 8-bit type.
 * <p>
 * Implementations must guarantee that no bit beyond {@link #getBits()} is ever observable in
 * the values they produce.
 *
 * @param <W> the Java type used to hold values of this word type.
 */
public interface WordType<W> {
    /**
     * The short name of this type, e.g. {@code i32} or {@code u8}.
     *
     * @return the name of the type.
     */
    String getName();

    /**
     * The number of bits in a value of this type.
     *
     * @return the bit width of the type.
     */
    int getBits();

    /**
     * Whether values of this type are interpreted as two's complement.
     *
     * @return {@code true} if the type is signed.
     */
    boolean isSigned();

    /**
     * The additive identity.
     *
     * @return zero.
     */
    W zero();

    /**
     * The multiplicative identity.
     *
     * @return one.
     */
    W one();

    /**
     * The smallest value representable by this type.
     *
     * @return the minimum value.
     */
    W min();

    /**
     * The largest value representable by this type.
     *
     * @return the maximum value.
     */
    W max();
}
