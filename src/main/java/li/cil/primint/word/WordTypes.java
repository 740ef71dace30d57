package li.cil.primint.word;

import li.cil.primint.api.Multiplicative;
import li.cil.primint.api.PrimitiveWordType;
import li.cil.primint.api.Sizes;

import java.util.List;

/**
 * The standard fixed-width integer types.
 * <p>
 * Unsigned types share their Java representation with the signed type of the same width, e.g.
 * a {@code u8} value of 200 is held as the {@link Byte} -56.
 */
public final class WordTypes {
    public static final LongBackedWordType<Byte> I8 = new LongBackedWordType<>("i8", Sizes.SIZE_8, true, v -> (byte) v);
    public static final LongBackedWordType<Byte> U8 = new LongBackedWordType<>("u8", Sizes.SIZE_8, false, v -> (byte) v);
    public static final LongBackedWordType<Short> I16 = new LongBackedWordType<>("i16", Sizes.SIZE_16, true, v -> (short) v);
    public static final LongBackedWordType<Short> U16 = new LongBackedWordType<>("u16", Sizes.SIZE_16, false, v -> (short) v);
    public static final LongBackedWordType<Integer> I32 = new LongBackedWordType<>("i32", Sizes.SIZE_32, true, v -> (int) v);
    public static final LongBackedWordType<Integer> U32 = new LongBackedWordType<>("u32", Sizes.SIZE_32, false, v -> (int) v);
    public static final LongBackedWordType<Long> I64 = new LongBackedWordType<>("i64", Sizes.SIZE_64, true, v -> v);
    public static final LongBackedWordType<Long> U64 = new LongBackedWordType<>("u64", Sizes.SIZE_64, false, v -> v);
    public static final LongBackedWordType<Long> ISIZE = new LongBackedWordType<>("isize", Sizes.SIZE_POINTER, true, v -> v);
    public static final LongBackedWordType<Long> USIZE = new LongBackedWordType<>("usize", Sizes.SIZE_POINTER, false, v -> v);
    public static final Int128WordType I128 = new Int128WordType("i128", true);
    public static final Int128WordType U128 = new Int128WordType("u128", false);

    public static final List<PrimitiveWordType<?>> ALL = List.of(
            I8, U8, I16, U16, I32, U32, I64, U64, ISIZE, USIZE, I128, U128);

    public static <W> StrictWordType<W> strict(final Multiplicative<W> type) {
        return new StrictWordType<>(type);
    }

    private WordTypes() {
    }
}
