package li.cil.primint.api;

/**
 * Constants for the supported word widths.
 * <p>
 * These constants are named by their bit width.
 */
public final class Sizes {
    public static final int SIZE_8 = 8;
    public static final int SIZE_16 = 16;
    public static final int SIZE_32 = 32;
    public static final int SIZE_64 = 64;
    public static final int SIZE_128 = 128;

    // The JVM addresses everything through longs, so pointer-sized words are 64 bit wide.
    public static final int SIZE_POINTER = SIZE_64;

    public static boolean isSupported(final int bits) {
        return bits == SIZE_8 || bits == SIZE_16 || bits == SIZE_32 || bits == SIZE_64 || bits == SIZE_128;
    }

    private Sizes() {
    }
}
