package li.cil.primint;

import li.cil.primint.utils.MathUtils;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class MathUtilsTests {
    private static final BigInteger UNSIGNED_LONG_MASK = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    @Test
    public void multiplyHighUnsignedOfEdgeValues() {
        assertEquals(0L, MathUtils.multiplyHighUnsigned(0, -1L));
        assertEquals(-2L, MathUtils.multiplyHighUnsigned(-1L, -1L));
        assertEquals(1L, MathUtils.multiplyHighUnsigned(1L << 32, 1L << 32));
        assertEquals(1L << 62, MathUtils.multiplyHighUnsigned(Long.MIN_VALUE, Long.MIN_VALUE));
    }

    @Test
    public void multiplyHighUnsignedMatchesBigInteger() {
        final Random random = new Random(0);
        for (int i = 0; i < 100000; i++) {
            final long x = random.nextLong();
            final long y = random.nextLong();
            final long expected = unsigned(x).multiply(unsigned(y)).shiftRight(64).longValue();
            assertEquals(expected, MathUtils.multiplyHighUnsigned(x, y), () -> Long.toUnsignedString(x) + " * " + Long.toUnsignedString(y));
        }
    }

    private static BigInteger unsigned(final long value) {
        return BigInteger.valueOf(value).and(UNSIGNED_LONG_MASK);
    }
}
