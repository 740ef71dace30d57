package li.cil.primint;

import li.cil.primint.api.Multiplicative;
import li.cil.primint.api.PrimitiveWordType;
import li.cil.primint.math.Power;
import li.cil.primint.word.Int128;
import li.cil.primint.word.WordTypes;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public final class PowerTests {
    @Test
    public void smallPowersAreComputed() {
        assertEquals((byte) 16, WordTypes.U8.pow((byte) 2, 4));
        assertEquals(8, WordTypes.I32.pow(2, 3));
        assertEquals(-8, WordTypes.I32.pow(-2, 3));
        assertEquals(4, WordTypes.I32.pow(-2, 2));
        assertEquals(1L, WordTypes.I64.pow(1L, 100));
        assertEquals(0L, WordTypes.I64.pow(0L, 10));
        assertEquals(Int128.valueOf(-8), WordTypes.I128.pow(Int128.valueOf(-2), 3));
    }

    @Test
    public void zeroToThePowerOfZeroIsOne() {
        assertEquals((byte) 1, WordTypes.I8.pow((byte) 0, 0));
        assertEquals(Optional.of(1), WordTypes.U32.checkedPow(0, 0));
        assertEquals(Optional.of(Int128.ONE), WordTypes.U128.checkedPow(Int128.ZERO, 0));
    }

    @Test
    public void checkedPowDetectsOverflow() {
        assertEquals(Optional.empty(), WordTypes.U8.checkedPow((byte) 7, 8));
        assertEquals(Optional.of((byte) 243), WordTypes.U8.checkedPow((byte) 3, 5));
        assertEquals(Optional.empty(), WordTypes.U8.checkedPow((byte) 2, 8));
        assertEquals(Optional.of((byte) -128), WordTypes.I8.checkedPow((byte) -2, 7));
        assertEquals(Optional.empty(), WordTypes.I8.checkedPow((byte) 2, 7));
        assertEquals(Optional.of(Long.MIN_VALUE), WordTypes.U64.checkedPow(2L, 63));
        assertEquals(Optional.empty(), WordTypes.U64.checkedPow(2L, 64));
        assertEquals(Optional.of(Int128.MIN_VALUE), WordTypes.I128.checkedPow(Int128.valueOf(-2), 127));
        assertEquals(Optional.empty(), WordTypes.I128.checkedPow(Int128.valueOf(2), 127));
    }

    @Test
    public void powWrapsOnOverflow() {
        assertEquals((byte) 0, WordTypes.I8.pow((byte) 2, 8));
        assertEquals((byte) (7 * 7 * 7 * 7 * 7 * 7 * 7 * 7), WordTypes.U8.pow((byte) 7, 8));
        assertEquals(0, WordTypes.U32.pow(2, 32));
    }

    @Test
    public void negativeExponentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> WordTypes.I32.pow(2, -1));
        assertThrows(IllegalArgumentException.class, () -> WordTypes.I32.checkedPow(2, -1));
    }

    @Test
    public void powInheritsOverflowBehaviorFromMultiplication() {
        final Multiplicative<Byte> strict = WordTypes.strict(WordTypes.I8);
        assertEquals((byte) 64, Power.pow(strict, (byte) 2, 6));
        assertEquals((byte) -128, Power.pow(strict, (byte) -2, 7));
        assertThrows(ArithmeticException.class, () -> Power.pow(strict, (byte) 2, 7));
        assertEquals(Optional.empty(), Power.checkedPow(strict, (byte) 2, 7));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void zeroExponentDoesNotMultiply() {
        final Multiplicative<Integer> type = mock(Multiplicative.class);
        when(type.one()).thenReturn(1);

        assertEquals(1, Power.pow(type, 0, 0));
        assertEquals(Optional.of(1), Power.checkedPow(type, 0, 0));

        verify(type, never()).mul(any(), any());
        verify(type, never()).checkedMul(any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void exponentOfOneDoesNotMultiply() {
        final Multiplicative<Integer> type = mock(Multiplicative.class);
        when(type.checkedMul(any(), any())).thenReturn(Optional.empty());

        assertEquals(5, Power.pow(type, 5, 1));
        assertEquals(Optional.of(5), Power.checkedPow(type, 5, 1));

        verify(type, never()).mul(any(), any());
        verify(type, never()).checkedMul(any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void checkedPowStopsAtFirstOverflow() {
        final Multiplicative<Integer> type = mock(Multiplicative.class);
        when(type.checkedMul(any(), any())).thenReturn(Optional.empty());

        assertEquals(Optional.empty(), Power.checkedPow(type, 3, 8));
        assertEquals(Optional.empty(), Power.checkedPow(type, 3, 7));

        verify(type, times(2)).checkedMul(any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void multiplicationCountIsLogarithmic() {
        final Multiplicative<Integer> type = mock(Multiplicative.class);
        when(type.mul(any(), any())).thenAnswer(invocation ->
                (Integer) invocation.getArgument(0) * (Integer) invocation.getArgument(1));

        // 8 = 0b1000: three squarings.
        assertEquals(6561, Power.pow(type, 3, 8));
        verify(type, times(3)).mul(any(), any());

        clearInvocations(type);

        // 7 = 0b111: two squarings, two accumulations.
        assertEquals(2187, Power.pow(type, 3, 7));
        verify(type, times(4)).mul(any(), any());
    }

    @TestFactory
    public Collection<DynamicTest> testPowLaws() {
        return WordTypes.ALL.stream()
                .map(type -> DynamicTest.dynamicTest(type.getName(), () -> checkPowLaws(type)))
                .collect(Collectors.toList());
    }

    @TestFactory
    public Collection<DynamicTest> testPowAgainstExactResult() {
        return WordTypes.ALL.stream()
                .map(type -> DynamicTest.dynamicTest(type.getName(), () -> checkPowAgainstExactResult(type)))
                .collect(Collectors.toList());
    }

    private static <W> void checkPowLaws(final PrimitiveWordType<W> type) {
        final Random random = new Random(0);
        for (int i = 0; i < 10000; i++) {
            final W base = WordOracle.randomValue(type, random);
            final long e1 = random.nextInt(1 << 20);
            final long e2 = random.nextInt(1 << 20);

            assertEquals(type.one(), type.pow(base, 0));
            assertEquals(Optional.of(type.one()), type.checkedPow(base, 0));

            final long e = e1 + 1;
            assertEquals(type.mul(base, type.pow(base, e - 1)), type.pow(base, e),
                    () -> type + ": " + base + "^" + e);
            assertEquals(type.mul(type.pow(base, e1), type.pow(base, e2)), type.pow(base, e1 + e2),
                    () -> type + ": " + base + "^(" + e1 + "+" + e2 + ")");
        }
    }

    private static <W> void checkPowAgainstExactResult(final PrimitiveWordType<W> type) {
        final Random random = new Random(0);
        for (int i = 0; i < 10000; i++) {
            final W base = WordOracle.randomValue(type, random);
            final int exponent = random.nextInt(40);

            final BigInteger exact = WordOracle.toBigInteger(type, base).pow(exponent);
            final Optional<W> expected = WordOracle.ifFits(type, exact);
            final Optional<W> actual = type.checkedPow(base, exponent);
            if (!Objects.equals(expected, actual)) {
                fail(type + ": " + base + "^" + exponent + " = " + actual + " != " + expected);
            }

            assertEquals(WordOracle.fromBigInteger(type, exact), type.pow(base, exponent),
                    () -> type + ": " + base + "^" + exponent);
            actual.ifPresent(value -> assertEquals(type.pow(base, exponent), value));
        }
    }
}
