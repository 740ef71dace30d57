package li.cil.primint;

import li.cil.primint.word.Int128;
import li.cil.primint.word.LongBackedWordType;
import li.cil.primint.word.WordTypes;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public final class LongBackedWordTypeTests {
    @Test
    public void unsignedValuesShareTheSignedRepresentation() {
        assertEquals(200L, WordTypes.U8.toLong((byte) -56));
        assertEquals(-56L, WordTypes.I8.toLong((byte) -56));
        assertEquals((byte) -1, WordTypes.U8.max());
        assertEquals((byte) 0, WordTypes.U8.min());
        assertEquals(Byte.MIN_VALUE, WordTypes.I8.min());
        assertEquals(-1L, WordTypes.U64.max());
    }

    @Test
    public void unsupportedWidthsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LongBackedWordType<>("i24", 24, true, v -> (int) v));
        assertThrows(IllegalArgumentException.class, () -> new LongBackedWordType<>("i128", 128, true, v -> v));
    }

    @Test
    public void shiftsOutOfRangeAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> WordTypes.I32.shl(1, 32));
        assertThrows(IllegalArgumentException.class, () -> WordTypes.U8.shr((byte) 1, -1));
        assertThrows(IllegalArgumentException.class, () -> WordTypes.I128.shl(Int128.ONE, 128));
        assertEquals(Optional.empty(), WordTypes.I32.checkedShl(1, 32));
        assertEquals(2, WordTypes.I32.wrappingShl(1, 33));
    }

    @Test
    public void shiftsRespectSignedness() {
        assertEquals((byte) 0xE0, WordTypes.I8.shr((byte) 0x80, 2));
        assertEquals((byte) 0x20, WordTypes.U8.shr((byte) 0x80, 2));
        assertEquals((byte) 0xE0, WordTypes.U8.signedShr((byte) 0x80, 2));
        assertEquals((byte) 0x20, WordTypes.I8.unsignedShr((byte) 0x80, 2));
        assertEquals(Long.MIN_VALUE >>> 4, WordTypes.U64.shr(Long.MIN_VALUE, 4));
    }

    @Test
    public void divisionByZeroThrows() {
        assertThrows(ArithmeticException.class, () -> WordTypes.I32.div(1, 0));
        assertThrows(ArithmeticException.class, () -> WordTypes.U64.rem(1L, 0L));
        assertEquals(Optional.empty(), WordTypes.I32.checkedDiv(1, 0));
    }

    @Test
    public void minDividedByMinusOneWraps() {
        assertEquals(Byte.MIN_VALUE, WordTypes.I8.div(Byte.MIN_VALUE, (byte) -1));
        assertEquals((byte) 0, WordTypes.I8.rem(Byte.MIN_VALUE, (byte) -1));
        assertEquals(Optional.empty(), WordTypes.I8.checkedDiv(Byte.MIN_VALUE, (byte) -1));
        assertEquals(Optional.empty(), WordTypes.I64.checkedRem(Long.MIN_VALUE, -1L));
    }

    @Test
    public void euclideanRemainderIsNeverNegative() {
        assertEquals(-4, WordTypes.I32.divEuclid(-7, 2));
        assertEquals(1, WordTypes.I32.remEuclid(-7, 2));
        assertEquals(4, WordTypes.I32.divEuclid(-7, -2));
        assertEquals(1, WordTypes.I32.remEuclid(-7, -2));
        assertEquals(-3, WordTypes.I32.divEuclid(7, -2));
        assertEquals(1, WordTypes.I32.remEuclid(7, -2));
        assertEquals((byte) 127, WordTypes.I8.remEuclid((byte) -1, Byte.MIN_VALUE));
        assertEquals((byte) 1, WordTypes.I8.divEuclid((byte) -1, Byte.MIN_VALUE));

        // Unsigned types have no negative remainders, so these are plain division.
        assertEquals((byte) 0, WordTypes.U8.divEuclid((byte) -7, (byte) -2));
        assertEquals((byte) -7, WordTypes.U8.remEuclid((byte) -7, (byte) -2));
    }

    @Test
    public void euclideanDivisionOfMinByMinusOne() {
        assertEquals(Integer.MIN_VALUE, WordTypes.I32.divEuclid(Integer.MIN_VALUE, -1));
        assertEquals(0, WordTypes.I32.remEuclid(Integer.MIN_VALUE, -1));
        assertEquals(Optional.empty(), WordTypes.I32.checkedDivEuclid(Integer.MIN_VALUE, -1));
        assertEquals(Optional.empty(), WordTypes.I32.checkedRemEuclid(Integer.MIN_VALUE, -1));
        assertEquals(Optional.empty(), WordTypes.I32.checkedDivEuclid(1, 0));
        assertThrows(ArithmeticException.class, () -> WordTypes.I64.remEuclid(1L, 0L));
    }

    @Test
    public void endiannessConversionsAreByteSwapsOrIdentity() {
        final int value = 0x12345678;
        final boolean swapsForBigEndian = WordTypes.I32.toBe(value) != value;
        final boolean swapsForLittleEndian = WordTypes.I32.toLe(value) != value;
        assertNotEquals(swapsForBigEndian, swapsForLittleEndian);
        assertEquals(0x78563412, swapsForBigEndian ? WordTypes.I32.toBe(value) : WordTypes.I32.toLe(value));
    }
}
