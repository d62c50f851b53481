/*
 * The MIT License
 *
 * Copyright 2024 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.checkedvalues;

import static com.mastfrog.checkedvalues.StandardBehavior.PANICKING;
import static com.mastfrog.checkedvalues.StandardBehavior.SATURATING;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import org.junit.jupiter.api.Test;

public class HardClampTest {

    private static final ClampType ZERO_TO_TEN
            = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, SATURATING);
    private static final ClampType TEN_OR_MORE
            = ClampType.builder(NumberKind.LONG).lower(10).panicking().build();

    @Test
    public void testSaturatingArithmetic() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        assertEquals(5, clamp.get());

        clamp.add(5);
        assertEquals(10, clamp.get());

        clamp.subtract(15);
        assertEquals(0, clamp.get());

        clamp.add(20);
        assertEquals(10, clamp.get());

        clamp.divide(2);
        assertEquals(5, clamp.get());

        clamp.multiply(2);
        assertEquals(10, clamp.get());

        clamp.multiply(2);
        assertEquals(10, clamp.get());

        clamp.remainder(2);
        assertEquals(0, clamp.get());
    }

    @Test
    public void testSaturationIsIdempotent() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 9);
        clamp.add(3);
        assertEquals(10, clamp.get());
        clamp.add(3);
        assertEquals(10, clamp.get());
        clamp.subtract(200).subtract(200);
        assertEquals(0, clamp.get());
    }

    @Test
    public void testConstructionDoesNotClamp() {
        try {
            HardClamp c = HardClamp.of(ZERO_TO_TEN, 11);
            fail("Exception should have been thrown: " + c);
        } catch (OutOfBoundsException e) {
            assertEquals(11, e.value());
            assertEquals(0, e.lower());
            assertEquals(10, e.upper());
        }
        assertThrows(OutOfBoundsException.class, () -> HardClamp.of(TEN_OR_MORE, 9));
        assertEquals(10, HardClamp.of(TEN_OR_MORE, 10).get());
    }

    @Test
    public void testResolvedConstruction() {
        assertEquals(10, HardClamp.resolved(ZERO_TO_TEN, 200).get());
        assertEquals(4, HardClamp.resolved(ZERO_TO_TEN, 4).get());
        assertThrows(OutOfBoundsException.class, () -> HardClamp.resolved(TEN_OR_MORE, 3));
        assertThrows(MachineOverflowException.class, () -> HardClamp.resolved(ZERO_TO_TEN, 256));
    }

    @Test
    public void testPanickingArithmeticLeavesValueUnchanged() {
        HardClamp value = HardClamp.of(TEN_OR_MORE, 10);
        value.add(1);
        assertEquals(11, value.get());
        try {
            value.subtract(2);
            fail("Exception should have been thrown by " + value);
        } catch (OutOfBoundsException e) {
            assertTrue(e.isTooSmall(), e::getMessage);
        }
        assertEquals(11, value.get());
        assertThrows(OutOfBoundsException.class, () -> value.negate());
        assertEquals(11, value.get());
    }

    @Test
    public void testMachineOverflowIgnoresBehavior() {
        ClampType wide = ClampType.builder(NumberKind.LONG).saturating().build();
        HardClamp big = HardClamp.of(wide, Long.MAX_VALUE);
        assertThrows(MachineOverflowException.class, () -> big.add(1));
        assertEquals(Long.MAX_VALUE, big.get());
    }

    @Test
    public void testDivisionByZeroIgnoresBehavior() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        assertThrows(DivisionByZeroException.class, () -> clamp.divide(0));
        assertThrows(DivisionByZeroException.class, () -> clamp.remainder(0));
        assertThrows(DivisionByZeroException.class, () -> clamp.dividedBy(0));
        assertEquals(5, clamp.get());
    }

    @Test
    public void testByValueOperationsDoNotMutate() {
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 4);
        HardClamp b = HardClamp.of(ZERO_TO_TEN, 3);
        HardClamp sum = a.plus(b);
        assertNotSame(a, sum);
        assertEquals(7, sum.get());
        assertEquals(4, a.get());
        assertEquals(10, a.plus(100).get());
        assertEquals(1, a.minus(b).get());
        assertEquals(0, b.minus(a).get());
        assertEquals(10, a.times(b).get());
        assertEquals(1, a.dividedBy(b).get());
        assertEquals(1, a.modulo(b).get());
        assertEquals(0, a.negated().get());
        assertEquals(4, a.get());
    }

    @Test
    public void testInPlaceOperationsWithAnotherClamp() {
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 4);
        HardClamp b = HardClamp.of(ZERO_TO_TEN, 3);
        assertSame(a, a.add(b));
        assertEquals(7, a.get());
        a.multiply(b);
        assertEquals(10, a.get());
        a.subtract(b).subtract(b);
        assertEquals(4, a.get());
        a.add(a);
        assertEquals(8, a.get());
    }

    @Test
    public void testBitwiseOperations() {
        ClampType bits = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 0x3F, SATURATING);
        HardClamp c = HardClamp.of(bits, 0b1100);
        c.apply(BinaryOp.AND, 0b1010);
        assertEquals(0b1000, c.get());
        c.apply(BinaryOp.OR, 0b0001);
        assertEquals(0b1001, c.get());
        c.apply(BinaryOp.XOR, 0b1111);
        assertEquals(0b0110, c.get());
        c.apply(BinaryOp.SHIFT_LEFT, 3);
        assertEquals(0b110000, c.get());
        c.apply(BinaryOp.SHIFT_LEFT, 1);
        assertEquals(0x3F, c.get());
        c.apply(BinaryOp.SHIFT_RIGHT, 4);
        assertEquals(3, c.get());
        // ~3 in a byte is 0xFC, above the upper bound
        assertEquals(0x3F, c.combine(UnaryOp.NOT).get());
        assertEquals(3, c.get());
    }

    @Test
    public void testSet() {
        HardClamp c = HardClamp.of(ZERO_TO_TEN, 1);
        assertSame(c, c.set(9));
        assertEquals(9, c.get());
        assertThrows(OutOfBoundsException.class, () -> c.set(11));
        assertEquals(9, c.get());
    }

    @Test
    public void testParse() {
        HardClamp c = HardClamp.parse(ZERO_TO_TEN, "7");
        assertEquals(7, c.get());
        assertEquals(c, HardClamp.parse(ZERO_TO_TEN, c.toString()));
        assertThrows(OutOfBoundsException.class, () -> HardClamp.parse(ZERO_TO_TEN, "11"));
        assertThrows(NumberFormatException.class, () -> HardClamp.parse(ZERO_TO_TEN, "seven"));
    }

    @Test
    public void testRandomAndDefault() {
        for (int i = 0; i < 200; i++) {
            long v = HardClamp.random(ZERO_TO_TEN).get();
            assertTrue(v >= 0 && v <= 10, () -> "Out of range: " + v);
        }
        assertEquals(0, HardClamp.defaultOf(ZERO_TO_TEN).get());
        assertEquals(10, HardClamp.defaultOf(TEN_OR_MORE).get());
    }

    @Test
    public void testSignPredicates() {
        ClampType signed = ClampType.of(NumberKind.BYTE, -5, 5, PANICKING);
        assertTrue(HardClamp.of(signed, -1).isNegative());
        assertTrue(HardClamp.of(signed, 0).isZero());
        assertTrue(HardClamp.of(signed, 1).isPositive());
        assertFalse(HardClamp.of(signed, 1).isNegative());
        assertEquals(-3, HardClamp.of(signed, 3).negate().get());
    }

    @Test
    public void testEqualityAndOrdering() {
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 3);
        HardClamp b = HardClamp.of(ZERO_TO_TEN, 3);
        HardClamp c = HardClamp.of(ZERO_TO_TEN, 4);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.compareTo(c) < 0);
        assertFalse(a.equals(HardClamp.of(ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, PANICKING), 3)));
        assertFalse(a.equals(a.toSoft()));
        HardClamp copy = a.copy();
        copy.add(1);
        assertEquals(3, a.get());
        assertEquals(4, copy.get());
    }

    @Test
    public void testCapabilities() {
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 3);
        InherentLimits limits = a;
        InherentBehavior behavior = a;
        assertEquals(0, limits.lower());
        assertEquals(10, limits.upper());
        assertSame(SATURATING, behavior.behavior());
        assertEquals(3L, a.getAsLong());
    }

    @Test
    public void testClampsOfDifferentTypesDoNotCompare() {
        ClampType panicking = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, PANICKING);
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 5);
        HardClamp b = HardClamp.of(panicking, 5);
        assertFalse(a.equals(b));
        try {
            a.compareTo(b);
            fail("Clamps of different types should not compare");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().startsWith("Cannot combine"), ex::getMessage);
        }
        assertEquals(0, a.compareTo(HardClamp.of(ZERO_TO_TEN, 5)));
        TreeSet<HardClamp> set = new TreeSet<>();
        set.add(a);
        assertThrows(IllegalArgumentException.class, () -> set.add(b));
        assertEquals(1, set.size());
    }

    @Test
    public void testLeasedClampStillSupportsIdentityMethods() {
        HardClamp a = HardClamp.of(ZERO_TO_TEN, 5);
        HardClamp b = HardClamp.of(ZERO_TO_TEN, 5);
        int hash = a.hashCode();
        Set<HardClamp> set = new HashSet<>();
        set.add(a);
        try (Guard<Long> g = a.modify()) {
            g.set(8L);
            assertThrows(IllegalStateException.class, a::get);
            assertEquals(b, a);
            assertEquals(hash, a.hashCode());
            assertEquals("5", a.toString());
            assertTrue(set.contains(a));
            g.commit();
        }
        assertEquals("8", a.toString());
        assertFalse(a.equals(b));
    }
}
