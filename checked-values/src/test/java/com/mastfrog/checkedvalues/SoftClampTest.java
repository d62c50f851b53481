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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class SoftClampTest {

    private static final ClampType ZERO_TO_TEN
            = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, SATURATING);
    private static final ClampType STRICT_ZERO_TO_TEN
            = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, PANICKING);

    @Test
    public void testArithmetic() {
        SoftClamp clamp = SoftClamp.of(ZERO_TO_TEN, 5);
        assertEquals(5, clamp.getUnchecked());
        assertTrue(clamp.isValid());

        clamp.add(5);
        assertEquals(10, clamp.getUnchecked());
        assertTrue(clamp.isValid());

        clamp.subtract(15);
        assertEquals(0, clamp.getUnchecked());
        assertTrue(clamp.isValid());

        clamp.setUnchecked(30);
        assertEquals(30, clamp.getUnchecked());
        assertFalse(clamp.isValid());
    }

    @Test
    public void testConstructionAcceptsOutOfRangeValues() {
        SoftClamp clamp = SoftClamp.of(ZERO_TO_TEN, 200);
        assertEquals(200, clamp.getUnchecked());
        assertFalse(clamp.isValid());
        OutOfBoundsException e = assertThrows(OutOfBoundsException.class, clamp::get);
        assertTrue(e.isTooLarge(), e::getMessage);
        assertThrows(OutOfBoundsException.class, clamp::toHard);

        assertThrows(MachineOverflowException.class, () -> SoftClamp.of(ZERO_TO_TEN, 256));
        assertThrows(MachineOverflowException.class, () -> SoftClamp.of(ZERO_TO_TEN, -1));
    }

    @Test
    public void testSetRoutesThroughBehavior() {
        SoftClamp sat = SoftClamp.of(ZERO_TO_TEN, 5);
        sat.set(30);
        assertEquals(10, sat.get());
        assertTrue(sat.isValid());

        SoftClamp strict = SoftClamp.of(STRICT_ZERO_TO_TEN, 5);
        assertThrows(OutOfBoundsException.class, () -> strict.set(30));
        assertEquals(5, strict.get());
        strict.set(7);
        assertEquals(7, strict.get());
    }

    @Test
    public void testUncheckedPathsBypassLimits() {
        SoftClamp clamp = SoftClamp.of(STRICT_ZERO_TO_TEN, 5);
        clamp.update(v -> v * 20);
        assertEquals(100, clamp.getUnchecked());
        assertFalse(clamp.isValid());
        assertEquals(100L, clamp.getAsLong());
        assertThrows(MachineOverflowException.class, () -> clamp.update(v -> v * 20));
        assertEquals(100, clamp.getUnchecked());

        clamp.setUnchecked(4);
        assertTrue(clamp.isValid());
        assertEquals(4, clamp.toHard().get());
    }

    @Test
    public void testArithmeticOnAnInvalidValueResolvesIt() {
        SoftClamp clamp = SoftClamp.of(ZERO_TO_TEN, 30);
        clamp.subtract(1);
        assertEquals(10, clamp.get());

        SoftClamp strict = SoftClamp.of(STRICT_ZERO_TO_TEN, 30);
        assertThrows(OutOfBoundsException.class, () -> strict.subtract(1));
        assertEquals(30, strict.getUnchecked());
        strict.subtract(25);
        assertEquals(5, strict.get());
    }

    @Test
    public void testParseAcceptsAnyRepresentableValue() {
        assertEquals(200, SoftClamp.parse(ZERO_TO_TEN, "200").getUnchecked());
        assertThrows(NumberFormatException.class, () -> SoftClamp.parse(ZERO_TO_TEN, "256"));
        assertThrows(NumberFormatException.class, () -> SoftClamp.parse(ZERO_TO_TEN, "ten"));
    }

    @Test
    public void testConversionBetweenHardAndSoft() {
        SoftClamp soft = HardClamp.of(ZERO_TO_TEN, 6).toSoft();
        assertEquals(6, soft.get());
        assertEquals(ZERO_TO_TEN, soft.type());
        HardClamp hard = soft.toHard();
        assertEquals(6, hard.get());
    }

    @Test
    public void testRandomAndDefaultAreValid() {
        for (int i = 0; i < 100; i++) {
            assertTrue(SoftClamp.random(ZERO_TO_TEN).isValid());
        }
        assertEquals(0, SoftClamp.defaultOf(ZERO_TO_TEN).get());
    }
}
