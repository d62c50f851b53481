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

import static com.mastfrog.checkedvalues.StandardBehavior.SATURATING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class GuardTest {

    private static final ClampType ZERO_TO_TEN
            = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, SATURATING);

    @Test
    public void testHardClampGuard() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        assertEquals(5, clamp.get());

        Guard<Long> g = clamp.modify();
        assertSame(GuardState.UNCHANGED, g.check());
        g.set(10L);
        assertSame(GuardState.CHANGED, g.check());
        g.commit();
        assertSame(Guard.Outcome.COMMITTED, g.outcome());
        assertEquals(10, clamp.get());

        Guard<Long> g2 = clamp.modify();
        assertSame(GuardState.UNCHANGED, g2.check());
        g2.set(15L);
        assertSame(GuardState.CHANGED, g2.check());
        assertFalse(g2.isValid());
        assertThrows(OutOfBoundsException.class, g2::commit);
        assertTrue(g2.isOpen());
        g2.cancel();
        assertEquals(10, clamp.get());
    }

    @Test
    public void testFailedCommitCanBeRetried() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        Guard<Long> g = clamp.modify();
        g.set(15L);
        assertThrows(OutOfBoundsException.class, g::commit);
        assertTrue(clamp.isLeased());
        g.update(v -> v - 7);
        assertEquals(8L, g.get());
        assertTrue(g.isValid());
        g.commit();
        assertFalse(clamp.isLeased());
        assertEquals(8, clamp.get());
    }

    @Test
    public void testStateIsDerivedFromEquality() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        Guard<Long> g = clamp.modify();
        g.set(6L);
        assertSame(GuardState.CHANGED, g.check());
        g.set(5L);
        assertSame(GuardState.UNCHANGED, g.check());
        assertEquals(5L, g.snapshot());
        g.commit();
        assertEquals(5, clamp.get());
    }

    @Test
    public void testGuardCannotBeReused() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        Guard<Long> g = clamp.modify();
        g.set(7L);
        g.commit();
        assertThrows(IllegalStateException.class, g::commit);
        assertThrows(IllegalStateException.class, g::cancel);
        assertThrows(IllegalStateException.class, g::check);
        assertThrows(IllegalStateException.class, () -> g.set(3L));
        assertThrows(IllegalStateException.class, g::get);
        assertEquals(7, clamp.get());

        Guard<Long> g2 = clamp.modify();
        g2.cancel();
        assertSame(Guard.Outcome.CANCELLED, g2.outcome());
        assertThrows(IllegalStateException.class, g2::commit);
        g2.close();
        assertSame(Guard.Outcome.CANCELLED, g2.outcome());
    }

    @Test
    public void testOwnerIsExclusivelyLeased() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        Guard<Long> g = clamp.modify();
        assertTrue(clamp.isLeased());
        assertThrows(IllegalStateException.class, clamp::modify);
        assertThrows(IllegalStateException.class, clamp::get);
        assertThrows(IllegalStateException.class, () -> clamp.add(1));
        assertThrows(IllegalStateException.class, () -> clamp.set(1));
        assertThrows(IllegalStateException.class, () -> clamp.plus(1));
        g.cancel();
        assertFalse(clamp.isLeased());
        assertEquals(5, clamp.get());
        clamp.modify().cancel();
    }

    @Test
    public void testCloseCancelsAnOpenGuard() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        try (Guard<Long> g = clamp.modify()) {
            g.set(9L);
        }
        assertFalse(clamp.isLeased());
        assertEquals(5, clamp.get());

        try (Guard<Long> g = clamp.modify()) {
            g.set(9L);
            g.commit();
        }
        assertEquals(9, clamp.get());
    }

    @Test
    public void testSoftClampCommitAcceptsAnyRepresentableValue() {
        SoftClamp clamp = SoftClamp.of(ZERO_TO_TEN, 5);
        Guard<Long> g = clamp.modify();
        g.set(30L);
        assertTrue(g.isValid());
        g.commit();
        assertEquals(30, clamp.getUnchecked());
        assertFalse(clamp.isValid());

        Guard<Long> g2 = clamp.modify();
        g2.set(300L);
        assertFalse(g2.isValid());
        assertThrows(MachineOverflowException.class, g2::commit);
        g2.cancel();
        assertEquals(30, clamp.getUnchecked());
    }

    @Test
    public void testNullsAreRejected() {
        HardClamp clamp = HardClamp.of(ZERO_TO_TEN, 5);
        try (Guard<Long> g = clamp.modify()) {
            assertThrows(NullPointerException.class, () -> g.set(null));
            assertEquals(5L, g.get());
        }
    }
}
