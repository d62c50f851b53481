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

import java.util.concurrent.ThreadLocalRandom;

/**
 * An immutable, inclusive <code>(lower, upper)</code> range over the values of
 * a {@link NumberKind}. Invalid ranges cannot be constructed.
 *
 * @author Tim Boudreau
 */
public final class Limits implements InherentLimits {

    private final NumberKind kind;
    private final long lower;
    private final long upper;

    private Limits(NumberKind kind, long lower, long upper) {
        this.kind = kind;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Create a range.
     *
     * @param kind The number kind
     * @param lower The minimum, inclusive
     * @param upper The maximum, inclusive
     * @return A range
     * @throws InvalidLimitsException if lower &gt; upper or either bound is
     * not representable by the kind
     */
    public static Limits of(NumberKind kind, long lower, long upper) {
        if (kind == null) {
            throw new IllegalArgumentException("Null kind");
        }
        if (lower > upper) {
            throw new InvalidLimitsException(lower, upper, "Lower bound "
                    + lower + " is greater than upper bound " + upper);
        }
        if (!kind.contains(lower) || !kind.contains(upper)) {
            throw new InvalidLimitsException(lower, upper, "Bounds " + lower
                    + " to " + upper + " are not within the bounds of " + kind
                    + " (" + kind.min() + " to " + kind.max() + ")");
        }
        return new Limits(kind, lower, upper);
    }

    /**
     * The full range of a number kind.
     *
     * @param kind A kind
     * @return A range
     */
    public static Limits defaults(NumberKind kind) {
        return of(kind, kind.min(), kind.max());
    }

    @Override
    public NumberKind kind() {
        return kind;
    }

    @Override
    public long lower() {
        return lower;
    }

    @Override
    public long upper() {
        return upper;
    }

    /**
     * The value a clamp over these limits starts from when none is given:
     * zero if zero is in range, otherwise the lower bound.
     *
     * @return A value within this range
     */
    public long defaultValue() {
        return contains(0) ? 0 : lower;
    }

    /**
     * Ensures that the passed value is within this range.
     *
     * @param value A value
     * @return the value
     * @throws OutOfBoundsException if it is not
     */
    public long check(long value) {
        if (!contains(value)) {
            throw new OutOfBoundsException(value, lower, upper);
        }
        return value;
    }

    /**
     * Pin a value to the nearest bound if it lies outside this range.
     *
     * @param value A value
     * @return A value within this range
     */
    public long clamp(long value) {
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * Pick a value uniformly from this range.
     *
     * @return A value within this range
     */
    public long randomValue() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        if (upper < Long.MAX_VALUE) {
            return rnd.nextLong(lower, upper + 1);
        } else if (lower > Long.MIN_VALUE) {
            return rnd.nextLong(lower - 1, upper) + 1;
        }
        return rnd.nextLong();
    }

    @Override
    public int hashCode() {
        long h = 102071L * (lower ^ (lower >>> 32))
                + 43867L * (upper ^ (upper >>> 32));
        return (int) (h ^ (h >>> 32)) + 7 * kind.ordinal();
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != Limits.class) {
            return false;
        }
        Limits other = (Limits) o;
        return other.kind == kind && other.lower == lower
                && other.upper == upper;
    }

    @Override
    public String toString() {
        return kind + "[" + lower + ".." + upper + "]";
    }
}
