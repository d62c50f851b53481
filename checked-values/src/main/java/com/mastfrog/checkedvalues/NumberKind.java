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

/**
 * The primitive integer width a clamp is declared over. All values are carried
 * as <code>long</code>, and a kind determines which longs are representable.
 * Arithmetic is computed in 64 bits: a result a long cannot hold is a machine
 * overflow no matter what behavior the clamp type uses, while a result outside
 * the kind but within a long simply lies outside the clamp's limits.
 * <p>
 * Unsigned 64-bit values are not supported, since they cannot be carried in a
 * <code>long</code> without reinterpreting its sign bit.
 * </p>
 *
 * @author Tim Boudreau
 */
public enum NumberKind {
    BYTE(Byte.MIN_VALUE, Byte.MAX_VALUE, 8, true),
    UNSIGNED_BYTE(0, 0xFFL, 8, false),
    SHORT(Short.MIN_VALUE, Short.MAX_VALUE, 16, true),
    UNSIGNED_SHORT(0, 0xFFFFL, 16, false),
    INT(Integer.MIN_VALUE, Integer.MAX_VALUE, 32, true),
    UNSIGNED_INT(0, 0xFFFF_FFFFL, 32, false),
    LONG(Long.MIN_VALUE, Long.MAX_VALUE, 64, true);

    private final long min;
    private final long max;
    private final int bits;
    private final boolean signed;

    NumberKind(long min, long max, int bits, boolean signed) {
        this.min = min;
        this.max = max;
        this.bits = bits;
        this.signed = signed;
    }

    /**
     * The smallest representable value.
     *
     * @return A minimum
     */
    public long min() {
        return min;
    }

    /**
     * The largest representable value.
     *
     * @return A maximum
     */
    public long max() {
        return max;
    }

    public int bits() {
        return bits;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    /**
     * All bits of this kind set, as a long; used to confine bitwise negation
     * of unsigned values to their width.
     *
     * @return A mask
     */
    long mask() {
        return bits == 64 ? -1L : (1L << bits) - 1;
    }

    /**
     * Parse text the way the corresponding primitive type would: text which
     * is not an integer, or which names an integer this kind cannot hold, is
     * malformed.
     *
     * @param text Some text
     * @return A value within the bounds of this kind
     * @throws NumberFormatException if the text is not a representable
     * integer
     */
    public long parse(String text) {
        if (text == null) {
            throw new NumberFormatException("Cannot parse null as " + this);
        }
        long result = Long.parseLong(text.trim());
        if (!contains(result)) {
            throw new NumberFormatException("Value " + text
                    + " is outside the bounds of " + this
                    + " (" + min + " to " + max + ")");
        }
        return result;
    }

    /**
     * Ensure a value can be held by this kind.
     *
     * @param value A value
     * @return the value
     * @throws MachineOverflowException if it cannot
     */
    public long requireRepresentable(long value) {
        if (!contains(value)) {
            throw new MachineOverflowException(this, "Value " + value
                    + " cannot be represented as " + this);
        }
        return value;
    }
}
