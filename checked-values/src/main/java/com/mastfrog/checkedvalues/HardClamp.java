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
 * A bounded integer whose value is always within the limits of its
 * {@link ClampType}. Construction and {@link #set(long)} reject out-of-range
 * values; arithmetic resolves out-of-range results through the type's
 * behavior (saturating to the violated bound, or throwing an
 * {@link OutOfBoundsException}); and a {@link Guard} from {@link #modify()}
 * refuses to commit an out-of-range staged value.
 * <pre>
 * ClampType type = ClampType.of(NumberKind.UNSIGNED_BYTE, 0, 10, StandardBehavior.SATURATING);
 * HardClamp clamp = HardClamp.of(type, 5);
 * clamp.add(5);      // 10
 * clamp.subtract(15); // 0
 * clamp.add(20);     // 10
 * </pre>
 *
 * @author Tim Boudreau
 */
public final class HardClamp extends Clamp<HardClamp> {

    private HardClamp(ClampType type, long value) {
        super(type, value);
    }

    /**
     * Create a new HardClamp.
     *
     * @param type The clamp type
     * @param value The initial value
     * @return A HardClamp
     * @throws OutOfBoundsException if the passed value is outside the limits
     * of the type
     */
    public static HardClamp of(ClampType type, long value) {
        return new HardClamp(type, type.validate(value));
    }

    /**
     * Create a new HardClamp, routing an out-of-range initial value through
     * the type's behavior, so a saturating type pins it to the nearest bound.
     *
     * @param type The clamp type
     * @param value The initial value
     * @return A HardClamp
     * @throws OutOfBoundsException if the value is out of range and the
     * type's behavior is panicking
     * @throws MachineOverflowException if the value cannot be represented by
     * the type's number kind
     */
    public static HardClamp resolved(ClampType type, long value) {
        return new HardClamp(type, type.resolve(type.kind().requireRepresentable(value)));
    }

    /**
     * Create a HardClamp with a value chosen uniformly from the limits of the
     * type.
     *
     * @param type The clamp type
     * @return A HardClamp
     */
    public static HardClamp random(ClampType type) {
        return new HardClamp(type, type.randomValue());
    }

    /**
     * Create a HardClamp holding zero if the type allows it, otherwise the
     * lower bound.
     *
     * @param type The clamp type
     * @return A HardClamp
     */
    public static HardClamp defaultOf(ClampType type) {
        return new HardClamp(type, type.defaultValue());
    }

    /**
     * Parse text as a HardClamp.
     *
     * @param type The clamp type
     * @param text Some text
     * @return A HardClamp
     * @throws NumberFormatException if the text is not an integer the
     * number kind can represent
     * @throws OutOfBoundsException if it is outside the type's limits
     */
    public static HardClamp parse(ClampType type, String text) {
        return new HardClamp(type, type.parse(text));
    }

    @Override
    HardClamp self() {
        return this;
    }

    @Override
    HardClamp create(long value) {
        return new HardClamp(type, value);
    }

    @Override
    long validateStaged(long staged) {
        return type.validate(staged);
    }

    /**
     * Get the value, which is always within the limits.
     *
     * @return The value
     * @throws IllegalStateException if a guard is open on this clamp
     */
    public long get() {
        return current();
    }

    @Override
    public long getAsLong() {
        return get();
    }

    /**
     * Replace the value.
     *
     * @param value A new value
     * @return this
     * @throws OutOfBoundsException if the value is outside the limits, in
     * which case this clamp is unchanged
     */
    public HardClamp set(long value) {
        store(type.validate(value));
        return this;
    }

    /**
     * Convert to a SoftClamp of the same type and value.
     *
     * @return A SoftClamp
     */
    public SoftClamp toSoft() {
        return SoftClamp.of(type, get());
    }
}
