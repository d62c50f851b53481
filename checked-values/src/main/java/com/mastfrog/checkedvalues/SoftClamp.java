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

import java.util.function.LongUnaryOperator;

/**
 * A bounded integer whose value is allowed to stray outside the limits of its
 * {@link ClampType}. Construction, {@link #setUnchecked(long)},
 * {@link #update(LongUnaryOperator)} and guard commits accept any value the
 * number kind can represent; {@link #set(long)} and arithmetic route results
 * outside the limits through the type's behavior. Whether the current value
 * is within the limits is reported by {@link #isValid()}.
 *
 * @author Tim Boudreau
 */
public final class SoftClamp extends Clamp<SoftClamp> {

    private SoftClamp(ClampType type, long value) {
        super(type, value);
    }

    /**
     * Create a new SoftClamp, storing the value as-is even if it is outside
     * the limits of the type.
     *
     * @param type The clamp type
     * @param value The initial value
     * @return A SoftClamp
     * @throws MachineOverflowException if the value cannot be represented by
     * the type's number kind
     */
    public static SoftClamp of(ClampType type, long value) {
        return new SoftClamp(type, type.kind().requireRepresentable(value));
    }

    public static SoftClamp random(ClampType type) {
        return new SoftClamp(type, type.randomValue());
    }

    public static SoftClamp defaultOf(ClampType type) {
        return new SoftClamp(type, type.defaultValue());
    }

    /**
     * Parse text as a SoftClamp; any integer the number kind can represent is
     * accepted.
     *
     * @param type The clamp type
     * @param text Some text
     * @return A SoftClamp
     * @throws NumberFormatException if the text is not an integer the number
     * kind can represent
     */
    public static SoftClamp parse(ClampType type, String text) {
        return new SoftClamp(type, type.kind().parse(text));
    }

    @Override
    SoftClamp self() {
        return this;
    }

    @Override
    SoftClamp create(long value) {
        return new SoftClamp(type, value);
    }

    @Override
    long validateStaged(long staged) {
        return type.kind().requireRepresentable(staged);
    }

    /**
     * Determine if the current value is within the limits; recomputed on
     * every call.
     *
     * @return true if it is
     */
    public boolean isValid() {
        return type.contains(current());
    }

    /**
     * Get the value if it is within the limits.
     *
     * @return The value
     * @throws OutOfBoundsException if it is not
     */
    public long get() {
        return type.validate(current());
    }

    /**
     * Get the value whether or not it is within the limits.
     *
     * @return The value
     */
    public long getUnchecked() {
        return current();
    }

    @Override
    public long getAsLong() {
        return getUnchecked();
    }

    /**
     * Set the value, routing a value outside the limits through the type's
     * behavior.
     *
     * @param value A new value
     * @return this
     * @throws OutOfBoundsException if the value is outside the limits and the
     * behavior is panicking, in which case this clamp is unchanged
     */
    public SoftClamp set(long value) {
        store(type.resolve(type.kind().requireRepresentable(value)));
        return this;
    }

    /**
     * Set the value as-is.
     *
     * @param value A new value
     * @return this
     * @throws MachineOverflowException if the value cannot be represented by
     * the type's number kind
     */
    public SoftClamp setUnchecked(long value) {
        store(type.kind().requireRepresentable(value));
        return this;
    }

    /**
     * Transform the raw value directly, bypassing the limits.
     *
     * @param transform A function of the current value
     * @return this
     */
    public SoftClamp update(LongUnaryOperator transform) {
        return setUnchecked(transform.applyAsLong(current()));
    }

    /**
     * Convert to a HardClamp of the same type and value.
     *
     * @return A HardClamp
     * @throws OutOfBoundsException if the current value is outside the
     * limits
     */
    public HardClamp toHard() {
        return HardClamp.of(type, current());
    }
}
