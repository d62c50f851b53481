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
 * Thrown when a value falls outside the limits of a clamp type, whether from
 * construction, from validated setters, from a guard commit, or from
 * arithmetic on a clamp type whose behavior is
 * {@link StandardBehavior#PANICKING}.
 *
 * @author Tim Boudreau
 */
public final class OutOfBoundsException extends IllegalArgumentException {

    private final long value;
    private final long lower;
    private final long upper;

    public OutOfBoundsException(long value, long lower, long upper) {
        super(value < lower
                ? "Value too small: " + value + " (min: " + lower + ")"
                : "Value too large: " + value + " (max: " + upper + ")");
        this.value = value;
        this.lower = lower;
        this.upper = upper;
    }

    public OutOfBoundsException(long value, Limits limits) {
        this(value, limits.lower(), limits.upper());
    }

    public long value() {
        return value;
    }

    public long lower() {
        return lower;
    }

    public long upper() {
        return upper;
    }

    public boolean isTooSmall() {
        return value < lower;
    }

    public boolean isTooLarge() {
        return value > upper;
    }
}
