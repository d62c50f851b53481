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
 * Bounds capability: exposes the inclusive range a type enforces. Along with
 * {@link InherentBehavior} and {@link RawConversion}, this is the surface code
 * generators emitting concrete wrapper types are expected to target.
 *
 * @author Tim Boudreau
 */
public interface InherentLimits {

    /**
     * The primitive width values are carried as.
     *
     * @return A kind
     */
    NumberKind kind();

    /**
     * The minimum value, inclusive.
     *
     * @return A minimum
     */
    long lower();

    /**
     * The maximum value, inclusive.
     *
     * @return A maximum
     */
    long upper();

    default boolean contains(long value) {
        return value >= lower() && value <= upper();
    }
}
