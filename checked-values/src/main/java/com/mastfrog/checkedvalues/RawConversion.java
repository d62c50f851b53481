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
 * Conversion capability: a two-way mapping between a wrapper type and the raw
 * integer it wraps. Converting from a raw value runs whatever validation the
 * wrapper's construction runs.
 *
 * @param <W> The wrapper type
 * @author Tim Boudreau
 */
public interface RawConversion<W> {

    /**
     * Wrap a raw value.
     *
     * @param raw A raw value
     * @return A wrapper
     * @throws OutOfBoundsException if the wrapper enforces limits the value
     * lies outside of
     */
    W fromRaw(long raw);

    /**
     * Unwrap a wrapper.
     *
     * @param wrapper A wrapper
     * @return Its raw value
     */
    long toRaw(W wrapper);
}
