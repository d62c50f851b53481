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
 * Shared arithmetic for clamps: computes a raw result with machine-checked
 * arithmetic, then routes any result outside the limits through the clamp
 * type's behavior.
 *
 * @author Tim Boudreau
 */
final class Arithmetic {

    private Arithmetic() {
        throw new AssertionError();
    }

    static long apply(ClampType type, BinaryOp op, long lhs, long rhs) {
        return resolve(type, op.apply(type.kind(), lhs, rhs));
    }

    static long apply(ClampType type, UnaryOp op, long value) {
        return resolve(type, op.apply(type.kind(), value));
    }

    /**
     * Returns the raw value if within the limits of the type, otherwise
     * whatever its behavior resolves it to.
     */
    static long resolve(ClampType type, long raw) {
        Limits limits = type.limits();
        long result;
        if (raw > limits.upper()) {
            result = type.behavior().resolveOverflow(raw, limits);
        } else if (raw < limits.lower()) {
            result = type.behavior().resolveUnderflow(raw, limits);
        } else {
            return raw;
        }
        // A behavior may not hand back an out-of-range value
        return limits.check(result);
    }
}
