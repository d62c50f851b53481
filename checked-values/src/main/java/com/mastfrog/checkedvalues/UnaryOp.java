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
 * Single-operand operations supported by clamps.
 *
 * @author Tim Boudreau
 */
public enum UnaryOp {
    /**
     * Arithmetic negation; only negating the minimum long is a machine
     * overflow. Negating a nonzero unsigned value yields a negative result,
     * which no unsigned clamp's limits contain.
     */
    NEGATE {
        @Override
        public long apply(NumberKind kind, long value) {
            kind.requireRepresentable(value);
            if (value == Long.MIN_VALUE) {
                throw new MachineOverflowException(kind, "-" + value
                        + " overflows");
            }
            return -value;
        }
    },
    /**
     * Bitwise complement within the width of the kind.
     */
    NOT {
        @Override
        public long apply(NumberKind kind, long value) {
            kind.requireRepresentable(value);
            return kind.isSigned() ? ~value : ~value & kind.mask();
        }
    };

    /**
     * Apply this operation to a value of the passed kind.
     *
     * @param kind A number kind
     * @param value A value representable by it
     * @return The result
     * @throws MachineOverflowException if the value is not representable by
     * the kind, or the result overflows a long
     */
    public abstract long apply(NumberKind kind, long value);
}
