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
 * Two-operand operations supported by clamps. Operands must be values of the
 * number kind; the result is computed with overflow-checked 64-bit
 * arithmetic, throwing {@link MachineOverflowException} if a long cannot hold
 * it. A result outside the number kind but within a long is returned as-is;
 * it is necessarily outside a clamp's limits too, and resolving it is left to
 * {@link Arithmetic}.
 *
 * @author Tim Boudreau
 */
public enum BinaryOp {
    ADD("+") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return Math.addExact(a, b);
        }
    },
    SUBTRACT("-") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return Math.subtractExact(a, b);
        }
    },
    MULTIPLY("*") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return Math.multiplyExact(a, b);
        }
    },
    DIVIDE("/") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            if (b == 0) {
                throw new DivisionByZeroException("Division of " + a + " by zero");
            }
            if (b == -1 && a == Long.MIN_VALUE) {
                throw new ArithmeticException("long overflow");
            }
            return a / b;
        }
    },
    REMAINDER("%") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            if (b == 0) {
                throw new DivisionByZeroException("Remainder of " + a + " by zero");
            }
            return a % b;
        }
    },
    AND("&") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return a & b;
        }
    },
    OR("|") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return a | b;
        }
    },
    XOR("^") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return a ^ b;
        }
    },
    SHIFT_LEFT("<<") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            int distance = shiftDistance(kind, b);
            long result = a << distance;
            if (result >> distance != a) {
                throw new ArithmeticException("Bits lost shifting " + a
                        + " left by " + distance);
            }
            return result;
        }
    },
    SHIFT_RIGHT(">>") {
        @Override
        long compute(NumberKind kind, long a, long b) {
            return a >> shiftDistance(kind, b);
        }
    };

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    abstract long compute(NumberKind kind, long a, long b);

    /**
     * Apply this operation to two values of the passed kind.
     *
     * @param kind The number kind of both operands and the result
     * @param a The left operand
     * @param b The right operand
     * @return The result
     * @throws MachineOverflowException if either operand is not
     * representable by the kind, or the result overflows a long
     * @throws DivisionByZeroException if dividing by zero
     */
    public long apply(NumberKind kind, long a, long b) {
        kind.requireRepresentable(a);
        kind.requireRepresentable(b);
        try {
            return compute(kind, a, b);
        } catch (DivisionByZeroException e) {
            throw e;
        } catch (ArithmeticException e) {
            MachineOverflowException ex = new MachineOverflowException(kind,
                    a + " " + symbol + " " + b + " overflows");
            ex.initCause(e);
            throw ex;
        }
    }

    public String symbol() {
        return symbol;
    }

    static int shiftDistance(NumberKind kind, long b) {
        if (b < 0 || b >= kind.bits()) {
            throw new ArithmeticException("Shift distance " + b
                    + " out of range for " + kind);
        }
        return (int) b;
    }
}
