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

import java.util.function.LongSupplier;

/**
 * Base class for {@link HardClamp} and {@link SoftClamp}: a mutable holder of
 * a <code>long</code> of some {@link ClampType}, with in-place and by-value
 * arithmetic resolved through the type's behavior, and staged mutation via
 * {@link #modify()}.
 * <p>
 * In-place operations only write the result back if the whole operation
 * succeeds; a thrown exception always leaves the clamp as it was. Combining
 * or comparing two clamps requires that they have equal types.
 * </p>
 * <p>
 * While a guard from {@link #modify()} is open, reads, writes and arithmetic
 * throw {@link IllegalStateException}. {@link #equals(Object)},
 * {@link #hashCode()} and {@link #toString()} are exempt, and report the
 * value from before the guard was opened.
 * </p>
 *
 * @param <C> The concrete clamp type
 * @author Tim Boudreau
 */
public abstract class Clamp<C extends Clamp<C>> implements LongSupplier,
        Comparable<C>, InherentLimits, InherentBehavior {

    final ClampType type;
    long value;
    private boolean leased;

    Clamp(ClampType type, long value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Create another clamp of the same concrete type and clamp type.
     */
    abstract C create(long value);

    /**
     * Validate a value staged in a guard, returning what to store.
     */
    abstract long validateStaged(long staged);

    abstract C self();

    final void ensureNotLeased() {
        if (leased) {
            throw new IllegalStateException("Clamp of type " + type
                    + " is leased to an open guard");
        }
    }

    /**
     * The raw value, whether or not it is in range.
     */
    final long current() {
        ensureNotLeased();
        return value;
    }

    final void store(long value) {
        ensureNotLeased();
        this.value = value;
    }

    public final ClampType type() {
        return type;
    }

    @Override
    public final NumberKind kind() {
        return type.kind();
    }

    @Override
    public final long lower() {
        return type.lower();
    }

    @Override
    public final long upper() {
        return type.upper();
    }

    @Override
    public final Behavior behavior() {
        return type.behavior();
    }

    /**
     * Determine if a guard is currently open on this clamp.
     *
     * @return true if leased
     */
    public final boolean isLeased() {
        return leased;
    }

    /**
     * Open a guard over this clamp. Until the guard is committed, cancelled
     * or closed, this clamp may not be read, written or modified.
     *
     * @return A guard whose staged value starts as this clamp's value
     * @throws IllegalStateException if a guard is already open
     */
    public final Guard<Long> modify() {
        ensureNotLeased();
        leased = true;
        Long snapshot = value;
        return new Guard<>(new Lease<Long>() {
            @Override
            public Long validate(Long staged) {
                return validateStaged(staged);
            }

            @Override
            public void write(Long staged) {
                value = staged;
            }

            @Override
            public void release() {
                leased = false;
            }
        }, snapshot, snapshot);
    }

    /**
     * Apply a two-operand operation in place.
     *
     * @param op The operation
     * @param operand The right operand
     * @return this
     * @throws OutOfBoundsException if the result is out of range and the
     * behavior is panicking
     * @throws MachineOverflowException if the result cannot be represented
     * @throws DivisionByZeroException on division by zero
     */
    public final C apply(BinaryOp op, long operand) {
        store(Arithmetic.apply(type, op, current(), operand));
        return self();
    }

    public final C apply(BinaryOp op, C operand) {
        type.requireSameType(operand.type);
        return apply(op, operand.current());
    }

    public final C apply(UnaryOp op) {
        store(Arithmetic.apply(type, op, current()));
        return self();
    }

    /**
     * Apply a two-operand operation, returning the result as a new clamp and
     * leaving this one unchanged.
     *
     * @param op The operation
     * @param operand The right operand
     * @return A new clamp
     */
    public final C combine(BinaryOp op, long operand) {
        return create(Arithmetic.apply(type, op, current(), operand));
    }

    public final C combine(BinaryOp op, C operand) {
        type.requireSameType(operand.type);
        return combine(op, operand.current());
    }

    public final C combine(UnaryOp op) {
        return create(Arithmetic.apply(type, op, current()));
    }

    public final C add(long operand) {
        return apply(BinaryOp.ADD, operand);
    }

    public final C add(C operand) {
        return apply(BinaryOp.ADD, operand);
    }

    public final C subtract(long operand) {
        return apply(BinaryOp.SUBTRACT, operand);
    }

    public final C subtract(C operand) {
        return apply(BinaryOp.SUBTRACT, operand);
    }

    public final C multiply(long operand) {
        return apply(BinaryOp.MULTIPLY, operand);
    }

    public final C multiply(C operand) {
        return apply(BinaryOp.MULTIPLY, operand);
    }

    public final C divide(long operand) {
        return apply(BinaryOp.DIVIDE, operand);
    }

    public final C divide(C operand) {
        return apply(BinaryOp.DIVIDE, operand);
    }

    public final C remainder(long operand) {
        return apply(BinaryOp.REMAINDER, operand);
    }

    public final C remainder(C operand) {
        return apply(BinaryOp.REMAINDER, operand);
    }

    public final C negate() {
        return apply(UnaryOp.NEGATE);
    }

    public final C plus(long operand) {
        return combine(BinaryOp.ADD, operand);
    }

    public final C plus(C operand) {
        return combine(BinaryOp.ADD, operand);
    }

    public final C minus(long operand) {
        return combine(BinaryOp.SUBTRACT, operand);
    }

    public final C minus(C operand) {
        return combine(BinaryOp.SUBTRACT, operand);
    }

    public final C times(long operand) {
        return combine(BinaryOp.MULTIPLY, operand);
    }

    public final C times(C operand) {
        return combine(BinaryOp.MULTIPLY, operand);
    }

    public final C dividedBy(long operand) {
        return combine(BinaryOp.DIVIDE, operand);
    }

    public final C dividedBy(C operand) {
        return combine(BinaryOp.DIVIDE, operand);
    }

    public final C modulo(long operand) {
        return combine(BinaryOp.REMAINDER, operand);
    }

    public final C modulo(C operand) {
        return combine(BinaryOp.REMAINDER, operand);
    }

    public final C negated() {
        return combine(UnaryOp.NEGATE);
    }

    public final boolean isZero() {
        return current() == 0;
    }

    public final boolean isNegative() {
        return current() < 0;
    }

    public final boolean isPositive() {
        return current() > 0;
    }

    /**
     * Create an independent clamp with the same type and value.
     *
     * @return A copy
     */
    public final C copy() {
        return create(current());
    }

    /**
     * Compare by value.
     *
     * @param o Another clamp of the same type
     * @return A comparison result
     * @throws IllegalArgumentException if the types differ
     */
    @Override
    public final int compareTo(C o) {
        type.requireSameType(o.type);
        return Long.compare(current(), o.current());
    }

    @Override
    public final int hashCode() {
        return (int) (102071L * (value ^ (value >>> 32))) + 43867 * type.hashCode();
    }

    @Override
    public final boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != getClass()) {
            return false;
        }
        Clamp<?> other = (Clamp<?>) o;
        return other.value == value && other.type.equals(type);
    }

    /**
     * Returns the raw value, so that parsing the result of this method with
     * the clamp's type yields an equal clamp.
     *
     * @return A string
     */
    @Override
    public final String toString() {
        return Long.toString(value);
    }
}
