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

import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Staged mutation of a clamp or view. A guard holds exclusive access to its
 * owner from the moment it is opened; while it is open, the owner rejects
 * reads, writes and further guards. Changes are made to a staged copy, which
 * only replaces the owner's value on a successful {@link #commit()}.
 * <p>
 * Every guard reaches exactly one outcome: committed or cancelled. A commit
 * which fails validation leaves both the owner and the guard as they were, so
 * the staged value can be fixed and committed again, or cancelled. A guard
 * closed while still open (for example, at the end of a try-with-resources
 * block) is cancelled.
 * </p>
 * <pre>
 * try (Guard&lt;Long&gt; g = clamp.modify()) {
 *     g.set(10L);
 *     if (g.isValid()) {
 *         g.commit();
 *     }
 * }
 * </pre>
 *
 * @param <T> The value type
 * @author Tim Boudreau
 */
public final class Guard<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Guard.class);

    private final Lease<T> lease;
    private final T snapshot;
    private T staged;
    private Outcome outcome = Outcome.OPEN;

    Guard(Lease<T> lease, T snapshot, T staged) {
        this.lease = lease;
        this.snapshot = snapshot;
        this.staged = staged;
    }

    /**
     * Where a guard is in its lifecycle.
     */
    public enum Outcome {
        OPEN,
        COMMITTED,
        CANCELLED
    }

    private void ensureOpen() {
        if (outcome != Outcome.OPEN) {
            throw new IllegalStateException("Guard already " + outcome);
        }
    }

    /**
     * Get the staged value.
     *
     * @return The staged value
     */
    public T get() {
        ensureOpen();
        return staged;
    }

    /**
     * Replace the staged value; nothing is validated until commit.
     *
     * @param value A new staged value
     * @return this
     */
    public Guard<T> set(T value) {
        ensureOpen();
        staged = Objects.requireNonNull(value, "value");
        return this;
    }

    public Guard<T> update(UnaryOperator<T> transform) {
        ensureOpen();
        return set(transform.apply(staged));
    }

    /**
     * The owner's value at the time this guard was opened.
     *
     * @return The snapshot
     */
    public T snapshot() {
        return snapshot;
    }

    /**
     * Peek at whether the staged value differs from the snapshot.
     *
     * @return The state
     */
    public GuardState check() {
        ensureOpen();
        return Objects.equals(staged, snapshot) ? GuardState.UNCHANGED
                : GuardState.CHANGED;
    }

    /**
     * Determine whether a commit of the current staged value would succeed,
     * without committing it.
     *
     * @return true if it would
     */
    public boolean isValid() {
        ensureOpen();
        try {
            lease.validate(staged);
            return true;
        } catch (IllegalArgumentException | ArithmeticException ex) {
            return false;
        }
    }

    /**
     * Validate the staged value and, if it passes, write it to the owner and
     * release it.
     *
     * @throws OutOfBoundsException if committing to a hard clamp and the
     * staged value is outside its limits
     * @throws ValidationException if committing to a view whose validator
     * rejects the staged value
     * @throws MachineOverflowException if the staged value cannot be
     * represented by a clamp's number kind
     * @throws IllegalStateException if this guard is no longer open
     */
    public void commit() {
        ensureOpen();
        T value;
        try {
            value = lease.validate(staged);
        } catch (RuntimeException ex) {
            LOG.debug("Commit of {} rejected: {}", staged, ex.getMessage());
            throw ex;
        }
        lease.write(value);
        finish(Outcome.COMMITTED);
    }

    /**
     * Discard the staged value and release the owner unchanged.
     *
     * @throws IllegalStateException if this guard is no longer open
     */
    public void cancel() {
        ensureOpen();
        finish(Outcome.CANCELLED);
    }

    /**
     * Cancels this guard if it is still open; does nothing otherwise.
     */
    @Override
    public void close() {
        if (outcome == Outcome.OPEN) {
            if (!Objects.equals(staged, snapshot)) {
                LOG.warn("Guard closed without commit or cancel; discarding "
                        + "staged value {} (was {})", staged, snapshot);
            }
            finish(Outcome.CANCELLED);
        }
    }

    private void finish(Outcome outcome) {
        this.outcome = outcome;
        lease.release();
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isOpen() {
        return outcome == Outcome.OPEN;
    }

    @Override
    public String toString() {
        return "Guard(" + outcome + ", staged=" + staged
                + ", snapshot=" + snapshot + ")";
    }
}
