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
 * Policy deciding what happens when an arithmetic result would leave the
 * limits of a clamp type. A behavior either returns a replacement value
 * within the limits, or throws; it never returns an out-of-range value.
 * <p>
 * Behaviors are chosen per clamp type, not per call. See
 * {@link StandardBehavior} for the two standard policies.
 * </p>
 *
 * @author Tim Boudreau
 */
public interface Behavior {

    /**
     * Resolve a result greater than the upper bound.
     *
     * @param raw The computed result
     * @param limits The limits it violates
     * @return A value within the limits
     * @throws OutOfBoundsException if the behavior does not resolve overflow
     */
    long resolveOverflow(long raw, Limits limits);

    /**
     * Resolve a result less than the lower bound.
     *
     * @param raw The computed result
     * @param limits The limits it violates
     * @return A value within the limits
     * @throws OutOfBoundsException if the behavior does not resolve underflow
     */
    long resolveUnderflow(long raw, Limits limits);
}
