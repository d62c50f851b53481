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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two standard overflow policies.
 *
 * @author Tim Boudreau
 */
public enum StandardBehavior implements Behavior {
    /**
     * Treats leaving the limits as a programming error, throwing an
     * {@link OutOfBoundsException}.
     */
    PANICKING {
        @Override
        public long resolveOverflow(long raw, Limits limits) {
            throw new OutOfBoundsException(raw, limits);
        }

        @Override
        public long resolveUnderflow(long raw, Limits limits) {
            throw new OutOfBoundsException(raw, limits);
        }
    },
    /**
     * Pins the result to the bound it violated.
     */
    SATURATING {
        @Override
        public long resolveOverflow(long raw, Limits limits) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("Saturate {} to upper bound of {}", raw, limits);
            }
            return limits.upper();
        }

        @Override
        public long resolveUnderflow(long raw, Limits limits) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("Saturate {} to lower bound of {}", raw, limits);
            }
            return limits.lower();
        }
    };

    private static final Logger LOG = LoggerFactory.getLogger(StandardBehavior.class);
}
