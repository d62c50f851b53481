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

import java.lang.annotation.Documented;
import static java.lang.annotation.ElementType.TYPE;
import java.lang.annotation.Retention;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import java.lang.annotation.Target;

/**
 * Declares a clamp type on a marker class or interface, so that the limits and
 * behavior of a bounded value live in one place and can be looked up with
 * {@link ClampType#declaredBy(Class)}:
 * <pre>
 * &#064;Clamped(kind = NumberKind.UNSIGNED_BYTE, maximum = 100,
 *         behavior = StandardBehavior.SATURATING)
 * interface Percentage {}
 *
 * HardClamp pct = HardClamp.of(ClampType.declaredBy(Percentage.class), 50);
 * </pre>
 * <p>
 * Both bounds are inclusive. An unset minimum or maximum means the
 * corresponding bound of the kind.
 * </p>
 *
 * @author Tim Boudreau
 */
@Documented
@Target(TYPE)
@Retention(RUNTIME)
public @interface Clamped {

    /**
     * The primitive width values are carried as.
     *
     * @return A kind
     */
    NumberKind kind() default NumberKind.INT;

    /**
     * The minimum value, inclusive.
     *
     * @return A minimum
     */
    long minimum() default Long.MAX_VALUE; // intentional

    /**
     * The maximum value, inclusive.
     *
     * @return The maximum value
     */
    long maximum() default Long.MIN_VALUE;

    /**
     * What arithmetic does when a result leaves the range.
     *
     * @return A behavior
     */
    StandardBehavior behavior() default StandardBehavior.PANICKING;

    /**
     * Name used in the type's string form; the simple name of the annotated
     * type if unset.
     *
     * @return A name
     */
    String name() default "";
}
