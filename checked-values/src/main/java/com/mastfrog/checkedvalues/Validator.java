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
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A side-effect-free test of an item, which throws a
 * {@link ValidationException} describing why an item is invalid. Calling it
 * any number of times on the same item gives the same answer.
 *
 * @param <T> The item type
 * @author Tim Boudreau
 */
@FunctionalInterface
public interface Validator<T> {

    /**
     * Validate an item.
     *
     * @param item An item
     * @throws ValidationException if the item is invalid
     */
    void validate(T item);

    default boolean isValid(T item) {
        return !problem(item).isPresent();
    }

    /**
     * Get the reason an item is invalid, if it is.
     *
     * @param item An item
     * @return The reason, or empty if the item is valid
     */
    default Optional<String> problem(T item) {
        try {
            validate(item);
            return Optional.empty();
        } catch (ValidationException ex) {
            return Optional.of(ex.reason());
        }
    }

    /**
     * Combine this validator with another; the result rejects whatever either
     * rejects, reporting this validator's reason first.
     *
     * @param other Another validator
     * @return A validator
     */
    default Validator<T> and(Validator<? super T> other) {
        Objects.requireNonNull(other, "other");
        return item -> {
            validate(item);
            other.validate(item);
        };
    }

    /**
     * Create a validator from a predicate.
     *
     * @param <T> The item type
     * @param test Returns true for valid items
     * @param reason The reason reported for items the test rejects
     * @return A validator
     */
    static <T> Validator<T> of(Predicate<? super T> test, String reason) {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(reason, "reason");
        return item -> {
            if (!test.test(item)) {
                throw new ValidationException(reason);
            }
        };
    }

    /**
     * A validator which accepts exactly the values within the limits of a
     * clamp type.
     *
     * @param type A clamp type
     * @return A validator
     */
    static Validator<Long> within(InherentLimits type) {
        Objects.requireNonNull(type, "type");
        return item -> {
            if (!type.contains(item)) {
                OutOfBoundsException oob = new OutOfBoundsException(item,
                        type.lower(), type.upper());
                throw new ValidationException(oob.getMessage(), oob);
            }
        };
    }
}
