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
import java.util.function.UnaryOperator;

/**
 * An item of any type paired with a {@link Validator}. Unlike a clamp, a view
 * does not bound its item: it may hold an invalid item, and validity is only
 * checked on demand: by {@link #isValid()}, {@link #check()}, by unwrapping,
 * and by committing a {@link Guard} obtained from {@link #modify()}.
 * <p>
 * Guards over a view stage a copy of the item made by the view's copy
 * function; the default copy function is the identity, which is only
 * appropriate for immutable items.
 * </p>
 * <p>
 * {@link #unwrap()}, a successful {@link #tryUnwrap()} and {@link #cancel()}
 * consume the view; using it afterwards throws an
 * {@link IllegalStateException}.
 * </p>
 *
 * @param <T> The item type
 * @author Tim Boudreau
 */
public final class View<T> {

    private final Validator<? super T> validator;
    private final UnaryOperator<T> copier;
    private T item;
    private boolean leased;
    private boolean consumed;

    private View(T item, Validator<? super T> validator, UnaryOperator<T> copier) {
        this.item = Objects.requireNonNull(item, "item");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    /**
     * Create a view; always succeeds, whether or not the item is valid.
     *
     * @param <T> The item type
     * @param item The item
     * @param validator The validator
     * @return A view
     */
    public static <T> View<T> withValidator(T item, Validator<? super T> validator) {
        return new View<>(item, validator, UnaryOperator.identity());
    }

    /**
     * Create a view over a mutable item, whose guards will stage a copy made
     * by the passed function.
     *
     * @param <T> The item type
     * @param item The item
     * @param validator The validator
     * @param copier Creates an independent copy of an item
     * @return A view
     */
    public static <T> View<T> withValidator(T item, Validator<? super T> validator,
            UnaryOperator<T> copier) {
        return new View<>(item, validator, copier);
    }

    private void ensureUsable() {
        if (consumed) {
            throw new IllegalStateException("View has been consumed");
        }
        if (leased) {
            throw new IllegalStateException("View is leased to an open guard");
        }
    }

    /**
     * Get the item, valid or not.
     *
     * @return The item
     */
    public T get() {
        ensureUsable();
        return item;
    }

    /**
     * Replace the item without validating it.
     *
     * @param item A new item
     * @return this
     */
    public View<T> set(T item) {
        ensureUsable();
        this.item = Objects.requireNonNull(item, "item");
        return this;
    }

    public Validator<? super T> validator() {
        return validator;
    }

    public boolean isValid() {
        ensureUsable();
        return validator.isValid(item);
    }

    /**
     * Validate the current item.
     *
     * @throws ValidationException if it is invalid
     */
    public void check() {
        ensureUsable();
        validator.validate(item);
    }

    /**
     * Get the reason the current item is invalid, if it is.
     *
     * @return A reason, or empty
     */
    public Optional<String> problem() {
        ensureUsable();
        return validator.problem(item);
    }

    /**
     * Open a guard over this view. Committing the guard runs the validator
     * on the staged item.
     *
     * @return A guard
     * @throws IllegalStateException if a guard is already open or the view
     * has been consumed
     */
    public Guard<T> modify() {
        ensureUsable();
        T staged = copier.apply(item);
        leased = true;
        return new Guard<>(new Lease<T>() {
            @Override
            public T validate(T staged) {
                validator.validate(staged);
                return staged;
            }

            @Override
            public void write(T value) {
                item = value;
            }

            @Override
            public void release() {
                leased = false;
            }
        }, item, staged);
    }

    /**
     * Consume this view, returning its item.
     *
     * @return The item
     * @throws ValidationException if the item is invalid, in which case the
     * view is not consumed
     */
    public T unwrap() {
        ensureUsable();
        validator.validate(item);
        consumed = true;
        return item;
    }

    /**
     * Consume this view if its item is valid, returning the item; otherwise
     * return empty and leave this view untouched, so the item can be
     * inspected, repaired through {@link #modify()}, or discarded with
     * {@link #cancel()}.
     *
     * @return The item if valid
     */
    public Optional<T> tryUnwrap() {
        ensureUsable();
        if (!validator.isValid(item)) {
            return Optional.empty();
        }
        consumed = true;
        return Optional.of(item);
    }

    /**
     * Discard this view, valid or not.
     */
    public void cancel() {
        ensureUsable();
        consumed = true;
        item = null;
    }

    public boolean isConsumed() {
        return consumed;
    }

    @Override
    public String toString() {
        return consumed ? "View(consumed)" : "View(" + item + ")";
    }
}
