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

import static com.mastfrog.checkedvalues.StandardBehavior.PANICKING;
import static com.mastfrog.checkedvalues.StandardBehavior.SATURATING;
import java.util.Objects;

/**
 * The type of a clamp: its limits plus the behavior its arithmetic uses. Two
 * clamps can only be combined if their types are equal, so two types over the
 * same limits with different behaviors never mix.
 * <p>
 * Types are built once and shared, either programmatically via
 * {@link #of(NumberKind, long, long, Behavior)} or {@link #builder(NumberKind)},
 * or from a {@link Clamped} annotation via {@link #declaredBy(Class)}. Invalid
 * limits are rejected when the type is built.
 * </p>
 *
 * @author Tim Boudreau
 */
public final class ClampType implements InherentLimits, InherentBehavior {

    private static final ClassValue<ClampType> DECLARED = new ClassValue<ClampType>() {
        @Override
        protected ClampType computeValue(Class<?> type) {
            Clamped anno = type.getAnnotation(Clamped.class);
            if (anno == null) {
                throw new IllegalArgumentException(type.getName()
                        + " is not annotated with @" + Clamped.class.getSimpleName());
            }
            Builder b = builder(anno.kind()).behavior(anno.behavior())
                    .named(anno.name().isEmpty() ? type.getSimpleName() : anno.name());
            if (anno.minimum() != Long.MAX_VALUE) {
                b.lower(anno.minimum());
            }
            if (anno.maximum() != Long.MIN_VALUE) {
                b.upper(anno.maximum());
            }
            return b.build();
        }
    };

    private final Limits limits;
    private final Behavior behavior;
    private final String name;

    private ClampType(Limits limits, Behavior behavior, String name) {
        this.limits = limits;
        this.behavior = behavior;
        this.name = name;
    }

    public static ClampType of(Limits limits, Behavior behavior) {
        return new ClampType(Objects.requireNonNull(limits, "limits"),
                Objects.requireNonNull(behavior, "behavior"), null);
    }

    /**
     * Create a clamp type.
     *
     * @param kind The number kind
     * @param lower The minimum, inclusive
     * @param upper The maximum, inclusive
     * @param behavior The overflow behavior
     * @return A type
     * @throws InvalidLimitsException if the limits are invalid
     */
    public static ClampType of(NumberKind kind, long lower, long upper, Behavior behavior) {
        return of(Limits.of(kind, lower, upper), behavior);
    }

    public static Builder builder(NumberKind kind) {
        return new Builder(kind);
    }

    /**
     * Get the clamp type declared by a {@link Clamped} annotation on the
     * passed type; the result is computed once per class.
     *
     * @param marker An annotated type
     * @return A clamp type
     * @throws IllegalArgumentException if the type is not annotated
     * @throws InvalidLimitsException if the annotation declares invalid
     * limits
     */
    public static ClampType declaredBy(Class<?> marker) {
        return DECLARED.get(marker);
    }

    public Limits limits() {
        return limits;
    }

    @Override
    public NumberKind kind() {
        return limits.kind();
    }

    @Override
    public long lower() {
        return limits.lower();
    }

    @Override
    public long upper() {
        return limits.upper();
    }

    @Override
    public boolean contains(long value) {
        return limits.contains(value);
    }

    @Override
    public Behavior behavior() {
        return behavior;
    }

    /**
     * The name of this type, if it was given one.
     *
     * @return A name or null
     */
    public String name() {
        return name;
    }

    /**
     * Ensures that the passed value is within the limits of this type, without
     * constructing anything.
     *
     * @param value A value
     * @return the value
     * @throws OutOfBoundsException if it is not
     */
    public long validate(long value) {
        return limits.check(value);
    }

    /**
     * Route a value through this type's behavior if it lies outside the
     * limits.
     *
     * @param value A value
     * @return A value within the limits
     * @throws OutOfBoundsException if the behavior does not resolve it
     */
    public long resolve(long value) {
        return Arithmetic.resolve(this, value);
    }

    public long defaultValue() {
        return limits.defaultValue();
    }

    public long randomValue() {
        return limits.randomValue();
    }

    /**
     * Parse text as a value of this type.
     *
     * @param text Some text
     * @return A value within the limits
     * @throws NumberFormatException if the text is not an integer
     * representable by the number kind
     * @throws OutOfBoundsException if the value is outside the limits
     */
    public long parse(String text) {
        return validate(kind().parse(text));
    }

    public HardClamp hard(long value) {
        return HardClamp.of(this, value);
    }

    public SoftClamp soft(long value) {
        return SoftClamp.of(this, value);
    }

    /**
     * Conversion between raw values and hard clamps of this type; conversion
     * from a raw value throws if it is out of range.
     *
     * @return A conversion
     */
    public RawConversion<HardClamp> hardConversion() {
        return new RawConversion<HardClamp>() {
            @Override
            public HardClamp fromRaw(long raw) {
                return HardClamp.of(ClampType.this, raw);
            }

            @Override
            public long toRaw(HardClamp wrapper) {
                requireSameType(wrapper.type());
                return wrapper.get();
            }
        };
    }

    /**
     * Conversion between raw values and soft clamps of this type; conversion
     * from a raw value accepts anything the number kind can represent.
     *
     * @return A conversion
     */
    public RawConversion<SoftClamp> softConversion() {
        return new RawConversion<SoftClamp>() {
            @Override
            public SoftClamp fromRaw(long raw) {
                return SoftClamp.of(ClampType.this, raw);
            }

            @Override
            public long toRaw(SoftClamp wrapper) {
                requireSameType(wrapper.type());
                return wrapper.getUnchecked();
            }
        };
    }

    void requireSameType(ClampType other) {
        if (!equals(other)) {
            throw new IllegalArgumentException("Cannot combine a " + other
                    + " with a " + this);
        }
    }

    @Override
    public int hashCode() {
        return limits.hashCode() + 71 * behavior.hashCode()
                + (name == null ? 0 : 31 * name.hashCode());
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != ClampType.class) {
            return false;
        }
        ClampType other = (ClampType) o;
        return limits.equals(other.limits) && behavior.equals(other.behavior)
                && Objects.equals(name, other.name);
    }

    @Override
    public String toString() {
        return (name == null ? "" : name + " ") + limits + " " + behavior;
    }

    /**
     * Builder for clamp types; unset bounds default to the bounds of the
     * number kind, and the default behavior is panicking.
     */
    public static final class Builder {

        private final NumberKind kind;
        private Long lower;
        private Long upper;
        private Behavior behavior = PANICKING;
        private String name;

        Builder(NumberKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder lower(long lower) {
            this.lower = lower;
            return this;
        }

        public Builder upper(long upper) {
            this.upper = upper;
            return this;
        }

        public Builder behavior(Behavior behavior) {
            this.behavior = Objects.requireNonNull(behavior, "behavior");
            return this;
        }

        public Builder saturating() {
            return behavior(SATURATING);
        }

        public Builder panicking() {
            return behavior(PANICKING);
        }

        public Builder named(String name) {
            this.name = name;
            return this;
        }

        /**
         * Build the type.
         *
         * @return A clamp type
         * @throws InvalidLimitsException if the bounds are invalid
         */
        public ClampType build() {
            Limits limits = Limits.of(kind,
                    lower == null ? kind.min() : lower,
                    upper == null ? kind.max() : upper);
            return new ClampType(limits, behavior, name);
        }
    }
}
