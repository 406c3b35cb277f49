package com.selectra.scorecard.rubric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered {@code (lowerBound, value)} bands. A lookup returns the value of the
 * first band whose lower bound the input reaches, or the floor value when no
 * band matches. Bands added with {@code above} exclude their bound, so they
 * express upper-closed ranges such as {@code (3, 6]}.
 *
 * @param <T> band value type
 */
public final class ThresholdTable<T> {

    private final List<Band<T>> bands;
    private final T floor;

    private ThresholdTable(List<Band<T>> bands, T floor) {
        this.bands = Collections.unmodifiableList(bands);
        this.floor = floor;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public T lookup(double input) {
        for (Band<T> band : bands) {
            if (band.inclusive ? input >= band.lowerBound : input > band.lowerBound) {
                return band.value;
            }
        }
        return floor;
    }

    public List<Double> lowerBounds() {
        return bands.stream().map(b -> b.lowerBound).collect(Collectors.toList());
    }

    private static final class Band<T> {
        private final double lowerBound;
        private final boolean inclusive;
        private final T value;

        private Band(double lowerBound, boolean inclusive, T value) {
            this.lowerBound = lowerBound;
            this.inclusive = inclusive;
            this.value = value;
        }
    }

    public static final class Builder<T> {

        private final List<Band<T>> bands = new ArrayList<>();

        private Builder() {
        }

        /**
         * Bands must be added from the highest lower bound down.
         */
        public Builder<T> atLeast(double lowerBound, T value) {
            return add(lowerBound, true, value);
        }

        public Builder<T> above(double lowerBound, T value) {
            return add(lowerBound, false, value);
        }

        private Builder<T> add(double lowerBound, boolean inclusive, T value) {
            if (!bands.isEmpty() && bands.get(bands.size() - 1).lowerBound <= lowerBound) {
                throw new IllegalArgumentException(
                        "Lower bounds must be strictly descending, got " + lowerBound);
            }
            bands.add(new Band<>(lowerBound, inclusive, value));
            return this;
        }

        public ThresholdTable<T> otherwise(T floor) {
            return new ThresholdTable<>(new ArrayList<>(bands), floor);
        }
    }
}
