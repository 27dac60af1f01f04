package com.example.chronotrace.index;

import java.time.Instant;
import java.util.Objects;

/**
 * A single predicate over {@link PointMetadata}. Predicates compare by value, so two
 * predicates built separately from the same inputs are equal and share a canonical form.
 */
public abstract class FilterPredicate {

    private final FilterField field;

    private FilterPredicate(FilterField field) {
        this.field = field;
    }

    public FilterField getField() {
        return field;
    }

    public abstract boolean test(PointMetadata metadata);

    /**
     * Stable textual form used for cache keys.
     */
    public abstract String canonical();

    public static FilterPredicate exact(FilterField field, String value) {
        return new Exact(field, value);
    }

    public static FilterPredicate timeRange(Instant from, Instant to) {
        return new TimeRange(from, to);
    }

    public static FilterPredicate flag(FilterField field, boolean expected) {
        return new Flag(field, expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterPredicate)) return false;
        return canonical().equals(((FilterPredicate) o).canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }

    @Override
    public String toString() {
        return canonical();
    }

    static final class Exact extends FilterPredicate {
        private final String value;

        Exact(FilterField field, String value) {
            super(field);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean test(PointMetadata m) {
            switch (getField()) {
                case CAMERA_ID: return value.equals(m.getCameraId());
                case LOCATION: return value.equals(m.getLocation());
                case VIDEO_ID: return value.equals(m.getVideoId());
                default: throw new IllegalStateException("not an exact-match field: " + getField());
            }
        }

        @Override
        public String canonical() {
            return getField().name() + "=" + value;
        }
    }

    static final class TimeRange extends FilterPredicate {
        private final Instant from;
        private final Instant to;

        TimeRange(Instant from, Instant to) {
            super(FilterField.TIME_RANGE);
            this.from = from;
            this.to = to;
        }

        // inclusive on both ends; an open end is unbounded
        @Override
        public boolean test(PointMetadata m) {
            Instant ts = m.getTimestamp();
            if (ts == null) return false;
            if (from != null && ts.isBefore(from)) return false;
            return to == null || !ts.isAfter(to);
        }

        @Override
        public String canonical() {
            return getField().name() + "=[" + (from == null ? "*" : from.toString()) + ","
                    + (to == null ? "*" : to.toString()) + "]";
        }
    }

    static final class Flag extends FilterPredicate {
        private final boolean expected;

        Flag(FilterField field, boolean expected) {
            super(field);
            this.expected = expected;
        }

        @Override
        public boolean test(PointMetadata m) {
            switch (getField()) {
                case HAS_FACES: return m.isHasFaces() == expected;
                case HAS_VEHICLES: return m.isHasVehicles() == expected;
                case MOTION_DETECTED: return m.isMotionDetected() == expected;
                default: throw new IllegalStateException("not a flag field: " + getField());
            }
        }

        @Override
        public String canonical() {
            return getField().name() + "=" + expected;
        }
    }
}
