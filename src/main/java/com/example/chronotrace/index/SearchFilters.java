package com.example.chronotrace.index;

import com.example.chronotrace.error.FilterValidationException;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conjunction of metadata predicates, at most one per field. Predicates are kept in field order
 * regardless of the order they were added in, so logically identical filter sets are equal and
 * produce the same {@link #canonicalKey()}.
 */
public final class SearchFilters {

    private static final SearchFilters NONE = new SearchFilters(new EnumMap<>(FilterField.class));

    private final Map<FilterField, FilterPredicate> predicates;

    private SearchFilters(EnumMap<FilterField, FilterPredicate> predicates) {
        this.predicates = Collections.unmodifiableMap(predicates);
    }

    public static SearchFilters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(PointMetadata metadata) {
        for (FilterPredicate p : predicates.values()) {
            if (!p.test(metadata)) return false;
        }
        return true;
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public Collection<FilterPredicate> predicates() {
        return predicates.values();
    }

    public String canonicalKey() {
        if (predicates.isEmpty()) return "*";
        return predicates.values().stream().map(FilterPredicate::canonical).collect(Collectors.joining("&"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchFilters)) return false;
        return predicates.equals(((SearchFilters) o).predicates);
    }

    @Override
    public int hashCode() {
        return predicates.hashCode();
    }

    @Override
    public String toString() {
        return "SearchFilters{" + canonicalKey() + "}";
    }

    public static final class Builder {
        private final EnumMap<FilterField, FilterPredicate> predicates = new EnumMap<>(FilterField.class);

        public Builder cameraId(String cameraId) {
            return exact(FilterField.CAMERA_ID, cameraId);
        }

        public Builder location(String location) {
            return exact(FilterField.LOCATION, location);
        }

        public Builder videoId(String videoId) {
            return exact(FilterField.VIDEO_ID, videoId);
        }

        public Builder timeRange(Instant from, Instant to) {
            if (from == null && to == null) {
                throw new FilterValidationException("time range needs at least one bound");
            }
            if (from != null && to != null && from.isAfter(to)) {
                throw new FilterValidationException("time range start " + from + " is after end " + to);
            }
            return add(FilterPredicate.timeRange(from, to));
        }

        public Builder hasFaces(boolean expected) {
            return add(FilterPredicate.flag(FilterField.HAS_FACES, expected));
        }

        public Builder hasVehicles(boolean expected) {
            return add(FilterPredicate.flag(FilterField.HAS_VEHICLES, expected));
        }

        public Builder motionDetected(boolean expected) {
            return add(FilterPredicate.flag(FilterField.MOTION_DETECTED, expected));
        }

        private Builder exact(FilterField field, String value) {
            if (value == null || value.isBlank()) {
                throw new FilterValidationException(field + " filter must not be blank");
            }
            return add(FilterPredicate.exact(field, value.trim()));
        }

        private Builder add(FilterPredicate predicate) {
            FilterPredicate existing = predicates.get(predicate.getField());
            if (existing != null && !existing.equals(predicate)) {
                throw new FilterValidationException("conflicting predicates for " + predicate.getField()
                        + ": " + existing.canonical() + " and " + predicate.canonical());
            }
            predicates.put(predicate.getField(), predicate);
            return this;
        }

        public SearchFilters build() {
            if (predicates.isEmpty()) return NONE;
            return new SearchFilters(new EnumMap<>(predicates));
        }
    }
}
