package com.parsely.backend.services.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.parsely.backend.enums.FieldName;

/**
 * Immutable mapping over the closed {@link FieldName} set. Every field is always present,
 * either resolved or {@link FieldValue#UNRESOLVED}.
 */
public final class FieldMap {

    private static final FieldMap UNRESOLVED_MAP = builder().build();

    private final Map<FieldName, FieldValue> values;

    private FieldMap(EnumMap<FieldName, FieldValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FieldMap unresolved() {
        return UNRESOLVED_MAP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FieldValue get(FieldName field) {
        return values.get(field);
    }

    public boolean isResolved(FieldName field) {
        return values.get(field).isResolved();
    }

    public Set<FieldName> resolvedFields() {
        EnumSet<FieldName> out = EnumSet.noneOf(FieldName.class);
        values.forEach((field, value) -> {
            if (value.isResolved()) out.add(field);
        });
        return Collections.unmodifiableSet(out);
    }

    public Set<FieldName> unresolvedFields() {
        EnumSet<FieldName> out = EnumSet.allOf(FieldName.class);
        out.removeAll(resolvedFields());
        return Collections.unmodifiableSet(out);
    }

    public int resolvedCount() {
        return resolvedFields().size();
    }

    public boolean isEmpty() {
        return resolvedCount() == 0;
    }

    /**
     * Snake-case keys in field order; unresolved values map to {@code null}.
     */
    public Map<String, String> toKeyedMap() {
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((field, value) -> out.put(field.getKey(), value.asOptional().orElse(null)));
        return out;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        values.forEach(builder::set);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMap other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMap" + toKeyedMap();
    }

    public static final class Builder {

        private final EnumMap<FieldName, FieldValue> values = new EnumMap<>(FieldName.class);

        private Builder() {
            for (FieldName field : FieldName.values()) {
                values.put(field, FieldValue.UNRESOLVED);
            }
        }

        public Builder set(FieldName field, String value) {
            return set(field, FieldValue.of(value));
        }

        public Builder set(FieldName field, FieldValue value) {
            values.put(field, value == null ? FieldValue.UNRESOLVED : value);
            return this;
        }

        /**
         * Sets the value only when the field is still unresolved and the new value is resolved.
         */
        public Builder setIfUnresolved(FieldName field, String value) {
            return setIfUnresolved(field, FieldValue.of(value));
        }

        public Builder setIfUnresolved(FieldName field, FieldValue value) {
            if (!values.get(field).isResolved() && value != null && value.isResolved()) {
                values.put(field, value);
            }
            return this;
        }

        public boolean isResolved(FieldName field) {
            return values.get(field).isResolved();
        }

        public FieldValue get(FieldName field) {
            return values.get(field);
        }

        public FieldMap build() {
            return new FieldMap(new EnumMap<>(values));
        }
    }
}
