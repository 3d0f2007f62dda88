package com.shiprule.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of MatchRecord.
 * Immutable after construction.
 */
public final class DefaultMatchRecord implements MatchRecord {

    private final Map<String, Object> fields;

    private DefaultMatchRecord(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    @Override
    public Optional<Object> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @Override
    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "MatchRecord" + fields;
    }

    /**
     * Builder for DefaultMatchRecord.
     */
    public static class Builder implements MatchRecord.Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        @Override
        public Builder field(String name, Object value) {
            if (name != null && value != null) {
                this.fields.put(name, value);
            }
            return this;
        }

        @Override
        public Builder fields(Map<String, ?> fields) {
            if (fields != null) {
                fields.forEach(this::field);
            }
            return this;
        }

        @Override
        public MatchRecord build() {
            return new DefaultMatchRecord(this);
        }
    }
}
