package com.logx.analyzer.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Optional;

/**
 * Closed set of values a log field or rule metadata entry may hold.
 *
 * <p>
 * Serialized with a {@code type} discriminator so persisted field maps keep
 * their value kinds across a round trip.
 * </p>
 *
 * @author Naveed Gung
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FieldValue.StringValue.class, name = "string"),
        @JsonSubTypes.Type(value = FieldValue.NumberValue.class, name = "number"),
        @JsonSubTypes.Type(value = FieldValue.BooleanValue.class, name = "bool"),
        @JsonSubTypes.Type(value = FieldValue.TimestampValue.class, name = "timestamp")
})
public sealed interface FieldValue {

    /** Render the value as display text. */
    String asText();

    /** The string payload, present only for string values. */
    default Optional<String> text() {
        return Optional.empty();
    }

    static FieldValue of(String value) {
        return new StringValue(value == null ? "" : value);
    }

    static FieldValue of(double value) {
        return new NumberValue(value);
    }

    static FieldValue of(boolean value) {
        return new BooleanValue(value);
    }

    static FieldValue of(Instant value) {
        return new TimestampValue(value);
    }

    record StringValue(@JsonProperty("value") String value) implements FieldValue {
        @Override
        public String asText() {
            return value;
        }

        @Override
        public Optional<String> text() {
            return Optional.of(value);
        }
    }

    record NumberValue(@JsonProperty("value") double value) implements FieldValue {
        @Override
        public String asText() {
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
    }

    record BooleanValue(@JsonProperty("value") boolean value) implements FieldValue {
        @Override
        public String asText() {
            return String.valueOf(value);
        }
    }

    record TimestampValue(@JsonProperty("value") Instant value) implements FieldValue {
        @Override
        public String asText() {
            return value == null ? "" : value.toString();
        }
    }
}
