package io.iamcore.resource.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.iamcore.CommandException;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * A metadata value before it is stored. Each variant knows how to serialize itself.
 */
public sealed interface MetadataValue {

    /**
     * Returns the stored form, or an empty string when there is nothing to store.
     *
     * @throws CommandException {@code SERIALIZATION_ERROR} if a structured value cannot be
     *                          written
     */
    String serialize(ObjectMapper mapper);

    /**
     * A plain string.
     */
    record Scalar(String value) implements MetadataValue {
        @Override
        public String serialize(ObjectMapper mapper) {
            return value == null ? "" : value;
        }
    }

    /**
     * An absolute http(s) URL.
     */
    record Url(URI value) implements MetadataValue {
        public Url {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String serialize(ObjectMapper mapper) {
            return value.toString();
        }
    }

    /**
     * A list of complex attribute values, stored as a JSON array. An empty list stores
     * nothing.
     */
    record Structured(List<?> values) implements MetadataValue {
        public Structured {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public String serialize(ObjectMapper mapper) {
            if (values.isEmpty()) {
                return "";
            }
            try {
                return mapper.writeValueAsString(values);
            } catch (JsonProcessingException e) {
                throw CommandException.serialization("METADATA-ENCODE", e);
            }
        }
    }
}
