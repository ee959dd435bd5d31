package lineup.queue.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque job payload: a type tag naming the handler plus serialized bytes.
 * The queue never looks inside {@link #data()}.
 */
public final class JobPayload {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String type;
    private final byte[] data;

    public JobPayload(String type, byte[] data) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("payload type is required");
        }
        this.type = type;
        this.data = data != null ? data.clone() : new byte[0];
    }

    public static JobPayload of(String type, byte[] data) {
        return new JobPayload(type, data);
    }

    public static JobPayload ofText(String type, String text) {
        return new JobPayload(type, text != null ? text.getBytes(StandardCharsets.UTF_8) : null);
    }

    /**
     * Encode {@code value} as JSON.
     */
    public static JobPayload json(String type, Object value) {
        try {
            return new JobPayload(type, MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode payload of type " + type, e);
        }
    }

    public String type() {
        return type;
    }

    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public String asText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Decode a payload created with {@link #json(String, Object)}.
     */
    public <T> T readJson(Class<T> valueType) {
        try {
            return MAPPER.readValue(data, valueType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode payload of type " + type, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobPayload other))
            return false;
        return type.equals(other.type) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "JobPayload{type='" + type + "', size=" + data.length + "}";
    }
}
