package io.gatesync.core.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * One proposed change to a keyed target resource. {@code existing} is absent for creates,
 * {@code value} for deletes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffOperation<T>(Type type, String key, T existing, T value) {

    public static <T> DiffOperation<T> create(String key, T value) {
        return new DiffOperation<>(Type.CREATE, key, null, value);
    }

    public static <T> DiffOperation<T> update(String key, T existing, T value) {
        return new DiffOperation<>(Type.UPDATE, key, existing, value);
    }

    public static <T> DiffOperation<T> delete(String key, T existing) {
        return new DiffOperation<>(Type.DELETE, key, existing, null);
    }

    public enum Type {
        CREATE,
        UPDATE,
        DELETE;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
