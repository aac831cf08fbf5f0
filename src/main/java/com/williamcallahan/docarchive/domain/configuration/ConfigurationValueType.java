package com.williamcallahan.docarchive.domain.configuration;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Declared type of a configuration key. Governs coercion of stored string values on read and
 * exact type matching on write.
 */
public enum ConfigurationValueType {
    STRING(String.class) {
        @Override
        public Object coerce(String storedValue) {
            return storedValue;
        }
    },
    INTEGER(Integer.class) {
        @Override
        public Object coerce(String storedValue) {
            return Integer.valueOf(storedValue.trim());
        }
    },
    BOOLEAN(Boolean.class) {
        @Override
        public Object coerce(String storedValue) {
            String normalized = storedValue.trim().toLowerCase(Locale.ROOT);
            if (TRUE_TOKENS.contains(normalized)) {
                return Boolean.TRUE;
            }
            if (FALSE_TOKENS.contains(normalized)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Not a boolean value: " + storedValue);
        }
    },
    FLOAT(Double.class) {
        @Override
        public Object coerce(String storedValue) {
            return Double.valueOf(storedValue.trim());
        }
    };

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes", "y", "t", "on");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "n", "f", "off");

    private final Class<?> javaType;

    ConfigurationValueType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Converts a stored string into this type.
     *
     * @param storedValue non-null string read from the override store
     * @return value of {@link #javaType()}
     * @throws IllegalArgumentException when the string cannot be read as this type
     */
    public abstract Object coerce(String storedValue);

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Whether the runtime class of {@code value} is exactly this type's Java class.
     */
    public boolean isExactInstance(Object value) {
        return value != null && value.getClass() == javaType;
    }

    /**
     * Encodes a value of this type for the override store.
     */
    public String encode(Object value) {
        Objects.requireNonNull(value, "value");
        return String.valueOf(value);
    }
}
