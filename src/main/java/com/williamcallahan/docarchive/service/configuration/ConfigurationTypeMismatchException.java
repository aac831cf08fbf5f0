package com.williamcallahan.docarchive.service.configuration;

import com.williamcallahan.docarchive.domain.configuration.ConfigurationKey;

/**
 * Signals that a value written to a configuration key is not exactly of the key's declared type.
 * Thrown before anything is written.
 */
public class ConfigurationTypeMismatchException extends RuntimeException {

    private final ConfigurationKey key;

    /**
     * Creates an exception describing the expected and actual types.
     *
     * @param key key being written
     * @param value rejected value, may be {@code null}
     */
    public ConfigurationTypeMismatchException(ConfigurationKey key, Object value) {
        super("Configuration key " + key.name() + " expects " + key.type().javaType().getSimpleName()
                + " but got " + (value == null ? "null" : value.getClass().getSimpleName()));
        this.key = key;
    }

    public ConfigurationKey getKey() {
        return key;
    }
}
