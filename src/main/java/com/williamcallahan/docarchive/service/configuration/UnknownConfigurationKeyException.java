package com.williamcallahan.docarchive.service.configuration;

/**
 * Signals that a configuration key is not part of the registry.
 */
public class UnknownConfigurationKeyException extends RuntimeException {

    private final String key;

    /**
     * Creates an exception naming the rejected key.
     *
     * @param key key that is not registered
     */
    public UnknownConfigurationKeyException(String key) {
        super("Unknown configuration key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
