package com.williamcallahan.docarchive.domain.configuration;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of configuration options that can be overridden per deployment.
 *
 * <p>Each key carries its declared type and compiled-in default. A {@code null} default means the
 * option is unset unless overridden.</p>
 */
public enum ConfigurationKey {
    OCR_LANGUAGE(ConfigurationValueType.STRING, "eng"),
    OCR_MODE(ConfigurationValueType.STRING, "skip"),
    OCR_SKIP_ARCHIVE_FILE(ConfigurationValueType.STRING, "never"),
    OCR_CLEAN(ConfigurationValueType.STRING, "clean"),
    OCR_DESKEW(ConfigurationValueType.BOOLEAN, Boolean.TRUE),
    OCR_ROTATE_PAGES(ConfigurationValueType.BOOLEAN, Boolean.TRUE),
    OCR_ROTATE_PAGES_THRESHOLD(ConfigurationValueType.FLOAT, 12.0d),
    OCR_OUTPUT_TYPE(ConfigurationValueType.STRING, "pdfa"),
    OCR_PAGES(ConfigurationValueType.INTEGER, 0),
    OCR_IMAGE_DPI(ConfigurationValueType.INTEGER, null),
    OCR_MAX_IMAGE_PIXELS(ConfigurationValueType.INTEGER, null),
    OCR_COLOR_CONVERSION_STRATEGY(ConfigurationValueType.STRING, "RGB"),
    OCR_USER_ARGS(ConfigurationValueType.STRING, null),
    NUMBER_OF_SUGGESTED_DATES(ConfigurationValueType.INTEGER, 3),
    IGNORE_DATES(ConfigurationValueType.STRING, ""),
    DATE_ORDER(ConfigurationValueType.STRING, "DMY");

    private static final Map<String, ConfigurationKey> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ConfigurationKey::name, Function.identity()));

    private final ConfigurationValueType type;
    private final Object defaultValue;

    ConfigurationKey(ConfigurationValueType type, Object defaultValue) {
        if (defaultValue != null && !type.isExactInstance(defaultValue)) {
            throw new IllegalArgumentException("Default does not match declared type " + type);
        }
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public ConfigurationValueType type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * Looks up a key by its exact name.
     */
    public static Optional<ConfigurationKey> fromName(String name) {
        return Optional.ofNullable(name).map(BY_NAME::get);
    }
}
