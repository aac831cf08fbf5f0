package com.williamcallahan.docarchive.service.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.docarchive.domain.configuration.ConfigurationKey;
import com.williamcallahan.docarchive.domain.configuration.ConfigurationValueType;
import com.williamcallahan.docarchive.domain.ocr.OcrSettings;
import com.williamcallahan.docarchive.model.OcrSettingsEntity;
import com.williamcallahan.docarchive.repository.OcrSettingsRepository;
import com.williamcallahan.docarchive.service.configuration.ConfigurationOptionService;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the effective {@link OcrSettings}: each option comes from the stored OCR settings row when
 * set, otherwise from {@link ConfigurationOptionService}.
 */
@Service
public class OcrSettingsResolver {
    private static final TypeReference<Map<String, Object>> USER_ARGS_TYPE = new TypeReference<>() {};

    private final OcrSettingsRepository ocrSettingsRepository;
    private final ConfigurationOptionService configurationOptionService;
    private final ObjectMapper objectMapper;

    public OcrSettingsResolver(
            OcrSettingsRepository ocrSettingsRepository,
            ConfigurationOptionService configurationOptionService,
            ObjectMapper objectMapper) {
        this.ocrSettingsRepository = Objects.requireNonNull(ocrSettingsRepository, "ocrSettingsRepository");
        this.configurationOptionService =
                Objects.requireNonNull(configurationOptionService, "configurationOptionService");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Resolves the OCR options currently in effect.
     *
     * @return merged settings
     * @throws IllegalStateException when the OCR settings row has not been created
     * @throws IllegalArgumentException when a fallback value or the user arguments cannot be read
     */
    @Transactional(readOnly = true)
    public OcrSettings resolve() {
        OcrSettingsEntity stored = ocrSettingsRepository.findFirstByOrderByIdAsc()
                .orElseThrow(() -> new IllegalStateException("OCR settings row is missing"));

        return new OcrSettings(
                stored.getPages() != null ? stored.getPages() : integerOption(ConfigurationKey.OCR_PAGES),
                textOr(stored.getLanguage(), ConfigurationKey.OCR_LANGUAGE),
                textOr(stored.getOutputType(), ConfigurationKey.OCR_OUTPUT_TYPE),
                textOr(stored.getMode(), ConfigurationKey.OCR_MODE),
                textOr(stored.getSkipArchiveFile(), ConfigurationKey.OCR_SKIP_ARCHIVE_FILE),
                stored.getImageDpi() != null ? stored.getImageDpi() : integerOption(ConfigurationKey.OCR_IMAGE_DPI),
                textOr(stored.getUnpaperClean(), ConfigurationKey.OCR_CLEAN),
                stored.getDeskew() != null ? stored.getDeskew() : booleanOption(ConfigurationKey.OCR_DESKEW),
                stored.getRotatePages() != null
                        ? stored.getRotatePages()
                        : booleanOption(ConfigurationKey.OCR_ROTATE_PAGES),
                stored.getRotatePagesThreshold() != null
                        ? stored.getRotatePagesThreshold()
                        : doubleOption(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD),
                stored.getMaxImagePixels() != null
                        ? stored.getMaxImagePixels()
                        : nullableDoubleOption(ConfigurationKey.OCR_MAX_IMAGE_PIXELS),
                textOr(stored.getColorConversionStrategy(), ConfigurationKey.OCR_COLOR_CONVERSION_STRATEGY),
                resolveUserArgs(stored.getUserArgs()));
    }

    private Map<String, Object> resolveUserArgs(String storedUserArgs) {
        if (storedUserArgs != null && !storedUserArgs.isBlank()) {
            return parseUserArgs(storedUserArgs);
        }
        Object configuredUserArgs = configurationOptionService.get(ConfigurationKey.OCR_USER_ARGS);
        if (configuredUserArgs == null || configuredUserArgs.toString().isBlank()) {
            return null;
        }
        return parseUserArgs(configuredUserArgs.toString());
    }

    private Map<String, Object> parseUserArgs(String json) {
        try {
            return objectMapper.readValue(json, USER_ARGS_TYPE);
        } catch (JsonProcessingException malformedJson) {
            throw new IllegalArgumentException("OCR user arguments are not a JSON object", malformedJson);
        }
    }

    private String textOr(String storedValue, ConfigurationKey key) {
        if (storedValue != null && !storedValue.isBlank()) {
            return storedValue;
        }
        Object configured = configurationOptionService.get(key);
        if (configured == null) {
            throw new IllegalArgumentException("No value configured for " + key.name());
        }
        return configured.toString();
    }

    private Integer integerOption(ConfigurationKey key) {
        Object configured = configurationOptionService.get(key);
        if (configured == null || configured instanceof Integer) {
            return (Integer) configured;
        }
        String text = configured.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException notAnInteger) {
            throw new IllegalArgumentException(key.name() + " is not an integer: " + text, notAnInteger);
        }
    }

    private boolean booleanOption(ConfigurationKey key) {
        Object configured = configurationOptionService.get(key);
        if (configured instanceof Boolean flag) {
            return flag;
        }
        if (configured == null) {
            return false;
        }
        try {
            return (Boolean) ConfigurationValueType.BOOLEAN.coerce(configured.toString());
        } catch (IllegalArgumentException notABoolean) {
            throw new IllegalArgumentException(key.name() + " is not a boolean: " + configured, notABoolean);
        }
    }

    private double doubleOption(ConfigurationKey key) {
        Double value = nullableDoubleOption(key);
        if (value == null) {
            throw new IllegalArgumentException("No value configured for " + key.name());
        }
        return value;
    }

    private Double nullableDoubleOption(ConfigurationKey key) {
        Object configured = configurationOptionService.get(key);
        if (configured == null) {
            return null;
        }
        if (configured instanceof Number number) {
            return number.doubleValue();
        }
        String text = configured.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException notANumber) {
            throw new IllegalArgumentException(key.name() + " is not a number: " + text, notANumber);
        }
    }
}
