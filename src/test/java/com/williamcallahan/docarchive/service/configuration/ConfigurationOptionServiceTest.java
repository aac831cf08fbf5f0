package com.williamcallahan.docarchive.service.configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.docarchive.domain.configuration.ConfigurationKey;
import com.williamcallahan.docarchive.model.ConfigurationOption;
import com.williamcallahan.docarchive.repository.ConfigurationOptionRepository;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

/**
 * Verifies stored override, environment and default precedence against a real override table.
 */
@DataJpaTest
class ConfigurationOptionServiceTest {

    @Autowired
    ConfigurationOptionRepository configurationOptionRepository;

    @Autowired
    TestEntityManager entityManager;

    private final Map<String, String> environment = new HashMap<>();
    private ConfigurationOptionService service;

    @BeforeEach
    void setUp() {
        service = new ConfigurationOptionService(configurationOptionRepository, environment::get);
    }

    @Test
    void defaultsApplyWhenNothingIsConfigured() {
        assertEquals("eng", service.get(ConfigurationKey.OCR_LANGUAGE));
        assertEquals(Boolean.TRUE, service.get(ConfigurationKey.OCR_DESKEW));
        assertEquals(12.0d, service.get(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD));
        assertEquals(0, service.get("OCR_PAGES"));
        assertNull(service.get(ConfigurationKey.OCR_IMAGE_DPI));
    }

    @Test
    void environmentOverridesDefaultAsRawString() {
        environment.put("DOCARCHIVE_OCR_PAGES", "5");
        environment.put("DOCARCHIVE_OCR_DESKEW", "false");

        assertEquals("5", service.get(ConfigurationKey.OCR_PAGES));
        assertEquals("false", service.get(ConfigurationKey.OCR_DESKEW));
    }

    @Test
    void storedOverrideWinsOverEnvironmentAndIsCoerced() {
        environment.put("DOCARCHIVE_OCR_PAGES", "5");
        configurationOptionRepository.save(new ConfigurationOption("OCR_PAGES", "7"));

        assertEquals(7, service.get(ConfigurationKey.OCR_PAGES));
    }

    @Test
    void emptyStoredValueFallsThrough() {
        environment.put("DOCARCHIVE_OCR_LANGUAGE", "deu");
        configurationOptionRepository.save(new ConfigurationOption("OCR_LANGUAGE", ""));

        assertEquals("deu", service.get(ConfigurationKey.OCR_LANGUAGE));
    }

    @Test
    void unreadableStoredValueFallsThroughToDefault() {
        configurationOptionRepository.save(new ConfigurationOption("OCR_PAGES", "several"));

        assertEquals(0, service.get(ConfigurationKey.OCR_PAGES));
    }

    @Test
    void setThenGetReturnsTheStoredValue() {
        service.set("OCR_ROTATE_PAGES", false);
        service.set(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD, 8.5d);
        service.set(ConfigurationKey.OCR_LANGUAGE, "deu+eng");

        assertEquals(Boolean.FALSE, service.get(ConfigurationKey.OCR_ROTATE_PAGES));
        assertEquals(8.5d, service.get(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD));
        assertEquals("deu+eng", service.get(ConfigurationKey.OCR_LANGUAGE));
    }

    @Test
    void longStringValueSurvivesAFlush() {
        StringBuilder userArgs = new StringBuilder("{");
        for (int index = 0; index < 60; index++) {
            if (index > 0) {
                userArgs.append(", ");
            }
            userArgs.append("\"option_number_").append(index).append("\": ").append(index);
        }
        userArgs.append('}');
        assertTrue(userArgs.length() > 1024);

        service.set(ConfigurationKey.OCR_USER_ARGS, userArgs.toString());
        entityManager.flush();
        entityManager.clear();

        assertEquals(userArgs.toString(), service.get(ConfigurationKey.OCR_USER_ARGS));
    }

    @Test
    void setReplacesAnExistingOverride() {
        service.set(ConfigurationKey.NUMBER_OF_SUGGESTED_DATES, 4);
        service.set(ConfigurationKey.NUMBER_OF_SUGGESTED_DATES, 9);

        assertEquals(9, service.get(ConfigurationKey.NUMBER_OF_SUGGESTED_DATES));
        assertEquals("9", configurationOptionRepository.findByKey("NUMBER_OF_SUGGESTED_DATES")
                .orElseThrow().getValue());
    }

    @Test
    void typeMismatchLeavesThePreviousValueInPlace() {
        service.set(ConfigurationKey.OCR_PAGES, 3);

        ConfigurationTypeMismatchException mismatch = assertThrows(ConfigurationTypeMismatchException.class,
                () -> service.set(ConfigurationKey.OCR_PAGES, "4"));

        assertEquals(ConfigurationKey.OCR_PAGES, mismatch.getKey());
        assertEquals(3, service.get(ConfigurationKey.OCR_PAGES));
    }

    @Test
    void booleanIsNotAcceptedForIntegerKey() {
        assertThrows(ConfigurationTypeMismatchException.class,
                () -> service.set(ConfigurationKey.OCR_PAGES, true));
        assertThrows(ConfigurationTypeMismatchException.class,
                () -> service.set(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD, 12));
    }

    @Test
    void unknownKeysAreRejectedForReadAndWrite() {
        UnknownConfigurationKeyException onRead =
                assertThrows(UnknownConfigurationKeyException.class, () -> service.get("NOT_A_KEY"));
        assertEquals("NOT_A_KEY", onRead.getKey());

        assertThrows(UnknownConfigurationKeyException.class, () -> service.set("NOT_A_KEY", "x"));
        assertEquals(0, configurationOptionRepository.count());
    }

    @Test
    void environmentVariableNameUsesPrefix() {
        assertEquals("DOCARCHIVE_DATE_ORDER",
                ConfigurationOptionService.environmentVariableName(ConfigurationKey.DATE_ORDER));
    }
}
