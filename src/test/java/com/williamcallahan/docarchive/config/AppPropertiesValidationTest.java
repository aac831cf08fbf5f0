package com.williamcallahan.docarchive.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsBlankMediaRoot() {
        AppProperties appProperties = new AppProperties();
        appProperties.getStorage().setMediaRoot(" ");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsUnknownTimeZone() {
        AppProperties appProperties = new AppProperties();
        appProperties.getStorage().setTimeZone("Mars/Olympus");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsUncompilableParseTransform() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFilename().getParseTransforms().add(new AppProperties.ParseTransform("([a-z", "$1"));

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsParseTransformWithoutReplacement() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFilename().getParseTransforms().add(new AppProperties.ParseTransform("^x$", null));

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveOcrTimeout() {
        AppProperties appProperties = new AppProperties();
        appProperties.getOcr().setTimeoutSeconds(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
