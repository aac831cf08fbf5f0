package com.williamcallahan.docarchive.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.docarchive.domain.configuration.ConfigurationKey;
import com.williamcallahan.docarchive.domain.ocr.OcrSettings;
import com.williamcallahan.docarchive.model.OcrSettingsEntity;
import com.williamcallahan.docarchive.repository.OcrSettingsRepository;
import com.williamcallahan.docarchive.service.configuration.ConfigurationOptionService;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies that stored OCR options win over configured ones field by field.
 */
class OcrSettingsResolverTest {

    private OcrSettingsRepository ocrSettingsRepository;
    private ConfigurationOptionService configurationOptionService;
    private OcrSettingsResolver resolver;
    private OcrSettingsEntity stored;

    @BeforeEach
    void setUp() {
        ocrSettingsRepository = mock(OcrSettingsRepository.class);
        configurationOptionService = mock(ConfigurationOptionService.class);
        for (ConfigurationKey key : ConfigurationKey.values()) {
            when(configurationOptionService.get(key)).thenReturn(key.defaultValue());
        }
        stored = new OcrSettingsEntity();
        when(ocrSettingsRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.of(stored));
        resolver = new OcrSettingsResolver(ocrSettingsRepository, configurationOptionService, new ObjectMapper());
    }

    @Test
    void emptyRowUsesConfiguredDefaults() {
        OcrSettings settings = resolver.resolve();

        assertEquals(0, settings.pages());
        assertEquals("eng", settings.language());
        assertEquals("pdfa", settings.outputType());
        assertEquals("skip", settings.mode());
        assertEquals("never", settings.skipArchiveFile());
        assertNull(settings.imageDpi());
        assertEquals("clean", settings.clean());
        assertTrue(settings.deskew());
        assertTrue(settings.rotate());
        assertEquals(12.0d, settings.rotateThreshold());
        assertNull(settings.maxImagePixels());
        assertEquals("RGB", settings.colorConversionStrategy());
        assertNull(settings.userArgs());
    }

    @Test
    void storedValuesWinFieldByField() {
        stored.setLanguage("deu");
        stored.setPages(2);
        stored.setDeskew(false);
        stored.setRotatePagesThreshold(3.5d);
        stored.setUserArgs("{\"jbig2_lossy\": true}");

        OcrSettings settings = resolver.resolve();

        assertEquals("deu", settings.language());
        assertEquals(2, settings.pages());
        assertFalse(settings.deskew());
        assertEquals(3.5d, settings.rotateThreshold());
        assertEquals(Map.of("jbig2_lossy", true), settings.userArgs());
        assertEquals("pdfa", settings.outputType());
    }

    @Test
    void blankStoredTextFallsBackToConfiguration() {
        stored.setMode("  ");

        assertEquals("skip", resolver.resolve().mode());
    }

    @Test
    void environmentStringsAreConverted() {
        when(configurationOptionService.get(ConfigurationKey.OCR_PAGES)).thenReturn("4");
        when(configurationOptionService.get(ConfigurationKey.OCR_DESKEW)).thenReturn("false");
        when(configurationOptionService.get(ConfigurationKey.OCR_ROTATE_PAGES_THRESHOLD)).thenReturn("6.5");
        when(configurationOptionService.get(ConfigurationKey.OCR_MAX_IMAGE_PIXELS)).thenReturn("1000000");

        OcrSettings settings = resolver.resolve();

        assertEquals(4, settings.pages());
        assertFalse(settings.deskew());
        assertEquals(6.5d, settings.rotateThreshold());
        assertEquals(1_000_000d, settings.maxImagePixels());
    }

    @Test
    void environmentBooleansAcceptTheSameTokensAsStoredOverrides() {
        when(configurationOptionService.get(ConfigurationKey.OCR_DESKEW)).thenReturn("on");
        when(configurationOptionService.get(ConfigurationKey.OCR_ROTATE_PAGES)).thenReturn("OFF");

        OcrSettings settings = resolver.resolve();

        assertTrue(settings.deskew());
        assertFalse(settings.rotate());
    }

    @Test
    void unreadableEnvironmentBooleanIsRejected() {
        when(configurationOptionService.get(ConfigurationKey.OCR_DESKEW)).thenReturn("maybe");

        assertThrows(IllegalArgumentException.class, resolver::resolve);
    }

    @Test
    void configuredUserArgsAreParsedWhenRowHasNone() {
        when(configurationOptionService.get(ConfigurationKey.OCR_USER_ARGS)).thenReturn("{\"optimize\": 1}");

        assertEquals(Map.of("optimize", 1), resolver.resolve().userArgs());
    }

    @Test
    void malformedUserArgsAreRejected() {
        stored.setUserArgs("{not json");

        assertThrows(IllegalArgumentException.class, resolver::resolve);
    }

    @Test
    void nonNumericEnvironmentValueIsRejected() {
        when(configurationOptionService.get(ConfigurationKey.OCR_IMAGE_DPI)).thenReturn("high");

        assertThrows(IllegalArgumentException.class, resolver::resolve);
    }

    @Test
    void missingRowIsAnError() {
        when(ocrSettingsRepository.findFirstByOrderByIdAsc()).thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, resolver::resolve);
    }
}
