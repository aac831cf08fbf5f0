package com.williamcallahan.docarchive.service.ocr;

import com.williamcallahan.docarchive.model.OcrSettingsEntity;
import com.williamcallahan.docarchive.repository.OcrSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the empty OCR settings row on first start so every option falls through to the
 * configuration resolver until someone overrides it. Runs before any management command.
 */
@Component
public class OcrSettingsInitializer {
    private static final Logger log = LoggerFactory.getLogger(OcrSettingsInitializer.class);

    private final OcrSettingsRepository ocrSettingsRepository;

    public OcrSettingsInitializer(OcrSettingsRepository ocrSettingsRepository) {
        this.ocrSettingsRepository = ocrSettingsRepository;
    }

    @EventListener(ApplicationStartedEvent.class)
    @Transactional
    public void ensureSettingsRow() {
        if (ocrSettingsRepository.count() == 0) {
            ocrSettingsRepository.save(new OcrSettingsEntity());
            log.info("Created default OCR settings");
        }
    }
}
