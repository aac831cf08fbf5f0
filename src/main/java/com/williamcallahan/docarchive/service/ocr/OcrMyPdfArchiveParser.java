package com.williamcallahan.docarchive.service.ocr;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.domain.ocr.OcrSettings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs {@code ocrmypdf} as an external process to produce PDF/A archive versions.
 */
@Service
public class OcrMyPdfArchiveParser implements ArchiveParser {
    private static final Logger log = LoggerFactory.getLogger(OcrMyPdfArchiveParser.class);

    static final String SKIP_ARCHIVE_ALWAYS = "always";

    private static final Set<String> SUPPORTED_MIME_TYPES = Set.of(
            "application/pdf",
            "image/png",
            "image/jpeg",
            "image/tiff",
            "image/gif",
            "image/webp");

    private final OcrSettingsResolver ocrSettingsResolver;
    private final OcrMyPdfArgumentsBuilder argumentsBuilder;
    private final AppProperties appProperties;

    public OcrMyPdfArchiveParser(OcrSettingsResolver ocrSettingsResolver,
                                 OcrMyPdfArgumentsBuilder argumentsBuilder,
                                 AppProperties appProperties) {
        this.ocrSettingsResolver = ocrSettingsResolver;
        this.argumentsBuilder = argumentsBuilder;
        this.appProperties = appProperties;
    }

    @Override
    public boolean supports(String mimeType) {
        return mimeType != null && SUPPORTED_MIME_TYPES.contains(mimeType.toLowerCase(Locale.ROOT));
    }

    @Override
    public Optional<Path> createArchive(Path source, String mimeType, Path scratchDir) throws IOException {
        OcrSettings settings = ocrSettingsResolver.resolve();
        if (SKIP_ARCHIVE_ALWAYS.equalsIgnoreCase(settings.skipArchiveFile())
                || OcrMyPdfArgumentsBuilder.MODE_SKIP_NO_ARCHIVE.equalsIgnoreCase(settings.mode())) {
            log.debug("Archive generation disabled by OCR settings for {}", source.getFileName());
            return Optional.empty();
        }

        Files.createDirectories(scratchDir);
        Path output = Files.createTempFile(scratchDir, "archive-", ".pdf");
        Path processLog = Files.createTempFile(scratchDir, "ocrmypdf-", ".log");
        List<String> command = argumentsBuilder.build(appProperties.getOcr().getBinary(), settings, source, output);
        log.debug("Running {}", command);

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(processLog.toFile())
                .start();
        boolean succeeded = false;
        try {
            boolean finished = process.waitFor(appProperties.getOcr().getTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ArchiveGenerationException("ocrmypdf timed out for " + source.getFileName());
            }
            if (process.exitValue() != 0) {
                String toolOutput = Files.readString(processLog, StandardCharsets.UTF_8);
                throw new ArchiveGenerationException(
                        "ocrmypdf exited with " + process.exitValue() + " for " + source.getFileName()
                                + ": " + toolOutput.strip());
            }
            succeeded = true;
        } catch (InterruptedException interrupted) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ArchiveGenerationException("Interrupted while running ocrmypdf", interrupted);
        } finally {
            Files.deleteIfExists(processLog);
            if (!succeeded) {
                Files.deleteIfExists(output);
            }
        }
        return Optional.of(output);
    }
}
