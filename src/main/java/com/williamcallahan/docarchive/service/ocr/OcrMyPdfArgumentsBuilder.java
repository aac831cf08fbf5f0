package com.williamcallahan.docarchive.service.ocr;

import com.williamcallahan.docarchive.domain.ocr.OcrSettings;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Renders {@link OcrSettings} as an {@code ocrmypdf} command line.
 */
@Component
public class OcrMyPdfArgumentsBuilder {
    static final String MODE_SKIP = "skip";
    static final String MODE_SKIP_NO_ARCHIVE = "skip_noarchive";
    static final String MODE_REDO = "redo";
    static final String MODE_FORCE = "force";

    static final String CLEAN_CLEAN = "clean";
    static final String CLEAN_FINAL = "clean-final";

    private static final double PIXELS_PER_MEGAPIXEL = 1_000_000d;

    /**
     * Builds the full argument list, binary first and the input and output files last.
     *
     * @param binary executable name or path
     * @param settings effective OCR settings
     * @param input source document
     * @param output archive PDF to produce
     * @return command line suitable for {@link ProcessBuilder}
     */
    public List<String> build(String binary, OcrSettings settings, Path input, Path output) {
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(settings, "settings");
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.addAll(options(settings));
        command.add(input.toString());
        command.add(output.toString());
        return command;
    }

    /**
     * Renders only the option flags for the given settings.
     */
    public List<String> options(OcrSettings settings) {
        List<String> arguments = new ArrayList<>();
        arguments.add("--language");
        arguments.add(settings.language());
        arguments.add("--output-type");
        arguments.add(settings.outputType());

        String mode = settings.mode().toLowerCase(Locale.ROOT);
        switch (mode) {
            case MODE_SKIP, MODE_SKIP_NO_ARCHIVE -> arguments.add("--skip-text");
            case MODE_REDO -> arguments.add("--redo-ocr");
            case MODE_FORCE -> arguments.add("--force-ocr");
            default -> throw new IllegalArgumentException("Unsupported OCR mode: " + settings.mode());
        }

        String clean = settings.clean().toLowerCase(Locale.ROOT);
        if (CLEAN_CLEAN.equals(clean)) {
            arguments.add("--clean");
        } else if (CLEAN_FINAL.equals(clean)) {
            // ocrmypdf rejects --clean-final together with --redo-ocr
            arguments.add(MODE_REDO.equals(mode) ? "--clean" : "--clean-final");
        }

        if (settings.deskew() && !MODE_REDO.equals(mode)) {
            arguments.add("--deskew");
        }
        if (settings.rotate()) {
            arguments.add("--rotate-pages");
            arguments.add("--rotate-pages-threshold");
            arguments.add(plainNumber(settings.rotateThreshold()));
        }
        if (settings.pages() != null && settings.pages() > 0) {
            arguments.add("--pages");
            arguments.add("1-" + settings.pages());
        }
        if (settings.imageDpi() != null) {
            arguments.add("--image-dpi");
            arguments.add(String.valueOf(settings.imageDpi()));
        }
        if (settings.maxImagePixels() != null && settings.maxImagePixels() > 0) {
            arguments.add("--max-image-mpixels");
            arguments.add(plainNumber(settings.maxImagePixels() / PIXELS_PER_MEGAPIXEL));
        }
        if (settings.colorConversionStrategy() != null
                && !settings.colorConversionStrategy().isBlank()
                && settings.outputType().startsWith("pdfa")) {
            arguments.add("--color-conversion-strategy");
            arguments.add(settings.colorConversionStrategy());
        }
        if (settings.userArgs() != null) {
            appendUserArgs(arguments, settings.userArgs());
        }
        return arguments;
    }

    private static void appendUserArgs(List<String> arguments, Map<String, Object> userArgs) {
        // Sorted so the command line is stable between runs.
        for (Map.Entry<String, Object> userArg : new TreeMap<>(userArgs).entrySet()) {
            String flag = "--" + userArg.getKey().replace('_', '-');
            Object value = userArg.getValue();
            if (value instanceof Boolean enabled) {
                if (enabled) {
                    arguments.add(flag);
                }
            } else if (value != null) {
                arguments.add(flag);
                arguments.add(value instanceof Number number ? plainNumber(number.doubleValue()) : value.toString());
            }
        }
    }

    static String plainNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
