package com.williamcallahan.docarchive.domain.ocr;

import java.util.Map;
import java.util.Objects;

/**
 * Effective OCR options for one run, after stored overrides and configuration fallbacks are merged.
 *
 * @param pages number of leading pages to OCR, {@code null} or 0 for all
 * @param language OCR language code(s), for example {@code eng+deu}
 * @param outputType output flavor ({@code pdf}, {@code pdfa}, {@code pdfa-1} ...)
 * @param mode OCR mode ({@code skip}, {@code redo}, {@code force}, {@code skip_noarchive})
 * @param skipArchiveFile when to skip producing an archive ({@code never}, {@code with_text}, {@code always})
 * @param imageDpi fallback DPI for images without resolution metadata, may be {@code null}
 * @param clean unpaper cleaning mode ({@code clean}, {@code clean-final}, {@code none})
 * @param deskew whether to deskew pages
 * @param rotate whether to auto-rotate pages
 * @param rotateThreshold confidence threshold for page rotation
 * @param maxImagePixels decompression-bomb limit in pixels, may be {@code null}
 * @param colorConversionStrategy Ghostscript color conversion strategy for PDF/A output
 * @param userArgs extra tool arguments, may be {@code null}
 */
public record OcrSettings(
        Integer pages,
        String language,
        String outputType,
        String mode,
        String skipArchiveFile,
        Integer imageDpi,
        String clean,
        boolean deskew,
        boolean rotate,
        double rotateThreshold,
        Double maxImagePixels,
        String colorConversionStrategy,
        Map<String, Object> userArgs) {

    public OcrSettings {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(outputType, "outputType");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(skipArchiveFile, "skipArchiveFile");
        Objects.requireNonNull(clean, "clean");
        userArgs = userArgs == null ? null : Map.copyOf(userArgs);
    }
}
