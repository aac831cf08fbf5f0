package com.williamcallahan.docarchive.service.ocr;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Produces a searchable PDF archive version of an original document.
 */
public interface ArchiveParser {

    /**
     * Whether this parser can render an archive for the given mime type.
     */
    boolean supports(String mimeType);

    /**
     * Renders an archive version of {@code source} into {@code scratchDir}.
     *
     * @param source original document file
     * @param mimeType mime type of the original
     * @param scratchDir working directory owned by the caller
     * @return path of the produced archive PDF, or empty when the settings say no archive is wanted
     * @throws IOException when the source cannot be read or the output cannot be written
     * @throws ArchiveGenerationException when the external tool fails
     */
    Optional<Path> createArchive(Path source, String mimeType, Path scratchDir) throws IOException;
}
