package com.williamcallahan.docarchive.service.ocr;

/**
 * Raised when an archive version of a document could not be produced.
 */
public class ArchiveGenerationException extends RuntimeException {

    public ArchiveGenerationException(String message) {
        super(message);
    }

    public ArchiveGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
