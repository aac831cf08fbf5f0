package com.williamcallahan.docarchive.service.storage;

/**
 * Raised when an encrypted media file cannot be decrypted.
 */
public class GpgDecryptionException extends RuntimeException {

    public GpgDecryptionException(String message) {
        super(message);
    }

    public GpgDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
