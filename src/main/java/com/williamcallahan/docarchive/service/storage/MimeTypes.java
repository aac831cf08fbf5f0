package com.williamcallahan.docarchive.service.storage;

import java.util.Locale;
import java.util.Map;

/**
 * Default file extensions for the mime types the archive stores.
 */
public final class MimeTypes {
    private static final Map<String, String> DEFAULT_EXTENSIONS = Map.ofEntries(
            Map.entry("application/pdf", ".pdf"),
            Map.entry("image/jpeg", ".jpg"),
            Map.entry("image/png", ".png"),
            Map.entry("image/tiff", ".tiff"),
            Map.entry("image/gif", ".gif"),
            Map.entry("image/webp", ".webp"),
            Map.entry("image/bmp", ".bmp"),
            Map.entry("text/plain", ".txt"),
            Map.entry("text/csv", ".csv"),
            Map.entry("text/html", ".html"),
            Map.entry("message/rfc822", ".eml"),
            Map.entry("application/msword", ".doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ".docx"),
            Map.entry("application/vnd.ms-excel", ".xls"),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ".xlsx"),
            Map.entry("application/vnd.oasis.opendocument.text", ".odt"),
            Map.entry("application/vnd.oasis.opendocument.spreadsheet", ".ods"));

    private MimeTypes() {
    }

    /**
     * Returns the default extension, including the leading dot, or {@code ""} for unknown types.
     */
    public static String defaultExtension(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        return DEFAULT_EXTENSIONS.getOrDefault(mimeType.toLowerCase(Locale.ROOT), "");
    }
}
