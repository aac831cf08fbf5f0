package com.williamcallahan.docarchive.service.storage;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.StorageType;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps documents to their files in the media tree.
 *
 * <p>Documents without a stored filename use the legacy name {@code <id:07><ext>}, with a
 * {@code .gpg} suffix when the original is encrypted.</p>
 */
@Component
public class DocumentStorageLayout {
    public static final String ENCRYPTED_SUFFIX = ".gpg";
    private static final String THUMBNAIL_EXTENSION = ".webp";
    private static final String ARCHIVE_EXTENSION = ".pdf";

    private final MediaDirectories mediaDirectories;
    private final ZoneId zone;

    @Autowired
    public DocumentStorageLayout(MediaDirectories mediaDirectories, AppProperties appProperties) {
        this(mediaDirectories, ZoneId.of(appProperties.getStorage().getTimeZone()));
    }

    public DocumentStorageLayout(MediaDirectories mediaDirectories, ZoneId zone) {
        this.mediaDirectories = Objects.requireNonNull(mediaDirectories, "mediaDirectories");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public Path sourcePath(Document document) {
        String filename = document.getFilename();
        if (filename == null) {
            filename = legacyName(document) + fileType(document);
            if (document.getStorageType() == StorageType.GPG) {
                filename += ENCRYPTED_SUFFIX;
            }
        }
        return resolveInside(mediaDirectories.getOriginalsDir(), filename);
    }

    /**
     * Archive PDF location, or empty when the document has no archive version.
     */
    public Optional<Path> archivePath(Document document) {
        if (!document.hasArchiveVersion()) {
            return Optional.empty();
        }
        return Optional.of(resolveInside(mediaDirectories.getArchiveDir(), document.getArchiveFilename()));
    }

    public Path thumbnailPath(Document document) {
        String thumbnailName = legacyName(document) + THUMBNAIL_EXTENSION;
        if (document.getStorageType() == StorageType.GPG) {
            thumbnailName += ENCRYPTED_SUFFIX;
        }
        return mediaDirectories.getThumbnailDir().resolve(thumbnailName);
    }

    /**
     * Download name for a document: its display name, an optional {@code _NN} counter and
     * suffix, then {@code .pdf} for the archive or the original's extension. Contains no path.
     *
     * @param document document to name
     * @param archive whether the archive version is being served
     * @param counter disambiguation counter, omitted when 0
     * @param suffix optional text appended before the extension
     * @return sanitized file name
     */
    public String publicFilename(Document document, boolean archive, int counter, String suffix) {
        StringBuilder name = new StringBuilder(document.displayName(zone));
        if (counter > 0) {
            name.append(String.format("_%02d", counter));
        }
        if (suffix != null) {
            name.append(suffix);
        }
        name.append(archive ? ARCHIVE_EXTENSION : fileType(document));
        return FilenameSanitizer.sanitize(name.toString(), "-");
    }

    public static String fileType(Document document) {
        return MimeTypes.defaultExtension(document.getMimeType());
    }

    static String legacyName(Document document) {
        Long id = Objects.requireNonNull(document.getId(), "document has not been saved");
        return String.format("%07d", id);
    }

    private static Path resolveInside(Path root, String relativeName) {
        Path resolved = root.resolve(relativeName).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Stored filename escapes the media tree: " + relativeName);
        }
        return resolved;
    }

    public ZoneId getZone() {
        return zone;
    }

    public MediaDirectories getMediaDirectories() {
        return mediaDirectories;
    }
}
