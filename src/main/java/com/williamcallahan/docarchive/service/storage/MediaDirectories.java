package com.williamcallahan.docarchive.service.storage;

import com.williamcallahan.docarchive.config.AppProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Media tree locations. All directories are created on startup.
 *
 * <pre>
 * &lt;media-root&gt;/documents/originals
 * &lt;media-root&gt;/documents/archive
 * &lt;media-root&gt;/documents/thumbnails
 * </pre>
 */
@Component
public class MediaDirectories {
    private final Path mediaRoot;
    private final Path originalsDir;
    private final Path archiveDir;
    private final Path thumbnailDir;
    private final Path scratchDir;

    @Autowired
    public MediaDirectories(AppProperties appProperties) throws IOException {
        this(Paths.get(appProperties.getStorage().getMediaRoot()),
                Paths.get(appProperties.getStorage().getScratchDir()));
    }

    public MediaDirectories(Path mediaRoot, Path scratchDir) throws IOException {
        this.mediaRoot = mediaRoot.toAbsolutePath().normalize();
        Path documentsDir = this.mediaRoot.resolve("documents");
        this.originalsDir = documentsDir.resolve("originals");
        this.archiveDir = documentsDir.resolve("archive");
        this.thumbnailDir = documentsDir.resolve("thumbnails");
        this.scratchDir = scratchDir.toAbsolutePath().normalize();
        Files.createDirectories(this.originalsDir);
        Files.createDirectories(this.archiveDir);
        Files.createDirectories(this.thumbnailDir);
        Files.createDirectories(this.scratchDir);
    }

    public Path getMediaRoot() {
        return mediaRoot;
    }

    public Path getOriginalsDir() {
        return originalsDir;
    }

    public Path getArchiveDir() {
        return archiveDir;
    }

    public Path getThumbnailDir() {
        return thumbnailDir;
    }

    public Path getScratchDir() {
        return scratchDir;
    }
}
