package com.williamcallahan.docarchive.service.management;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import com.williamcallahan.docarchive.service.storage.DocumentStorageLayout;
import com.williamcallahan.docarchive.service.storage.FileChecksums;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-checks stored documents against the files in the media tree.
 */
@Service
public class SanityChecker {
    private static final Logger log = LoggerFactory.getLogger(SanityChecker.class);

    private static final Set<String> IGNORED_FILE_NAMES = Set.of(".DS_Store", "media.lock");

    private final DocumentRepository documentRepository;
    private final DocumentStorageLayout storageLayout;
    private final FileChecksums fileChecksums;

    public SanityChecker(DocumentRepository documentRepository,
                         DocumentStorageLayout storageLayout,
                         FileChecksums fileChecksums) {
        this.documentRepository = documentRepository;
        this.storageLayout = storageLayout;
        this.fileChecksums = fileChecksums;
    }

    /**
     * Runs every check and logs the findings.
     */
    public SanityCheckMessages checkAndLog() throws IOException {
        SanityCheckMessages messages = check();
        messages.logMessages(log);
        return messages;
    }

    /**
     * Runs every check without logging.
     *
     * @return findings, empty when the media tree and database agree
     * @throws IOException when the media tree cannot be listed
     */
    public SanityCheckMessages check() throws IOException {
        SanityCheckMessages messages = new SanityCheckMessages();
        Set<Path> unclaimedFiles = listMediaFiles();

        for (Document document : documentRepository.findAllByOrderByIdAsc()) {
            messages.rememberTitle(document.getId(), document.getTitle());
            checkThumbnail(document, messages, unclaimedFiles);
            checkOriginal(document, messages, unclaimedFiles);
            checkArchive(document, messages, unclaimedFiles);
            if (document.getContent() == null || document.getContent().isBlank()) {
                messages.info(document.getId(), "Document contains no OCR data");
            }
        }

        for (Path orphan : unclaimedFiles) {
            messages.warning(null, "Orphaned file in media dir: " + orphan);
        }
        return messages;
    }

    private void checkThumbnail(Document document, SanityCheckMessages messages, Set<Path> unclaimedFiles) {
        Path thumbnail = storageLayout.thumbnailPath(document);
        if (!Files.exists(thumbnail)) {
            messages.error(document.getId(), "Thumbnail of document does not exist.");
            return;
        }
        unclaimedFiles.remove(thumbnail);
        if (!Files.isReadable(thumbnail)) {
            messages.error(document.getId(), "Cannot read thumbnail file of document: " + thumbnail);
        }
    }

    private void checkOriginal(Document document, SanityCheckMessages messages, Set<Path> unclaimedFiles) {
        Path source = storageLayout.sourcePath(document);
        if (!Files.exists(source)) {
            messages.error(document.getId(), "Original of document does not exist.");
            return;
        }
        unclaimedFiles.remove(source);
        try {
            String actual = fileChecksums.md5(source);
            if (!actual.equals(document.getChecksum())) {
                messages.error(document.getId(),
                        "Checksum mismatch. Stored: " + document.getChecksum() + ", actual: " + actual + ".");
            }
        } catch (IOException unreadable) {
            messages.error(document.getId(), "Cannot read original file of document: " + unreadable.getMessage());
        }
    }

    private void checkArchive(Document document, SanityCheckMessages messages, Set<Path> unclaimedFiles) {
        boolean hasChecksum = document.getArchiveChecksum() != null;
        if (hasChecksum && !document.hasArchiveVersion()) {
            messages.error(document.getId(), "Document has an archive file checksum, but no archive filename.");
            return;
        }
        if (!hasChecksum && document.hasArchiveVersion()) {
            messages.error(document.getId(), "Document has an archive file, but its checksum is missing.");
            return;
        }
        Optional<Path> archive = storageLayout.archivePath(document);
        if (archive.isEmpty()) {
            return;
        }
        if (!Files.exists(archive.get())) {
            messages.error(document.getId(), "Archived version of document does not exist.");
            return;
        }
        unclaimedFiles.remove(archive.get());
        try {
            String actual = fileChecksums.md5(archive.get());
            if (!actual.equals(document.getArchiveChecksum())) {
                messages.error(document.getId(), "Checksum mismatch of archived document. Stored: "
                        + document.getArchiveChecksum() + ", actual: " + actual + ".");
            }
        } catch (IOException unreadable) {
            messages.error(document.getId(), "Cannot read archive file of document: " + unreadable.getMessage());
        }
    }

    private Set<Path> listMediaFiles() throws IOException {
        Path mediaRoot = storageLayout.getMediaDirectories().getMediaRoot();
        try (Stream<Path> paths = Files.walk(mediaRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> !IGNORED_FILE_NAMES.contains(path.getFileName().toString()))
                    .map(path -> path.toAbsolutePath().normalize())
                    .collect(Collectors.toCollection(TreeSet::new));
        }
    }
}
