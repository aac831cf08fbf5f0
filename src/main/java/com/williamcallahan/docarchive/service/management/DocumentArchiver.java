package com.williamcallahan.docarchive.service.management;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import com.williamcallahan.docarchive.service.ocr.ArchiveGenerationException;
import com.williamcallahan.docarchive.service.ocr.ArchiveParser;
import com.williamcallahan.docarchive.service.storage.DocumentStorageLayout;
import com.williamcallahan.docarchive.service.storage.FileChecksums;
import com.williamcallahan.docarchive.service.storage.FilenameGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates or replaces the searchable PDF archive version of stored documents.
 */
@Service
public class DocumentArchiver {
    private static final Logger log = LoggerFactory.getLogger(DocumentArchiver.class);

    private final DocumentRepository documentRepository;
    private final List<ArchiveParser> archiveParsers;
    private final DocumentStorageLayout storageLayout;
    private final FilenameGenerator filenameGenerator;
    private final FileChecksums fileChecksums;

    public DocumentArchiver(DocumentRepository documentRepository,
                            List<ArchiveParser> archiveParsers,
                            DocumentStorageLayout storageLayout,
                            FilenameGenerator filenameGenerator,
                            FileChecksums fileChecksums) {
        this.documentRepository = documentRepository;
        this.archiveParsers = List.copyOf(archiveParsers);
        this.storageLayout = storageLayout;
        this.filenameGenerator = filenameGenerator;
        this.fileChecksums = fileChecksums;
    }

    /**
     * Archives every document that has no archive version yet, or every document when
     * {@code overwrite} is set. A failure on one document is logged and does not stop the run.
     *
     * @param overwrite whether to regenerate existing archive versions
     * @return per-run counts
     */
    public ArchiveRunSummary archiveAll(boolean overwrite) {
        List<Document> documents = overwrite
                ? documentRepository.findAllByOrderByIdAsc()
                : documentRepository.findByArchiveFilenameIsNullOrderByIdAsc();
        log.info("Archiving {} document(s)", documents.size());

        int archived = 0;
        int skipped = 0;
        int failed = 0;
        for (Document document : documents) {
            try {
                if (archive(document)) {
                    archived++;
                } else {
                    skipped++;
                }
            } catch (IOException | ArchiveGenerationException e) {
                failed++;
                log.error("Error while archiving document {}: {}", document.getId(), e.getMessage(), e);
            }
        }
        return new ArchiveRunSummary(archived, skipped, failed);
    }

    /**
     * Archives a single document by id.
     *
     * @return {@code true} when a new archive version was stored
     * @throws DocumentNotFoundException when no such document exists
     * @throws IOException when the original cannot be read or the archive cannot be moved into place
     */
    public boolean archive(long documentId) throws IOException {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return archive(document);
    }

    private boolean archive(Document document) throws IOException {
        Optional<ArchiveParser> parser = archiveParsers.stream()
                .filter(candidate -> candidate.supports(document.getMimeType()))
                .findFirst();
        if (parser.isEmpty()) {
            log.warn("No archive parser for mime type {} of document {}, skipping",
                    document.getMimeType(), document.getId());
            return false;
        }

        Path source = storageLayout.sourcePath(document);
        Path scratchDir = storageLayout.getMediaDirectories().getScratchDir();
        Optional<Path> rendered = parser.get().createArchive(source, document.getMimeType(), scratchDir);
        if (rendered.isEmpty()) {
            log.info("No archive version produced for document {}", document.getId());
            return false;
        }

        Optional<Path> previousArchive = storageLayout.archivePath(document);
        String archiveChecksum = fileChecksums.md5(rendered.get());
        String archiveFilename = filenameGenerator.generateUnique(document, true);

        document.setArchiveChecksum(archiveChecksum);
        document.setArchiveFilename(archiveFilename);
        Path target = storageLayout.archivePath(document).orElseThrow();
        Files.createDirectories(target.getParent());
        Files.move(rendered.get(), target, StandardCopyOption.REPLACE_EXISTING);
        if (previousArchive.isPresent() && !previousArchive.get().equals(target)) {
            Files.deleteIfExists(previousArchive.get());
        }

        documentRepository.save(document);
        log.info("Stored archive version {} for document {}", archiveFilename, document.getId());
        return true;
    }
}
