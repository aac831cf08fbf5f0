package com.williamcallahan.docarchive.service.management;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import com.williamcallahan.docarchive.service.storage.DocumentStorageLayout;
import com.williamcallahan.docarchive.service.storage.FilenameGenerator;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves stored files to the names the current filename format produces.
 */
@Service
public class DocumentRenamer {
    private static final Logger log = LoggerFactory.getLogger(DocumentRenamer.class);

    private final DocumentRepository documentRepository;
    private final DocumentStorageLayout storageLayout;
    private final FilenameGenerator filenameGenerator;

    public DocumentRenamer(DocumentRepository documentRepository,
                           DocumentStorageLayout storageLayout,
                           FilenameGenerator filenameGenerator) {
        this.documentRepository = documentRepository;
        this.storageLayout = storageLayout;
        this.filenameGenerator = filenameGenerator;
    }

    /**
     * Renames every document.
     *
     * @return number of documents whose files moved
     * @throws IOException when a file cannot be moved; documents renamed before the failure keep
     *     their new names
     */
    public int renameAll() throws IOException {
        int renamed = 0;
        for (Document document : documentRepository.findAllByOrderByIdAsc()) {
            if (rename(document)) {
                renamed++;
            }
        }
        log.info("Renamed {} document(s)", renamed);
        return renamed;
    }

    /**
     * Regenerates the original and archive filenames of one document and moves its files. A
     * document whose original is missing is left untouched.
     *
     * @return {@code true} when any file moved
     */
    public boolean rename(Document document) throws IOException {
        Path oldSource = storageLayout.sourcePath(document);
        Optional<Path> oldArchive = storageLayout.archivePath(document);
        if (!Files.exists(oldSource)) {
            log.warn("Original of document {} does not exist, not renaming it", document.getId());
            return false;
        }

        String oldFilename = document.getFilename();
        String oldArchiveFilename = document.getArchiveFilename();

        document.setFilename(filenameGenerator.generateUnique(document, false));
        if (document.hasArchiveVersion()) {
            document.setArchiveFilename(filenameGenerator.generateUnique(document, true));
        }
        Path newSource = storageLayout.sourcePath(document);
        Optional<Path> newArchive = storageLayout.archivePath(document);

        boolean sourceMoved = false;
        try {
            sourceMoved = moveIfChanged(oldSource, newSource);
            boolean archiveMoved = oldArchive.isPresent() && moveIfChanged(oldArchive.get(), newArchive.orElseThrow());
            if (!sourceMoved && !archiveMoved && sameNames(document, oldFilename, oldArchiveFilename)) {
                return false;
            }
        } catch (IOException moveFailure) {
            if (sourceMoved) {
                moveBack(newSource, oldSource, moveFailure);
            }
            document.setFilename(oldFilename);
            document.setArchiveFilename(oldArchiveFilename);
            throw moveFailure;
        }

        documentRepository.save(document);
        deleteEmptyParents(oldSource, storageLayout.getMediaDirectories().getOriginalsDir());
        if (oldArchive.isPresent()) {
            deleteEmptyParents(oldArchive.get(), storageLayout.getMediaDirectories().getArchiveDir());
        }
        log.debug("Document {} now stored as {}", document.getId(), document.getFilename());
        return true;
    }

    private static boolean sameNames(Document document, String oldFilename, String oldArchiveFilename) {
        return Objects.equals(document.getFilename(), oldFilename)
                && Objects.equals(document.getArchiveFilename(), oldArchiveFilename);
    }

    private static boolean moveIfChanged(Path from, Path to) throws IOException {
        if (from.equals(to)) {
            return false;
        }
        Files.createDirectories(to.getParent());
        Files.move(from, to);
        return true;
    }

    /**
     * Returns a moved original to its previous location. A failure here is attached to
     * {@code moveFailure} as suppressed so the first error stays the one reported.
     */
    static void moveBack(Path newSource, Path oldSource, IOException moveFailure) {
        try {
            Files.move(newSource, oldSource);
        } catch (IOException rollbackFailure) {
            log.error("Could not move {} back to {}", newSource, oldSource, rollbackFailure);
            moveFailure.addSuppressed(rollbackFailure);
        }
    }

    /**
     * Removes directories left empty by a move, up to but excluding {@code root}.
     */
    static void deleteEmptyParents(Path movedFile, Path root) throws IOException {
        Path directory = movedFile.getParent();
        while (directory != null && directory.startsWith(root) && !directory.equals(root)) {
            try {
                if (!Files.deleteIfExists(directory)) {
                    return;
                }
            } catch (DirectoryNotEmptyException stillInUse) {
                return;
            }
            directory = directory.getParent();
        }
    }
}
