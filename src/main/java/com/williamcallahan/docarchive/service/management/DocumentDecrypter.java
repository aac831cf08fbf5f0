package com.williamcallahan.docarchive.service.management;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.StorageType;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import com.williamcallahan.docarchive.service.storage.DocumentStorageLayout;
import com.williamcallahan.docarchive.service.storage.GpgDecryptionException;
import com.williamcallahan.docarchive.service.storage.GpgFileDecryptor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Converts GPG-encrypted documents back to plain storage: decrypts the original and thumbnail,
 * drops the {@code .gpg} suffix from the stored filename and removes the encrypted files.
 */
@Service
public class DocumentDecrypter {
    private static final Logger log = LoggerFactory.getLogger(DocumentDecrypter.class);

    private final DocumentRepository documentRepository;
    private final DocumentStorageLayout storageLayout;
    private final GpgFileDecryptor fileDecryptor;
    private final String configuredPassphrase;

    @Autowired
    public DocumentDecrypter(DocumentRepository documentRepository,
                             DocumentStorageLayout storageLayout,
                             GpgFileDecryptor fileDecryptor,
                             AppProperties appProperties) {
        this(documentRepository, storageLayout, fileDecryptor, appProperties.getStorage().getPassphrase());
    }

    public DocumentDecrypter(DocumentRepository documentRepository,
                             DocumentStorageLayout storageLayout,
                             GpgFileDecryptor fileDecryptor,
                             String configuredPassphrase) {
        this.documentRepository = documentRepository;
        this.storageLayout = storageLayout;
        this.fileDecryptor = fileDecryptor;
        this.configuredPassphrase = configuredPassphrase;
    }

    /**
     * Decrypts every encrypted document.
     *
     * @param passphrase passphrase to use instead of {@code app.storage.passphrase}, ignored when
     *     blank
     * @return number of documents decrypted
     * @throws IllegalStateException when no passphrase is available
     * @throws IOException when a file cannot be read or written; documents decrypted before the
     *     failure stay decrypted
     * @throws GpgDecryptionException when a file cannot be decrypted
     */
    public int decryptAll(String passphrase) throws IOException {
        char[] effectivePassphrase = effectivePassphrase(passphrase);
        List<Document> encrypted = documentRepository.findByStorageTypeOrderByIdAsc(StorageType.GPG);
        for (Document document : encrypted) {
            decrypt(document, effectivePassphrase);
        }
        log.info("Decrypted {} document(s)", encrypted.size());
        return encrypted.size();
    }

    private char[] effectivePassphrase(String passphrase) {
        if (passphrase != null && !passphrase.isBlank()) {
            return passphrase.toCharArray();
        }
        if (configuredPassphrase != null && !configuredPassphrase.isBlank()) {
            return configuredPassphrase.toCharArray();
        }
        throw new IllegalStateException(
                "You must supply a passphrase, either with --passphrase or app.storage.passphrase");
    }

    void decrypt(Document document, char[] passphrase) throws IOException {
        String encryptedFilename = document.getFilename();
        if (encryptedFilename != null && !encryptedFilename.endsWith(DocumentStorageLayout.ENCRYPTED_SUFFIX)) {
            throw new GpgDecryptionException(
                    "Unexpected file extension of document " + document.getId() + ": " + encryptedFilename);
        }
        Path encryptedSource = storageLayout.sourcePath(document);
        Path encryptedThumbnail = storageLayout.thumbnailPath(document);

        document.setStorageType(StorageType.UNENCRYPTED);
        if (encryptedFilename != null) {
            document.setFilename(encryptedFilename.substring(
                    0, encryptedFilename.length() - DocumentStorageLayout.ENCRYPTED_SUFFIX.length()));
        }
        Path source = storageLayout.sourcePath(document);
        Path thumbnail = storageLayout.thumbnailPath(document);
        boolean hasThumbnail = Files.exists(encryptedThumbnail);

        try {
            fileDecryptor.decrypt(encryptedSource, source, passphrase);
            if (hasThumbnail) {
                fileDecryptor.decrypt(encryptedThumbnail, thumbnail, passphrase);
            } else {
                log.warn("Thumbnail of document {} does not exist, decrypting the original only", document.getId());
            }
        } catch (IOException | GpgDecryptionException failure) {
            removePartialOutput(source, failure);
            removePartialOutput(thumbnail, failure);
            document.setStorageType(StorageType.GPG);
            document.setFilename(encryptedFilename);
            throw failure;
        }

        documentRepository.save(document);
        Files.delete(encryptedSource);
        if (hasThumbnail) {
            Files.delete(encryptedThumbnail);
        }
        log.debug("Document {} is now stored unencrypted as {}", document.getId(), source.getFileName());
    }

    private static void removePartialOutput(Path output, Exception failure) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
