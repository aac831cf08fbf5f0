package com.williamcallahan.docarchive.service.management;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.StorageType;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import com.williamcallahan.docarchive.service.storage.DocumentStorageLayout;
import com.williamcallahan.docarchive.service.storage.FileChecksums;
import com.williamcallahan.docarchive.service.storage.GpgDecryptionException;
import com.williamcallahan.docarchive.service.storage.GpgFileDecryptor;
import com.williamcallahan.docarchive.service.storage.GpgTestFiles;
import com.williamcallahan.docarchive.service.storage.MediaDirectories;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

/**
 * Verifies that encrypted documents end up as plain files with matching checksums.
 */
@DataJpaTest
class DocumentDecrypterTest {
    private static final byte[] ORIGINAL = "%PDF-1.4 wow".getBytes(StandardCharsets.UTF_8);
    private static final byte[] THUMBNAIL = "RIFF....WEBPVP8 thumbnail".getBytes(StandardCharsets.UTF_8);

    @Autowired
    DocumentRepository documentRepository;

    @TempDir
    Path tempDir;

    private MediaDirectories mediaDirectories;
    private DocumentStorageLayout layout;
    private final FileChecksums fileChecksums = new FileChecksums();

    @BeforeEach
    void setUp() throws Exception {
        mediaDirectories = new MediaDirectories(tempDir.resolve("media"), tempDir.resolve("scratch"));
        layout = new DocumentStorageLayout(mediaDirectories, ZoneOffset.UTC);
    }

    private DocumentDecrypter decrypter(String configuredPassphrase) {
        return new DocumentDecrypter(documentRepository, layout, new GpgFileDecryptor(), configuredPassphrase);
    }

    private Document encryptedDocument(String filename) throws Exception {
        Path plain = Files.write(tempDir.resolve("plain.pdf"), ORIGINAL);
        Document document = new Document("wow", "application/pdf", fileChecksums.md5(plain));
        document.setFilename(filename);
        document.setStorageType(StorageType.GPG);
        document = documentRepository.save(document);
        GpgTestFiles.encrypt(ORIGINAL, layout.sourcePath(document), "test", true);
        GpgTestFiles.encrypt(THUMBNAIL, layout.thumbnailPath(document), "test", false);
        return document;
    }

    @Test
    void decryptsOriginalAndThumbnail() throws Exception {
        Document document = encryptedDocument("0000004.pdf.gpg");
        Path encryptedSource = layout.sourcePath(document);
        Path encryptedThumbnail = layout.thumbnailPath(document);

        assertEquals(1, decrypter("test").decryptAll(null));

        Document decrypted = documentRepository.findById(document.getId()).orElseThrow();
        assertEquals(StorageType.UNENCRYPTED, decrypted.getStorageType());
        assertEquals("0000004.pdf", decrypted.getFilename());
        assertEquals(mediaDirectories.getOriginalsDir().resolve("0000004.pdf"), layout.sourcePath(decrypted));
        assertFalse(layout.thumbnailPath(decrypted).toString().endsWith(".gpg"));
        assertTrue(Files.isRegularFile(layout.sourcePath(decrypted)));
        assertTrue(Files.isRegularFile(layout.thumbnailPath(decrypted)));
        assertEquals(decrypted.getChecksum(), fileChecksums.md5(layout.sourcePath(decrypted)));
        assertFalse(Files.exists(encryptedSource));
        assertFalse(Files.exists(encryptedThumbnail));
    }

    @Test
    void legacyNamedDocumentKeepsLegacyName() throws Exception {
        Document document = encryptedDocument(null);

        decrypter(null).decryptAll("test");

        Document decrypted = documentRepository.findById(document.getId()).orElseThrow();
        assertEquals(String.format("%07d.pdf", document.getId()), layout.sourcePath(decrypted).getFileName().toString());
        assertEquals(decrypted.getChecksum(), fileChecksums.md5(layout.sourcePath(decrypted)));
    }

    @Test
    void missingPassphraseIsRejectedBeforeTouchingFiles() throws Exception {
        Document document = encryptedDocument("0000005.pdf.gpg");

        assertThrows(IllegalStateException.class, () -> decrypter("").decryptAll(" "));

        assertTrue(Files.exists(layout.sourcePath(document)));
        assertEquals(StorageType.GPG, document.getStorageType());
    }

    @Test
    void wrongPassphraseKeepsTheDocumentEncrypted() throws Exception {
        Document document = encryptedDocument("0000006.pdf.gpg");
        Path encryptedSource = layout.sourcePath(document);

        assertThrows(GpgDecryptionException.class, () -> decrypter("nope").decryptAll(null));

        assertEquals(StorageType.GPG, document.getStorageType());
        assertEquals("0000006.pdf.gpg", document.getFilename());
        assertTrue(Files.exists(encryptedSource));
        assertFalse(Files.exists(mediaDirectories.getOriginalsDir().resolve("0000006.pdf")));
    }

    @Test
    void unencryptedDocumentsAreLeftAlone() throws Exception {
        Document document = new Document("plain", "application/pdf", "plain-checksum");
        document.setFilename("plain.pdf");
        documentRepository.save(document);

        assertEquals(0, decrypter("test").decryptAll(null));
    }
}
