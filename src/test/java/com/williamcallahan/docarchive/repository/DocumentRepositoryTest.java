package com.williamcallahan.docarchive.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.docarchive.model.Correspondent;
import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.Tag;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Verifies document persistence rules and the lookups used by the management commands.
 */
@DataJpaTest
class DocumentRepositoryTest {

    @Autowired
    DocumentRepository documentRepository;

    @Autowired
    CorrespondentRepository correspondentRepository;

    @Autowired
    TagRepository tagRepository;

    @Test
    void persistingStampsTimestamps() {
        Document document = documentRepository.saveAndFlush(new Document("Invoice", "application/pdf", "c1"));

        assertNotNull(document.getId());
        assertNotNull(document.getCreated());
        assertNotNull(document.getAdded());
        assertNotNull(document.getModified());
    }

    @Test
    void checksumsAreUnique() {
        documentRepository.saveAndFlush(new Document("One", "application/pdf", "same"));

        assertThrows(DataIntegrityViolationException.class,
                () -> documentRepository.saveAndFlush(new Document("Two", "application/pdf", "same")));
    }

    @Test
    void archiveSerialNumberMustBeInRange() {
        Document document = new Document("Invoice", "application/pdf", "c2");
        document.setArchiveSerialNumber(Document.ARCHIVE_SERIAL_NUMBER_MAX + 1);

        assertThrows(RuntimeException.class, () -> documentRepository.saveAndFlush(document));
    }

    @Test
    void findsDocumentsWithoutArchiveInIdOrder() {
        Document archived = new Document("Archived", "application/pdf", "c3");
        archived.setArchiveFilename("archived.pdf");
        archived.setArchiveChecksum("a3");
        documentRepository.save(archived);
        Document first = documentRepository.save(new Document("First", "application/pdf", "c4"));
        Document second = documentRepository.save(new Document("Second", "application/pdf", "c5"));

        List<Document> pending = documentRepository.findByArchiveFilenameIsNullOrderByIdAsc();

        assertEquals(List.of(first.getId(), second.getId()), pending.stream().map(Document::getId).toList());
        assertTrue(documentRepository.existsByArchiveFilename("archived.pdf"));
        assertFalse(documentRepository.existsByFilename("archived.pdf"));
        assertEquals(List.of("archived.pdf"), documentRepository.findAllArchiveFilenames());
    }

    @Test
    void relationsAreLoadedWithTheDocument() {
        Correspondent bank = correspondentRepository.save(new Correspondent("Bank"));
        Tag inbox = new Tag("inbox");
        inbox.setInboxTag(true);
        inbox = tagRepository.save(inbox);
        Document document = new Document("Statement", "application/pdf", "c6");
        document.setCorrespondent(bank);
        document.getTags().add(inbox);
        documentRepository.saveAndFlush(document);

        Document loaded = documentRepository.findByChecksum("c6").orElseThrow();

        assertEquals("Bank", loaded.getCorrespondent().getName());
        assertEquals(1, loaded.getTags().size());
        assertEquals(List.of(inbox.getId()), tagRepository.findByInboxTagTrue().stream().map(Tag::getId).toList());
        assertTrue(correspondentRepository.findByNameAndOwnerIsNull("Bank").isPresent());
    }
}
