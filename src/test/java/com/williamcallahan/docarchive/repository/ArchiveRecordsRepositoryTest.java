package com.williamcallahan.docarchive.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.FilterRuleType;
import com.williamcallahan.docarchive.model.LogEntry;
import com.williamcallahan.docarchive.model.Note;
import com.williamcallahan.docarchive.model.SavedView;
import com.williamcallahan.docarchive.model.TaskRecord;
import com.williamcallahan.docarchive.model.TaskState;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

/**
 * Verifies saved views, notes, task records and log entries.
 */
@DataJpaTest
class ArchiveRecordsRepositoryTest {

    @Autowired
    SavedViewRepository savedViewRepository;

    @Autowired
    NoteRepository noteRepository;

    @Autowired
    DocumentRepository documentRepository;

    @Autowired
    TaskRecordRepository taskRecordRepository;

    @Autowired
    LogEntryRepository logEntryRepository;

    @Test
    void savedViewKeepsItsFilterRules() {
        SavedView view = new SavedView("Inbox", true, false);
        view.addFilterRule(FilterRuleType.IS_IN_INBOX, "true");
        view.addFilterRule(FilterRuleType.TITLE_CONTAINS, "bill");
        savedViewRepository.saveAndFlush(view);

        SavedView loaded = savedViewRepository.findByShowOnDashboardTrueOrderByNameAsc().get(0);

        assertEquals(2, loaded.getFilterRules().size());
        assertEquals("SavedViewFilterRule: 0 : bill", loaded.getFilterRules().stream()
                .filter(rule -> rule.getRuleType() == FilterRuleType.TITLE_CONTAINS)
                .findFirst().orElseThrow().toString());
        assertTrue(savedViewRepository.findByShowInSidebarTrueOrderByNameAsc().isEmpty());
    }

    @Test
    void filterRuleCodesAreBounded() {
        assertEquals(FilterRuleType.TITLE_CONTAINS, FilterRuleType.fromCode(0));
        assertEquals(35, FilterRuleType.values().length - 1);
        assertThrows(IllegalArgumentException.class, () -> FilterRuleType.fromCode(36));
    }

    @Test
    void notesAreListedOldestFirst() {
        Document document = documentRepository.save(new Document("Lease", "application/pdf", "n1"));
        Note later = new Note(document, "alex", "second");
        later.setCreated(Instant.parse("2022-01-02T00:00:00Z"));
        Note earlier = new Note(document, "alex", "first");
        earlier.setCreated(Instant.parse("2022-01-01T00:00:00Z"));
        noteRepository.save(later);
        noteRepository.save(earlier);

        List<String> texts = noteRepository.findByDocumentIdOrderByCreatedAsc(document.getId()).stream()
                .map(Note::getText)
                .toList();

        assertEquals(List.of("first", "second"), texts);
    }

    @Test
    void taskRecordMovesThroughItsStates() {
        TaskRecord task = new TaskRecord("abc-123", "consume_file", "scan.pdf");
        task.markStarted(Instant.parse("2022-01-01T00:00:00Z"));
        task.markFinished(TaskState.SUCCESS, Instant.parse("2022-01-01T00:01:00Z"), "Success. New document id 4");
        taskRecordRepository.saveAndFlush(task);

        TaskRecord loaded = taskRecordRepository.findByTaskId("abc-123").orElseThrow();

        assertEquals(TaskState.SUCCESS, loaded.getStatus());
        assertEquals("Task abc-123", loaded.toString());
        assertEquals(1, taskRecordRepository.findByAcknowledgedFalseOrderByDateCreatedDesc().size());
        assertThrows(IllegalArgumentException.class,
                () -> task.markFinished(TaskState.STARTED, Instant.now(), null));
    }

    @Test
    void logEntriesAreGrouped() {
        UUID group = UUID.randomUUID();
        logEntryRepository.save(new LogEntry(group, Level.INFO, "Consuming scan.pdf"));
        logEntryRepository.save(new LogEntry(group, Level.ERROR, "Consumption failed"));
        logEntryRepository.save(new LogEntry(UUID.randomUUID(), Level.INFO, "Unrelated"));

        List<LogEntry> entries = logEntryRepository.findByGroupOrderByCreatedAsc(group);

        assertEquals(2, entries.size());
    }
}
