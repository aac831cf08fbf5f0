package com.williamcallahan.docarchive.service.management;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Findings of one sanity check run, grouped by document. Findings not tied to a document, such
 * as orphaned files, are kept under a {@code null} document id.
 */
public class SanityCheckMessages {
    static final String NO_ISSUES = "Sanity checker detected no issues.";

    private final Map<Long, List<Message>> messagesByDocument = new LinkedHashMap<>();
    private final Map<Long, String> documentTitles = new LinkedHashMap<>();

    /**
     * One finding.
     *
     * @param documentId affected document, {@code null} for global findings
     * @param level severity
     * @param text human-readable description
     */
    public record Message(Long documentId, Level level, String text) {
        public Message {
            Objects.requireNonNull(level, "level");
            Objects.requireNonNull(text, "text");
        }
    }

    public void error(Long documentId, String text) {
        add(new Message(documentId, Level.ERROR, text));
    }

    public void warning(Long documentId, String text) {
        add(new Message(documentId, Level.WARN, text));
    }

    public void info(Long documentId, String text) {
        add(new Message(documentId, Level.INFO, text));
    }

    void rememberTitle(Long documentId, String title) {
        documentTitles.put(documentId, title);
    }

    private void add(Message message) {
        messagesByDocument.computeIfAbsent(message.documentId(), id -> new ArrayList<>()).add(message);
    }

    public boolean isEmpty() {
        return messagesByDocument.isEmpty();
    }

    public int size() {
        return messagesByDocument.values().stream().mapToInt(List::size).sum();
    }

    public boolean hasError() {
        return hasLevel(Level.ERROR);
    }

    public boolean hasWarning() {
        return hasLevel(Level.WARN);
    }

    private boolean hasLevel(Level level) {
        return messagesByDocument.values().stream()
                .flatMap(List::stream)
                .anyMatch(message -> message.level() == level);
    }

    /**
     * Findings for one document, or the global findings when {@code documentId} is {@code null}.
     */
    public List<Message> forDocument(Long documentId) {
        return Collections.unmodifiableList(messagesByDocument.getOrDefault(documentId, List.of()));
    }

    public List<Message> all() {
        return messagesByDocument.values().stream().flatMap(List::stream).toList();
    }

    /**
     * Writes the findings to {@code logger}: a header line per affected document followed by its
     * findings at their own level, or a single line when there is nothing to report.
     */
    public void logMessages(Logger logger) {
        if (isEmpty()) {
            logger.info(NO_ISSUES);
            return;
        }
        for (Map.Entry<Long, List<Message>> entry : messagesByDocument.entrySet()) {
            Long documentId = entry.getKey();
            if (documentId != null) {
                logger.info("Detected following issue(s) with document #{}, titled {}",
                        documentId, documentTitles.getOrDefault(documentId, ""));
            }
            for (Message message : entry.getValue()) {
                logger.atLevel(message.level()).log(message.text());
            }
        }
    }
}
