package com.williamcallahan.docarchive.service.storage;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.MatchingEntity;
import com.williamcallahan.docarchive.model.StorageType;
import com.williamcallahan.docarchive.model.Tag;
import com.williamcallahan.docarchive.repository.DocumentRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Generates stored filenames from the configured filename format.
 *
 * <p>The format is taken from the document's storage path when it has one, otherwise from
 * {@code app.storage.filename-format}. Placeholders are written as {@code {name}}; a value that
 * is not set renders as {@code none}. A blank format, or one with an unknown placeholder, falls
 * back to the legacy {@code <id:07>} name.</p>
 */
@Service
public class FilenameGenerator {
    private static final Logger log = LoggerFactory.getLogger(FilenameGenerator.class);

    static final String MISSING_VALUE = "none";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final String filenameFormat;
    private final DocumentStorageLayout storageLayout;
    private final DocumentRepository documentRepository;

    @Autowired
    public FilenameGenerator(AppProperties appProperties,
                             DocumentStorageLayout storageLayout,
                             DocumentRepository documentRepository) {
        this(appProperties.getStorage().getFilenameFormat(), storageLayout, documentRepository);
    }

    public FilenameGenerator(String filenameFormat,
                             DocumentStorageLayout storageLayout,
                             DocumentRepository documentRepository) {
        this.filenameFormat = filenameFormat == null ? "" : filenameFormat;
        this.storageLayout = Objects.requireNonNull(storageLayout, "storageLayout");
        this.documentRepository = Objects.requireNonNull(documentRepository, "documentRepository");
    }

    /**
     * Renders the relative filename for a document.
     *
     * @param document saved document
     * @param counter disambiguation counter rendered as {@code _NN}, omitted when 0
     * @param archive whether to name the archive version ({@code .pdf}) or the original
     * @return filename relative to the originals or archive directory
     */
    public String generate(Document document, int counter, boolean archive) {
        String format = document.getStoragePath() != null
                ? document.getStoragePath().getPath()
                : filenameFormat;

        String path = renderFormat(format, document);
        if (path.isEmpty()) {
            path = DocumentStorageLayout.legacyName(document);
        }

        StringBuilder filename = new StringBuilder(path);
        if (counter > 0) {
            filename.append(String.format("_%02d", counter));
        }
        filename.append(archive ? ".pdf" : DocumentStorageLayout.fileType(document));
        if (!archive && document.getStorageType() == StorageType.GPG) {
            filename.append(DocumentStorageLayout.ENCRYPTED_SUFFIX);
        }
        return filename.toString();
    }

    /**
     * Renders a filename that does not collide with any other stored file, bumping the counter
     * until it is free. The document's current name is always acceptable.
     *
     * @param document saved document
     * @param archive whether to name the archive version
     * @return free filename relative to the originals or archive directory
     */
    public String generateUnique(Document document, boolean archive) {
        String currentName = archive ? document.getArchiveFilename() : document.getFilename();
        Path root = archive
                ? storageLayout.getMediaDirectories().getArchiveDir()
                : storageLayout.getMediaDirectories().getOriginalsDir();
        Set<String> originalStems = archive ? originalStems() : Set.of();

        for (int counter = 0; ; counter++) {
            String candidate = generate(document, counter, archive);
            if (candidate.equals(currentName)) {
                return candidate;
            }
            boolean taken = Files.exists(root.resolve(candidate))
                    || (archive
                            ? documentRepository.existsByArchiveFilename(candidate)
                            : documentRepository.existsByFilename(candidate));
            if (!taken && archive && claimedByAnotherOriginal(document, candidate, originalStems)) {
                taken = true;
            }
            if (!taken) {
                return candidate;
            }
            log.debug("Filename {} is taken, trying counter {}", candidate, counter + 1);
        }
    }

    /**
     * An archive name mirrors its original's name, so an archive may not take a name whose stem
     * belongs to a different document's original.
     */
    private static boolean claimedByAnotherOriginal(Document document, String candidate, Set<String> originalStems) {
        String candidateStem = stem(candidate);
        if (document.getFilename() != null && stem(document.getFilename()).equals(candidateStem)) {
            return false;
        }
        return originalStems.contains(candidateStem);
    }

    private Set<String> originalStems() {
        return documentRepository.findAllFilenames().stream()
                .map(FilenameGenerator::stem)
                .collect(Collectors.toSet());
    }

    static String stem(String filename) {
        int separatorIndex = filename.lastIndexOf('/');
        int dotIndex = filename.lastIndexOf('.');
        return dotIndex > separatorIndex + 1 ? filename.substring(0, dotIndex) : filename;
    }

    private String renderFormat(String format, Document document) {
        if (format == null || format.isBlank()) {
            return "";
        }
        Map<String, String> values = placeholderValues(document, storageLayout.getZone());
        Matcher matcher = PLACEHOLDER.matcher(format);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            if (value == null) {
                log.warn("Invalid filename format {}: unknown placeholder {}, using the default name",
                        format, matcher.group());
                return "";
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);

        return Arrays.stream(rendered.toString().split("/"))
                .map(String::strip)
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.joining("/"));
    }

    private static Map<String, String> placeholderValues(Document document, ZoneId zone) {
        Map<String, String> values = new HashMap<>();
        values.put("title", safe(document.getTitle()));
        values.put("correspondent", nameOf(document.getCorrespondent()));
        values.put("document_type", nameOf(document.getDocumentType()));

        LocalDate created = document.getCreated() == null ? null : document.getCreated().atZone(zone).toLocalDate();
        putDate(values, "created", created);
        LocalDate added = document.getAdded() == null ? null : document.getAdded().atZone(zone).toLocalDate();
        putDate(values, "added", added);

        values.put("asn", document.getArchiveSerialNumber() == null
                ? MISSING_VALUE
                : String.valueOf(document.getArchiveSerialNumber()));
        String tagList = document.getTags().stream()
                .map(Tag::getName)
                .sorted()
                .collect(Collectors.joining(","));
        values.put("tag_list", safe(tagList));
        values.put("owner_username", safe(document.getOwner()));
        return values;
    }

    private static void putDate(Map<String, String> values, String prefix, LocalDate date) {
        if (date == null) {
            values.put(prefix, MISSING_VALUE);
            values.put(prefix + "_year", MISSING_VALUE);
            values.put(prefix + "_month", MISSING_VALUE);
            values.put(prefix + "_day", MISSING_VALUE);
            return;
        }
        values.put(prefix, date.toString());
        values.put(prefix + "_year", String.format("%04d", date.getYear()));
        values.put(prefix + "_month", String.format("%02d", date.getMonthValue()));
        values.put(prefix + "_day", String.format("%02d", date.getDayOfMonth()));
    }

    private static String nameOf(MatchingEntity entity) {
        return entity == null ? MISSING_VALUE : safe(entity.getName());
    }

    private static String safe(String value) {
        if (value == null || value.isBlank()) {
            return MISSING_VALUE;
        }
        String sanitized = FilenameSanitizer.sanitize(value, "-");
        return sanitized.isEmpty() ? MISSING_VALUE : sanitized;
    }
}
