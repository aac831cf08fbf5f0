package com.williamcallahan.docarchive.service.filename;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.domain.filename.FilenameParseTransform;
import com.williamcallahan.docarchive.domain.filename.ParsedFilename;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Recovers a creation date and a title from an uploaded filename.
 *
 * <p>Steps, in order: at most one configured rewrite rule, extension removal, then an ordered list
 * of patterns where the first match wins. The final pattern matches anything, so every non-null
 * filename yields a result. The extractor holds no mutable state and is safe to share.</p>
 */
@Service
public class FilenameMetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(FilenameMetadataExtractor.class);

    private static final int FULL_TIMESTAMP_DIGITS = 14;
    private static final int MIN_YEAR = 1;
    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMddHHmmss", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);

    // Ordered: first match wins, the last entry always matches.
    private static final List<FilenamePattern> FILENAME_PATTERNS = List.of(
            new FilenamePattern(
                    "created-title",
                    Pattern.compile("^(?<created>\\d{8}(\\d{6})?Z?) - (?<title>.*)$",
                            Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                    matcher -> ParsedFilename.of(parseCreated(matcher.group("created")), matcher.group("title"))),
            new FilenamePattern(
                    "title",
                    Pattern.compile("(?<title>.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
                    matcher -> ParsedFilename.of(null, matcher.group("title"))));

    private final List<FilenameParseTransform> parseTransforms;

    /**
     * Creates an extractor with the rewrite rules from {@code app.filename.parse-transforms}.
     */
    @Autowired
    public FilenameMetadataExtractor(AppProperties appProperties) {
        this(appProperties.getFilename().getParseTransforms().stream()
                .map(rule -> FilenameParseTransform.compile(rule.getPattern(), rule.getReplacement()))
                .toList());
    }

    /**
     * Creates an extractor with an explicit, ordered list of rewrite rules.
     *
     * @param parseTransforms rewrite rules, tried in order
     */
    public FilenameMetadataExtractor(List<FilenameParseTransform> parseTransforms) {
        this.parseTransforms = List.copyOf(Objects.requireNonNull(parseTransforms, "parseTransforms"));
    }

    /**
     * Extracts metadata from a raw filename.
     *
     * @param rawFilename filename as uploaded, may include an extension
     * @return parsed metadata; never {@code null}
     */
    public ParsedFilename extract(String rawFilename) {
        Objects.requireNonNull(rawFilename, "rawFilename");

        String rewritten = applyFirstMatchingTransform(rawFilename);
        String nameToMatch = stripExtension(rewritten);

        for (FilenamePattern filenamePattern : FILENAME_PATTERNS) {
            Matcher matcher = filenamePattern.pattern().matcher(nameToMatch);
            if (matcher.matches()) {
                log.debug("Filename matched pattern {}", filenamePattern.name());
                return filenamePattern.extractor().apply(matcher);
            }
        }
        throw new IllegalStateException("Fallback filename pattern did not match");
    }

    private String applyFirstMatchingTransform(String filename) {
        for (FilenameParseTransform transform : parseTransforms) {
            String rewritten = transform.rewrite(filename);
            if (rewritten != null) {
                return rewritten;
            }
        }
        return filename;
    }

    /**
     * Drops the extension. A name that is only a dot-extension ({@code .pdf}) has no usable text
     * and becomes empty.
     */
    static String stripExtension(String filename) {
        String withoutExtension = splitExtension(filename);
        if (withoutExtension.equals(filename) && filename.startsWith(".")) {
            return "";
        }
        return withoutExtension;
    }

    /**
     * Returns the filename without its extension. The extension begins at the last dot of the
     * final path segment, unless every character before that dot is also a dot.
     */
    static String splitExtension(String filename) {
        int separatorIndex = filename.lastIndexOf('/');
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > separatorIndex) {
            for (int index = separatorIndex + 1; index < dotIndex; index++) {
                if (filename.charAt(index) != '.') {
                    return filename.substring(0, dotIndex);
                }
            }
        }
        return filename;
    }

    /**
     * Parses an 8 or 14 digit timestamp, optionally suffixed with {@code Z}. Date-only input gets
     * a midnight time of day. Returns {@code null} for digits that do not form a valid timestamp,
     * including year 0.
     */
    static Instant parseCreated(String created) {
        String digits = created.endsWith("Z") || created.endsWith("z")
                ? created.substring(0, created.length() - 1)
                : created;
        StringBuilder padded = new StringBuilder(digits);
        while (padded.length() < FULL_TIMESTAMP_DIGITS) {
            padded.append('0');
        }
        try {
            LocalDateTime parsed = LocalDateTime.parse(padded, CREATED_FORMAT);
            if (parsed.getYear() < MIN_YEAR) {
                log.debug("Ignoring filename timestamp before year {}: {}", MIN_YEAR, created);
                return null;
            }
            return parsed.toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException invalidTimestamp) {
            log.debug("Ignoring unparseable filename timestamp {}", created);
            return null;
        }
    }

    private record FilenamePattern(String name, Pattern pattern, Function<Matcher, ParsedFilename> extractor) {
    }
}
