package com.williamcallahan.docarchive.domain.filename;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Metadata recovered from an uploaded filename.
 *
 * <p>The extractor only ever fills {@code created} and {@code title}. {@code correspondent},
 * {@code tags} and {@code extension} are carried for callers that merge in metadata from other
 * sources.</p>
 *
 * @param created creation timestamp in UTC, or {@code null} when the name carries none
 * @param title title text, possibly empty
 * @param correspondent correspondent name supplied by the caller, may be {@code null}
 * @param tags tag names supplied by the caller
 * @param extension file extension supplied by the caller, may be {@code null}
 */
public record ParsedFilename(
        Instant created, String title, String correspondent, List<String> tags, String extension) {

    public ParsedFilename {
        Objects.requireNonNull(title, "title");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Creates a result carrying only the fields derived from the filename.
     */
    public static ParsedFilename of(Instant created, String title) {
        return new ParsedFilename(created, title, null, List.of(), null);
    }

    public ParsedFilename withCorrespondent(String correspondentName) {
        return new ParsedFilename(created, title, correspondentName, tags, extension);
    }

    public ParsedFilename withTags(List<String> tagNames) {
        return new ParsedFilename(created, title, correspondent, tagNames, extension);
    }

    public ParsedFilename withExtension(String fileExtension) {
        return new ParsedFilename(created, title, correspondent, tags, fileExtension);
    }
}
