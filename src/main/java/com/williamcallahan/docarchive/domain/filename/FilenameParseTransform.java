package com.williamcallahan.docarchive.domain.filename;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled filename rewrite rule applied before metadata extraction.
 *
 * @param pattern pattern searched anywhere in the raw filename
 * @param replacement replacement template in {@link Matcher} syntax
 */
public record FilenameParseTransform(Pattern pattern, String replacement) {

    public FilenameParseTransform {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }

    public static FilenameParseTransform compile(String regex, String replacement) {
        return new FilenameParseTransform(Pattern.compile(regex), replacement);
    }

    /**
     * Replaces every match of this rule in the filename.
     *
     * @param filename raw filename
     * @return the rewritten name, or {@code null} when the pattern does not occur at all
     */
    public String rewrite(String filename) {
        Matcher matcher = pattern.matcher(filename);
        if (!matcher.find()) {
            return null;
        }
        return matcher.replaceAll(replacement);
    }
}
