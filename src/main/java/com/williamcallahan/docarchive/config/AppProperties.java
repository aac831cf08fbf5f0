package com.williamcallahan.docarchive.config;

import jakarta.annotation.PostConstruct;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Storage storage = new Storage();
    private Filename filename = new Filename();
    private Ocr ocr = new Ocr();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Filename getFilename() {
        return filename;
    }

    public void setFilename(Filename filename) {
        this.filename = filename;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public void setOcr(Ocr ocr) {
        this.ocr = ocr;
    }

    /**
     * Rejects settings that would only fail later, in the middle of a management command.
     *
     * @throws IllegalArgumentException when a directory, zone or rewrite rule is invalid
     */
    @PostConstruct
    public void validateConfiguration() {
        requireText(storage.getMediaRoot(), "app.storage.media-root");
        requireText(storage.getScratchDir(), "app.storage.scratch-dir");
        try {
            ZoneId.of(storage.getTimeZone());
        } catch (DateTimeException invalidZone) {
            throw new IllegalArgumentException("app.storage.time-zone is not a valid zone: " + storage.getTimeZone(),
                    invalidZone);
        }
        for (ParseTransform transform : filename.getParseTransforms()) {
            requireText(transform.getPattern(), "app.filename.parse-transforms[].pattern");
            if (transform.getReplacement() == null) {
                throw new IllegalArgumentException("app.filename.parse-transforms[].replacement is required");
            }
            try {
                Pattern.compile(transform.getPattern());
            } catch (PatternSyntaxException invalidPattern) {
                throw new IllegalArgumentException("Invalid filename parse transform pattern: " + transform.getPattern(),
                        invalidPattern);
            }
        }
        requireText(ocr.getBinary(), "app.ocr.binary");
        if (ocr.getTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("app.ocr.timeout-seconds must be positive");
        }
    }

    private static void requireText(String value, String propertyName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(propertyName + " must not be blank");
        }
    }

    public static class Storage {
        private String mediaRoot = "media";
        private String scratchDir = "data/scratch";
        private String timeZone = "UTC";
        private String filenameFormat = "";
        private String passphrase = "";

        public String getMediaRoot() { return mediaRoot; }
        public void setMediaRoot(String mediaRoot) { this.mediaRoot = mediaRoot; }

        public String getScratchDir() { return scratchDir; }
        public void setScratchDir(String scratchDir) { this.scratchDir = scratchDir; }

        public String getTimeZone() { return timeZone; }
        public void setTimeZone(String timeZone) { this.timeZone = timeZone; }

        public String getFilenameFormat() { return filenameFormat; }
        public void setFilenameFormat(String filenameFormat) { this.filenameFormat = filenameFormat; }

        /**
         * Passphrase of GPG-encrypted originals and thumbnails. Only needed for decryption.
         */
        public String getPassphrase() { return passphrase; }
        public void setPassphrase(String passphrase) { this.passphrase = passphrase; }
    }

    public static class Filename {
        private List<ParseTransform> parseTransforms = new ArrayList<>();

        public List<ParseTransform> getParseTransforms() { return parseTransforms; }
        public void setParseTransforms(List<ParseTransform> parseTransforms) { this.parseTransforms = parseTransforms; }
    }

    /**
     * One filename rewrite rule. The replacement uses {@link java.util.regex.Matcher} syntax
     * ({@code $1}, {@code ${name}}).
     */
    public static class ParseTransform {
        private String pattern;
        private String replacement;

        public ParseTransform() {
        }

        public ParseTransform(String pattern, String replacement) {
            this.pattern = pattern;
            this.replacement = replacement;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }

        public String getReplacement() { return replacement; }
        public void setReplacement(String replacement) { this.replacement = replacement; }
    }

    public static class Ocr {
        private String binary = "ocrmypdf";
        private long timeoutSeconds = 1800;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
