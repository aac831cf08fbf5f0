package com.williamcallahan.docarchive.model;

/**
 * Strategy used to auto-assign a matching entity (tag, correspondent, ...) to incoming documents.
 *
 * <p>Persisted by ordinal, so constants must never be reordered.</p>
 */
public enum MatchingAlgorithm {
    NONE("None"),
    ANY("Any word"),
    ALL("All words"),
    LITERAL("Exact match"),
    REGEX("Regular expression"),
    FUZZY("Fuzzy word"),
    AUTO("Automatic");

    private final String label;

    MatchingAlgorithm(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
