package com.williamcallahan.docarchive.model;

/**
 * Criteria a saved view can filter documents by. Persisted by ordinal.
 */
public enum FilterRuleType {
    TITLE_CONTAINS("title contains"),
    CONTENT_CONTAINS("content contains"),
    ASN_IS("ASN is"),
    CORRESPONDENT_IS("correspondent is"),
    DOCUMENT_TYPE_IS("document type is"),
    IS_IN_INBOX("is in inbox"),
    HAS_TAG("has tag"),
    HAS_ANY_TAG("has any tag"),
    CREATED_BEFORE("created before"),
    CREATED_AFTER("created after"),
    CREATED_YEAR_IS("created year is"),
    CREATED_MONTH_IS("created month is"),
    CREATED_DAY_IS("created day is"),
    ADDED_BEFORE("added before"),
    ADDED_AFTER("added after"),
    MODIFIED_BEFORE("modified before"),
    MODIFIED_AFTER("modified after"),
    DOES_NOT_HAVE_TAG("does not have tag"),
    DOES_NOT_HAVE_ASN("does not have ASN"),
    TITLE_OR_CONTENT_CONTAINS("title or content contains"),
    FULLTEXT_QUERY("fulltext query"),
    MORE_LIKE_THIS("more like this"),
    HAS_TAGS_IN("has tags in"),
    ASN_GREATER_THAN("ASN greater than"),
    ASN_LESS_THAN("ASN less than"),
    STORAGE_PATH_IS("storage path is"),
    HAS_CORRESPONDENT_IN("has correspondent in"),
    DOES_NOT_HAVE_CORRESPONDENT_IN("does not have correspondent in"),
    HAS_DOCUMENT_TYPE_IN("has document type in"),
    DOES_NOT_HAVE_DOCUMENT_TYPE_IN("does not have document type in"),
    HAS_STORAGE_PATH_IN("has storage path in"),
    DOES_NOT_HAVE_STORAGE_PATH_IN("does not have storage path in"),
    OWNER_IS("owner is"),
    HAS_OWNER_IN("has owner in"),
    DOES_NOT_HAVE_OWNER("does not have owner"),
    DOES_NOT_HAVE_OWNER_IN("does not have owner in");

    private final String label;

    FilterRuleType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a rule type from its wire code.
     *
     * @param code numeric rule code
     * @return matching rule type
     * @throws IllegalArgumentException when the code is out of range
     */
    public static FilterRuleType fromCode(int code) {
        FilterRuleType[] ruleTypes = values();
        if (code < 0 || code >= ruleTypes.length) {
            throw new IllegalArgumentException("Unknown filter rule type: " + code);
        }
        return ruleTypes[code];
    }

    public int code() {
        return ordinal();
    }
}
