package com.williamcallahan.docarchive.model;

/**
 * How a document's original file is stored on disk.
 */
public enum StorageType {
    UNENCRYPTED("unencrypted", "Unencrypted"),
    GPG("gpg", "Encrypted with GNU Privacy Guard");

    private final String code;
    private final String label;

    StorageType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }
}
