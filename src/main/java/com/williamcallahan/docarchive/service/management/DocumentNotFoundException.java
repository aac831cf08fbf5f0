package com.williamcallahan.docarchive.service.management;

/**
 * Raised when a management operation names a document id that does not exist.
 */
public class DocumentNotFoundException extends RuntimeException {
    private final long documentId;

    public DocumentNotFoundException(long documentId) {
        super("Document " + documentId + " does not exist");
        this.documentId = documentId;
    }

    public long getDocumentId() {
        return documentId;
    }
}
