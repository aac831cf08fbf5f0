package com.williamcallahan.docarchive.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Kind of document, such as invoice or contract.
 */
@Entity
@Table(name = "document_types", uniqueConstraints = @UniqueConstraint(columnNames = {"name", "owner"}))
public class DocumentType extends MatchingEntity {

    protected DocumentType() {
    }

    public DocumentType(String name) {
        super(name);
    }
}
