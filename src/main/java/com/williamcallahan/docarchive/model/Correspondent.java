package com.williamcallahan.docarchive.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Sender or recipient a document is filed under.
 */
@Entity
@Table(name = "correspondents", uniqueConstraints = @UniqueConstraint(columnNames = {"name", "owner"}))
public class Correspondent extends MatchingEntity {

    protected Correspondent() {
    }

    public Correspondent(String name) {
        super(name);
    }
}
