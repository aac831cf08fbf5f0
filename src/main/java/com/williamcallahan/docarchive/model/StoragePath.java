package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Named filename format that overrides the global format for the documents assigned to it.
 */
@Entity
@Table(name = "storage_paths", uniqueConstraints = @UniqueConstraint(columnNames = {"name", "owner"}))
public class StoragePath extends MatchingEntity {

    @Column(name = "path", length = 512, nullable = false)
    private String path;

    protected StoragePath() {
    }

    public StoragePath(String name, String path) {
        super(name);
        this.path = path;
    }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
}
