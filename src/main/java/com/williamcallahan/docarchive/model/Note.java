package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Free-text note a user attached to a document.
 */
@Entity
@Table(name = "notes")
public class Note {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Lob
    @Column(name = "note")
    private String text = "";

    @Column(name = "created", nullable = false)
    private Instant created;

    @ManyToOne
    @JoinColumn(name = "document_id")
    private Document document;

    @Column(name = "username", length = 150)
    private String username;

    protected Note() {
    }

    public Note(Document document, String username, String text) {
        this.document = document;
        this.username = username;
        this.text = text;
    }

    @PrePersist
    void onCreate() {
        if (created == null) {
            created = Instant.now();
        }
    }

    public Long getId() { return id; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Instant getCreated() { return created; }
    public void setCreated(Instant created) { this.created = created; }

    public Document getDocument() { return document; }

    public String getUsername() { return username; }

    @Override
    public String toString() {
        return text;
    }
}
