package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.event.Level;

/**
 * Persisted log line, grouped by the id of the operation that produced it.
 */
@Entity
@Table(name = "log_entries")
public class LogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_group")
    private UUID group;

    @Lob
    @Column(name = "message", nullable = false)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", length = 8, nullable = false)
    private Level level = Level.INFO;

    @Column(name = "created", nullable = false, updatable = false)
    private Instant created;

    protected LogEntry() {
    }

    public LogEntry(UUID group, Level level, String message) {
        this.group = group;
        this.level = level;
        this.message = message;
    }

    @PrePersist
    void onCreate() {
        created = Instant.now();
    }

    public Long getId() { return id; }

    public UUID getGroup() { return group; }

    public String getMessage() { return message; }

    public Level getLevel() { return level; }

    public Instant getCreated() { return created; }

    @Override
    public String toString() {
        return message;
    }
}
