package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(name = "tags", uniqueConstraints = @UniqueConstraint(columnNames = {"name", "owner"}))
public class Tag extends MatchingEntity {
    public static final String DEFAULT_COLOR = "#a6cee3";

    @Column(name = "color", length = 7, nullable = false)
    private String color = DEFAULT_COLOR;

    /**
     * Inbox tags are attached to every newly consumed document.
     */
    @Column(name = "is_inbox_tag", nullable = false)
    private boolean inboxTag = false;

    protected Tag() {
    }

    public Tag(String name) {
        super(name);
    }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public boolean isInboxTag() { return inboxTag; }
    public void setInboxTag(boolean inboxTag) { this.inboxTag = inboxTag; }
}
