package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

/**
 * Shared columns for entities that documents can be matched against by name or content.
 */
@MappedSuperclass
public abstract class MatchingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 128, nullable = false)
    private String name;

    @Column(name = "match_text", length = 256)
    private String match = "";

    @Enumerated(EnumType.ORDINAL)
    @Column(name = "matching_algorithm", nullable = false)
    private MatchingAlgorithm matchingAlgorithm = MatchingAlgorithm.ANY;

    @Column(name = "is_insensitive", nullable = false)
    private boolean insensitive = true;

    @Column(name = "owner", length = 150)
    private String owner;

    protected MatchingEntity() {
    }

    protected MatchingEntity(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getMatch() { return match; }
    public void setMatch(String match) { this.match = match; }

    public MatchingAlgorithm getMatchingAlgorithm() { return matchingAlgorithm; }
    public void setMatchingAlgorithm(MatchingAlgorithm matchingAlgorithm) { this.matchingAlgorithm = matchingAlgorithm; }

    public boolean isInsensitive() { return insensitive; }
    public void setInsensitive(boolean insensitive) { this.insensitive = insensitive; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    @Override
    public String toString() {
        return name;
    }
}
