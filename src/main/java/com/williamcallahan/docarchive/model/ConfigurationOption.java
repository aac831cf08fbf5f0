package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

/**
 * Stored per-deployment override for a configuration key. The value is kept string-encoded and
 * coerced to the key's declared type on read.
 */
@Entity
@Table(name = "configuration_options")
public class ConfigurationOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "option_key", length = 128, nullable = false, unique = true)
    private String key;

    @Lob
    @Column(name = "option_value")
    private String value;

    protected ConfigurationOption() {
    }

    public ConfigurationOption(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public Long getId() { return id; }

    public String getKey() { return key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    @Override
    public String toString() {
        return key;
    }
}
