package com.williamcallahan.docarchive.web;

/**
 * Body of {@code GET /api/config/{key}}.
 *
 * @param key registry key name
 * @param value effective value, {@code null} when the key has no value
 */
public record ConfigurationValueResponse(String key, Object value) {
}
