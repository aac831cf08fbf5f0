package com.williamcallahan.docarchive.web;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code PUT /api/config/{key}}. JSON strings, integers, booleans and decimals arrive as
 * {@code String}, {@code Integer}, {@code Boolean} and {@code Double}.
 *
 * @param value new value for the key
 */
public record ConfigurationValueRequest(@NotNull(message = "value is required") Object value) {
}
