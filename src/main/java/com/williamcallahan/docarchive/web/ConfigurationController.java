package com.williamcallahan.docarchive.web;

import com.williamcallahan.docarchive.domain.errors.ApiSuccessResponse;
import com.williamcallahan.docarchive.service.configuration.ConfigurationOptionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads and overrides runtime configuration keys.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigurationController {

    private final ConfigurationOptionService configurationOptionService;

    public ConfigurationController(ConfigurationOptionService configurationOptionService) {
        this.configurationOptionService = configurationOptionService;
    }

    /**
     * GET /api/config/{key} - Returns the effective value of a key
     */
    @GetMapping("/{key}")
    public ResponseEntity<ConfigurationValueResponse> getValue(@PathVariable String key) {
        return ResponseEntity.ok(new ConfigurationValueResponse(key, configurationOptionService.get(key)));
    }

    /**
     * PUT /api/config/{key} - Stores an override for a key
     */
    @PutMapping("/{key}")
    public ResponseEntity<ApiSuccessResponse> setValue(@PathVariable String key,
                                                       @Valid @RequestBody ConfigurationValueRequest request) {
        configurationOptionService.set(key, request.value());
        return ResponseEntity.ok(ApiSuccessResponse.success("Updated " + key));
    }
}
