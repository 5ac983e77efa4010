package com.whereq.scribe.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the faster-whisper HTTP server.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "scribe.engine")
public class EngineProperties {

    /**
     * Base URL of the engine, e.g. http://localhost:8000
     */
    @NotBlank
    private String baseUrl = "http://localhost:8000";

    /**
     * Path of the synchronous transcription endpoint
     */
    @NotBlank
    private String transcribePath = "/transcribe";

    /**
     * Path listing the supported language codes
     */
    @NotBlank
    private String languagesPath = "/languages";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Largest response body kept in memory, in bytes
     */
    private int maxInMemorySize = 16 * 1024 * 1024;
}
