package com.whereq.scribe.controller;

import com.whereq.scribe.dto.LanguagesResponse;
import com.whereq.scribe.engine.TranscriptionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Lists the languages the transcription engine accepts.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/languages")
@Tag(name = "Languages", description = "Languages supported by the transcription engine")
public class LanguageController {

    @Autowired
    private TranscriptionEngine transcriptionEngine;

    @GetMapping
    @Operation(summary = "Supported languages", description = "Language codes accepted by the language form field")
    public Mono<ResponseEntity<LanguagesResponse>> languages() {
        return transcriptionEngine.supportedLanguages()
                .map(languages -> ResponseEntity.ok(LanguagesResponse.of(languages)))
                .onErrorResume(e -> {
                    log.warn("Could not list engine languages: {}", e.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
                });
    }
}
