package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Parameters handed to the transcription engine.
 * Validated once at submission, never modified afterwards.
 *
 * @author WhereQ Inc.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TranscriptionParams implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int MIN_BEAM_SIZE = 1;
    public static final int MAX_BEAM_SIZE = 10;

    /**
     * Language hint (e.g. "en", "de"). Null means auto-detect.
     */
    String language;

    /**
     * Transcribe in the spoken language or translate to English.
     */
    @NotNull
    @Builder.Default
    TaskKind task = TaskKind.TRANSCRIBE;

    /**
     * Beam size for decoding.
     */
    @Min(MIN_BEAM_SIZE)
    @Max(MAX_BEAM_SIZE)
    @Builder.Default
    int beamSize = 5;

    /**
     * Filter silence with voice activity detection.
     */
    @Builder.Default
    boolean vadFilter = true;

    /**
     * Include word-level timestamps in the result.
     */
    @Builder.Default
    boolean wordTimestamps = false;

    /**
     * Label segments and words with speakers.
     */
    @Builder.Default
    boolean enableDiarization = false;

    /**
     * Lower bound on detected speakers (diarization only).
     */
    @Min(1)
    Integer minSpeakers;

    /**
     * Upper bound on detected speakers (diarization only).
     */
    @Min(1)
    Integer maxSpeakers;

    /**
     * Name of the uploaded file, kept for logging.
     */
    String originalFilename;

    @JsonIgnore
    @AssertTrue(message = "minSpeakers must not exceed maxSpeakers")
    public boolean isSpeakerRangeValid() {
        return minSpeakers == null || maxSpeakers == null || minSpeakers <= maxSpeakers;
    }

    public static TranscriptionParams defaults() {
        return TranscriptionParams.builder().build();
    }
}
