package com.whereq.scribe.dto;

import lombok.Data;
import org.springframework.http.codec.multipart.FilePart;

/**
 * Multipart form of a transcription submission.
 * Unset fields fall back to the parameter defaults.
 */
@Data
public class TranscriptionForm {
    /**
     * The audio upload
     */
    private FilePart file;

    /**
     * Language code (e.g. "en"); omit to auto-detect
     */
    private String language;

    /**
     * "transcribe" or "translate"
     */
    private String task;

    private Integer beamSize;
    private Boolean vadFilter;
    private Boolean wordTimestamps;
    private Boolean enableDiarization;
    private Integer minSpeakers;
    private Integer maxSpeakers;
}
