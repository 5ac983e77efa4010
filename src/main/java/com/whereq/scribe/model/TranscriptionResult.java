package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the transcription engine, stored verbatim on the job.
 * Fields without a property of their own are kept in {@link #getExtra()} and written back out as is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionResult {
    /**
     * Full transcript, segments joined by a space
     */
    private String text;

    /**
     * Detected (or hinted) language code
     */
    private String language;

    /**
     * Confidence of the language detection
     */
    @JsonAlias("language_probability")
    private double languageProbability;

    /**
     * Audio duration in seconds
     */
    private double duration;

    /**
     * Model that produced the transcript
     */
    private String model;

    /**
     * Timed segments in playback order
     */
    @Builder.Default
    private List<TranscriptSegment> segments = new ArrayList<>();

    /**
     * Distinct speaker labels (diarization only)
     */
    private List<String> speakers;

    /**
     * Wall-clock seconds spent in the engine
     */
    @JsonAlias("processing_time")
    private double processingTime;

    /**
     * Whether the engine produced word-level timings
     */
    @JsonAlias("word_timestamps")
    private Boolean wordTimestamps;

    /**
     * Diarization summary (speaker count, per-speaker talk time), as the engine reports it
     */
    private Map<String, Object> diarization;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extra.put(name, value);
    }
}
