package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A timed piece of the transcript
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptSegment {
    private double start;
    private double end;
    private String text;

    /**
     * Speaker label, present when diarization ran
     */
    private String speaker;

    /**
     * Word timings, present when word timestamps were requested
     */
    private List<TranscriptWord> words;
}
