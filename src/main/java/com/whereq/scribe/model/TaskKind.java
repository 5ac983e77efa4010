package com.whereq.scribe.model;

/**
 * What the engine should produce from the audio
 */
public enum TaskKind {
    /**
     * Text in the spoken language
     */
    TRANSCRIBE,

    /**
     * Text translated to English
     */
    TRANSLATE;

    /**
     * Parse the lower-case wire name ("transcribe", "translate"), ignoring case
     *
     * @throws IllegalArgumentException for any other value
     */
    public static TaskKind parse(String value) {
        for (TaskKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value == null ? null : value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Task must be 'transcribe' or 'translate'");
    }
}
