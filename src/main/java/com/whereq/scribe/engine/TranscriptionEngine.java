package com.whereq.scribe.engine;

import com.whereq.scribe.exception.TranscriptionException;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The transcription capability the workers drive.
 *
 * Calls are synchronous and carry no timeout of their own; the worker waits as long as
 * the engine takes.
 */
public interface TranscriptionEngine {

    /**
     * Transcribe stored audio.
     *
     * @param audioRef handle of the stored audio
     * @param params engine parameters
     * @return the transcription result
     * @throws com.whereq.scribe.exception.TranscriptionException if the engine fails
     */
    TranscriptionResult transcribe(String audioRef, TranscriptionParams params);

    /**
     * Language codes the engine accepts. Engines that cannot list them fail with
     * {@link TranscriptionException}.
     */
    default Mono<List<String>> supportedLanguages() {
        return Mono.error(new TranscriptionException("Engine does not list its languages"));
    }
}
