package com.whereq.scribe.storage;

import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Location shared by the submission path and the workers where uploaded audio waits
 * for transcription. An audio ref is an opaque handle issued by {@link #store}.
 */
public interface AudioStorage {

    /**
     * Persist uploaded audio.
     *
     * @param content the uploaded bytes
     * @param originalFilename client-side name, used only for its extension
     * @return Mono with the audio ref
     */
    Mono<String> store(Flux<DataBuffer> content, String originalFilename);

    /**
     * @param audioRef handle issued by {@link #store}
     * @return true if the audio is still there
     */
    boolean exists(String audioRef);

    /**
     * Remove the audio. Removing missing audio is not an error.
     *
     * @param audioRef handle issued by {@link #store}
     * @return true if something was deleted
     * @throws IOException if the audio exists but cannot be removed
     */
    boolean delete(String audioRef) throws IOException;

    /**
     * @param audioRef handle issued by {@link #store}
     * @return local path of the audio
     */
    Path resolve(String audioRef);
}
