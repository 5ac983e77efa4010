package com.whereq.scribe.storage;

import com.whereq.scribe.exception.AudioStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Audio kept as files in one directory. Refs are file names relative to that directory;
 * workers in other processes need the same directory mounted.
 */
@Slf4j
public class LocalAudioStorage implements AudioStorage {

    private final Path directory;

    public LocalAudioStorage(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new AudioStorageException("Cannot create audio directory " + this.directory, e);
        }
        log.info("Audio storage directory: {}", this.directory);
    }

    @Override
    public Mono<String> store(Flux<DataBuffer> content, String originalFilename) {
        String audioRef = UUID.randomUUID() + extension(originalFilename);
        Path target = resolve(audioRef);

        return DataBufferUtils.write(content, target)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(IOException.class, e -> new AudioStorageException("Failed to store audio " + audioRef, e))
            .doOnSuccess(v -> log.debug("Stored audio {} ({})", audioRef, originalFilename))
            .thenReturn(audioRef);
    }

    @Override
    public boolean exists(String audioRef) {
        return Files.isRegularFile(resolve(audioRef));
    }

    @Override
    public boolean delete(String audioRef) throws IOException {
        boolean deleted = Files.deleteIfExists(resolve(audioRef));
        if (deleted) {
            log.debug("Deleted audio file: {}", audioRef);
        }
        return deleted;
    }

    @Override
    public Path resolve(String audioRef) {
        Path path = directory.resolve(audioRef).normalize();
        if (!path.startsWith(directory)) {
            throw new IllegalArgumentException("Audio ref escapes the storage directory: " + audioRef);
        }
        return path;
    }

    public Path getDirectory() {
        return directory;
    }

    static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        String ext = name.substring(dot);
        return ext.matches("\\.[A-Za-z0-9]{1,10}") ? ext.toLowerCase(Locale.ROOT) : "";
    }
}
