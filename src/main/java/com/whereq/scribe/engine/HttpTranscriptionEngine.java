package com.whereq.scribe.engine;

import com.whereq.scribe.dto.LanguagesResponse;
import com.whereq.scribe.exception.TranscriptionException;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import com.whereq.scribe.storage.AudioStorage;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Engine client for a faster-whisper HTTP server.
 *
 * Posts the audio as multipart/form-data with one form field per parameter and
 * blocks until the server answers.
 */
@Slf4j
public class HttpTranscriptionEngine implements TranscriptionEngine {

    private final WebClient webClient;
    private final EngineProperties properties;
    private final AudioStorage audioStorage;

    public HttpTranscriptionEngine(WebClient.Builder webClientBuilder,
                                   EngineProperties properties,
                                   AudioStorage audioStorage) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis());

        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySize()))
            .build();
        this.properties = properties;
        this.audioStorage = audioStorage;

        log.info("Initialized transcription engine client: baseUrl={}", properties.getBaseUrl());
    }

    @Override
    public TranscriptionResult transcribe(String audioRef, TranscriptionParams params) {
        Path audio = audioStorage.resolve(audioRef);
        log.info("Transcribing {} (task={}, language={}, beamSize={})",
            audio.getFileName(), params.getTask(), params.getLanguage(), params.getBeamSize());

        try {
            TranscriptionResult result = webClient.post()
                .uri(properties.getTranscribePath())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(audio, params).build()))
                .retrieve()
                .bodyToMono(TranscriptionResult.class)
                .block();

            if (result == null) {
                throw new TranscriptionException("Engine returned an empty response");
            }
            log.info("Transcription complete. Language: {}, Duration: {}s", result.getLanguage(), result.getDuration());
            return result;
        } catch (WebClientResponseException e) {
            throw new TranscriptionException(String.format("Engine returned status %d: %s",
                e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (WebClientRequestException e) {
            throw new TranscriptionException("Engine unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public Mono<List<String>> supportedLanguages() {
        return webClient.get()
            .uri(properties.getLanguagesPath())
            .retrieve()
            .bodyToMono(LanguagesResponse.class)
            .map(response -> response.getLanguages() != null ? response.getLanguages() : List.<String>of())
            .onErrorMap(WebClientResponseException.class, e -> new TranscriptionException(
                String.format("Engine returned status %d", e.getStatusCode().value()), e))
            .onErrorMap(WebClientRequestException.class,
                e -> new TranscriptionException("Engine unreachable: " + e.getMessage(), e));
    }

    static MultipartBodyBuilder form(Path audio, TranscriptionParams params) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new FileSystemResource(audio));
        if (params.getLanguage() != null) {
            builder.part("language", params.getLanguage());
        }
        builder.part("task", params.getTask().name().toLowerCase(Locale.ROOT));
        builder.part("beam_size", String.valueOf(params.getBeamSize()));
        builder.part("vad_filter", String.valueOf(params.isVadFilter()));
        builder.part("word_timestamps", String.valueOf(params.isWordTimestamps()));
        builder.part("enable_diarization", String.valueOf(params.isEnableDiarization()));
        if (params.getMinSpeakers() != null) {
            builder.part("min_speakers", String.valueOf(params.getMinSpeakers()));
        }
        if (params.getMaxSpeakers() != null) {
            builder.part("max_speakers", String.valueOf(params.getMaxSpeakers()));
        }
        return builder;
    }
}
