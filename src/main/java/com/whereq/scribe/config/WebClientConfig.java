package com.whereq.scribe.config;

import com.whereq.scribe.engine.EngineProperties;
import com.whereq.scribe.engine.HttpTranscriptionEngine;
import com.whereq.scribe.engine.TranscriptionEngine;
import com.whereq.scribe.storage.AudioStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the transcription engine client
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB
    }

    @Bean
    @ConditionalOnMissingBean(TranscriptionEngine.class)
    public TranscriptionEngine transcriptionEngine(WebClient.Builder webClientBuilder,
                                                   EngineProperties engineProperties,
                                                   AudioStorage audioStorage) {
        return new HttpTranscriptionEngine(webClientBuilder, engineProperties, audioStorage);
    }
}
