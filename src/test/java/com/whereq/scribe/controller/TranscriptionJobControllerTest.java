package com.whereq.scribe.controller;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.exception.QuotaExceededException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import com.whereq.scribe.model.TaskKind;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import com.whereq.scribe.notify.StatusNotifier;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.service.JobSubmissionService;
import com.whereq.scribe.store.JobStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {TranscriptionJobController.class, HealthController.class})
@Import(ScribeProperties.class)
class TranscriptionJobControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private JobSubmissionService jobSubmissionService;

    @MockBean
    private JobStore jobStore;

    @MockBean
    private JobQueue jobQueue;

    @MockBean
    private StatusNotifier statusNotifier;

    @Test
    void submitReturnsAcceptedWithLocation() {
        when(jobSubmissionService.submit(any(), eq("a.wav"), any())).thenReturn(Mono.just("job-1"));

        webTestClient.post().uri("/api/v1/transcriptions")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(form("translate", "3")))
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/transcriptions/job-1")
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-1")
            .jsonPath("$.status").isEqualTo("QUEUED");

        ArgumentCaptor<TranscriptionParams> params = ArgumentCaptor.forClass(TranscriptionParams.class);
        verify(jobSubmissionService).submit(any(), eq("a.wav"), params.capture());
        assertThat(params.getValue().getTask()).isEqualTo(TaskKind.TRANSLATE);
        assertThat(params.getValue().getBeamSize()).isEqualTo(3);
        assertThat(params.getValue().getLanguage()).isEqualTo("en");
    }

    @Test
    void unknownTaskIsBadRequest() {
        webTestClient.post().uri("/api/v1/transcriptions")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(form("summarize", "5")))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Task must be 'transcribe' or 'translate'");

        verifyNoInteractions(jobSubmissionService);
    }

    @Test
    void missingFileIsBadRequest() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("task", "transcribe");

        webTestClient.post().uri("/api/v1/transcriptions")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(builder.build()))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void fullQueueIsTooManyRequests() {
        when(jobSubmissionService.submit(any(), any(), any()))
            .thenReturn(Mono.error(new QuotaExceededException("Queue is full, cannot accept more jobs")));

        webTestClient.post().uri("/api/v1/transcriptions")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(form("transcribe", "5")))
            .exchange()
            .expectStatus().isEqualTo(429);
    }

    @Test
    void getReturnsJob() {
        when(jobStore.get("job-1")).thenReturn(Mono.just(completedJob()));

        webTestClient.get().uri("/api/v1/transcriptions/job-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("COMPLETED")
            .jsonPath("$.progress").isEqualTo(100)
            .jsonPath("$.result.text").isEqualTo("hello");
    }

    @Test
    void getUnknownJobIsNotFound() {
        when(jobStore.get("missing")).thenReturn(Mono.empty());

        webTestClient.get().uri("/api/v1/transcriptions/missing")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void listPassesFilterAndLimit() {
        when(jobStore.list(JobStatus.COMPLETED, 5)).thenReturn(Flux.just(completedJob()));

        webTestClient.get().uri("/api/v1/transcriptions?status=completed&limit=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].jobId").isEqualTo("job-1");
    }

    @Test
    void listRejectsBadArguments() {
        webTestClient.get().uri("/api/v1/transcriptions?status=DONE")
            .exchange()
            .expectStatus().isBadRequest();
        webTestClient.get().uri("/api/v1/transcriptions?limit=0")
            .exchange()
            .expectStatus().isBadRequest();

        verify(jobStore, never()).list(any(), anyInt());
    }

    @Test
    void queueStats() {
        when(jobQueue.size()).thenReturn(Mono.just(3L));

        webTestClient.get().uri("/api/v1/transcriptions/queue")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.pending").isEqualTo(3)
            .jsonPath("$.maxSize").isEqualTo(1000);
    }

    @Test
    void eventsStreamEndsAtTerminalStatus() {
        TranscriptionJob running = TranscriptionJob.builder()
            .id("job-1")
            .status(JobStatus.PROCESSING)
            .progress(10)
            .createdAt(Instant.now())
            .build();
        when(jobStore.get("job-1")).thenReturn(Mono.just(running));
        when(statusNotifier.subscribeWhenReady("job-1"))
            .thenReturn(Mono.just(Flux.just(JobStatusEvent.of("job-1", JobStatus.COMPLETED, 100))));

        List<JobStatusEvent> events = webTestClient.get().uri("/api/v1/transcriptions/job-1/events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobStatusEvent.class)
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(5));

        assertThat(events).isNotEmpty();
        assertThat(events.get(events.size() - 1).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void eventsStreamSkipsEventsOlderThanSnapshot() {
        TranscriptionJob running = TranscriptionJob.builder()
            .id("job-1")
            .status(JobStatus.PROCESSING)
            .progress(30)
            .createdAt(Instant.now())
            .build();
        when(jobStore.get("job-1")).thenReturn(Mono.just(running));
        Flux<JobStatusEvent> live = Flux.just(
                JobStatusEvent.of("job-1", JobStatus.QUEUED, 0),
                JobStatusEvent.of("job-1", JobStatus.PROCESSING, 10),
                JobStatusEvent.of("job-1", JobStatus.COMPLETED, 100))
            .delaySubscription(Duration.ofMillis(200));
        when(statusNotifier.subscribeWhenReady("job-1")).thenReturn(Mono.just(live));

        List<JobStatusEvent> events = webTestClient.get().uri("/api/v1/transcriptions/job-1/events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobStatusEvent.class)
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(5));

        assertThat(events).extracting(JobStatusEvent::getStatus)
            .containsExactly(JobStatus.PROCESSING, JobStatus.COMPLETED);
        assertThat(events.get(0).getProgress()).isEqualTo(30);
    }

    @Test
    void snapshotIsReadAfterChannelIsListening() {
        TranscriptionJob running = TranscriptionJob.builder()
            .id("job-1")
            .status(JobStatus.PROCESSING)
            .progress(10)
            .createdAt(Instant.now())
            .build();
        AtomicBoolean listening = new AtomicBoolean();
        List<Boolean> listeningAtRead = new CopyOnWriteArrayList<>();
        when(jobStore.get("job-1")).thenAnswer(invocation -> Mono.fromSupplier(() -> {
            listeningAtRead.add(listening.get());
            return running;
        }));
        when(statusNotifier.subscribeWhenReady("job-1")).thenReturn(
            Mono.delay(Duration.ofMillis(100))
                .doOnNext(tick -> listening.set(true))
                .thenReturn(Flux.just(JobStatusEvent.of("job-1", JobStatus.FAILED, 10))
                    .delaySubscription(Duration.ofMillis(100))));

        List<JobStatusEvent> events = webTestClient.get().uri("/api/v1/transcriptions/job-1/events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobStatusEvent.class)
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(5));

        assertThat(events).extracting(JobStatusEvent::getStatus)
            .containsExactly(JobStatus.PROCESSING, JobStatus.FAILED);
        // the first read only decides between 200 and 404
        assertThat(listeningAtRead).containsExactly(false, true);
    }

    @Test
    void eventsForFinishedJobCarryFinalState() {
        when(jobStore.get("job-1")).thenReturn(Mono.just(completedJob()));

        List<JobStatusEvent> events = webTestClient.get().uri("/api/v1/transcriptions/job-1/events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(JobStatusEvent.class)
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(5));

        assertThat(events).extracting(JobStatusEvent::getStatus).containsExactly(JobStatus.COMPLETED);
        verifyNoInteractions(statusNotifier);
    }

    @Test
    void eventsForUnknownJobIsNotFound() {
        when(jobStore.get("missing")).thenReturn(Mono.empty());

        webTestClient.get().uri("/api/v1/transcriptions/missing/events")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void healthReportsBackend() {
        when(jobStore.ping()).thenReturn(Mono.just(true));
        when(jobQueue.size()).thenReturn(Mono.just(0L));

        webTestClient.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.backend.type").isEqualTo("REDIS");
    }

    @Test
    void healthIsUnavailableWhenStoreIsDown() {
        when(jobStore.ping()).thenReturn(Mono.just(false));
        when(jobQueue.size()).thenReturn(Mono.just(0L));

        webTestClient.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.status").isEqualTo("DOWN");
    }

    private static MultiValueMap<String, HttpEntity<?>> form(
            String task, String beamSize) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource(new byte[]{1, 2, 3}) {
            @Override
            public String getFilename() {
                return "a.wav";
            }
        });
        builder.part("language", "en");
        builder.part("task", task);
        builder.part("beamSize", beamSize);
        return builder.build();
    }

    private static TranscriptionJob completedJob() {
        Instant now = Instant.now();
        return TranscriptionJob.builder()
            .id("job-1")
            .status(JobStatus.COMPLETED)
            .audioRef("a.wav")
            .params(TranscriptionParams.defaults())
            .progress(100)
            .createdAt(now)
            .startedAt(now)
            .completedAt(now)
            .result(TranscriptionResult.builder().text("hello").build())
            .build();
    }
}
