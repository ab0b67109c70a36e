package com.tooldigest.research.controller;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.ProgressEvent;
import com.tooldigest.research.dto.ResearchRunView;
import com.tooldigest.research.dto.ResearchStartRequest;
import com.tooldigest.research.dto.ResearchStartResponse;
import com.tooldigest.research.service.ResearchPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;

/**
 * Controller for the autonomous research pipeline.
 * Provides endpoints for:
 * - Starting a research run
 * - Reading the current run's status
 * - Real-time SSE streaming of run progress
 */
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchPipelineService researchPipelineService;
    private final ResearchProperties properties;

    /**
     * Start a research run.
     *
     * @return 202 Accepted with the run id, 409 when a run is already active
     */
    @PostMapping("/start")
    public ResponseEntity<ResearchStartResponse> start(
            @Valid @RequestBody(required = false) ResearchStartRequest request
    ) {
        List<String> focusAreas = request != null ? request.focusAreas() : List.of();
        Integer maxTools = request != null ? request.maxTools() : null;
        log.info("Research start requested: focusAreas={}, maxTools={}", focusAreas, maxTools);

        ResearchRunView run = researchPipelineService.start(focusAreas, maxTools);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResearchStartResponse.started(run.runId()));
    }

    @GetMapping("/status")
    public ResearchRunView status() {
        return researchPipelineService.status();
    }

    /**
     * SSE stream of the current run.
     *
     * Events are named by type (progress, complete, error). Earlier events of the run are
     * replayed first. A heartbeat comment is sent periodically until the terminal event,
     * after which the stream closes.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> stream() {
        Duration heartbeatInterval = Duration.ofSeconds(properties.getPipeline().getHeartbeatSeconds());

        return researchPipelineService.subscribe()
                .publish(shared -> {
                    Flux<ServerSentEvent<ProgressEvent>> events = shared
                            .map(event -> ServerSentEvent.<ProgressEvent>builder()
                                    .event(event.type().getValue())
                                    .data(event)
                                    .build());

                    Flux<ServerSentEvent<ProgressEvent>> heartbeat = Flux.interval(heartbeatInterval)
                            .map(tick -> ServerSentEvent.<ProgressEvent>builder()
                                    .comment("heartbeat")
                                    .build())
                            .takeUntilOther(shared.then());

                    return Flux.merge(events, heartbeat);
                })
                .doOnSubscribe(sub -> log.debug("New research SSE subscriber"))
                .doOnCancel(() -> log.debug("Research SSE subscriber disconnected"));
    }
}
