package com.tooldigest.research.service;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;

/**
 * Progress events of the current research run.
 *
 * Each run gets a replaying sink, so a late subscriber first receives the run's earlier
 * events and then live ones. The sink completes after a terminal event; anything
 * published afterwards is dropped.
 */
@Service
@Slf4j
public class ProgressEventBus {

    static final String NO_RUN_MESSAGE = "No research has been run yet";

    private final int replayLimit;
    private final Clock clock;

    private String currentRunId;
    private Sinks.Many<ProgressEvent> currentSink;
    private boolean terminated;

    public ProgressEventBus(ResearchProperties properties, Clock clock) {
        this.replayLimit = Math.max(1, properties.getPipeline().getEventReplayLimit());
        this.clock = clock;
    }

    /**
     * Starts a fresh event stream for a run. A previous, unfinished stream is completed.
     */
    public synchronized void open(String runId) {
        if (currentSink != null && !terminated) {
            log.warn("Opening stream for run {} while run {} was not terminated", runId, currentRunId);
            currentSink.tryEmitComplete();
        }
        currentRunId = runId;
        currentSink = Sinks.many().replay().limit(replayLimit);
        terminated = false;
        log.debug("Opened progress stream for run {}", runId);
    }

    /**
     * @return false when the event was dropped (unknown run, or the run already terminated)
     */
    public synchronized boolean publish(String runId, ProgressEvent event) {
        if (currentSink == null || !runId.equals(currentRunId)) {
            log.debug("Dropping event for inactive run {}: {}", runId, event.message());
            return false;
        }
        if (terminated) {
            log.debug("Dropping event after terminal event for run {}: {}", runId, event.message());
            return false;
        }

        Sinks.EmitResult result = currentSink.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("Failed to emit progress event for run {}: {}", runId, result);
        }
        if (event.isTerminal()) {
            terminated = true;
            currentSink.tryEmitComplete();
        }
        return result.isSuccess();
    }

    /**
     * Replay plus live events of the current run, completing after its terminal event.
     */
    public synchronized Flux<ProgressEvent> stream() {
        if (currentSink == null) {
            return Flux.just(ProgressEvent.complete(NO_RUN_MESSAGE, Instant.now(clock)));
        }
        return currentSink.asFlux();
    }

    public synchronized String currentRunId() {
        return currentRunId;
    }
}
