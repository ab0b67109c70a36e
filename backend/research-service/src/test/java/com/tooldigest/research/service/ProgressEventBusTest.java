package com.tooldigest.research.service;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.ProgressEvent;
import com.tooldigest.research.entity.ProgressEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressEventBusTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private ProgressEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new ProgressEventBus(new ResearchProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Without any run the stream is a single complete event")
    void noRun() {
        StepVerifier.create(bus.stream())
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(ProgressEventType.COMPLETE);
                    assertThat(event.message()).isEqualTo(ProgressEventBus.NO_RUN_MESSAGE);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Late subscribers get earlier events replayed, then the stream completes on the terminal event")
    void replaysAndCompletes() {
        bus.open("run-1");
        bus.publish("run-1", ProgressEvent.progress("Phase 1/4", NOW));
        bus.publish("run-1", ProgressEvent.progress("Phase 2/4", NOW));

        StepVerifier.create(bus.stream())
                .expectNextMatches(e -> e.message().equals("Phase 1/4"))
                .expectNextMatches(e -> e.message().equals("Phase 2/4"))
                .then(() -> bus.publish("run-1", ProgressEvent.complete("done", NOW)))
                .expectNextMatches(ProgressEvent::isTerminal)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Events after the terminal event, or for another run, are dropped")
    void dropsAfterTerminal() {
        bus.open("run-1");

        assertThat(bus.publish("run-1", ProgressEvent.error("boom", NOW))).isTrue();
        assertThat(bus.publish("run-1", ProgressEvent.progress("late", NOW))).isFalse();
        assertThat(bus.publish("run-2", ProgressEvent.progress("stray", NOW))).isFalse();

        StepVerifier.create(bus.stream())
                .expectNextMatches(e -> e.type() == ProgressEventType.ERROR && e.message().equals("boom"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Opening a new run completes the previous unfinished stream")
    void openCompletesPrevious() {
        bus.open("run-1");
        bus.publish("run-1", ProgressEvent.progress("working", NOW));
        Flux<ProgressEvent> previous = bus.stream();

        bus.open("run-2");

        StepVerifier.create(previous)
                .expectNextCount(1)
                .verifyComplete();
        assertThat(bus.currentRunId()).isEqualTo("run-2");
        assertThat(bus.publish("run-1", ProgressEvent.progress("stale", NOW))).isFalse();
    }
}
