package com.tooldigest.research.service;

import com.tooldigest.research.dto.ProgressEvent;
import com.tooldigest.research.dto.ResearchRunView;
import com.tooldigest.research.entity.RunPhase;
import com.tooldigest.research.entity.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one research run. Written by the pipeline thread, read through
 * {@link #toView()} from request threads.
 */
final class ResearchRun {

    private final String runId;
    private final List<String> focusAreas;
    private final int maxTools;
    private final Instant startedAt;
    private final List<ProgressEvent> events = new ArrayList<>();

    private RunStatus status = RunStatus.RUNNING;
    private RunPhase phase = RunPhase.PLANNING;
    private int discoveredCount;
    private int addedCount;
    private Instant completedAt;
    private String error;

    ResearchRun(String runId, List<String> focusAreas, int maxTools, Instant startedAt) {
        this.runId = runId;
        this.focusAreas = List.copyOf(focusAreas);
        this.maxTools = maxTools;
        this.startedAt = startedAt;
    }

    String getRunId() {
        return runId;
    }

    List<String> getFocusAreas() {
        return focusAreas;
    }

    int getMaxTools() {
        return maxTools;
    }

    synchronized RunStatus getStatus() {
        return status;
    }

    synchronized boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    synchronized void setPhase(RunPhase phase) {
        this.phase = phase;
    }

    synchronized void setDiscoveredCount(int discoveredCount) {
        this.discoveredCount = discoveredCount;
    }

    synchronized int getDiscoveredCount() {
        return discoveredCount;
    }

    synchronized void setAddedCount(int addedCount) {
        this.addedCount = addedCount;
    }

    synchronized int getAddedCount() {
        return addedCount;
    }

    synchronized String getError() {
        return error;
    }

    synchronized void addEvent(ProgressEvent event) {
        events.add(event);
    }

    synchronized void complete(Instant at) {
        status = RunStatus.COMPLETED;
        phase = RunPhase.DONE;
        completedAt = at;
    }

    synchronized void fail(String message, Instant at) {
        status = RunStatus.ERROR;
        phase = RunPhase.DONE;
        error = message;
        completedAt = at;
    }

    synchronized ResearchRunView toView() {
        return new ResearchRunView(runId, status, phase, focusAreas, maxTools, discoveredCount, addedCount,
                startedAt, completedAt, error, events);
    }
}
