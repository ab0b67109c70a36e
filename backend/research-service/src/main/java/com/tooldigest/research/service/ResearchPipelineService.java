package com.tooldigest.research.service;

import com.tooldigest.research.client.GitHubClient;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.GitHubRepoStats;
import com.tooldigest.research.dto.ProgressEvent;
import com.tooldigest.research.dto.ResearchRunView;
import com.tooldigest.research.dto.ResearchedTool;
import com.tooldigest.research.dto.SearchRequest;
import com.tooldigest.research.dto.SearchResponse;
import com.tooldigest.research.dto.SentimentRecord;
import com.tooldigest.research.dto.ValidatedTool;
import com.tooldigest.research.entity.ResearchLogEntry;
import com.tooldigest.research.entity.RunPhase;
import com.tooldigest.research.entity.SearchDepth;
import com.tooldigest.research.exception.ResearchAlreadyRunningException;
import com.tooldigest.research.repository.MergeResult;
import com.tooldigest.research.service.pipeline.CandidateDeduplicator;
import com.tooldigest.research.service.pipeline.CandidateExtractor;
import com.tooldigest.research.service.pipeline.ExtractionOutcome;
import com.tooldigest.research.service.pipeline.QualityFilter;
import com.tooldigest.research.service.pipeline.ResearchPlan;
import com.tooldigest.research.service.pipeline.ResearchPlanner;
import com.tooldigest.research.service.pipeline.ValidationOutcome;
import com.tooldigest.research.service.search.SearchProviderChain;
import com.tooldigest.research.service.sentiment.SentimentAnalyzer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a research run: Planning, Discovery, Validation, Sentiment, then Merge.
 *
 * At most one run is active per process. The run executes on the single-thread
 * research executor and blocks on each external call there; callers observe it
 * through {@link #status()} snapshots and the {@link #subscribe()} event stream.
 * Recoverable failures become warning events; anything else ends the run in error.
 */
@Service
@Slf4j
public class ResearchPipelineService {

    static final String WARNING_PREFIX = "Warning: ";

    private final ResearchPlanner planner;
    private final SearchProviderChain searchProviderChain;
    private final CandidateExtractor extractor;
    private final CandidateDeduplicator deduplicator;
    private final QualityFilter qualityFilter;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final GitHubClient gitHubClient;
    private final CatalogMerger catalogMerger;
    private final ResearchLogService researchLogService;
    private final ProgressEventBus eventBus;
    private final ResearchProperties properties;
    private final Executor executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Object lock = new Object();
    private ResearchRun currentRun;

    private Counter runsStartedCounter;
    private Counter runsCompletedCounter;
    private Counter runsFailedCounter;

    public ResearchPipelineService(
            ResearchPlanner planner,
            SearchProviderChain searchProviderChain,
            CandidateExtractor extractor,
            CandidateDeduplicator deduplicator,
            QualityFilter qualityFilter,
            SentimentAnalyzer sentimentAnalyzer,
            GitHubClient gitHubClient,
            CatalogMerger catalogMerger,
            ResearchLogService researchLogService,
            ProgressEventBus eventBus,
            ResearchProperties properties,
            @Qualifier("researchExecutor") Executor executor,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.planner = planner;
        this.searchProviderChain = searchProviderChain;
        this.extractor = extractor;
        this.deduplicator = deduplicator;
        this.qualityFilter = qualityFilter;
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.gitHubClient = gitHubClient;
        this.catalogMerger = catalogMerger;
        this.researchLogService = researchLogService;
        this.eventBus = eventBus;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runsStartedCounter = Counter.builder("research.runs.started")
                .description("Number of research runs started")
                .register(meterRegistry);

        runsCompletedCounter = Counter.builder("research.runs.completed")
                .description("Number of research runs that completed")
                .register(meterRegistry);

        runsFailedCounter = Counter.builder("research.runs.failed")
                .description("Number of research runs that ended in error")
                .register(meterRegistry);
    }

    /**
     * Starts a run in the background.
     *
     * @param maxTools null for the configured default
     * @throws ResearchAlreadyRunningException when a run is active
     */
    public ResearchRunView start(List<String> focusAreas, Integer maxTools) {
        int limit = maxTools != null ? maxTools : properties.getPipeline().getDefaultMaxTools();
        if (limit < 1) {
            throw new IllegalArgumentException("maxTools must be at least 1");
        }

        synchronized (lock) {
            if (currentRun != null && currentRun.isRunning()) {
                throw new ResearchAlreadyRunningException(currentRun.getRunId());
            }

            ResearchRun run = new ResearchRun(UUID.randomUUID().toString(),
                    focusAreas == null ? List.of() : focusAreas, limit, Instant.now(clock));
            currentRun = run;
            eventBus.open(run.getRunId());
            runsStartedCounter.increment();
            log.info("Starting research run {} (focusAreas={}, maxTools={})",
                    run.getRunId(), run.getFocusAreas(), limit);

            try {
                executor.execute(() -> execute(run));
            } catch (RejectedExecutionException e) {
                log.error("Research executor rejected run {}: {}", run.getRunId(), e.getMessage());
                fail(run, "Research executor rejected the run: " + e.getMessage());
            }
            return run.toView();
        }
    }

    public ResearchRunView status() {
        synchronized (lock) {
            return currentRun == null ? ResearchRunView.idle() : currentRun.toView();
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return currentRun != null && currentRun.isRunning();
        }
    }

    /**
     * Events of the current run from its start, then live, completing after the terminal event.
     */
    public Flux<ProgressEvent> subscribe() {
        return eventBus.stream();
    }

    void execute(ResearchRun run) {
        try {
            emit(run, "Starting autonomous research session");
            ResearchPlan plan = planning(run);
            List<CandidateTool> discovered = discovery(run, plan);
            List<ValidatedTool> validated = validation(run, discovered);
            List<ResearchedTool> researched = sentiment(run, validated);
            MergeResult merge = merge(run, researched);
            complete(run, merge);
        } catch (Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Research run {} failed: {}", run.getRunId(), message, e);
            fail(run, message);
            if (e instanceof Error error) {
                throw error;
            }
        }
    }

    // ========== Phases ==========

    private ResearchPlan planning(ResearchRun run) {
        run.setPhase(RunPhase.PLANNING);
        emit(run, "Phase 1/4: Planning research strategy...");
        long start = System.nanoTime();

        ResearchPlan plan = await(planner.plan(run.getFocusAreas(), run.getMaxTools()));
        if (plan.isFallback()) {
            warn(run, "planning failed (" + plan.fallbackReason() + "), using default query set");
        }
        emit(run, "Created research plan with " + plan.queries().size() + " queries"
                + elapsed(RunPhase.PLANNING, start));
        return plan;
    }

    private List<CandidateTool> discovery(ResearchRun run, ResearchPlan plan) {
        run.setPhase(RunPhase.DISCOVERY);
        List<String> queries = plan.queries();
        emit(run, "Phase 2/4: Discovery - executing " + queries.size() + " searches");
        long start = System.nanoTime();

        List<CandidateTool> discovered = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            emit(run, "Executing search " + (i + 1) + "/" + queries.size() + ": " + query);

            SearchResponse response;
            try {
                response = await(searchProviderChain.search(new SearchRequest(query,
                        properties.getPipeline().getResultsPerQuery(), SearchDepth.ADVANCED, List.of())));
            } catch (RuntimeException e) {
                warn(run, "search failed for '" + query + "', skipping query (" + e.getMessage() + ")");
                skipped++;
                continue;
            }

            emit(run, "  " + response.results().size() + " results from " + response.provider()
                    + ", extracting tools...");
            ExtractionOutcome outcome = await(extractor.extract(query, response));
            if (outcome.isFailed()) {
                warn(run, "could not extract tools for '" + query + "', skipping query (" + outcome.error() + ")");
                skipped++;
                continue;
            }
            discovered.addAll(outcome.candidates());
            emit(run, "  Found " + outcome.candidates().size() + " tools from this query");
        }

        emit(run, "Discovery complete. Found " + discovered.size() + " potential tools"
                + (skipped > 0 ? " (" + skipped + " queries skipped)" : "")
                + elapsed(RunPhase.DISCOVERY, start));
        return discovered;
    }

    private List<ValidatedTool> validation(ResearchRun run, List<CandidateTool> discovered) {
        run.setPhase(RunPhase.VALIDATION);
        emit(run, "Phase 3/4: Validation - reviewing " + discovered.size() + " candidates");
        long start = System.nanoTime();

        List<CandidateTool> unique = deduplicator.deduplicate(discovered);
        emit(run, "  Removed duplicates: " + discovered.size() + " -> " + unique.size());

        ValidationOutcome outcome = await(qualityFilter.validate(unique));
        if (outcome.isFallback()) {
            warn(run, "quality review unavailable (" + outcome.fallbackReason() + "), kept "
                    + outcome.approved().size() + " candidates with confidence >= "
                    + properties.getValidation().getConfidenceThreshold());
        }

        List<ValidatedTool> approved = outcome.approved();
        if (approved.size() > run.getMaxTools()) {
            approved = approved.subList(0, run.getMaxTools());
        }
        run.setDiscoveredCount(approved.size());

        StringBuilder summary = new StringBuilder("Validation complete. ")
                .append(outcome.approved().size()).append(" of ").append(outcome.submitted())
                .append(" reviewed tools passed quality checks");
        if (outcome.excluded() > 0) {
            summary.append(", ").append(outcome.excluded()).append(" not reviewed (over the review limit)");
        }
        if (approved.size() < outcome.approved().size()) {
            summary.append(", keeping the first ").append(approved.size());
        }
        emit(run, summary + elapsed(RunPhase.VALIDATION, start));
        return approved;
    }

    private List<ResearchedTool> sentiment(ResearchRun run, List<ValidatedTool> validated) {
        run.setPhase(RunPhase.SENTIMENT);
        emit(run, "Phase 4/4: Sentiment - analyzing public sentiment for " + validated.size() + " tools");
        long start = System.nanoTime();

        List<ResearchedTool> researched = new ArrayList<>();
        for (int i = 0; i < validated.size(); i++) {
            ValidatedTool tool = validated.get(i);
            emit(run, "Analyzing sentiment " + (i + 1) + "/" + validated.size() + ": " + tool.title());

            SentimentRecord record = analyzeSentiment(run, tool);
            GitHubRepoStats github = fetchGitHubStats(run, tool);
            researched.add(new ResearchedTool(tool, record, github));
        }

        emit(run, "Sentiment analysis complete for " + researched.size() + " tools"
                + elapsed(RunPhase.SENTIMENT, start));
        return researched;
    }

    private SentimentRecord analyzeSentiment(ResearchRun run, ValidatedTool tool) {
        SentimentRecord record;
        try {
            record = await(sentimentAnalyzer.analyze(tool.title()));
        } catch (RuntimeException e) {
            log.warn("Sentiment analysis failed for {}", tool.title(), e);
            record = SentimentRecord.failed(tool.title(), null, Instant.now(clock), e.getMessage());
        }

        if (record.searchError() != null) {
            warn(run, "sentiment search failed for " + tool.title() + " (" + record.searchError() + ")");
        } else {
            emit(run, "  Sentiment: " + record.summary().rating().getValue() + " ("
                    + record.analyzedCount() + "/" + record.mentions().size() + " articles analyzed)");
        }
        return record;
    }

    private GitHubRepoStats fetchGitHubStats(ResearchRun run, ValidatedTool tool) {
        if (!gitHubClient.isEnabled()) {
            return null;
        }
        Optional<String> repository = GitHubClient.repositoryOf(tool.candidate().url())
                .or(() -> GitHubClient.repositoryIn(tool.candidate().description()));
        if (repository.isEmpty()) {
            return null;
        }

        emit(run, "  Fetching GitHub stats for " + repository.get());
        try {
            return await(gitHubClient.fetchStats(repository.get()));
        } catch (RuntimeException e) {
            log.warn("GitHub lookup failed for {}: {}", repository.get(), e.getMessage());
            return null;
        }
    }

    private MergeResult merge(ResearchRun run, List<ResearchedTool> researched) {
        emit(run, "Merging " + researched.size() + " tools into catalog...");
        long start = System.nanoTime();

        MergeResult result = catalogMerger.merge(researched);
        run.setAddedCount(result.addedCount());

        emit(run, "Merge complete: added " + result.addedCount() + " new tools, "
                + result.skipped() + " already in catalog" + elapsed("merge", start));
        return result;
    }

    // ========== Terminal transitions ==========
    // The terminal event and the status change happen under the start lock, so a new run
    // is only accepted once the previous run's stream holds its terminal event.

    private void complete(ResearchRun run, MergeResult merge) {
        String message = "Research complete! Discovered " + run.getDiscoveredCount()
                + " tools, added " + merge.addedCount() + " new tools";
        Instant at = Instant.now(clock);
        synchronized (lock) {
            publish(run, ProgressEvent.complete(message, at));
            run.complete(at);
        }
        runsCompletedCounter.increment();
        log.info("[{}] {}", run.getRunId(), message);
        recordLog(run);
    }

    private void fail(ResearchRun run, String message) {
        Instant at = Instant.now(clock);
        synchronized (lock) {
            publish(run, ProgressEvent.error(message, at));
            run.fail(message, at);
        }
        runsFailedCounter.increment();
        recordLog(run);
    }

    private void recordLog(ResearchRun run) {
        researchLogService.record(new ResearchLogEntry(
                run.getRunId(),
                run.getFocusAreas(),
                run.getMaxTools(),
                run.getStatus(),
                run.getDiscoveredCount(),
                run.getAddedCount(),
                run.getError(),
                Instant.now(clock)
        ));
    }

    // ========== Helpers ==========

    private void emit(ResearchRun run, String message) {
        log.info("[{}] {}", run.getRunId(), message);
        publish(run, ProgressEvent.progress(message, Instant.now(clock)));
    }

    private void warn(ResearchRun run, String message) {
        log.warn("[{}] {}", run.getRunId(), message);
        publish(run, ProgressEvent.progress(WARNING_PREFIX + message, Instant.now(clock)));
    }

    private void publish(ResearchRun run, ProgressEvent event) {
        run.addEvent(event);
        eventBus.publish(run.getRunId(), event);
    }

    private <T> T await(Mono<T> mono) {
        return mono.block(Duration.ofSeconds(properties.getPipeline().getStepTimeoutSeconds()));
    }

    private String elapsed(RunPhase phase, long startNanos) {
        return elapsed(phase.getValue(), startNanos);
    }

    private String elapsed(String phase, long startNanos) {
        long nanos = System.nanoTime() - startNanos;
        Timer.builder("research.phase.duration")
                .description("Time spent in a research pipeline phase")
                .tag("phase", phase)
                .register(meterRegistry)
                .record(Duration.ofNanos(nanos));
        return String.format(" in %.1fs", nanos / 1_000_000_000.0);
    }
}
