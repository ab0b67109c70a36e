package com.tooldigest.research.service.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooldigest.research.client.ModelClient;
import com.tooldigest.research.client.ModelRequest;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.CandidateTool;
import com.tooldigest.research.dto.ValidatedTool;
import com.tooldigest.research.util.ModelJsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QualityFilterTest {

    @Mock
    private ModelClient modelClient;

    private ResearchProperties properties;
    private QualityFilter filter;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        filter = new QualityFilter(modelClient, new ModelJsonParser(new ObjectMapper()), properties);
    }

    private static CandidateTool tool(String title, double confidence) {
        return new CandidateTool(title, "https://" + title.toLowerCase() + ".dev", title + " description",
                "Agent Framework", List.of(), confidence, null, "q", null, null);
    }

    private static List<CandidateTool> tools(int count) {
        List<CandidateTool> tools = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            tools.add(tool("Tool" + i, i % 2 == 0 ? 0.9 : 0.5));
        }
        return tools;
    }

    @Nested
    @DisplayName("Model verdict")
    class Verdict {

        @Test
        @DisplayName("Keeps approved tools in candidate order with their quality scores")
        void keepsApproved() {
            when(modelClient.complete(any())).thenReturn(Mono.just("""
                    {"approved_indices": [3, 1],
                     "reasoning": "1 and 3 are real",
                     "quality_scores": {"1": {"score": 0.95, "reason": "widely used"},
                                        "3": {"score": 0.8, "reason": "active"}}}
                    """));

            ValidationOutcome outcome = filter.validate(tools(3)).block();

            assertThat(outcome.isFallback()).isFalse();
            assertThat(outcome.approved()).extracting(ValidatedTool::title).containsExactly("Tool1", "Tool3");
            assertThat(outcome.approved().get(0).qualityScore()).isEqualTo(0.95);
            assertThat(outcome.approved().get(0).qualityReason()).isEqualTo("widely used");
            assertThat(outcome.reasoning()).isEqualTo("1 and 3 are real");
        }

        @Test
        @DisplayName("Ignores out-of-range and repeated indices")
        void ignoresBadIndices() {
            when(modelClient.complete(any())).thenReturn(Mono.just(
                    "{\"approved_indices\": [0, 2, 2, 4, -1, 99]}"));

            ValidationOutcome outcome = filter.validate(tools(3)).block();

            assertThat(outcome.approved()).extracting(ValidatedTool::title).containsExactly("Tool2");
        }

        @Test
        @DisplayName("Without a quality score the candidate confidence is used")
        void defaultsQualityScore() {
            when(modelClient.complete(any())).thenReturn(Mono.just("{\"approved_indices\": [2]}"));

            ValidationOutcome outcome = filter.validate(tools(2)).block();

            assertThat(outcome.approved().get(0).qualityScore()).isEqualTo(0.9);
            assertThat(outcome.approved().get(0).qualityReason()).isNull();
        }
    }

    @Nested
    @DisplayName("Review cap")
    class Cap {

        @Test
        @DisplayName("Submits only the first 20 candidates and reports the rest as excluded")
        void capsSubmission() {
            when(modelClient.complete(any())).thenReturn(Mono.just("{\"approved_indices\": [20, 21]}"));

            ValidationOutcome outcome = filter.validate(tools(25)).block();

            assertThat(outcome.submitted()).isEqualTo(20);
            assertThat(outcome.excluded()).isEqualTo(5);
            assertThat(outcome.approved()).extracting(ValidatedTool::title).containsExactly("Tool20");

            ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
            verify(modelClient).complete(captor.capture());
            assertThat(captor.getValue().userPrompt()).contains("20. Tool20").doesNotContain("21. Tool21");
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Unparseable verdict keeps submitted candidates with confidence >= 0.7")
        void unparseableVerdict() {
            when(modelClient.complete(any())).thenReturn(Mono.just("All of them look fine to me."));

            ValidationOutcome outcome = filter.validate(tools(4)).block();

            assertThat(outcome.isFallback()).isTrue();
            assertThat(outcome.approved()).extracting(ValidatedTool::title).containsExactly("Tool2", "Tool4");
            assertThat(outcome.approved()).allSatisfy(t -> assertThat(t.qualityScore()).isEqualTo(0.9));
        }

        @Test
        @DisplayName("Fallback only considers the submitted window")
        void fallbackRespectsCap() {
            properties.getValidation().setMaxCandidates(2);
            when(modelClient.complete(any())).thenReturn(Mono.error(new IllegalStateException("rate limited")));

            ValidationOutcome outcome = filter.validate(tools(6)).block();

            assertThat(outcome.fallbackReason()).contains("rate limited");
            assertThat(outcome.approved()).extracting(ValidatedTool::title).containsExactly("Tool2");
            assertThat(outcome.excluded()).isEqualTo(4);
        }

        @Test
        @DisplayName("Missing approved_indices falls back")
        void missingIndices() {
            when(modelClient.complete(any())).thenReturn(Mono.just("{\"reasoning\": \"hmm\"}"));

            assertThat(filter.validate(tools(2)).block().isFallback()).isTrue();
        }
    }

    @Test
    @DisplayName("No candidates means no model call")
    void emptyInput() {
        ValidationOutcome outcome = filter.validate(List.of()).block();

        assertThat(outcome.approved()).isEmpty();
        verifyNoInteractions(modelClient);
    }
}
