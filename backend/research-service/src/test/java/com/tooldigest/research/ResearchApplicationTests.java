package com.tooldigest.research;

import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.dto.ResearchRunView;
import com.tooldigest.research.entity.RunStatus;
import com.tooldigest.research.service.ResearchPipelineService;
import com.tooldigest.research.service.search.SearchProviderChain;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context load test with the test profile (no real API keys, no network).
 */
@SpringBootTest
@ActiveProfiles("test")
class ResearchApplicationTests {

    @Autowired
    private ResearchPipelineService researchPipelineService;

    @Autowired
    private SearchProviderChain searchProviderChain;

    @Autowired
    private ResearchProperties properties;

    @Test
    void contextLoads() {
        ResearchRunView status = researchPipelineService.status();

        assertThat(status.status()).isEqualTo(RunStatus.IDLE);
        assertThat(properties.getModel().getApiKey()).isEqualTo("test-key");
        assertThat(searchProviderChain.buildProviderChain()).isEmpty();
    }
}
