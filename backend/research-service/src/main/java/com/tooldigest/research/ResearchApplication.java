package com.tooldigest.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tool Digest Research Service.
 *
 * Runs the autonomous research pipeline that plans search queries with a language model,
 * discovers candidate developer tools through web search, filters them for quality,
 * scores public sentiment and merges the results into the JSON tool catalog.
 */
@SpringBootApplication
public class ResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchApplication.class, args);
    }
}
