package com.tooldigest.research.service.pipeline;

import java.util.List;

/**
 * Planning reply shape: {"reasoning": "...", "queries": ["..."]}
 */
record PlanPayload(String reasoning, List<String> queries) {
}
