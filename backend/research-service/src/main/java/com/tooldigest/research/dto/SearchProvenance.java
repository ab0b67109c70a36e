package com.tooldigest.research.dto;

import java.time.Instant;

public record SearchProvenance(String provider, String query, Instant searchedAt) {
}
