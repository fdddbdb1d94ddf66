package org.example.insights.model;

import java.util.Map;

public record RecapStatusResponse(
        boolean autoRecapEnabled,
        long enabledChats,
        long pendingCapsules,
        int inFlightRuns,
        int maxConcurrentRuns,
        Map<String, Object> metrics
) {
}
