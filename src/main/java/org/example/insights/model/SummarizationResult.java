package org.example.insights.model;

import java.util.List;

public record SummarizationResult(
        String logId,
        List<String> topicSummaries,
        String condensedSummary
) {
    public SummarizationResult {
        topicSummaries = topicSummaries == null ? List.of() : List.copyOf(topicSummaries);
    }
}
