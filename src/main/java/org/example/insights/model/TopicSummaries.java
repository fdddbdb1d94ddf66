package org.example.insights.model;

import java.util.List;

/**
 * Non-blank per-topic summaries from one summarization call, keyed by the persisted log id.
 */
public record TopicSummaries(
        String logId,
        List<String> summaries
) {
    public TopicSummaries {
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }
}
