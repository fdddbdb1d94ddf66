package org.example.insights.model;

public record RecapBatch(
        String pageTitle,
        PageSeries pageSeries,
        String condensedSummary
) {
}
