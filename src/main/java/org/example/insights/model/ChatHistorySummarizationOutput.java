package org.example.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One topic as returned by the summarization model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatHistorySummarizationOutput(
        @JsonProperty("topicName") String topicName,
        @JsonProperty("sinceId") Integer sinceId,
        @JsonProperty("participantsNamesWithoutUsername") List<String> participants,
        @JsonProperty("discussion") List<DiscussionPoint> discussion,
        @JsonProperty("conclusion") String conclusion
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiscussionPoint(
            @JsonProperty("point") String point,
            @JsonProperty("keyIds") List<Integer> keyIds
    ) {
    }
}
