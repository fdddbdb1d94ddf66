package org.example.insights.telegraph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegraphPage(
        String path,
        String url,
        String title
) {
}
