package org.example.insights.telegraph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The two Telegraph endpoints recap publishing uses. Content is a Telegraph node array.
 */
public interface TelegraphApi {

    TelegraphPage createPage(String accessToken, String title, String authorName, JsonNode content);

    /**
     * @param path page path, the last URL segment of a page
     */
    TelegraphPage editPage(String accessToken, String path, String title, String authorName, JsonNode content);
}
