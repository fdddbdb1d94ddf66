package org.example.insights.model;

import java.util.List;

/**
 * One page produced by pagination. {@code html} includes any series header and footer,
 * {@code blocks} holds only the body blocks taken from the source document.
 */
public record ContentPage(
        int partNumber,
        String title,
        String html,
        List<String> blocks
) {
    public ContentPage {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
