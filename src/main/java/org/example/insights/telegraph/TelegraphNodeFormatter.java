package org.example.insights.telegraph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts HTML into the Telegraph node format and measures its serialized size.
 * Tags Telegraph does not accept are unwrapped, keeping their children.
 */
@Component
public class TelegraphNodeFormatter {

    private static final Set<String> ALLOWED_TAGS = Set.of(
            "a", "aside", "b", "blockquote", "br", "code", "em", "figcaption", "figure",
            "h3", "h4", "hr", "i", "iframe", "img", "li", "ol", "p", "pre", "s", "strong",
            "u", "ul", "video"
    );

    private static final Map<String, String> TAG_ALIASES = Map.of(
            "h1", "h3",
            "h2", "h3",
            "h5", "h4",
            "h6", "h4"
    );

    private static final Set<String> ALLOWED_ATTRIBUTES = Set.of("href", "src");

    // Containers whose whitespace-only text children carry no content.
    private static final Set<String> STRUCTURAL_PARENTS = Set.of("body", "ul", "ol", "blockquote", "figure");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ArrayNode toNodes(String html) {
        Element body = Jsoup.parseBodyFragment(html == null ? "" : html).body();
        ArrayNode nodes = objectMapper.createArrayNode();
        appendChildren(body, nodes);
        return nodes;
    }

    public String toJson(String html) {
        try {
            return objectMapper.writeValueAsString(toNodes(html));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Telegraph nodes", e);
        }
    }

    /**
     * Size in UTF-8 bytes of the node JSON sent as the page content.
     */
    public int serializedSize(String html) {
        return toJson(html).getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Splits a document into its top-level blocks, each as outer HTML.
     */
    public List<String> topLevelBlocks(String html) {
        Element body = Jsoup.parseBodyFragment(html == null ? "" : html).body();
        List<String> blocks = new ArrayList<>();
        for (Node child : body.childNodes()) {
            if (child instanceof TextNode text) {
                if (!text.isBlank()) {
                    blocks.add(text.outerHtml());
                }
            } else if (child instanceof Element element) {
                blocks.add(element.outerHtml());
            }
        }
        return blocks;
    }

    private void appendChildren(Element parent, ArrayNode target) {
        for (Node child : parent.childNodes()) {
            if (child instanceof TextNode text) {
                if (text.isBlank() && STRUCTURAL_PARENTS.contains(parent.normalName())) {
                    continue;
                }
                String value = text.getWholeText();
                if (!value.isEmpty()) {
                    target.add(value);
                }
            } else if (child instanceof Element element) {
                String tag = normalizeTag(element.normalName());
                if (tag == null) {
                    appendChildren(element, target);
                    continue;
                }
                target.add(toNode(element, tag));
            }
        }
    }

    private ObjectNode toNode(Element element, String tag) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("tag", tag);

        ObjectNode attrs = null;
        for (String attribute : ALLOWED_ATTRIBUTES) {
            if (element.hasAttr(attribute)) {
                if (attrs == null) {
                    attrs = objectMapper.createObjectNode();
                }
                attrs.put(attribute, element.attr(attribute));
            }
        }
        if (attrs != null) {
            node.set("attrs", attrs);
        }

        ArrayNode children = objectMapper.createArrayNode();
        appendChildren(element, children);
        if (!children.isEmpty()) {
            node.set("children", children);
        }
        return node;
    }

    private String normalizeTag(String tag) {
        String lower = tag.toLowerCase(Locale.ROOT);
        String alias = TAG_ALIASES.get(lower);
        if (alias != null) {
            return alias;
        }
        return ALLOWED_TAGS.contains(lower) ? lower : null;
    }
}
