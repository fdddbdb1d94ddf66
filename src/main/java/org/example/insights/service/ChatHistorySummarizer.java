package org.example.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.insights.entity.ChatHistoryEntity;
import org.example.insights.entity.RecapLogEntity;
import org.example.insights.model.ChatHistorySummarizationOutput;
import org.example.insights.model.ChatInfo;
import org.example.insights.model.TopicSummaries;
import org.example.insights.repository.RecapLogRepository;
import org.example.insights.service.llm.LlmOptions;
import org.example.insights.service.llm.LlmProvider;
import org.example.insights.service.llm.LlmProviderException;
import org.example.insights.telegram.TelegramHtml;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns a chat history window into per-topic summaries and a one-line highlight.
 */
@Service
public class ChatHistorySummarizer {

    private static final Logger log = LoggerFactory.getLogger(ChatHistorySummarizer.class);

    static final int CONDENSE_FALLBACK_CHARS = 50;

    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#+\\s*");
    private static final String POINT_BULLET = "• ";

    private static final String SUMMARIZATION_SYSTEM_PROMPT = """
            You are an assistant that summarizes group chat conversations.
            Group the messages into the distinct topics that were discussed.
            Each input line has the form: msgId=<id> <author>[ replying to <id>]: <text>

            OUTPUT REQUIREMENTS:
            - Return ONLY a valid JSON object with a single "topics" array (no markdown, no prose before/after).
            - One element per topic, most discussed topic first, at most 8 topics.
            - sinceId: the msgId where the topic starts.
            - participantsNamesWithoutUsername: display names of the people who took part.
            - discussion: 1-5 key points, each with the msgIds that support it in keyIds.
            - conclusion: one sentence, or an empty string when the topic has no conclusion.

            JSON SCHEMA:
            {
              "topics": [
                {
                  "topicName": "string",
                  "sinceId": 0,
                  "participantsNamesWithoutUsername": ["string"],
                  "discussion": [
                    {"point": "string", "keyIds": [0]}
                  ],
                  "conclusion": "string"
                }
              ]
            }
            """;

    private static final String CONDENSE_SYSTEM_PROMPT = """
            You write one-line highlights of group chat conversations.
            Each input line has the form: msgId=<id> <author>[ replying to <id>]: <text>
            Reply with a single sentence of at most 120 characters that captures the most important topics.
            Start or end the sentence with one or two fitting emoji. Do not use markdown or quotes.
            """;

    private final LlmProvider summarizationProvider;
    private final LlmProvider condenseProvider;
    private final RecapLogRepository recapLogRepository;
    private final ObjectMapper objectMapper;
    private final int minMessages;
    private final int maxContextChars;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Sleeper sleeper;

    @Autowired
    public ChatHistorySummarizer(
            @Qualifier("recapSummarizationLlmProvider") LlmProvider summarizationProvider,
            @Qualifier("recapCondenseLlmProvider") LlmProvider condenseProvider,
            RecapLogRepository recapLogRepository,
            ObjectMapper objectMapper,
            @Value("${recap.summarization.min-messages:6}") int minMessages,
            @Value("${recap.summarization.max-context-chars:24000}") int maxContextChars,
            @Value("${recap.summarization.max-attempts:3}") int maxAttempts,
            @Value("${recap.summarization.retry-delay-ms:5000}") long retryDelayMs) {
        this(summarizationProvider, condenseProvider, recapLogRepository, objectMapper, minMessages, maxContextChars,
                maxAttempts, Duration.ofMillis(retryDelayMs), Sleeper.THREAD_SLEEP);
    }

    ChatHistorySummarizer(
            LlmProvider summarizationProvider,
            LlmProvider condenseProvider,
            RecapLogRepository recapLogRepository,
            ObjectMapper objectMapper,
            int minMessages,
            int maxContextChars,
            int maxAttempts,
            Duration retryDelay,
            Sleeper sleeper) {
        this.summarizationProvider = summarizationProvider;
        this.condenseProvider = condenseProvider;
        this.recapLogRepository = recapLogRepository;
        this.objectMapper = objectMapper;
        this.minMessages = minMessages;
        this.maxContextChars = maxContextChars;
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
    }

    /**
     * Summarizes the window into one text block per topic and records the run in the recap log.
     *
     * @throws InsufficientHistoryException when the window holds fewer than the configured minimum of messages
     * @throws EmptySummarizationException  when no topic produced a usable summary
     * @throws LlmProviderException         when the model call fails permanently or returns unparseable output
     * @throws Retries.RetriesExhaustedException when every attempt failed transiently
     */
    public TopicSummaries summarize(ChatInfo chat, List<ChatHistoryEntity> window) throws InterruptedException {
        int messageCount = window == null ? 0 : window.size();
        if (messageCount < minMessages) {
            throw new InsufficientHistoryException(chat.id(), messageCount, minMessages);
        }

        String context = buildHistoryContext(window);
        String generated = Retries.call(
                "summarize chat " + chat.id(),
                maxAttempts,
                retryDelay,
                sleeper,
                () -> summarizationProvider.generate(
                        SUMMARIZATION_SYSTEM_PROMPT,
                        "CHAT MESSAGES:\n" + context,
                        LlmOptions.json(0.3, 0.9, 2500)),
                ChatHistorySummarizer::isTransient);
        List<ChatHistorySummarizationOutput> topics = parseTopics(generated);

        List<String> summaries = topics.stream()
                .map(topic -> renderTopic(chat, topic))
                .filter(Objects::nonNull)
                .filter(summary -> !summary.isBlank())
                .toList();
        if (summaries.isEmpty()) {
            throw new EmptySummarizationException(chat.id());
        }

        String logId = UUID.randomUUID().toString();
        recapLogRepository.save(new RecapLogEntity(
                logId, chat.id(), messageCount, summarizationProvider.getModelName(), toJson(summaries)));
        log.info("Summarized {} messages of chat {} into {} topics (log {})",
                messageCount, chat.id(), summaries.size(), logId);
        return new TopicSummaries(logId, summaries);
    }

    /**
     * One-line highlight of the history window, requested independently of the topic summaries.
     * Never throws; falls back to the first summary as plain text.
     */
    public String condense(long chatId, List<ChatHistoryEntity> window, List<String> summaries, int hours) {
        String context = window == null || window.isEmpty() ? "" : buildHistoryContext(window);
        if (!context.isBlank()) {
            try {
                String generated = condenseProvider.generate(
                        CONDENSE_SYSTEM_PROMPT,
                        "CHAT MESSAGES:\n" + context,
                        LlmOptions.full(0.5, 0.9, 120));
                String condensed = generated == null ? "" : generated.trim();
                if (!condensed.isBlank()) {
                    return condensed;
                }
                log.warn("Condense provider returned an empty highlight for chat {}", chatId);
            } catch (RuntimeException e) {
                log.warn("Failed to condense recap for chat {}: {}", chatId, e.getMessage());
            }
        }
        if (summaries == null || summaries.isEmpty()) {
            return "Chat recap for the past " + hours + " hours";
        }
        return fallbackHighlight(summaries.get(0));
    }

    public String getModelName() {
        return summarizationProvider.getModelName();
    }

    /**
     * Topic heading and first discussion point of a rendered summary as plain text, cut to
     * {@value #CONDENSE_FALLBACK_CHARS} code points. Entities are decoded so the result is escaped once on delivery.
     */
    static String fallbackHighlight(String summary) {
        String[] lines = summary.split("\n");
        String heading = MARKDOWN_HEADING.matcher(lines[0]).replaceFirst("");
        String firstPoint = Arrays.stream(lines)
                .filter(line -> line.startsWith(POINT_BULLET))
                .map(line -> line.substring(POINT_BULLET.length()))
                .findFirst()
                .orElse("");
        Document fragment = Jsoup.parseBodyFragment(firstPoint.isEmpty() ? heading : heading + ": " + firstPoint);
        fragment.select("a").remove();
        String plain = fragment.body().text().trim();
        int[] codePoints = plain.codePoints().toArray();
        if (codePoints.length <= CONDENSE_FALLBACK_CHARS) {
            return plain;
        }
        return new String(codePoints, 0, CONDENSE_FALLBACK_CHARS).trim() + "...";
    }

    /**
     * Numbered message lines, newest kept when the window exceeds the context budget.
     */
    String buildHistoryContext(List<ChatHistoryEntity> window) {
        Deque<String> lines = new ArrayDeque<>();
        int used = 0;
        for (int i = window.size() - 1; i >= 0; i--) {
            String line = formatLine(window.get(i));
            if (line == null) {
                continue;
            }
            if (used + line.length() + 1 > maxContextChars) {
                break;
            }
            lines.addFirst(line);
            used += line.length() + 1;
        }
        return String.join("\n", lines);
    }

    private String formatLine(ChatHistoryEntity message) {
        String text = message.getText() == null ? "" : message.getText().replace('\n', ' ').trim();
        if (text.isBlank()) {
            return null;
        }
        String author = message.getFullName() == null || message.getFullName().isBlank()
                ? "Unknown"
                : message.getFullName().trim();
        StringBuilder line = new StringBuilder()
                .append("msgId=").append(message.getMessageId())
                .append(' ').append(author);
        if (message.getReplyToMessageId() != null) {
            line.append(" replying to ").append(message.getReplyToMessageId());
        }
        return line.append(": ").append(text).toString();
    }

    private static boolean isTransient(RuntimeException e) {
        return e instanceof LlmProviderException providerError && providerError.isTransient();
    }

    /**
     * Accepts either {@code {"topics": [...]}} or a bare topic array, ignoring prose around the JSON.
     */
    List<ChatHistorySummarizationOutput> parseTopics(String generated) {
        if (generated == null || generated.isBlank()) {
            throw new LlmProviderException("No summarization response returned from provider");
        }
        int objectStart = generated.indexOf('{');
        int arrayStart = generated.indexOf('[');
        boolean isObject = objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart);
        int start = isObject ? objectStart : arrayStart;
        int end = isObject ? generated.lastIndexOf('}') : generated.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new LlmProviderException("No JSON found in summarization response");
        }
        try {
            JsonNode root = objectMapper.readTree(generated.substring(start, end + 1));
            JsonNode topics = root.isArray() ? root : root.path("topics");
            if (!topics.isArray()) {
                throw new LlmProviderException("Summarization response has no topics array");
            }
            List<ChatHistorySummarizationOutput> parsed = objectMapper
                    .readerFor(new TypeReference<List<ChatHistorySummarizationOutput>>() { })
                    .readValue(topics);
            return parsed == null ? List.of() : parsed;
        } catch (IOException e) {
            throw new LlmProviderException("Invalid JSON summarization response from LLM provider", e);
        }
    }

    /**
     * Renders one topic as Telegram HTML with a markdown heading line.
     */
    String renderTopic(ChatInfo chat, ChatHistorySummarizationOutput topic) {
        if (topic == null || topic.topicName() == null || topic.topicName().isBlank()) {
            return null;
        }
        List<String> points = new ArrayList<>();
        if (topic.discussion() != null) {
            for (ChatHistorySummarizationOutput.DiscussionPoint point : topic.discussion()) {
                if (point == null || point.point() == null || point.point().isBlank()) {
                    continue;
                }
                points.add(POINT_BULLET + TelegramHtml.escape(point.point().trim()) + keyLinks(chat, point.keyIds()));
            }
        }
        String conclusion = topic.conclusion() == null ? "" : topic.conclusion().trim();
        if (points.isEmpty() && conclusion.isEmpty()) {
            return null;
        }

        StringBuilder summary = new StringBuilder("## ").append(TelegramHtml.escape(topic.topicName().trim()));
        if (topic.participants() != null && !topic.participants().isEmpty()) {
            summary.append("\n<b>Participants:</b> ")
                    .append(TelegramHtml.escape(String.join(", ", topic.participants())));
        }
        if (!points.isEmpty()) {
            summary.append("\n<b>Discussion:</b>");
            for (String point : points) {
                summary.append('\n').append(point);
            }
        }
        if (!conclusion.isEmpty()) {
            summary.append("\n<b>Conclusion:</b> ").append(TelegramHtml.escape(conclusion));
        }
        return summary.toString();
    }

    private String keyLinks(ChatInfo chat, List<Integer> keyIds) {
        if (!chat.isSuperGroup() || keyIds == null || keyIds.isEmpty()) {
            return "";
        }
        StringBuilder links = new StringBuilder();
        for (Integer keyId : keyIds) {
            if (keyId == null) {
                continue;
            }
            String url = TelegramHtml.messageLink(chat.id(), keyId);
            if (url != null) {
                links.append(' ').append(TelegramHtml.link(url, "[" + keyId + "]"));
            }
        }
        return links.toString();
    }

    private String toJson(List<String> summaries) {
        try {
            return objectMapper.writeValueAsString(summaries);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize recap log payload", e);
            return null;
        }
    }
}
