package org.example.insights.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens,  // nullable
    boolean jsonOutput
) {
    /**
     * Free-text reply.
     */
    public static LlmOptions full(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens, false);
    }

    /**
     * Reply constrained to a single JSON object, for providers that support it.
     */
    public static LlmOptions json(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens, true);
    }
}
