package org.example.insights.service.llm;

/**
 * Abstraction for LLM providers (OpenAI-compatible endpoints, Ollama).
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param systemPrompt instructions for the model, may be blank
     * @param userPrompt the prompt to send
     * @param options generation options (temperature, JSON output, etc.)
     * @return the generated text response
     * @throws LlmProviderException when the call fails; {@link LlmProviderException#isTransient()} tells
     *                              whether the same request may succeed later
     */
    String generate(String systemPrompt, String userPrompt, LlmOptions options);

    /**
     * Get the model used by this provider, shown in recap footers.
     */
    String getModelName();
}
