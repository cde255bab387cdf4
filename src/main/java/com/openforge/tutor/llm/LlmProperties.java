package com.openforge.tutor.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "tutor.llm" prefix:
 *
 * tutor:
 *   llm:
 *     primary:
 *       name: gemini
 *       base-url: https://generativelanguage.googleapis.com/v1beta/openai
 *       api-key: ...
 *       model: gemini-2.5-flash
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ...
 *       model: deepseek-chat
 *       timeout-seconds: 120
 *
 * The primary model is only a default: agent rows carry their own model id.
 */
@ConfigurationProperties(prefix = "tutor.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
