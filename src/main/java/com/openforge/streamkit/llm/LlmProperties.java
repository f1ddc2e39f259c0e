package com.openforge.streamkit.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised provider configuration.
 *
 * Reads from application.yml under the "streamkit.llm" prefix:
 *
 * streamkit:
 *   llm:
 *     primary:
 *       name: anthropic
 *       base-url: https://api.anthropic.com/v1
 *       api-key: sk-ant-...
 *       model: claude-sonnet-4-5
 *       api-version: 2023-06-01
 *       timeout-seconds: 120
 *     fallback:
 *       name: anthropic-proxy
 *       base-url: https://llm-proxy.internal/v1
 *       api-key: ...
 *       model: claude-haiku-4-5
 */
@ConfigurationProperties(prefix = "streamkit.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("2023-06-01") String apiVersion,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
