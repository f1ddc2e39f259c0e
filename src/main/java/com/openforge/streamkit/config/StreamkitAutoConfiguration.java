package com.openforge.streamkit.config;

import com.openforge.streamkit.llm.LlmRouter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Entry point for host applications: pulls in the shared HTTP/JSON beans,
 * the resilience wiring and the stream router.
 *
 * Registered in META-INF/spring/...AutoConfiguration.imports, so adding the
 * jar and a "streamkit.llm.primary" block to application.yml is enough.
 */
@AutoConfiguration
@Import({AppConfig.class, Resilience4jConfig.class, LlmRouter.class})
public class StreamkitAutoConfiguration {
}
