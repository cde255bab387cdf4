package com.openforge.tutor.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - Task executor      → fan-out context loads, speech chunks, validator calls, background writes
 *  - Java HttpClient    → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *  - Clock              → every TTL and elapsed-time check reads this, so tests can move time
 */
@Configuration
public class AppConfig {

    /**
     * Unbounded cached pool: every task here blocks on network I/O, and
     * callers join on fan-out results from inside the same pool, so a
     * fixed size could starve.  Concurrency towards rate-limited upstreams
     * is bounded at the call site (see ProgressiveSynthesisPipeline).
     *
     * Named "tutorTaskExecutor" to stay clear of Spring Boot's auto-configured
     * "applicationTaskExecutor" bean.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService tutorTaskExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tutor-task-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Single, shared HttpClient instance used by the LLM, speech and
     * cached-content clients.  Per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(ExecutorService tutorTaskExecutor) {
        return HttpClient.newBuilder()
                .executor(tutorTaskExecutor)
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, route_to …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (models add fields without breaking us)
     *
     * Model-facing schemas that use camelCase keys (audioText, confidenceScore …)
     * pin their names with @JsonProperty.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
