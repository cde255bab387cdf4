package com.openforge.tutor.config;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.llm.LlmProperties;
import com.openforge.tutor.speech.SpeechProperties;
import com.openforge.tutor.teaching.TeachingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Speech: endpoint, parallelism and failure budget
 *   - Context cache: TTL and renewal threshold
 *   - Teaching: validation timeout and handoff cap
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource         dataSource;
    private final LlmProperties      llmProperties;
    private final SpeechProperties   speechProperties;
    private final CacheProperties    cacheProperties;
    private final TeachingProperties teachingProperties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Tutor Engine  -  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Speech                                                  ║
                ║    Endpoint       : {}  key={}
                ║    Parallel/Fail  : {} in flight, stop after {} failures
                ╠══════════════════════════════════════════════════════════╣
                ║  Context Cache                                           ║
                ║    TTL / Renewal  : {}s / {}min
                ╠══════════════════════════════════════════════════════════╣
                ║  Teaching                                                ║
                ║    Validation     : {}s timeout, max handoffs {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                System.getProperty("java.version"),

                checkDatabase(),

                llmProperties.primary().name(),
                llmProperties.primary().model(),
                maskKey(llmProperties.primary().apiKey()),
                llmProperties.fallback().name(),
                llmProperties.fallback().model(),
                maskKey(llmProperties.fallback().apiKey()),

                speechProperties.baseUrl(),
                maskKey(speechProperties.apiKey()),
                speechProperties.maxParallelChunks(),
                speechProperties.failureThreshold(),

                cacheProperties.ttlSeconds(),
                cacheProperties.renewalThresholdMinutes(),

                teachingProperties.validationTimeoutSeconds(),
                teachingProperties.maxHandoffs()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
