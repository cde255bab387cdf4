package com.openforge.tutor.agent;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.cache.ClockTicker;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.repository.AgentRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Read-mostly view of the active agents.
 *
 * All active rows are loaded in one query and cached together for a short
 * TTL (five minutes by default); prompt edits made in the database show up
 * after expiry or after {@link #invalidate()}.
 */
@Slf4j
@Service
public class AgentRegistry {

    private static final String ALL = "all";

    private final AgentRepository agentRepository;
    private final Clock           clock;
    private final Cache<String, Map<String, Agent>> cache;

    public AgentRegistry(AgentRepository agentRepository, CacheProperties cacheProperties, Clock clock) {
        this.agentRepository = agentRepository;
        this.clock           = clock;
        this.cache           = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofMinutes(cacheProperties.agentTtlMinutes()))
                .ticker(new ClockTicker(clock))
                .build();
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    /**
     * Resolves aliases ("math" → "math_specialist") and returns the agent.
     *
     * @throws AgentNotFoundException when no active agent carries that name
     */
    public Agent get(String nameOrAlias) {
        return find(nameOrAlias).orElseThrow(() -> new AgentNotFoundException(
                "No active agent named '%s'".formatted(nameOrAlias)));
    }

    public Optional<Agent> find(String nameOrAlias) {
        if (nameOrAlias == null || nameOrAlias.isBlank()) return Optional.empty();
        return Optional.ofNullable(agents().get(AgentNames.resolveAlias(nameOrAlias)));
    }

    public Agent coordinator() {
        return get(AgentNames.COORDINATOR);
    }

    /** Active agents ordered by name. */
    public List<Agent> activeAgents() {
        return List.copyOf(agents().values());
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    public void invalidate() {
        cache.invalidateAll();
        log.info("[Agents] Agent cache invalidated");
    }

    public RegistryStatus status() {
        Map<String, Agent> cached = cache.getIfPresent(ALL);
        long ageSeconds = cache.policy().expireAfterWrite()
                .map(policy -> policy.ageOf(ALL, TimeUnit.SECONDS).orElse(0L))
                .orElse(0L);
        return new RegistryStatus(
                cached != null,
                cached == null ? 0 : cached.size(),
                cached == null ? 0L : ageSeconds);
    }

    public record RegistryStatus(boolean cached, int count, long ageSeconds) {}

    // ── Loading ──────────────────────────────────────────────────────────────

    private Map<String, Agent> agents() {
        Map<String, Agent> cached = cache.getIfPresent(ALL);
        if (cached != null) return cached;

        List<Agent> rows = agentRepository.findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE);
        Map<String, Agent> byName = new LinkedHashMap<>();
        for (Agent agent : rows) {
            byName.put(agent.getName(), agent);
        }
        if (byName.isEmpty()) {
            log.warn("[Agents] No active agents found in database");
            return Map.of();
        }
        cache.put(ALL, Collections.unmodifiableMap(byName));
        log.debug("[Agents] Loaded {} active agents at {}", byName.size(), clock.instant());
        return byName;
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class AgentNotFoundException extends RuntimeException {
        public AgentNotFoundException(String message) { super(message); }
    }
}
