package com.openforge.tutor.cache;

import com.openforge.tutor.agent.AgentRegistry;
import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.repository.LessonRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Keeps one server-side cached instruction set per model group (agents that
 * share a model share a cache; caches cannot span models).
 *
 * Lifecycle per model group:
 *
 *   absent ──create──▶ fresh ──(age > renewal threshold)──▶ stale
 *     ▲                  ▲                                    │
 *     │                  └──────────renew (TTL reset)─────────┤
 *     └──(age ≥ TTL, or renew failed → recreate, or invalidate)┘
 *
 * {@link #ensureFresh(String)} is called before every generation and never
 * blocks: it returns the current handle (or null) and schedules renewal or
 * warmup on the task executor.  Warmup is single-flight; concurrent callers
 * share the in-flight run.
 *
 * Renewals write back only if the entry they started from is still the
 * current one, so an {@link #invalidate()} or a newer create that lands while
 * the provider call is in flight is never overwritten.
 */
@Slf4j
@Service
public class ContextCacheManager {

    private static final String RULE = "═══════════════════════════════════════════";

    private final CachedContentClient client;
    private final AgentRegistry       agentRegistry;
    private final LessonRepository    lessonRepository;
    private final ExecutorService     executor;
    private final Clock               clock;
    private final Duration            ttl;
    private final Duration            renewalThreshold;

    private final ConcurrentMap<String, CachedInstructionSet> entries = new ConcurrentHashMap<>();
    private final Set<String> renewing = ConcurrentHashMap.newKeySet();
    private final AtomicReference<CompletableFuture<Void>> warmupInFlight = new AtomicReference<>();

    public ContextCacheManager(CachedContentClient client,
                               AgentRegistry agentRegistry,
                               LessonRepository lessonRepository,
                               ExecutorService tutorTaskExecutor,
                               CacheProperties properties,
                               Clock clock) {
        this.client           = client;
        this.agentRegistry    = agentRegistry;
        this.lessonRepository = lessonRepository;
        this.executor         = tutorTaskExecutor;
        this.clock            = clock;
        this.ttl              = Duration.ofSeconds(properties.ttlSeconds());
        this.renewalThreshold = Duration.ofMinutes(properties.renewalThresholdMinutes());
    }

    // ── Request path ─────────────────────────────────────────────────────────

    /**
     * Returns the cache handle for {@code model}, or null when none is usable.
     *
     * Never blocks on the provider.  A missing or expired entry schedules a
     * warmup; an entry past the renewal threshold schedules a renewal and is
     * still returned for this request.
     */
    public String ensureFresh(String model) {
        CachedInstructionSet entry = entries.get(model);
        Instant now = clock.instant();

        if (entry == null || entry.age(now).compareTo(ttl) >= 0) {
            if (entry != null) {
                entries.remove(model, entry);
                log.info("[Cache] {} cache expired ({}min old), dropping handle", model, entry.age(now).toMinutes());
            }
            warmup(null);
            return null;
        }

        if (entry.age(now).compareTo(renewalThreshold) > 0) {
            log.info("[Cache] {} cache approaching expiration ({}min old), renewing in background",
                    model, entry.age(now).toMinutes());
            renewInBackground(model, entry);
        }
        return entry.handle();
    }

    /** Current handle without side effects. */
    public String handleFor(String model) {
        CachedInstructionSet entry = entries.get(model);
        if (entry == null || entry.age(clock.instant()).compareTo(ttl) >= 0) return null;
        return entry.handle();
    }

    // ── Warmup ───────────────────────────────────────────────────────────────

    /**
     * Creates or renews the cache for every model group.  Fresh groups are
     * skipped.  When {@code lessonId} is given the lesson header and
     * curriculum are baked into newly created sets.
     *
     * Single-flight: a call made while a warmup is running returns that run.
     * The returned future always completes normally.
     */
    public CompletableFuture<Void> warmup(String lessonId) {
        CompletableFuture<Void> promise = new CompletableFuture<>();
        if (!warmupInFlight.compareAndSet(null, promise)) {
            CompletableFuture<Void> running = warmupInFlight.get();
            return running != null ? running : CompletableFuture.completedFuture(null);
        }
        try {
            executor.execute(() -> {
                try {
                    runWarmup(lessonId);
                } catch (Exception e) {
                    log.error("[Cache] Warmup failed: {}", e.getMessage(), e);
                } finally {
                    warmupInFlight.set(null);
                    promise.complete(null);
                }
            });
        } catch (RuntimeException e) {
            log.warn("[Cache] Could not schedule warmup: {}", e.getMessage());
            warmupInFlight.set(null);
            promise.complete(null);
        }
        return promise;
    }

    private void runWarmup(String lessonId) {
        List<Agent> agents = agentRegistry.activeAgents();
        if (agents.isEmpty()) {
            log.warn("[Cache] No active agents, nothing to cache");
            return;
        }
        Lesson lesson = lessonId == null ? null : lessonRepository.findByLessonId(lessonId).orElse(null);

        Map<String, List<Agent>> groups = agents.stream().collect(Collectors.groupingBy(
                Agent::getModel, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<String, List<Agent>> group : groups.entrySet()) {
            String model = group.getKey();
            try {
                warmGroup(model, group.getValue(), lesson);
            } catch (Exception e) {
                log.error("[Cache] Warmup of {} cache failed: {}", model, e.getMessage());
            }
        }
    }

    private void warmGroup(String model, List<Agent> agents, Lesson lesson) {
        Instant now = clock.instant();
        CachedInstructionSet entry = entries.get(model);

        if (entry != null && entry.age(now).compareTo(renewalThreshold) < 0) {
            log.info("[Cache] {} cache still fresh ({}min old), skipping warmup", model, entry.age(now).toMinutes());
            return;
        }
        if (entry != null && entry.age(now).compareTo(ttl) < 0) {
            try {
                client.renew(entry.handle(), ttl);
                if (entries.replace(model, entry, entry.renewedAt(now))) {
                    log.info("[Cache] ✓ {} cache renewed", model);
                } else {
                    log.info("[Cache] {} cache changed during renewal, keeping the newer entry", model);
                }
                return;
            } catch (Exception e) {
                log.warn("[Cache] {} renewal failed, recreating: {}", model, e.getMessage());
            }
        }
        create(model, agents, lesson);
    }

    private void renewInBackground(String model, CachedInstructionSet entry) {
        if (!renewing.add(model)) return;
        try {
            executor.execute(() -> {
                try {
                    client.renew(entry.handle(), ttl);
                    if (entries.replace(model, entry, entry.renewedAt(clock.instant()))) {
                        log.info("[Cache] ✓ {} cache renewed", model);
                    } else {
                        log.info("[Cache] {} cache changed during renewal, keeping the newer entry", model);
                    }
                } catch (Exception e) {
                    log.warn("[Cache] Background renewal failed for {}, recreating: {}", model, e.getMessage());
                    recreate(model, entry);
                } finally {
                    renewing.remove(model);
                }
            });
        } catch (RuntimeException e) {
            renewing.remove(model);
            log.warn("[Cache] Could not schedule renewal for {}: {}", model, e.getMessage());
        }
    }

    private void recreate(String model, CachedInstructionSet previous) {
        if (!entries.remove(model, previous)) {
            log.info("[Cache] {} cache changed during renewal, skipping recreate", model);
            return;
        }
        try {
            List<Agent> agents = agentRegistry.activeAgents().stream()
                    .filter(a -> model.equals(a.getModel()))
                    .toList();
            Lesson lesson = previous.lessonId() == null ? null
                    : lessonRepository.findByLessonId(previous.lessonId()).orElse(null);
            create(model, agents, lesson);
        } catch (Exception e) {
            log.error("[Cache] Recreate of {} cache failed: {}", model, e.getMessage());
        }
    }

    private void create(String model, List<Agent> agents, Lesson lesson) {
        if (agents.isEmpty()) {
            throw new CachedContentClient.CacheClientException("No agents to cache for model " + model);
        }
        String instruction = buildCombinedInstruction(agents, lesson);
        Instant now = clock.instant();
        String displayName = "tutor_" + model.replaceAll("[^A-Za-z0-9]", "_") + "_" + now.toEpochMilli();

        log.info("[Cache] Creating {} cache with {} agents{} (~{} tokens)",
                model, agents.size(),
                lesson != null ? " + lesson context" : "",
                instruction.length() / 4);

        String handle = client.create(model, displayName, instruction, ttl);
        entries.put(model, new CachedInstructionSet(
                model, handle, agents.size(), lesson == null ? null : lesson.getLessonId(), now, now));
        log.info("[Cache] ✓ {} cache created: {}", model, handle);
    }

    // ── Invalidation & status ────────────────────────────────────────────────

    /** Deletes every handle and forgets the entries; the next use recreates them. */
    public void invalidate() {
        if (entries.isEmpty()) {
            log.info("[Cache] No caches to invalidate");
            return;
        }
        for (CachedInstructionSet entry : List.copyOf(entries.values())) {
            try {
                client.delete(entry.handle());
                log.info("[Cache] ✓ {} cache invalidated", entry.modelGroup());
            } catch (Exception e) {
                log.warn("[Cache] Failed to delete {} cache: {}", entry.modelGroup(), e.getMessage());
            } finally {
                entries.remove(entry.modelGroup(), entry);
            }
        }
    }

    public Map<String, CacheStatus> status() {
        Instant now = clock.instant();
        Map<String, CacheStatus> status = new LinkedHashMap<>();
        entries.forEach((model, entry) -> status.put(model, new CacheStatus(
                true,
                entry.handle(),
                entry.age(now).toMinutes(),
                entry.age(now).compareTo(renewalThreshold) > 0)));
        return status;
    }

    public record CacheStatus(boolean cached, String handle, long ageMinutes, boolean renewalDue) {}

    // ── Instruction text ─────────────────────────────────────────────────────

    /**
     * Lesson header, curriculum and one block per agent, joined with
     * "\n\n---\n\n".  Agents reference their block by name at request time.
     */
    static String buildCombinedInstruction(List<Agent> agents, Lesson lesson) {
        List<String> sections = new ArrayList<>();
        String curriculum = lesson == null ? null : lesson.getCurriculum();
        boolean hasCurriculum = curriculum != null && !curriculum.isBlank();

        if (lesson != null) {
            sections.add(RULE);
            sections.add("CURRENT LESSON");
            sections.add(RULE);
            sections.add("Title: " + lesson.getTitle());
            sections.add("Subject: " + lesson.getSubject());
            sections.add("Learning Objective: " + lesson.getLearningObjective());
            sections.add("");
        }
        if (hasCurriculum) {
            sections.add(RULE);
            sections.add("LESSON CURRICULUM (Follow this plan exactly)");
            sections.add(RULE);
            sections.add("");
            sections.add(curriculum);
            sections.add("");
        }
        if (lesson != null) {
            sections.add(RULE);
            sections.add("AI AGENT SYSTEM PROMPTS");
            sections.add(RULE);
            sections.add("");
        }
        for (Agent agent : agents) {
            sections.add("AGENT: " + agent.getName() + "\nSYSTEM_PROMPT:\n" + agent.getSystemPrompt());
        }
        return String.join("\n\n---\n\n", sections);
    }
}
