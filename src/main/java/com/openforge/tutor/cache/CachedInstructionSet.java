package com.openforge.tutor.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One server-side cached instruction set per model group.
 *
 * @param modelGroup  model id shared by every agent in the set
 * @param handle      server resource name, e.g. "cachedContents/abc123"
 * @param agentCount  number of agent prompts baked into the set
 * @param lessonId    lesson whose context was included, or null
 * @param createdAt   when the set was first created
 * @param refreshedAt last create or TTL renewal; age is measured from here
 */
public record CachedInstructionSet(
        String modelGroup,
        String handle,
        int agentCount,
        String lessonId,
        Instant createdAt,
        Instant refreshedAt
) {

    public Duration age(Instant now) {
        return Duration.between(refreshedAt, now);
    }

    public CachedInstructionSet renewedAt(Instant now) {
        return new CachedInstructionSet(modelGroup, handle, agentCount, lessonId, createdAt, now);
    }
}
