package com.openforge.tutor.profile;

import com.openforge.tutor.cache.CacheProperties;
import com.openforge.tutor.cache.ClockTicker;
import com.openforge.tutor.domain.StudentProfile;
import com.openforge.tutor.repository.StudentProfileRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Student profiles with a short read-through cache.  Writes go straight to
 * the database and drop the cached snapshot.
 */
@Slf4j
@Service
public class ProfileService {

    private final StudentProfileRepository repository;
    private final Cache<String, LearnerProfile> cache;

    public ProfileService(StudentProfileRepository repository, CacheProperties cacheProperties, Clock clock) {
        this.repository = repository;
        this.cache      = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofMinutes(cacheProperties.profileTtlMinutes()))
                .ticker(new ClockTicker(clock))
                .build();
    }

    public Optional<LearnerProfile> find(String userId) {
        return Optional.ofNullable(cache.get(userId,
                id -> repository.findByUserId(id).map(LearnerProfile::of).orElse(null)));
    }

    /**
     * Merges new topics into the profile's struggle and strength sets.
     *
     * @return true when at least one topic was new
     */
    @Transactional
    public boolean addTopics(String userId, Collection<String> struggles, Collection<String> strengths) {
        StudentProfile profile = repository.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Profile not found: " + userId));

        boolean changed = profile.getStruggles().addAll(struggles);
        changed |= profile.getStrengths().addAll(strengths);
        if (changed) {
            repository.save(profile);
            invalidate(userId);
        }
        return changed;
    }

    public void invalidate(String userId) {
        cache.invalidate(userId);
    }
}
