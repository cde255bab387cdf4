package com.openforge.tutor.agent;

import com.openforge.tutor.domain.Agent;
import com.openforge.tutor.repository.AgentRepository;
import com.openforge.tutor.testutil.Fixtures;
import com.openforge.tutor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentRegistryTest {

    private final AgentRepository repository = mock(AgentRepository.class);
    private final MutableClock clock = MutableClock.at("2026-01-01T10:00:00Z");
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry(repository, Fixtures.cacheProperties(), clock);
        when(repository.findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE)).thenReturn(List.of(
                Fixtures.agent(AgentNames.COORDINATOR, "gemini-2.5-flash"),
                Fixtures.agent(AgentNames.MATH_SPECIALIST, "gemini-2.5-flash")));
    }

    @Test
    void resolvesAliases() {
        assertThat(registry.get("math").getName()).isEqualTo(AgentNames.MATH_SPECIALIST);
        assertThat(registry.get(" math_specialist ").getName()).isEqualTo(AgentNames.MATH_SPECIALIST);
        assertThat(registry.coordinator().getName()).isEqualTo(AgentNames.COORDINATOR);
    }

    @Test
    void unknownNameThrows() {
        assertThatThrownBy(() -> registry.get("art"))
                .isInstanceOf(AgentRegistry.AgentNotFoundException.class)
                .hasMessageContaining("art");
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.find("  ")).isEmpty();
    }

    @Test
    void loadsOnceUntilExpiry() {
        registry.get("math");
        registry.get(AgentNames.COORDINATOR);
        registry.activeAgents();
        verify(repository, times(1)).findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE);

        clock.advance(Duration.ofMinutes(6));
        registry.get("math");
        verify(repository, times(2)).findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE);
    }

    @Test
    void invalidateForcesReload() {
        registry.activeAgents();
        registry.invalidate();
        assertThat(registry.status().cached()).isFalse();

        registry.activeAgents();
        verify(repository, times(2)).findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE);
    }

    @Test
    void statusReportsCountAndAge() {
        registry.activeAgents();
        clock.advance(Duration.ofSeconds(30));

        AgentRegistry.RegistryStatus status = registry.status();

        assertThat(status.cached()).isTrue();
        assertThat(status.count()).isEqualTo(2);
        assertThat(status.ageSeconds()).isEqualTo(30);
    }

    @Test
    void emptyTableIsNotCached() {
        when(repository.findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE)).thenReturn(List.of());

        assertThat(registry.activeAgents()).isEmpty();
        registry.activeAgents();

        verify(repository, times(2)).findByStatusOrderByNameAsc(Agent.AgentStatus.ACTIVE);
    }
}
