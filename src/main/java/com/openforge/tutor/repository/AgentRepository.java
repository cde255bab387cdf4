package com.openforge.tutor.repository;

import com.openforge.tutor.domain.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentRepository extends JpaRepository<Agent, Long> {

    List<Agent> findByStatusOrderByNameAsc(Agent.AgentStatus status);
}
