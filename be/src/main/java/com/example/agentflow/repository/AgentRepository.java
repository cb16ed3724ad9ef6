package com.example.agentflow.repository;

import com.example.agentflow.domain.Agent;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AgentRepository extends JpaRepository<Agent, UUID> {

    Optional<Agent> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<Agent> findByOwnerIdAndIdIn(UUID ownerId, Collection<UUID> ids);

    List<Agent> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);
}
