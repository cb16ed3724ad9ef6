package com.example.agentflow.repository;

import com.example.agentflow.domain.Workflow;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    Optional<Workflow> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<Workflow> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);
}
