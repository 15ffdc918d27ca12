package com.clustergate.gatekeeper.repository;

import com.clustergate.gatekeeper.model.Deployment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the deployments table.
 */
public interface DeploymentRepository extends JpaRepository<Deployment, UUID> {

    /** Most recent deployments first; backs GET /deployments. */
    List<Deployment> findTop20ByOrderByCreatedAtDesc();
}
