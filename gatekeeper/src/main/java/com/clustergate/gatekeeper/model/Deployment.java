package com.clustergate.gatekeeper.model;

import com.clustergate.gatekeeper.deploy.DeploymentOutcome;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One admitted deployment and how it ended.
 *
 * Created by the gate right after the lock is taken, updated by the worker
 * thread when the external tool exits.
 *
 * DB table: deployments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployments")
public class Deployment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentState state = DeploymentState.RUNNING;

    @Column(name = "key_name", nullable = false)
    private String keyName;

    @Column(name = "admin_user", nullable = false)
    private String adminUser;

    // Rendered layout from the topology check, shown back to the operator.
    @Column(name = "topology_summary", columnDefinition = "TEXT")
    private String topologySummary;

    @Column(name = "log_file")
    private String logFile;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Deployment() {}   // required by JPA

    public Deployment(String keyName, String adminUser, String topologySummary) {
        this.keyName         = keyName;
        this.adminUser       = adminUser;
        this.topologySummary = topologySummary;
    }

    /** Record the engine's verdict and move to a terminal state. */
    public void finish(DeploymentOutcome outcome) {
        this.state      = outcome.succeeded() ? DeploymentState.SUCCEEDED : DeploymentState.FAILED;
        this.exitCode   = outcome.exitCode();
        this.logFile    = outcome.logFile() == null ? null : outcome.logFile().toString();
        this.message    = outcome.message();
        this.finishedAt = Instant.now();
    }

    /** Terminal failure without an engine outcome (dispatch failed, engine threw). */
    public void fail(String message) {
        this.state      = DeploymentState.FAILED;
        this.message    = message;
        this.finishedAt = Instant.now();
    }

    public UUID            getId()              { return id; }
    public DeploymentState getState()           { return state; }
    public String          getKeyName()         { return keyName; }
    public String          getAdminUser()       { return adminUser; }
    public String          getTopologySummary() { return topologySummary; }
    public String          getLogFile()         { return logFile; }
    public Integer         getExitCode()        { return exitCode; }
    public String          getMessage()         { return message; }
    public Instant         getCreatedAt()       { return createdAt; }
    public Instant         getUpdatedAt()       { return updatedAt; }
    public Instant         getFinishedAt()      { return finishedAt; }
}
