package com.clustergate.gatekeeper.service;

import com.clustergate.gatekeeper.lock.DeploymentLock;
import com.clustergate.gatekeeper.lock.DeploymentLockException;
import com.clustergate.gatekeeper.probe.ProbeFailure;
import com.clustergate.gatekeeper.probe.ProbeResult;
import com.clustergate.gatekeeper.probe.RemotePreflightProbe;
import com.clustergate.gatekeeper.topology.RoleSchema;
import com.clustergate.gatekeeper.topology.TopologyParseException;
import com.clustergate.gatekeeper.topology.TopologyParser;
import com.clustergate.gatekeeper.topology.TopologyRequest;
import com.clustergate.gatekeeper.topology.TopologyValidator;
import com.clustergate.gatekeeper.validation.CredentialValidator;
import com.clustergate.gatekeeper.validation.ValidationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

/**
 * Decides whether a deployment may start, and starts it.
 *
 * Stages run in a fixed order and the first failure ends the pipeline:
 * <pre>
 *   CREDENTIALS → TOPOLOGY → REMOTE_ACCESS → REACHABILITY → LOCK → LAUNCH
 * </pre>
 * The lock is taken last, right before the deployment is launched, so a
 * rejected request never leaves a lock behind. Once launched, the runner
 * releases the lock when the external tool exits.
 *
 * Nothing here throws to the caller: every outcome, including collaborator
 * failures, comes back as an {@link AdmissionDecision} or a
 * {@link ValidationOutcome} the API layer can show as is.
 *
 * Decisions are counted:
 * <pre>
 *   clustergate.admission.decisions{stage, outcome="admitted|rejected"}
 * </pre>
 */
@Service
public class DeploymentGate {

    private static final Logger log = LoggerFactory.getLogger(DeploymentGate.class);

    static final String LOCK_HELD    = "A deployment is already in progress";
    static final String LOCK_ERROR   = "Unable to access the deployment lock";
    static final String LAUNCH_ERROR = "Deployment could not be started";

    private final CredentialValidator  credentialValidator;
    private final TopologyParser       topologyParser;
    private final TopologyValidator    topologyValidator;
    private final RoleSchema           roleSchema;
    private final RemotePreflightProbe probe;
    private final DeploymentLock       lock;
    private final DeploymentRunner     runner;
    private final MeterRegistry        meterRegistry;

    public DeploymentGate(CredentialValidator credentialValidator,
                          TopologyParser topologyParser,
                          TopologyValidator topologyValidator,
                          RoleSchema roleSchema,
                          RemotePreflightProbe probe,
                          DeploymentLock lock,
                          DeploymentRunner runner,
                          MeterRegistry meterRegistry) {
        this.credentialValidator = credentialValidator;
        this.topologyParser      = topologyParser;
        this.topologyValidator   = topologyValidator;
        this.roleSchema          = roleSchema;
        this.probe               = probe;
        this.lock                = lock;
        this.runner              = runner;
        this.meterRegistry       = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Full admission
    // ------------------------------------------------------------------

    public AdmissionDecision admit(DeploymentRequest request) {
        AdmissionDecision decision = decide(request);
        meterRegistry.counter("clustergate.admission.decisions",
                "stage",   decision.stage().name().toLowerCase(Locale.ROOT),
                "outcome", decision.admitted() ? "admitted" : "rejected").increment();
        if (decision.admitted()) {
            log.info("Admitted deployment {} for {}", decision.deploymentId(), request);
        } else {
            log.info("Rejected {} at {}: {}", request, decision.stage(), decision.message());
        }
        return decision;
    }

    private AdmissionDecision decide(DeploymentRequest request) {
        // 1. administrator credentials
        ValidationOutcome credentials = credentialValidator.validate(
                request.adminUser(), request.adminPassword(), request.adminPasswordConfirm());
        if (!credentials.ok()) {
            return AdmissionDecision.rejected(AdmissionStage.CREDENTIALS, FailureCategory.INPUT, credentials.message());
        }

        // 2. layout
        TopologyRequest topology;
        try {
            topology = topologyParser.parse(request.ipsYaml());
        } catch (TopologyParseException e) {
            return AdmissionDecision.rejected(AdmissionStage.TOPOLOGY, FailureCategory.INPUT, e.getMessage());
        }
        ValidationOutcome layout = topologyValidator.validate(topology, roleSchema);
        if (!layout.ok()) {
            FailureCategory category = topology.isEmpty() ? FailureCategory.INPUT : FailureCategory.SCHEMA;
            return AdmissionDecision.rejected(AdmissionStage.TOPOLOGY, category, layout.message());
        }

        // 3. what the probe and the deployment tool need to log in
        ValidationOutcome access = credentialValidator.validateRemoteAccess(request.keyName(), request.rootPassword());
        if (!access.ok()) {
            return AdmissionDecision.rejected(AdmissionStage.REMOTE_ACCESS, FailureCategory.INPUT, access.message());
        }

        // 4. live SSH check
        ProbeResult reachability = probe.probe(topology.distinctHosts(), request.rootPassword());
        if (!reachability.reachable()) {
            return AdmissionDecision.rejected(AdmissionStage.REACHABILITY,
                    categoryOf(reachability.reason()), reachability.message());
        }

        // 5. single-flight lock, last admission step
        try {
            if (!lock.acquire()) {
                return AdmissionDecision.rejected(AdmissionStage.LOCK, FailureCategory.CONCURRENCY, LOCK_HELD);
            }
        } catch (DeploymentLockException e) {
            log.error("Deployment lock could not be acquired", e);
            return AdmissionDecision.rejected(AdmissionStage.LOCK, FailureCategory.UNKNOWN, LOCK_ERROR);
        }

        // 6. hand over to the runner; from here it owns the lock release
        try {
            UUID deploymentId = runner.launch(request, layout.message(), this::releaseAfterDeployment);
            return AdmissionDecision.admitted(deploymentId);
        } catch (RuntimeException e) {
            log.error("Deployment launch failed, releasing lock", e);
            try {
                releaseAfterDeployment();
            } catch (DeploymentLockException le) {
                log.error("Deployment lock could not be released; manual release needed", le);
            }
            return AdmissionDecision.rejected(AdmissionStage.LAUNCH, FailureCategory.UNKNOWN, LAUNCH_ERROR);
        }
    }

    private void releaseAfterDeployment() {
        if (!lock.release()) {
            log.warn("Deployment lock was already free when the deployment ended");
        }
    }

    static FailureCategory categoryOf(ProbeFailure failure) {
        return switch (failure) {
            case TIMEOUT, UNREACHABLE, CONNECTION_REFUSED -> FailureCategory.NETWORK;
            case AUTH_FAILED                              -> FailureCategory.AUTH;
            case UNKNOWN                                  -> FailureCategory.UNKNOWN;
        };
    }

    // ------------------------------------------------------------------
    // Individual stages, for the step-by-step front end
    // ------------------------------------------------------------------

    public ValidationOutcome validateCredentials(String username, String password, String passwordConfirm) {
        return credentialValidator.validate(username, password, passwordConfirm);
    }

    public ValidationOutcome validateTopology(String ipsYaml) {
        try {
            return topologyValidator.validate(topologyParser.parse(ipsYaml), roleSchema);
        } catch (TopologyParseException e) {
            return ValidationOutcome.failure(e.getMessage());
        }
    }

    /**
     * Layout check, remote-access form check and live probe, in that order.
     * The probe needs a valid layout to pick its host from.
     */
    public ValidationOutcome probeReachability(String ipsYaml, String keyName, String rootPassword) {
        TopologyRequest topology;
        try {
            topology = topologyParser.parse(ipsYaml);
        } catch (TopologyParseException e) {
            return ValidationOutcome.failure(e.getMessage());
        }
        ValidationOutcome layout = topologyValidator.validate(topology, roleSchema);
        if (!layout.ok()) {
            return layout;
        }
        ValidationOutcome access = credentialValidator.validateRemoteAccess(keyName, rootPassword);
        if (!access.ok()) {
            return access;
        }
        ProbeResult result = probe.probe(topology.distinctHosts(), rootPassword);
        return result.reachable() ? ValidationOutcome.success() : ValidationOutcome.failure(result.message());
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public ValidationOutcome acquireLock() {
        try {
            return lock.acquire()
                    ? ValidationOutcome.success("Deployment lock acquired")
                    : ValidationOutcome.failure(LOCK_HELD);
        } catch (DeploymentLockException e) {
            log.error("Deployment lock could not be acquired", e);
            return ValidationOutcome.failure(LOCK_ERROR);
        }
    }

    /** Manual release, e.g. to clear a marker left by a crashed deployment. */
    public ValidationOutcome releaseLock() {
        try {
            if (lock.release()) {
                log.warn("Deployment lock released by operator request");
                return ValidationOutcome.success("Deployment lock released");
            }
            return ValidationOutcome.failure("No deployment lock is held");
        } catch (DeploymentLockException e) {
            log.error("Deployment lock could not be released", e);
            return ValidationOutcome.failure(LOCK_ERROR);
        }
    }
}
