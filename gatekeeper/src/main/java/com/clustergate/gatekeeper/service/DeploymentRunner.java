package com.clustergate.gatekeeper.service;

import com.clustergate.gatekeeper.deploy.DeploymentEngine;
import com.clustergate.gatekeeper.deploy.DeploymentOptions;
import com.clustergate.gatekeeper.deploy.DeploymentOutcome;
import com.clustergate.gatekeeper.model.Deployment;
import com.clustergate.gatekeeper.repository.DeploymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs admitted deployments on the deployment worker pool.
 *
 * The gate hands over a completion callback (the lock release). This class
 * guarantees that callback runs exactly once per successful {@link #launch}:
 * after the engine returns, after it throws, and after the outcome fails to
 * save. If launch itself throws, the callback is NOT run and the caller
 * still owns the cleanup.
 */
@Component
public class DeploymentRunner {

    private static final Logger log = LoggerFactory.getLogger(DeploymentRunner.class);

    private final DeploymentEngine     engine;
    private final DeploymentRepository deploymentRepo;
    private final ExecutorService      workers;

    public DeploymentRunner(DeploymentEngine engine,
                            DeploymentRepository deploymentRepo,
                            ExecutorService deploymentWorkers) {
        this.engine         = engine;
        this.deploymentRepo = deploymentRepo;
        this.workers        = deploymentWorkers;
    }

    /**
     * Record a new RUNNING deployment and start it in the background.
     *
     * @param onFinished run on the worker thread once the deployment has ended, however it ended
     * @return id of the deployment record
     * @throws RejectedExecutionException if the worker pool refuses the run (record is marked FAILED)
     */
    public UUID launch(DeploymentRequest request, String topologySummary, Runnable onFinished) {
        Deployment deployment = deploymentRepo.save(
                new Deployment(request.keyName(), request.adminUser(), topologySummary));

        DeploymentOptions options = new DeploymentOptions(
                deployment.getId(),
                request.keyName(),
                request.adminUser(),
                request.adminPassword(),
                request.rootPassword(),
                request.ipsYaml());

        try {
            workers.execute(() -> run(deployment, options, onFinished));
        } catch (RejectedExecutionException e) {
            deployment.fail("Deployment could not be dispatched");
            deploymentRepo.save(deployment);
            throw e;
        }
        log.info("Deployment {} dispatched (keyName={})", deployment.getId(), request.keyName());
        return deployment.getId();
    }

    public Optional<Deployment> findById(UUID id) {
        return deploymentRepo.findById(id);
    }

    public List<Deployment> recent() {
        return deploymentRepo.findTop20ByOrderByCreatedAtDesc();
    }

    private void run(Deployment deployment, DeploymentOptions options, Runnable onFinished) {
        // Every log line of this run carries the deployment id, including the engine's.
        MDC.put("deploymentId", deployment.getId().toString());
        try {
            try {
                DeploymentOutcome outcome = engine.deploy(options);
                deployment.finish(outcome);
            } catch (RuntimeException e) {
                log.error("Deployment engine failed for {}", deployment.getId(), e);
                deployment.fail("Deployment engine failed unexpectedly");
            }
            deploymentRepo.save(deployment);
            log.info("Deployment {} ended in state {}", deployment.getId(), deployment.getState());
        } catch (RuntimeException e) {
            log.error("Could not record the result of deployment {}", deployment.getId(), e);
        } finally {
            try {
                onFinished.run();
            } catch (RuntimeException e) {
                log.error("Cleanup after deployment {} failed; the deployment lock may need manual release",
                        deployment.getId(), e);
            }
            MDC.clear();
        }
    }
}
