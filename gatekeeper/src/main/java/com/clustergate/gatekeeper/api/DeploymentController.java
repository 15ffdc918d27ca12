package com.clustergate.gatekeeper.api;

import com.clustergate.gatekeeper.api.dto.AdmissionResponse;
import com.clustergate.gatekeeper.api.dto.DeploymentResponse;
import com.clustergate.gatekeeper.api.dto.SubmitDeploymentRequest;
import com.clustergate.gatekeeper.service.AdmissionDecision;
import com.clustergate.gatekeeper.service.DeploymentGate;
import com.clustergate.gatekeeper.service.DeploymentRunner;
import com.clustergate.gatekeeper.service.FailureCategory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for deployments.
 *
 * POST /deployments        run the full admission pipeline and start the deployment
 * GET  /deployments        20 most recent deployments
 * GET  /deployments/{id}   poll one deployment
 */
@RestController
@RequestMapping("/deployments")
public class DeploymentController {

    private final DeploymentGate   gate;
    private final DeploymentRunner runner;

    public DeploymentController(DeploymentGate gate, DeploymentRunner runner) {
        this.gate   = gate;
        this.runner = runner;
    }

    /**
     * Submit a deployment.
     *
     * HTTP 201: admitted, body carries the deployment id
     * HTTP 409: another deployment holds the lock
     * HTTP 422: rejected by a validation or probe stage; body carries the reason
     *
     * Example:
     *   curl -X POST http://localhost:8080/deployments \
     *     -H "Content-Type: application/json" \
     *     -d '{"adminUser":"a@example.com","adminPassword":"secret1","adminPasswordConfirm":"secret1",
     *          "keyName":"mycluster","rootPassword":"...","ipsYaml":"controller: 10.0.0.1\nservers: [10.0.0.2]"}'
     */
    @PostMapping
    public ResponseEntity<AdmissionResponse> submit(@RequestBody SubmitDeploymentRequest req) {
        AdmissionDecision decision = gate.admit(req.toDeploymentRequest());
        HttpStatus status;
        if (decision.admitted()) {
            status = HttpStatus.CREATED;
        } else if (decision.category() == FailureCategory.CONCURRENCY) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return ResponseEntity.status(status).body(AdmissionResponse.from(decision));
    }

    @GetMapping
    public List<DeploymentResponse> recent() {
        return runner.recent().stream()
                .map(DeploymentResponse::from)
                .toList();
    }

    /**
     * Returns 404 if the deployment id is not found.
     */
    @GetMapping("/{id}")
    public DeploymentResponse getDeployment(@PathVariable UUID id) {
        return runner.findById(id)
                .map(DeploymentResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Deployment not found: " + id));
    }
}
