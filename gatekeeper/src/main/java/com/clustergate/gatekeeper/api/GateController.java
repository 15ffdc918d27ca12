package com.clustergate.gatekeeper.api;

import com.clustergate.gatekeeper.api.dto.CredentialsCheckRequest;
import com.clustergate.gatekeeper.api.dto.LockStatusResponse;
import com.clustergate.gatekeeper.api.dto.ReachabilityCheckRequest;
import com.clustergate.gatekeeper.api.dto.StageResponse;
import com.clustergate.gatekeeper.api.dto.TopologyCheckRequest;
import com.clustergate.gatekeeper.service.DeploymentGate;
import org.springframework.web.bind.annotation.*;

/**
 * Individual admission stages, so a front end can check each form step as
 * the operator fills it in.
 *
 * POST   /gate/credentials    administrator username/password rules
 * POST   /gate/topology       ips.yaml layout; on success the message is the rendered layout
 * POST   /gate/reachability   layout + SSH probe with the root password
 * GET    /gate/lock           is a deployment in progress?
 * POST   /gate/lock           take the deployment lock
 * DELETE /gate/lock           release it (manual recovery after a crash)
 *
 * Every check answers 200 with {ok, message}; a failed check is not an HTTP error.
 */
@RestController
@RequestMapping("/gate")
public class GateController {

    private final DeploymentGate gate;

    public GateController(DeploymentGate gate) {
        this.gate = gate;
    }

    @PostMapping("/credentials")
    public StageResponse validateCredentials(@RequestBody CredentialsCheckRequest req) {
        return StageResponse.from(gate.validateCredentials(req.username(), req.password(), req.passwordConfirm()));
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/gate/topology \
     *     -H "Content-Type: application/json" \
     *     -d '{"ipsYaml":"master: 10.0.0.1\nservers: [10.0.0.2, 10.0.0.3]"}'
     */
    @PostMapping("/topology")
    public StageResponse validateTopology(@RequestBody TopologyCheckRequest req) {
        return StageResponse.from(gate.validateTopology(req.ipsYaml()));
    }

    /**
     * May block for up to the configured probe timeout per probed host.
     */
    @PostMapping("/reachability")
    public StageResponse probeReachability(@RequestBody ReachabilityCheckRequest req) {
        return StageResponse.from(gate.probeReachability(req.ipsYaml(), req.keyName(), req.rootPassword()));
    }

    @GetMapping("/lock")
    public LockStatusResponse lockStatus() {
        return new LockStatusResponse(gate.isLocked());
    }

    @PostMapping("/lock")
    public StageResponse acquireLock() {
        return StageResponse.from(gate.acquireLock());
    }

    @DeleteMapping("/lock")
    public StageResponse releaseLock() {
        return StageResponse.from(gate.releaseLock());
    }
}
