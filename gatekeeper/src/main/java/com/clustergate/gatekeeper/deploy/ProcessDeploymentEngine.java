package com.clustergate.gatekeeper.deploy;

import com.clustergate.gatekeeper.config.GateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * {@link DeploymentEngine} that shells out to the configured deployment tool.
 *
 * For each run:
 *   1. writes the layout to {@code ips-{deploymentId}.yaml} in the log directory
 *   2. starts {@code clustergate.deploy.command} with the run's inputs in the environment
 *   3. sends stdout and stderr to {@code deploy-{timestamp}.log} in the log directory
 *   4. waits for the process; exit code 0 means success
 *
 * Credentials go through the environment rather than argv so they don't show
 * up in process listings.
 */
@Component
public class ProcessDeploymentEngine implements DeploymentEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessDeploymentEngine.class);

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    static final String ENV_DEPLOYMENT_ID  = "CLUSTERGATE_DEPLOYMENT_ID";
    static final String ENV_KEYNAME        = "CLUSTERGATE_KEYNAME";
    static final String ENV_IPS_FILE       = "CLUSTERGATE_IPS_FILE";
    static final String ENV_ADMIN_USER     = "CLUSTERGATE_ADMIN_USER";
    static final String ENV_ADMIN_PASSWORD = "CLUSTERGATE_ADMIN_PASSWORD";
    static final String ENV_ROOT_PASSWORD  = "CLUSTERGATE_ROOT_PASSWORD";

    private final GateProperties.Deploy settings;

    public ProcessDeploymentEngine(GateProperties properties) {
        this.settings = properties.deploy();
    }

    @Override
    public DeploymentOutcome deploy(DeploymentOptions options) {
        Path logDir  = Path.of(settings.logDirectory());
        Path logFile = logDir.resolve("deploy-" + LOG_TIMESTAMP.format(LocalDateTime.now()) + ".log");

        Process process;
        try {
            Files.createDirectories(logDir);
            Path ipsFile = logDir.resolve("ips-" + options.deploymentId() + ".yaml");
            Files.writeString(ipsFile, options.ipsYaml() == null ? "" : options.ipsYaml());

            ProcessBuilder builder = new ProcessBuilder(settings.command())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile());
            if (settings.workingDirectory() != null) {
                builder.directory(Path.of(settings.workingDirectory()).toFile());
            }
            Map<String, String> env = builder.environment();
            env.put(ENV_DEPLOYMENT_ID,  String.valueOf(options.deploymentId()));
            env.put(ENV_KEYNAME,        nullToEmpty(options.keyName()));
            env.put(ENV_IPS_FILE,       ipsFile.toAbsolutePath().toString());
            env.put(ENV_ADMIN_USER,     nullToEmpty(options.adminUser()));
            env.put(ENV_ADMIN_PASSWORD, nullToEmpty(options.adminPassword()));
            env.put(ENV_ROOT_PASSWORD,  nullToEmpty(options.rootPassword()));

            log.info("Starting deployment {}: {} (log: {})",
                    options.deploymentId(), settings.command(), logFile);
            process = builder.start();
        } catch (IOException e) {
            log.error("Could not start deployment {}", options.deploymentId(), e);
            return DeploymentOutcome.failure(-1, null, "Deployment command could not be started");
        }

        try {
            int exitCode = process.waitFor();
            if (exitCode == 0) {
                log.info("Deployment {} finished successfully", options.deploymentId());
                return DeploymentOutcome.success(logFile);
            }
            log.warn("Deployment {} exited with status {}", options.deploymentId(), exitCode);
            return DeploymentOutcome.failure(exitCode, logFile, "Deployment command exited with status " + exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            log.warn("Deployment {} interrupted, process terminated", options.deploymentId());
            return DeploymentOutcome.failure(-1, logFile, "Deployment was interrupted");
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
