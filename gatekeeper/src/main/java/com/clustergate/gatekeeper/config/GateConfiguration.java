package com.clustergate.gatekeeper.config;

import com.clustergate.gatekeeper.lock.DeploymentLock;
import com.clustergate.gatekeeper.lock.FileDeploymentLock;
import com.clustergate.gatekeeper.topology.RoleSchema;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the pieces of the gate that are plain objects rather than components:
 * the role schema, the lock implementation and the deployment worker pool.
 */
@Configuration
@EnableConfigurationProperties(GateProperties.class)
public class GateConfiguration {

    @Bean
    RoleSchema roleSchema(GateProperties properties) {
        return properties.schema().toRoleSchema();
    }

    @Bean
    DeploymentLock deploymentLock(GateProperties properties) {
        return new FileDeploymentLock(properties.lock().markerPath());
    }

    /**
     * Runs the external deployment command. One worker by default: the lock
     * already guarantees a single deployment in flight.
     */
    @Bean(destroyMethod = "shutdown")
    ExecutorService deploymentWorkers(GateProperties properties) {
        return Executors.newFixedThreadPool(properties.deploy().workers());
    }
}
