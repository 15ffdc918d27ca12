package com.clustergate.gatekeeper.service;

import com.clustergate.gatekeeper.deploy.DeploymentEngine;
import com.clustergate.gatekeeper.deploy.DeploymentOptions;
import com.clustergate.gatekeeper.deploy.DeploymentOutcome;
import com.clustergate.gatekeeper.model.Deployment;
import com.clustergate.gatekeeper.model.DeploymentState;
import com.clustergate.gatekeeper.repository.DeploymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DeploymentRunner.
 *
 * The worker pool is a mock that runs each task inline on the test thread,
 * so every assertion sees the finished run.
 */
@ExtendWith(MockitoExtension.class)
class DeploymentRunnerTest {

    @Mock DeploymentEngine     engine;
    @Mock DeploymentRepository deploymentRepo;
    @Mock ExecutorService      workers;

    DeploymentRunner runner;
    UUID             deploymentId;
    AtomicInteger    finishedCalls;

    @BeforeEach
    void setUp() {
        runner        = new DeploymentRunner(engine, deploymentRepo, workers);
        deploymentId  = UUID.randomUUID();
        finishedCalls = new AtomicInteger();

        // Emulate the id the database would generate on first save.
        lenient().doAnswer(inv -> {
            Deployment d = inv.getArgument(0);
            if (d.getId() == null) {
                ReflectionTestUtils.setField(d, "id", deploymentId);
            }
            return d;
        }).when(deploymentRepo).save(any(Deployment.class));
    }

    private void runTasksInline() {
        doAnswer(inv -> {
            inv.<Runnable>getArgument(0).run();
            return null;
        }).when(workers).execute(any(Runnable.class));
    }

    private static DeploymentRequest request() {
        return new DeploymentRequest("admin", "secret1", "secret1", "appscale", "rootpw", "master: h1\n");
    }

    private Deployment lastSaved() {
        ArgumentCaptor<Deployment> saved = ArgumentCaptor.forClass(Deployment.class);
        verify(deploymentRepo, atLeastOnce()).save(saved.capture());
        return saved.getValue();
    }

    // ------------------------------------------------------------------
    // launch()
    // ------------------------------------------------------------------

    @Test
    void launch_passesRequestToEngineWithRecordId() {
        runTasksInline();
        when(engine.deploy(any())).thenReturn(DeploymentOutcome.success(Path.of("logs/deploy.log")));

        UUID id = runner.launch(request(), "<p>master</p>", finishedCalls::incrementAndGet);

        assertThat(id).isEqualTo(deploymentId);
        ArgumentCaptor<DeploymentOptions> options = ArgumentCaptor.forClass(DeploymentOptions.class);
        verify(engine).deploy(options.capture());
        assertThat(options.getValue().deploymentId()).isEqualTo(deploymentId);
        assertThat(options.getValue().keyName()).isEqualTo("appscale");
        assertThat(options.getValue().rootPassword()).isEqualTo("rootpw");
        assertThat(options.getValue().ipsYaml()).isEqualTo("master: h1\n");
    }

    @Test
    void launch_engineSucceeds_recordSucceededAndCallbackRun() {
        runTasksInline();
        when(engine.deploy(any())).thenReturn(DeploymentOutcome.success(Path.of("logs/deploy.log")));

        runner.launch(request(), "<p>master</p>", finishedCalls::incrementAndGet);

        Deployment saved = lastSaved();
        assertThat(saved.getState()).isEqualTo(DeploymentState.SUCCEEDED);
        assertThat(saved.getExitCode()).isZero();
        assertThat(saved.getLogFile()).isEqualTo(Path.of("logs/deploy.log").toString());
        assertThat(saved.getTopologySummary()).isEqualTo("<p>master</p>");
        assertThat(saved.getFinishedAt()).isNotNull();
        assertThat(finishedCalls.get()).isEqualTo(1);
    }

    @Test
    void launch_engineReportsFailure_recordFailed() {
        runTasksInline();
        when(engine.deploy(any())).thenReturn(
                DeploymentOutcome.failure(2, Path.of("logs/deploy.log"), "Deployment command exited with status 2"));

        runner.launch(request(), "", finishedCalls::incrementAndGet);

        Deployment saved = lastSaved();
        assertThat(saved.getState()).isEqualTo(DeploymentState.FAILED);
        assertThat(saved.getExitCode()).isEqualTo(2);
        assertThat(saved.getMessage()).isEqualTo("Deployment command exited with status 2");
        assertThat(finishedCalls.get()).isEqualTo(1);
    }

    @Test
    void launch_engineThrows_recordFailedAndCallbackStillRun() {
        runTasksInline();
        when(engine.deploy(any())).thenThrow(new IllegalStateException("boom"));

        runner.launch(request(), "", finishedCalls::incrementAndGet);

        Deployment saved = lastSaved();
        assertThat(saved.getState()).isEqualTo(DeploymentState.FAILED);
        assertThat(saved.getMessage()).isEqualTo("Deployment engine failed unexpectedly");
        assertThat(finishedCalls.get()).isEqualTo(1);
    }

    @Test
    void launch_resultCannotBeSaved_callbackStillRun() {
        runTasksInline();
        when(engine.deploy(any())).thenReturn(DeploymentOutcome.success(null));
        doAnswer(inv -> {
            Deployment d = inv.getArgument(0);
            ReflectionTestUtils.setField(d, "id", deploymentId);
            return d;
        }).doThrow(new IllegalStateException("database down"))
                .when(deploymentRepo).save(any(Deployment.class));

        runner.launch(request(), "", finishedCalls::incrementAndGet);

        assertThat(finishedCalls.get()).isEqualTo(1);
    }

    @Test
    void launch_callbackThrows_doesNotEscapeWorker() {
        runTasksInline();
        when(engine.deploy(any())).thenReturn(DeploymentOutcome.success(null));

        runner.launch(request(), "", () -> {
            throw new IllegalStateException("release failed");
        });

        assertThat(lastSaved().getState()).isEqualTo(DeploymentState.SUCCEEDED);
    }

    @Test
    void launch_clearsMdcAfterRun() {
        runTasksInline();
        when(engine.deploy(any())).thenAnswer(inv -> {
            assertThat(MDC.get("deploymentId")).isEqualTo(deploymentId.toString());
            return DeploymentOutcome.success(null);
        });

        runner.launch(request(), "", finishedCalls::incrementAndGet);

        assertThat(MDC.get("deploymentId")).isNull();
    }

    @Test
    void launch_poolRejects_recordFailedAndCallbackNotRun() {
        doThrow(new RejectedExecutionException("shut down")).when(workers).execute(any(Runnable.class));

        assertThatThrownBy(() -> runner.launch(request(), "", finishedCalls::incrementAndGet))
                .isInstanceOf(RejectedExecutionException.class);

        Deployment saved = lastSaved();
        assertThat(saved.getState()).isEqualTo(DeploymentState.FAILED);
        assertThat(saved.getMessage()).isEqualTo("Deployment could not be dispatched");
        assertThat(finishedCalls.get()).isZero();
        verifyNoInteractions(engine);
    }

    @Test
    void launch_poolQueuesTask_recordStaysRunning() {
        // default mock: execute() accepts the task and never runs it
        UUID id = runner.launch(request(), "", finishedCalls::incrementAndGet);

        assertThat(id).isEqualTo(deploymentId);
        assertThat(lastSaved().getState()).isEqualTo(DeploymentState.RUNNING);
        assertThat(finishedCalls.get()).isZero();
    }
}
