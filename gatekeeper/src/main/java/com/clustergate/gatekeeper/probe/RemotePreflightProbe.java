package com.clustergate.gatekeeper.probe;

import com.clustergate.gatekeeper.config.GateProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Live check that the target machines accept the root password.
 *
 * Opens one SSH session, runs a no-op command and closes it. This catches a
 * wrong root password or an obvious network problem before a long deployment
 * is started. No retries: one bounded attempt per host.
 *
 * The attempt runs on a private pool so the caller waits at most
 * {@code timeoutSeconds}, even when the transport ignores its own timeout.
 *
 * Every attempt is timed:
 * <pre>
 *   clustergate.probe.duration{result="reachable|timeout|unreachable|connection_refused|auth_failed|unknown"}
 * </pre>
 */
@Component
public class RemotePreflightProbe {

    private static final Logger log = LoggerFactory.getLogger(RemotePreflightProbe.class);

    private final ExecutorService attempts = Executors.newCachedThreadPool();

    private final RemoteShell            shell;
    private final GateProperties.Probe   settings;
    private final MeterRegistry          meterRegistry;

    public RemotePreflightProbe(RemoteShell shell,
                                GateProperties properties,
                                MeterRegistry meterRegistry) {
        this.shell         = shell;
        this.settings      = properties.probe();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Probe the resolved node list.
     *
     * With {@link ProbeScope#FIRST_HOST} only {@code hosts[0]} is contacted.
     * With {@link ProbeScope#ALL_HOSTS} hosts are contacted in order and the
     * first failure is returned.
     *
     * @param hosts          node list from an already validated topology
     * @param rootPassword   validate it before calling; an empty one fails as UNKNOWN without connecting
     * @param timeoutSeconds wall-clock bound per host; non-positive values fall back to the configured timeout
     */
    public ProbeResult probe(List<String> hosts, String rootPassword, int timeoutSeconds) {
        if (rootPassword == null || rootPassword.isEmpty()) {
            log.warn("Preflight probe called without a root password");
            return ProbeResult.failed(ProbeFailure.UNKNOWN, hosts == null || hosts.isEmpty() ? "" : hosts.get(0));
        }
        if (timeoutSeconds <= 0) {
            log.warn("Preflight probe called with timeout {}s, using {}s", timeoutSeconds, settings.timeoutSeconds());
            timeoutSeconds = settings.timeoutSeconds();
        }
        if (hosts == null || hosts.isEmpty()) {
            log.warn("Preflight probe called with an empty host list");
            return ProbeResult.failed(ProbeFailure.UNKNOWN, "");
        }

        List<String> targets = settings.scope() == ProbeScope.ALL_HOSTS ? hosts : hosts.subList(0, 1);
        for (String host : targets) {
            ProbeResult result = probeHost(host, rootPassword, timeoutSeconds);
            if (!result.reachable()) {
                return result;
            }
        }
        return ProbeResult.reachable(targets.get(0));
    }

    /** Probe with the configured timeout. */
    public ProbeResult probe(List<String> hosts, String rootPassword) {
        return probe(hosts, rootPassword, settings.timeoutSeconds());
    }

    private ProbeResult probeHost(String host, String rootPassword, int timeoutSeconds) {
        RemoteTarget target = new RemoteTarget(host, settings.port(), settings.user(), rootPassword);
        log.info("Probing {} (timeout {}s)", target, timeoutSeconds);

        Timer.Sample sample = Timer.start(meterRegistry);
        ProbeResult result = attempt(target, timeoutSeconds);
        sample.stop(meterRegistry.timer("clustergate.probe.duration", "result", resultTag(result)));

        if (result.reachable()) {
            log.info("Probe of {} succeeded", target);
        } else {
            log.warn("Probe of {} failed: {}", target, result.reason());
        }
        return result;
    }

    private ProbeResult attempt(RemoteTarget target, int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        Future<?> attempt = attempts.submit(() -> shell.execute(target, settings.command(), timeout));
        try {
            attempt.get(timeoutSeconds, TimeUnit.SECONDS);
            return ProbeResult.reachable(target.host());
        } catch (TimeoutException e) {
            attempt.cancel(true);
            return ProbeResult.failed(ProbeFailure.TIMEOUT, target.host());
        } catch (ExecutionException e) {
            log.debug("Probe of {} failed", target, e.getCause());
            return ProbeResult.failed(failureOf(e.getCause()), target.host());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.cancel(true);
            return ProbeResult.failed(ProbeFailure.UNKNOWN, target.host());
        }
    }

    private static String resultTag(ProbeResult result) {
        return result.reachable() ? "reachable" : result.reason().name().toLowerCase(Locale.ROOT);
    }

    private static ProbeFailure failureOf(Throwable cause) {
        if (cause instanceof RemoteShellException rse) {
            return rse.getFailure();
        }
        return ProbeFailure.UNKNOWN;
    }

    @PreDestroy
    void shutdown() {
        attempts.shutdownNow();
    }
}
