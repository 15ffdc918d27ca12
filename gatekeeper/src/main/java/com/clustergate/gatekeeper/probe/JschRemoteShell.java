package com.clustergate.gatekeeper.probe;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.Slf4jLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.OutputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link RemoteShell} over SSH using JSch.
 *
 * Host keys are not checked: the probe runs against freshly provisioned
 * machines whose keys the gate has never seen.
 *
 * JSch reports most faults as a bare {@link JSchException} whose message (or
 * cause) names the socket error, so {@link #classify} walks the cause chain
 * and looks at both exception types and messages.
 */
@Component
public class JschRemoteShell implements RemoteShell {

    private static final Logger log = LoggerFactory.getLogger(JschRemoteShell.class);

    private static final long POLL_MILLIS = 50;

    public JschRemoteShell() {
        JSch.setLogger(new Slf4jLogger());
    }

    @Override
    public void execute(RemoteTarget target, String command, Duration timeout) {
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        long deadline = System.nanoTime() + timeout.toNanos();

        Session session = null;
        ChannelExec channel = null;
        try {
            session = new JSch().getSession(target.user(), target.host(), target.port());
            session.setPassword(target.password());
            session.setConfig("StrictHostKeyChecking", "no");
            session.setConfig("PreferredAuthentications", "password,keyboard-interactive");
            session.setTimeout(timeoutMillis);
            session.connect(timeoutMillis);

            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);
            channel.setOutputStream(OutputStream.nullOutputStream());
            channel.setErrStream(OutputStream.nullOutputStream());
            channel.connect(timeoutMillis);

            while (!channel.isClosed()) {
                if (System.nanoTime() > deadline) {
                    throw new RemoteShellException(ProbeFailure.TIMEOUT,
                            "'" + command + "' did not finish on " + target + " within " + timeout);
                }
                Thread.sleep(POLL_MILLIS);
            }
            log.debug("'{}' on {} exited with status {}", command, target, channel.getExitStatus());

        } catch (JSchException e) {
            throw new RemoteShellException(classify(e), "SSH session to " + target + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteShellException(ProbeFailure.TIMEOUT, "SSH session to " + target + " interrupted", e);
        } finally {
            if (channel != null) channel.disconnect();
            if (session != null) session.disconnect();
        }
    }

    /**
     * Map a JSch / socket fault to a {@link ProbeFailure}.
     * The first link in the cause chain that says something specific wins.
     */
    static ProbeFailure classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return ProbeFailure.TIMEOUT;
            }
            if (t instanceof NoRouteToHostException || t instanceof UnknownHostException) {
                return ProbeFailure.UNREACHABLE;
            }

            String msg = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (t instanceof ConnectException) {
                return msg.contains("refused") ? ProbeFailure.CONNECTION_REFUSED : ProbeFailure.UNREACHABLE;
            }
            if (msg.startsWith("timeout") || msg.contains("timed out")) {
                return ProbeFailure.TIMEOUT;
            }
            if (msg.startsWith("auth") || msg.contains("userauth fail")) {
                return ProbeFailure.AUTH_FAILED;
            }
            if (msg.contains("connection refused")) {
                return ProbeFailure.CONNECTION_REFUSED;
            }
            if (msg.contains("no route to host") || msg.contains("network is unreachable")
                    || msg.contains("unknownhostexception")) {
                return ProbeFailure.UNREACHABLE;
            }
        }
        return ProbeFailure.UNKNOWN;
    }
}
