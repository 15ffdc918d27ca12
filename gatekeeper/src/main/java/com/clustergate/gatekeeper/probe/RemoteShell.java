package com.clustergate.gatekeeper.probe;

import java.time.Duration;

/**
 * Password-authenticated remote command execution.
 *
 * Implementations translate their transport's faults into
 * {@link RemoteShellException} so no library exception type leaks out.
 */
public interface RemoteShell {

    /**
     * Open a session to {@code target}, run {@code command}, close the session.
     *
     * @param timeout bound for connecting and for the command to finish
     * @throws RemoteShellException if the session cannot be opened or the command does not finish in time
     */
    void execute(RemoteTarget target, String command, Duration timeout);
}
