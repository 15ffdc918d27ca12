package com.clustergate.gatekeeper.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link DeploymentLock} backed by a marker file.
 *
 * The marker's presence is the only lock state: nothing is cached in memory,
 * so a restarted gate sees a deployment that was running before the restart.
 * The flip side is that a marker left behind by a crash stays until an
 * operator releases it. It is reported at startup but never expired.
 *
 * All three operations run under one mutex so check-then-create and
 * check-then-delete never interleave within this process. Across processes
 * the empty marker is created atomically ({@link Files#createFile}), so a
 * second process racing on the same path loses cleanly instead of
 * overwriting.
 */
public class FileDeploymentLock implements DeploymentLock {

    private static final Logger log = LoggerFactory.getLogger(FileDeploymentLock.class);

    private final Path          marker;
    private final ReentrantLock mutex = new ReentrantLock();

    public FileDeploymentLock(Path marker) {
        this.marker = marker.toAbsolutePath().normalize();
        if (Files.exists(this.marker)) {
            log.warn("Deployment lock marker {} already exists. If no deployment is running, "
                    + "release it manually (DELETE /gate/lock).", this.marker);
        }
    }

    public Path marker() {
        return marker;
    }

    @Override
    public boolean isLocked() {
        mutex.lock();
        try {
            return Files.exists(marker);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean acquire() {
        mutex.lock();
        try {
            if (Files.exists(marker)) {
                return false;
            }
            Path parent = marker.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Empty marker: creation is the whole acquire, no write can fail after it.
            try {
                Files.createFile(marker);
            } catch (FileAlreadyExistsException e) {
                // another process created it between our check and create
                return false;
            }
            log.info("Deployment lock acquired ({})", marker);
            return true;
        } catch (IOException e) {
            throw new DeploymentLockException("Could not create lock marker " + marker, e);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean release() {
        mutex.lock();
        try {
            boolean released = Files.deleteIfExists(marker);
            if (released) {
                log.info("Deployment lock released ({})", marker);
            }
            return released;
        } catch (IOException e) {
            throw new DeploymentLockException("Could not delete lock marker " + marker, e);
        } finally {
            mutex.unlock();
        }
    }
}
