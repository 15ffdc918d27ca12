package com.clustergate.gatekeeper.lock;

/**
 * Single-flight guard: at most one deployment in progress at a time.
 *
 * Non-blocking. {@link #acquire()} either takes the lock immediately or
 * reports that someone else holds it; callers never wait or queue.
 *
 * State machine:
 * <pre>
 *   UNLOCKED --acquire()=true--> LOCKED --release()=true--> UNLOCKED
 *   LOCKED   --acquire()=false-> LOCKED
 *   UNLOCKED --release()=false-> UNLOCKED
 * </pre>
 */
public interface DeploymentLock {

    /** True iff a deployment currently holds the lock. */
    boolean isLocked();

    /**
     * Take the lock if it is free.
     *
     * @return true if this call took the lock, false if it was already held
     * @throws DeploymentLockException if the lock's backing store cannot be written
     */
    boolean acquire();

    /**
     * Drop the lock if it is held.
     *
     * @return true if a held lock was released, false if it was already free
     * @throws DeploymentLockException if the lock's backing store cannot be written
     */
    boolean release();
}
