package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.LockToken;

import java.util.Optional;

/**
 * Exclusive advisory lock guarding the status record's read-modify-write cycle.
 * Implementations decide how tokens are stored and when a held token counts
 * as abandoned; the store only polls {@link #tryAcquire(String)}.
 */
public interface StoreLock {

    String name();

    /**
     * Single, non-blocking acquisition attempt. Reclaims an abandoned token
     * if the implementation considers it stale.
     *
     * @return the token now held by {@code owner}, or empty if the lock is busy
     */
    Optional<LockToken> tryAcquire(String owner);

    /**
     * Release a token previously returned by {@link #tryAcquire(String)}.
     *
     * @return false if the token was no longer the current holder (e.g. reclaimed)
     */
    boolean release(LockToken token);

    /**
     * Current holder, if any.
     */
    Optional<LockToken> holder();
}
