package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.LockToken;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.service.LockTimeoutException;
import org.neuralchilli.planwright.service.StatusConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link StatusStore} serializing every read-modify-write through a {@link StoreLock}.
 *
 * Update cycle: acquire (polling at a fixed interval), read the latest
 * snapshot, optionally verify the caller's expected revision, apply the
 * mutator, reject shape changes, stamp, commit, notify listeners, release.
 * Nothing is committed unless every step before the commit succeeded.
 */
public class LockingStatusStore implements StatusStore {

    private static final Logger log = LoggerFactory.getLogger(LockingStatusStore.class);

    private final String name;
    private final SnapshotRepository snapshots;
    private final StoreLock lock;
    private final LockPolicy policy;
    private final Clock clock;
    private final List<CommitListener> listeners;

    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);
    private final AtomicLong ownerSequence = new AtomicLong();

    public LockingStatusStore(
            String name,
            SnapshotRepository snapshots,
            StoreLock lock,
            LockPolicy policy,
            Clock clock,
            List<CommitListener> listeners
    ) {
        this.name = name;
        this.snapshots = snapshots;
        this.lock = lock;
        this.policy = policy;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    public LockingStatusStore(String name, SnapshotRepository snapshots, StoreLock lock, LockPolicy policy) {
        this(name, snapshots, lock, policy, Clock.systemUTC(), List.of());
    }

    @Override
    public StatusRecord read() {
        return snapshots.load(name).orElseGet(StatusRecord::empty);
    }

    @Override
    public StatusRecord seed(StatusRecord definitions) {
        LockToken token = acquire(null);
        try {
            StatusRecord current = read();
            if (!current.isEmpty()) {
                if (current.sameShapeAs(definitions)) {
                    log.info("Store '{}' already seeded at revision {}", name, current.revision());
                    return current;
                }
                throw new IllegalStateException(
                        "Store '" + name + "' already holds different definitions");
            }
            // A restored record keeps its revisions; fresh definitions start at 1
            StatusRecord seeded = definitions.revision() > 0
                    ? commit(current.revision(), definitions.stamp(definitions, definitions.revision() + 1, clock.instant()))
                    : commit(current.revision(), definitions.stamp(null, 1L, clock.instant()));
            log.info("Seeded store '{}' with {} plans, {} phases",
                    name, seeded.plans().size(), seeded.phases().size());
            return seeded;
        } finally {
            release(token);
        }
    }

    @Override
    public StatusRecord update(StatusMutator mutator) {
        return execute(null, mutator, null);
    }

    @Override
    public StatusRecord update(long expectedRevision, StatusMutator mutator) {
        return execute(expectedRevision, mutator, null);
    }

    @Override
    public StatusRecord tryUpdate(StatusMutator mutator, Duration maxWait) {
        return execute(null, mutator, maxWait);
    }

    @Override
    public StatusRecord tryUpdate(long expectedRevision, StatusMutator mutator, Duration maxWait) {
        return execute(expectedRevision, mutator, maxWait);
    }

    @Override
    public StatusRecord tryUpdate(StatusMutator mutator) {
        return execute(null, mutator, policy.timeout());
    }

    private StatusRecord execute(Long expectedRevision, StatusMutator mutator, Duration maxWait) {
        LockToken token = acquire(maxWait);
        try {
            StatusRecord current = read();
            if (expectedRevision != null && current.revision() != expectedRevision) {
                throw new StatusConflictException(expectedRevision, current.revision());
            }

            StatusRecord proposed = mutator.apply(current);
            if (proposed == null) {
                throw new IllegalStateException("Mutator returned no record");
            }
            if (!proposed.sameShapeAs(current)) {
                throw new IllegalStateException(
                        "Mutator changed the shape of store '" + name + "'; only statuses may change");
            }
            if (proposed.equals(current)) {
                log.debug("No status changed in store '{}', revision stays {}", name, current.revision());
                return current;
            }
            return commit(current.revision(), proposed.stamp(current, current.revision() + 1, clock.instant()));
        } finally {
            release(token);
        }
    }

    private StatusRecord commit(long expectedRevision, StatusRecord next) {
        long nextRevision = next.revision();
        if (!snapshots.commit(name, expectedRevision, next)) {
            long actual = snapshots.load(name).map(StatusRecord::revision).orElse(0L);
            throw new StatusConflictException(expectedRevision, actual);
        }
        log.debug("Committed store '{}' revision {}", name, nextRevision);

        for (CommitListener listener : listeners) {
            try {
                listener.onCommit(next);
            } catch (RuntimeException e) {
                // The commit stands even when a listener fails
                log.error("Commit listener failed for store '{}' revision {}", name, nextRevision, e);
            }
        }
        return next;
    }

    /**
     * Poll for the lock. A null {@code maxWait} waits indefinitely.
     */
    private LockToken acquire(Duration maxWait) {
        String owner = instanceId + "-" + Thread.currentThread().getName() + "-" + ownerSequence.incrementAndGet();
        long started = System.nanoTime();

        while (true) {
            Optional<LockToken> token = lock.tryAcquire(owner);
            if (token.isPresent()) {
                log.trace("Acquired lock '{}' as {}", lock.name(), owner);
                return token.get();
            }

            Duration waited = Duration.ofNanos(System.nanoTime() - started);
            if (maxWait != null && waited.compareTo(maxWait) >= 0) {
                throw new LockTimeoutException(lock.name(), waited, currentHolder());
            }

            try {
                TimeUnit.MILLISECONDS.sleep(policy.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(lock.name(), Duration.ofNanos(System.nanoTime() - started),
                        currentHolder());
            }
        }
    }

    private String currentHolder() {
        return lock.holder().map(LockToken::owner).orElse(null);
    }

    private void release(LockToken token) {
        if (!lock.release(token)) {
            log.warn("Lock '{}' was no longer held by {} at release", lock.name(), token.owner());
        }
    }

    public String name() {
        return name;
    }
}
