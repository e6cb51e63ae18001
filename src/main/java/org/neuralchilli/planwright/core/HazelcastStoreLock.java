package org.neuralchilli.planwright.core;

import com.hazelcast.map.IMap;
import org.neuralchilli.planwright.domain.LockToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link StoreLock} backed by a single entry in a Hazelcast map.
 *
 * Acquire is {@code putIfAbsent}; reclaiming a stale token is a conditional
 * {@code replace} against the exact token observed, so two contenders cannot
 * both reclaim the same abandoned lock. Release removes only the caller's own token.
 */
public class HazelcastStoreLock implements StoreLock {

    private static final Logger log = LoggerFactory.getLogger(HazelcastStoreLock.class);

    private final IMap<String, LockToken> tokens;
    private final String name;
    private final Duration staleness;
    private final Clock clock;

    public HazelcastStoreLock(IMap<String, LockToken> tokens, String name, Duration staleness, Clock clock) {
        this.tokens = tokens;
        this.name = name;
        this.staleness = staleness;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<LockToken> tryAcquire(String owner) {
        Instant now = clock.instant();
        LockToken fresh = LockToken.acquire(name, owner, now);

        LockToken existing = tokens.putIfAbsent(name, fresh);
        if (existing == null) {
            return Optional.of(fresh);
        }

        if (existing.isStale(now, staleness)) {
            LockToken reclaimed = new LockToken(name, owner, now, existing.owner());
            if (tokens.replace(name, existing, reclaimed)) {
                log.warn("Reclaimed stale lock '{}' from {} (held {}ms, threshold {}ms)",
                        name, existing.owner(), existing.age(now).toMillis(), staleness.toMillis());
                return Optional.of(reclaimed);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean release(LockToken token) {
        return tokens.remove(name, token);
    }

    @Override
    public Optional<LockToken> holder() {
        return Optional.ofNullable(tokens.get(name));
    }
}
