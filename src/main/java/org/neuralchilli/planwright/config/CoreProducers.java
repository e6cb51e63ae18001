package org.neuralchilli.planwright.config;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.planwright.core.CachedGraph;
import org.neuralchilli.planwright.core.CommitListener;
import org.neuralchilli.planwright.core.ContentThresholds;
import org.neuralchilli.planwright.core.DependencyGraphBuilder;
import org.neuralchilli.planwright.core.EvidenceProvider;
import org.neuralchilli.planwright.core.FileSystemEvidenceProvider;
import org.neuralchilli.planwright.core.HazelcastSnapshotRepository;
import org.neuralchilli.planwright.core.HazelcastStoreLock;
import org.neuralchilli.planwright.core.LockPolicy;
import org.neuralchilli.planwright.core.LockingStatusStore;
import org.neuralchilli.planwright.core.Reconciler;
import org.neuralchilli.planwright.core.Scheduler;
import org.neuralchilli.planwright.core.StatusFileMirror;
import org.neuralchilli.planwright.core.StatusStore;
import org.neuralchilli.planwright.domain.LockToken;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.serializer.StatusRecordCodec;
import org.neuralchilli.planwright.worker.CommandWorker;
import org.neuralchilli.planwright.worker.ExecutionCoordinator;
import org.neuralchilli.planwright.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns configuration into the plain core objects. Core classes take their
 * collaborators through constructors and know nothing about CDI.
 */
@ApplicationScoped
public class CoreProducers {

    private static final Logger log = LoggerFactory.getLogger(CoreProducers.class);

    static final String SNAPSHOT_MAP = "planwright-snapshots";
    static final String LOCK_MAP = "planwright-locks";

    @Inject
    PlanwrightConfig config;

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    CachedGraph cachedGraph() {
        DependencyGraphBuilder builder = new DependencyGraphBuilder(config.scheduler().defaultGatingRule());
        return new CachedGraph(builder::build);
    }

    @Produces
    @Singleton
    Scheduler scheduler() {
        return new Scheduler();
    }

    @Produces
    @Singleton
    StatusRecordCodec statusRecordCodec() {
        return new StatusRecordCodec();
    }

    @Produces
    @Singleton
    StatusStore statusStore(HazelcastInstance hazelcast, StatusRecordCodec codec, Clock clock) {
        PlanwrightConfig.Store store = config.store();
        LockPolicy policy = new LockPolicy(
                store.lock().pollInterval(),
                store.lock().timeout(),
                store.lock().staleness()
        );

        IMap<String, StatusRecord> snapshots = hazelcast.getMap(SNAPSHOT_MAP);
        IMap<String, LockToken> locks = hazelcast.getMap(LOCK_MAP);

        Optional<StatusFileMirror> mirror = store.file()
                .map(file -> new StatusFileMirror(Path.of(file), codec));
        List<CommitListener> listeners = new ArrayList<>();
        mirror.ifPresent(listeners::add);

        LockingStatusStore statusStore = new LockingStatusStore(
                store.name(),
                new HazelcastSnapshotRepository(snapshots),
                new HazelcastStoreLock(locks, store.name() + "-lock", policy.staleness(), clock),
                policy,
                clock,
                listeners
        );
        log.info("Status store '{}' ready (poll {}, timeout {}, staleness {}, file {})",
                store.name(), policy.pollInterval(), policy.timeout(), policy.staleness(),
                store.file().orElse("none"));

        mirror.flatMap(StatusFileMirror::load).ifPresent(statusStore::seed);
        return statusStore;
    }

    @Produces
    @Singleton
    Reconciler reconciler() {
        PlanwrightConfig.Reconciler reconciler = config.reconciler();
        return Reconciler.withDefaultStrategies(
                new ContentThresholds(reconciler.minLength(), reconciler.unresolvedMarkers()));
    }

    @Produces
    @Singleton
    EvidenceProvider evidenceProvider() {
        return new FileSystemEvidenceProvider(Path.of(config.reconciler().root()));
    }

    @Produces
    @Singleton
    Worker worker() {
        PlanwrightConfig.Worker worker = config.worker();
        List<String> command = worker.command().orElse(List.of());
        if (command.isEmpty() && !worker.trialRun()) {
            log.warn("No planwright.worker.command configured; dispatched items will fail");
        }
        return new CommandWorker(command, worker.trialRun(), worker.timeout(), worker.incompleteExitCode());
    }

    @Produces
    @Singleton
    ExecutionCoordinator executionCoordinator(StatusStore store, Worker worker) {
        return new ExecutionCoordinator(store, worker, config.coordinator().workerId());
    }
}
