package org.neuralchilli.planwright.service;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.planwright.config.PlanwrightConfig;
import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Runs reconciliation in the background whenever files below the deliverable
 * root change, and at a fixed interval in case change events are missed.
 * Disabled unless {@code planwright.reconciler.watch.enabled} is set.
 */
@ApplicationScoped
public class ReconciliationWatcher {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationWatcher.class);

    @Inject
    SchedulingService schedulingService;

    @Inject
    PlanwrightConfig config;

    private WatchService watchService;
    private ExecutorService executor;
    private volatile boolean running = false;

    void onStart(@Observes StartupEvent event) {
        PlanwrightConfig.Reconciler.Watch watch = config.reconciler().watch();
        if (!watch.enabled()) {
            log.info("Reconciliation watching is disabled");
            return;
        }

        try {
            start(Path.of(config.reconciler().root()), watch.interval(), watch.mode());
        } catch (IOException e) {
            log.error("Failed to start reconciliation watcher", e);
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    void start(Path root, Duration interval, ReconcileMode mode) throws IOException {
        watchService = FileSystems.getDefault().newWatchService();

        if (Files.isDirectory(root)) {
            try (Stream<Path> dirs = Files.walk(root)) {
                for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                    dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                }
            }
            log.info("Watching deliverables below {}", root);
        } else {
            log.warn("Deliverable root does not exist: {} (periodic reconciliation only)", root);
        }

        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "reconciliation-watcher");
            t.setDaemon(true);
            return t;
        });
        executor.submit(() -> watchLoop(interval, mode));

        log.info("Reconciliation watcher started: every {} or on change, {} mode", interval, mode);
    }

    private void watchLoop(Duration interval, ReconcileMode mode) {
        while (running) {
            try {
                WatchKey key = watchService.poll(interval.toMillis(), TimeUnit.MILLISECONDS);

                if (key != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (event.kind() == OVERFLOW) {
                            log.warn("Watch event overflow - reconciling anyway");
                        } else {
                            log.debug("Deliverable {}: {}", event.kind().name(), event.context());
                        }
                    }
                    if (!key.reset()) {
                        log.warn("Watch key for {} no longer valid", key.watchable());
                    }
                }

                reconcile(mode);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Reconciliation watcher interrupted");
                break;
            } catch (Exception e) {
                log.error("Error in reconciliation watch loop", e);
            }
        }
    }

    private void reconcile(ReconcileMode mode) {
        if (schedulingService.status().isEmpty()) {
            log.trace("Store not seeded yet, skipping reconciliation");
            return;
        }
        List<Discrepancy> discrepancies = schedulingService.applyReconciliation(mode);
        if (!discrepancies.isEmpty()) {
            log.info("Background reconciliation found {} discrepancies", discrepancies.size());
        }
    }

    void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Reconciliation watcher did not stop in 5 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service", e);
        }
        log.info("Reconciliation watcher stopped");
    }

    boolean isRunning() {
        return running;
    }
}
