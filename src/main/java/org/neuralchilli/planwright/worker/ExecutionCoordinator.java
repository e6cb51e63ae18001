package org.neuralchilli.planwright.worker;

import org.neuralchilli.planwright.core.StatusStore;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Outcome;
import org.neuralchilli.planwright.domain.OutcomeKind;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkResult;
import org.neuralchilli.planwright.domain.WorkStatus;
import org.neuralchilli.planwright.service.ItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dispatches items to a {@link Worker} through a bounded pool.
 *
 * At most {@code concurrencyLimit} items run at once. Each reported result is
 * written with its own store update as soon as it arrives, so other readers see
 * partial progress. Failures are recorded as FAILED and never retried here.
 *
 * Cancellation is cooperative: {@link #cancel()} stops further submissions;
 * running workers finish and are recorded, unsubmitted items come back as
 * NOT_DISPATCHED with their status untouched.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final StatusStore store;
    private final Worker worker;
    private final String workerId;

    private volatile AtomicBoolean currentBatch = new AtomicBoolean(false);

    public ExecutionCoordinator(StatusStore store, Worker worker, String workerId) {
        this.store = store;
        this.worker = worker;
        this.workerId = workerId;
    }

    /**
     * Run every item in {@code refs} and report one outcome per item, in input order.
     *
     * @throws ItemNotFoundException if any reference is unknown; nothing is dispatched then
     */
    public List<Outcome> dispatch(List<ItemRef> refs, int concurrencyLimit) {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + concurrencyLimit);
        }
        if (refs.isEmpty()) {
            return List.of();
        }

        StatusRecord snapshot = store.read();
        List<WorkItem> items = new ArrayList<>(refs.size());
        for (ItemRef ref : refs) {
            items.add(snapshot.item(ref).orElseThrow(() -> new ItemNotFoundException(ref.toString())));
        }

        AtomicBoolean cancelled = new AtomicBoolean(false);
        currentBatch = cancelled;

        int threads = Math.min(concurrencyLimit, refs.size());
        log.info("Dispatching {} items on {} threads", refs.size(), threads);

        Outcome[] outcomes = new Outcome[refs.size()];
        List<Future<?>> futures = new ArrayList<>(refs.size());
        Semaphore slots = new Semaphore(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(workerId));

        try {
            for (int i = 0; i < refs.size(); i++) {
                ItemRef ref = refs.get(i);
                if (!awaitSlot(slots, cancelled)) {
                    log.info("Dispatch cancelled, {} items not submitted", refs.size() - i);
                    for (int j = i; j < refs.size(); j++) {
                        outcomes[j] = Outcome.notDispatched(refs.get(j));
                    }
                    break;
                }

                int index = i;
                WorkItem item = items.get(i);
                futures.add(executor.submit(() -> {
                    try {
                        outcomes[index] = run(item, ref);
                    } finally {
                        slots.release();
                    }
                }));
            }

            awaitAll(futures);
        } finally {
            executor.shutdown();
        }

        List<Outcome> result = Arrays.asList(outcomes);
        log.info("Dispatch finished: {}", summarize(result));
        return result;
    }

    /**
     * Stop submitting items from the batch in progress.
     */
    public void cancel() {
        log.info("Cancelling dispatch");
        currentBatch.set(true);
    }

    private boolean awaitSlot(Semaphore slots, AtomicBoolean cancelled) {
        try {
            while (!cancelled.get()) {
                if (slots.tryAcquire(50, TimeUnit.MILLISECONDS)) {
                    if (cancelled.get()) {
                        slots.release();
                        return false;
                    }
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            return false;
        }
    }

    private Outcome run(WorkItem item, ItemRef ref) {
        String threadName = Thread.currentThread().getName();
        log.info("[{}] Executing: {}", threadName, ref);
        Instant start = Instant.now();

        WorkResult result;
        try {
            result = worker.execute(item, ref);
            if (result == null) {
                result = WorkResult.failure("Worker returned no result");
            }
        } catch (RuntimeException e) {
            log.error("[{}] Exception executing {}", threadName, ref, e);
            result = WorkResult.failure("Exception: " + e.getMessage());
        }

        Duration duration = Duration.between(start, Instant.now());
        OutcomeKind kind = OutcomeKind.from(result.kind());
        WorkStatus status = result.toStatus();

        try {
            StatusRecord committed = store.update(current -> current.withItemStatus(ref, status));
            log.info("[{}] {}: {} ({}ms, revision {})",
                    threadName, ref, kind, duration.toMillis(), committed.revision());
            return new Outcome(ref, kind, result.message(), committed.revision(), duration);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to record {} for {}", threadName, kind, ref, e);
            return new Outcome(ref, kind, "Outcome not recorded: " + e.getMessage(), null, duration);
        }
    }

    private void awaitAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Dispatch task failed unexpectedly", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                currentBatch.set(true);
                throw new IllegalStateException("Interrupted while waiting for dispatched items", e);
            }
        }
    }

    private static String summarize(List<Outcome> outcomes) {
        StringBuilder summary = new StringBuilder();
        for (OutcomeKind kind : OutcomeKind.values()) {
            long count = outcomes.stream().filter(o -> o.kind() == kind).count();
            if (count > 0) {
                if (summary.length() > 0) {
                    summary.append(", ");
                }
                summary.append(count).append(' ').append(kind);
            }
        }
        return summary.toString();
    }
}
