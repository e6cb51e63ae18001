package org.neuralchilli.planwright.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planwright.core.InMemoryStatusStores;
import org.neuralchilli.planwright.core.StatusMutator;
import org.neuralchilli.planwright.core.StatusStore;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Outcome;
import org.neuralchilli.planwright.domain.OutcomeKind;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkResult;
import org.neuralchilli.planwright.domain.WorkStatus;
import org.neuralchilli.planwright.service.ItemNotFoundException;
import org.neuralchilli.planwright.service.LockTimeoutException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionCoordinatorTest {

    private static final ItemRef A = ItemRef.of("p", "a");
    private static final ItemRef B = ItemRef.of("p", "b");
    private static final ItemRef C = ItemRef.of("p", "c");

    private StatusStore store;
    private Worker worker;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setup() {
        store = InMemoryStatusStores.create("coordinator-test");
        store.seed(definitions("a", "b", "c", "d", "e", "f"));
        worker = mock(Worker.class);
        coordinator = new ExecutionCoordinator(store, worker, "worker-test");
    }

    @Test
    void shouldRecordEveryResultInInputOrder() {
        // Given
        when(worker.execute(any(), eq(A))).thenReturn(WorkResult.success(Map.of()));
        when(worker.execute(any(), eq(B))).thenReturn(WorkResult.failure("compile error"));
        when(worker.execute(any(), eq(C))).thenReturn(WorkResult.incomplete("half way"));

        // When
        List<Outcome> outcomes = coordinator.dispatch(List.of(C, A, B), 3);

        // Then
        assertThat(outcomes).extracting(Outcome::ref).containsExactly(C, A, B);
        assertThat(outcomes).extracting(Outcome::kind)
                .containsExactly(OutcomeKind.INCOMPLETE, OutcomeKind.COMPLETED, OutcomeKind.FAILED);
        assertThat(outcomes).extracting(Outcome::revision).doesNotContainNull().doesNotHaveDuplicates();

        StatusRecord after = store.read();
        assertThat(after.revision()).isEqualTo(4L);
        assertThat(status(A)).isEqualTo(WorkStatus.COMPLETED);
        assertThat(status(B)).isEqualTo(WorkStatus.FAILED);
        assertThat(status(C)).isEqualTo(WorkStatus.IN_PROGRESS);
    }

    @Test
    void shouldRecordWorkerExceptionAsFailure() {
        when(worker.execute(any(), eq(A))).thenThrow(new IllegalStateException("worker crashed"));

        List<Outcome> outcomes = coordinator.dispatch(List.of(A), 1);

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.kind()).isEqualTo(OutcomeKind.FAILED);
            assertThat(o.message()).contains("worker crashed");
        });
        assertThat(status(A)).isEqualTo(WorkStatus.FAILED);
    }

    @Test
    void shouldNeverExceedConcurrencyLimit() {
        // Given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        when(worker.execute(any(), any())).thenAnswer(inv -> {
            threads.add(Thread.currentThread().getName());
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            TimeUnit.MILLISECONDS.sleep(40);
            running.decrementAndGet();
            return WorkResult.success(Map.of());
        });
        List<ItemRef> all = store.read().itemRefs();

        // When
        List<Outcome> outcomes = coordinator.dispatch(all, 2);

        // Then
        assertThat(outcomes).hasSize(6).allSatisfy(o -> assertThat(o.kind()).isEqualTo(OutcomeKind.COMPLETED));
        assertThat(peak.get()).isBetween(1, 2);
        assertThat(threads).allSatisfy(name -> assertThat(name).startsWith("worker-test-dispatch-"));
        assertThat(store.read().revision()).isEqualTo(7L);
    }

    @Test
    void shouldMakeEachResultVisibleBeforeBatchFinishes() throws Exception {
        // Given: b blocks until released, a returns at once
        CountDownLatch release = new CountDownLatch(1);
        when(worker.execute(any(), eq(A))).thenReturn(WorkResult.success(Map.of()));
        when(worker.execute(any(), eq(B))).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return WorkResult.success(Map.of());
        });

        // When
        CompletableFuture<List<Outcome>> batch = CompletableFuture.supplyAsync(() -> coordinator.dispatch(List.of(A, B), 2));

        // Then
        await().atMost(Duration.ofSeconds(3)).until(() -> status(A) == WorkStatus.COMPLETED);
        assertThat(status(B)).isEqualTo(WorkStatus.NOT_STARTED);
        assertThat(batch).isNotDone();

        release.countDown();
        assertThat(batch.get(5, TimeUnit.SECONDS)).extracting(Outcome::kind)
                .containsExactly(OutcomeKind.COMPLETED, OutcomeKind.COMPLETED);
    }

    @Test
    void shouldStopSubmittingAfterCancel() throws Exception {
        // Given: one slot, occupied by a until released
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(worker.execute(any(), eq(A))).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return WorkResult.success(Map.of());
        });
        CompletableFuture<List<Outcome>> batch = CompletableFuture.supplyAsync(() -> coordinator.dispatch(List.of(A, B, C), 1));
        assertThat(started.await(3, TimeUnit.SECONDS)).isTrue();

        // When
        coordinator.cancel();
        release.countDown();

        // Then
        List<Outcome> outcomes = batch.get(5, TimeUnit.SECONDS);
        assertThat(outcomes).extracting(Outcome::kind)
                .containsExactly(OutcomeKind.COMPLETED, OutcomeKind.NOT_DISPATCHED, OutcomeKind.NOT_DISPATCHED);
        assertThat(outcomes.get(1).isRecorded()).isFalse();
        assertThat(status(B)).isEqualTo(WorkStatus.NOT_STARTED);
        assertThat(status(C)).isEqualTo(WorkStatus.NOT_STARTED);
        verify(worker, never()).execute(any(), eq(B));
    }

    @Test
    void shouldRejectUnknownItemsBeforeDispatching() {
        assertThatThrownBy(() -> coordinator.dispatch(List.of(A, ItemRef.of("p", "ghost")), 2))
                .isInstanceOf(ItemNotFoundException.class)
                .hasMessageContaining("p:ghost");
        verify(worker, never()).execute(any(), any());
    }

    @Test
    void shouldValidateArguments() {
        assertThatThrownBy(() -> coordinator.dispatch(List.of(A), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(coordinator.dispatch(List.of(), 4)).isEmpty();
    }

    @Test
    void shouldReportOutcomeThatCouldNotBeRecorded() {
        // Given
        StatusStore busy = mock(StatusStore.class);
        when(busy.read()).thenReturn(store.read());
        when(busy.update(any(StatusMutator.class)))
                .thenThrow(new LockTimeoutException("status-lock", Duration.ofSeconds(10), "other"));
        when(worker.execute(any(), eq(A))).thenReturn(WorkResult.success(Map.of()));

        // When
        List<Outcome> outcomes = new ExecutionCoordinator(busy, worker, "worker-test").dispatch(List.of(A), 1);

        // Then
        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.kind()).isEqualTo(OutcomeKind.COMPLETED);
            assertThat(o.isRecorded()).isFalse();
            assertThat(o.message()).startsWith("Outcome not recorded");
        });
    }

    private WorkStatus status(ItemRef ref) {
        return store.read().item(ref).orElseThrow().status();
    }

    private static StatusRecord definitions(String... ids) {
        List<WorkItem> items = Arrays.stream(ids).map(id -> WorkItem.builder(id).build()).toList();
        return StatusRecord.of(
                List.of(new Phase("ph1", null, List.of("p"))),
                List.of(new Plan("p", "ph1", items)));
    }
}
