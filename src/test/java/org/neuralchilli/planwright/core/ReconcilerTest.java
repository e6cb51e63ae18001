package org.neuralchilli.planwright.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.planwright.domain.Confidence;
import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.DiscrepancyKind;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconcilerTest {

    private static final String SUBSTANTIAL = "A complete write-up with enough substance to count as done.";

    @TempDir
    Path root;

    private final Reconciler reconciler = Reconciler.withDefaultStrategies(
            new ContentThresholds(20, List.of("TODO", "TBD")));

    private StatusStore store;
    private AtomicReference<StatusRecord> current;
    private EvidenceProvider evidence;

    @BeforeEach
    void setup() {
        evidence = new FileSystemEvidenceProvider(root);
        current = new AtomicReference<>();
        store = mock(StatusStore.class);
        when(store.read()).thenAnswer(inv -> current.get());
        when(store.update(any(StatusMutator.class))).thenAnswer(inv -> {
            StatusMutator mutator = inv.getArgument(0);
            StatusRecord previous = current.get();
            StatusRecord next = mutator.apply(previous);
            current.set(new StatusRecord(previous.revision() + 1, previous.lastUpdated(), next.phases(), next.plans()));
            return current.get();
        });
    }

    @Test
    void shouldReportUnresolvedMarkerWithoutTouchingStore() throws IOException {
        // Given: T3 recorded COMPLETED but its deliverable still has a TODO
        write("t3.md", SUBSTANTIAL + "\nTODO: add the rollback section\n");
        current.set(record(item("T3", WorkStatus.COMPLETED, "t3.md")));

        // When
        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        // Then
        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.ref()).isEqualTo(ItemRef.of("P", "T3"));
            assertThat(d.kind()).isEqualTo(DiscrepancyKind.STATUS_DRIFT);
            assertThat(d.recorded()).isEqualTo(WorkStatus.COMPLETED);
            assertThat(d.observed()).isEqualTo(WorkStatus.IN_PROGRESS);
            assertThat(d.confidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(d.reason()).contains("TODO");
        });
        verify(store, never()).update(any(StatusMutator.class));
        assertThat(current.get().revision()).isEqualTo(1L);
    }

    @Test
    void shouldApplyAllCorrectionsInOneUpdate() throws IOException {
        // Given
        write("a.md", SUBSTANTIAL);
        write("b.md", "short");
        current.set(record(
                item("a", WorkStatus.NOT_STARTED, "a.md"),
                item("b", WorkStatus.NOT_STARTED, "b.md"),
                item("c", WorkStatus.IN_PROGRESS, "missing.md")));

        // When
        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.APPLY);

        // Then
        assertThat(discrepancies).extracting(Discrepancy::observed)
                .containsExactly(WorkStatus.COMPLETED, WorkStatus.IN_PROGRESS, WorkStatus.NOT_STARTED);
        verify(store, times(1)).update(any(StatusMutator.class));

        StatusRecord after = current.get();
        assertThat(after.revision()).isEqualTo(2L);
        assertThat(status(after, "a")).isEqualTo(WorkStatus.COMPLETED);
        assertThat(status(after, "b")).isEqualTo(WorkStatus.IN_PROGRESS);
        assertThat(status(after, "c")).isEqualTo(WorkStatus.NOT_STARTED);
    }

    @Test
    void shouldFindNothingOnSecondRunWithoutChanges() throws IOException {
        write("a.md", SUBSTANTIAL);
        write("b.md", "- [x] designed\n- [ ] reviewed\n");
        current.set(record(
                item("a", WorkStatus.NOT_STARTED, "a.md"),
                item("b", WorkStatus.NOT_STARTED, "b.md")));

        List<Discrepancy> first = reconciler.reconcile(store, null, evidence, ReconcileMode.APPLY);
        List<Discrepancy> second = reconciler.reconcile(store, null, evidence, ReconcileMode.APPLY);

        assertThat(first).hasSize(2);
        assertThat(second).isEmpty();
        verify(store, times(1)).update(any(StatusMutator.class));
    }

    @Test
    void shouldReportWildcardMatchingSeveralFilesAsAmbiguous() throws IOException {
        // Given
        write("notes/a.md", SUBSTANTIAL);
        write("notes/b.md", SUBSTANTIAL);
        current.set(record(item("n", WorkStatus.NOT_STARTED, "notes/*.md")));

        // When
        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.APPLY);

        // Then
        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiscrepancyKind.AMBIGUOUS);
            assertThat(d.observed()).isNull();
            assertThat(d.candidatePaths()).containsExactly("notes/a.md", "notes/b.md");
        });
        verify(store, never()).update(any(StatusMutator.class));
    }

    @Test
    void shouldReportWildcardMatchingNothingAsAmbiguous() {
        current.set(record(item("n", WorkStatus.IN_PROGRESS, "reports/*.md")));

        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiscrepancyKind.AMBIGUOUS);
            assertThat(d.candidatePaths()).isEmpty();
            assertThat(d.reason()).contains("does not resolve");
        });
    }

    @Test
    void shouldResolveWildcardMatchingExactlyOneFile() throws IOException {
        write("reports/final.md", SUBSTANTIAL);
        current.set(record(item("r", WorkStatus.IN_PROGRESS, "reports/*.md")));

        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).extracting(Discrepancy::observed).containsExactly(WorkStatus.COMPLETED);
    }

    @Test
    void shouldPreferCompletionCriteriaOverContent() throws IOException {
        // Content alone would look complete; the unchecked box says otherwise
        write("plan.md", SUBSTANTIAL + "\n- [x] schema\n- [ ] migration\n");
        current.set(record(item("m", WorkStatus.COMPLETED, "plan.md")));

        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.observed()).isEqualTo(WorkStatus.IN_PROGRESS);
            assertThat(d.confidence()).isEqualTo(Confidence.HIGH);
            assertThat(d.reason()).contains("1/2");
        });
    }

    @Test
    void shouldNotRegressStartedItemWhenNoCriteriaSatisfied() throws IOException {
        write("plan.md", "- [ ] schema\n- [ ] migration\n");
        current.set(record(
                item("started", WorkStatus.IN_PROGRESS, "plan.md"),
                item("fresh", WorkStatus.NOT_STARTED, "plan.md")));

        assertThat(reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT)).isEmpty();
    }

    @Test
    void shouldTreatDirectoryAsPresentButNeverCompleted() throws IOException {
        Files.createDirectories(root.resolve("out/site"));
        current.set(record(item("site", WorkStatus.COMPLETED, "out/site")));

        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.observed()).isEqualTo(WorkStatus.IN_PROGRESS);
            assertThat(d.confidence()).isEqualTo(Confidence.LOW);
        });
    }

    @Test
    void shouldKeepFailedItemUnlessEvidenceShowsCompletion() throws IOException {
        write("stub.md", "TBD");
        write("done.md", SUBSTANTIAL);
        current.set(record(
                item("failed-stub", WorkStatus.FAILED, "stub.md"),
                item("failed-missing", WorkStatus.FAILED, "nothing.md"),
                item("blocked-done", WorkStatus.BLOCKED, "done.md")));

        List<Discrepancy> discrepancies = reconciler.reconcile(store, null, evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).singleElement().satisfies(d -> {
            assertThat(d.ref()).isEqualTo(ItemRef.of("P", "blocked-done"));
            assertThat(d.observed()).isEqualTo(WorkStatus.COMPLETED);
        });
    }

    @Test
    void shouldSkipItemsWithoutDeliverableAndOutsideScope() throws IOException {
        write("a.md", SUBSTANTIAL);
        current.set(record(
                item("a", WorkStatus.NOT_STARTED, "a.md"),
                item("b", WorkStatus.NOT_STARTED, "a.md"),
                item("no-deliverable", WorkStatus.COMPLETED, null)));

        List<Discrepancy> discrepancies = reconciler.reconcile(
                store, List.of(ItemRef.of("P", "b"), ItemRef.of("P", "no-deliverable")), evidence, ReconcileMode.REPORT);

        assertThat(discrepancies).extracting(Discrepancy::ref).containsExactly(ItemRef.of("P", "b"));
    }

    @Test
    void shouldLeaveItemAloneWhenItChangedSinceInspection() throws IOException {
        // Given: evidence says COMPLETED, but a worker marks the item FAILED before the correction lands
        write("a.md", SUBSTANTIAL);
        StatusRecord inspected = record(item("a", WorkStatus.IN_PROGRESS, "a.md"));
        current.set(inspected);
        when(store.read()).thenAnswer(inv -> {
            StatusRecord snapshot = current.get();
            current.set(snapshot.withItemStatus(ItemRef.of("P", "a"), WorkStatus.FAILED));
            return snapshot;
        });

        // When
        reconciler.reconcile(store, null, evidence, ReconcileMode.APPLY);

        // Then
        assertThat(status(current.get(), "a")).isEqualTo(WorkStatus.FAILED);
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static WorkItem item(String id, WorkStatus status, String deliverable) {
        return WorkItem.builder(id).status(status).deliverable(deliverable).build();
    }

    private static StatusRecord record(WorkItem... items) {
        StatusRecord definitions = StatusRecord.of(
                List.of(new Phase("ph1", null, List.of("P"))),
                List.of(new Plan("P", "ph1", List.of(items))));
        return new StatusRecord(1L, null, definitions.phases(), definitions.plans());
    }

    private static WorkStatus status(StatusRecord record, String itemId) {
        return record.item(ItemRef.of("P", itemId)).orElseThrow().status();
    }
}
