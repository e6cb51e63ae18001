package org.neuralchilli.planwright.service;

import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planwright.domain.Discrepancy;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.GraphStatistics;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Outcome;
import org.neuralchilli.planwright.domain.OutcomeKind;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.ReconcileMode;
import org.neuralchilli.planwright.domain.ScheduleResult;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class SchedulingServiceTest {

    private static final Path DELIVERABLES = Path.of("target/test-deliverables");

    @Inject
    SchedulingService service;

    @Inject
    HazelcastInstance hazelcast;

    @BeforeEach
    void setup() throws IOException {
        // Every test starts from an empty store
        hazelcast.getMap("planwright-snapshots").clear();
        hazelcast.getMap("planwright-locks").clear();
        Files.createDirectories(DELIVERABLES);
    }

    @AfterEach
    void cleanup() throws IOException {
        try (Stream<Path> paths = Files.walk(DELIVERABLES)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                if (!path.equals(DELIVERABLES)) {
                    Files.delete(path);
                }
            }
        }
    }

    @Test
    void shouldReturnSameSetFromDryRunAndFollowingRealRun() {
        // Given
        StatusRecord seeded = service.seed(definitions());

        // When
        ScheduleResult dryRun = service.listExecutable(null, null, 0, true);
        long afterDryRun = service.status().revision();
        ScheduleResult realRun = service.listExecutable(null, null, 0, false);

        // Then
        assertThat(afterDryRun).isEqualTo(seeded.revision());
        assertThat(realRun.executableRefs()).isEqualTo(dryRun.executableRefs());
        assertThat(realRun.blocked()).isEqualTo(dryRun.blocked());
        assertThat(realRun.executableRefs()).containsExactly(ItemRef.of("api", "schema"), ItemRef.of("api", "docs"));

        StatusRecord after = service.status();
        assertThat(after.revision()).isEqualTo(seeded.revision() + 1);
        assertThat(realRun.executableRefs())
                .allSatisfy(ref -> assertThat(after.item(ref).orElseThrow().status()).isEqualTo(WorkStatus.IN_PROGRESS));
        assertThat(service.listExecutable(null, null, 0, true).executableRefs()).isEmpty();
    }

    @Test
    void shouldNotWriteWhenNothingIsExecutable() {
        service.seed(definitions());
        service.listExecutable(null, null, 0, false);
        long claimed = service.status().revision();

        ScheduleResult again = service.listExecutable(null, null, 0, false);

        assertThat(again.isEmpty()).isTrue();
        assertThat(service.status().revision()).isEqualTo(claimed);
    }

    @Test
    void shouldApplyFiltersToExecutableSet() {
        service.seed(definitions());

        assertThat(service.listExecutable("api", null, 0, true).executableRefs())
                .containsExactly(ItemRef.of("api", "schema"), ItemRef.of("api", "docs"));
        assertThat(service.listExecutable("web", null, 0, true).executableRefs()).isEmpty();
        assertThat(service.listExecutable(null, Priority.CRITICAL, 0, true).executableRefs())
                .containsExactly(ItemRef.of("api", "schema"));
        assertThat(service.listExecutable(null, null, 1, true).executableRefs())
                .containsExactly(ItemRef.of("api", "schema"));
        assertThatThrownBy(() -> service.listExecutable("nope", null, 0, true))
                .isInstanceOf(PlanNotFoundException.class);
    }

    @Test
    void shouldRejectCyclicDefinitionsWithoutSeeding() {
        StatusRecord cyclic = StatusRecord.of(
                List.of(new Phase("ph1", null, List.of("p"))),
                List.of(new Plan("p", "ph1", List.of(
                        WorkItem.builder("x").dependsOn("y").build(),
                        WorkItem.builder("y").dependsOn("x").build()))));

        assertThatThrownBy(() -> service.seed(cyclic))
                .isInstanceOf(CycleDetectedException.class)
                .satisfies(e -> assertThat(((CycleDetectedException) e).cycle()).contains("p:x", "p:y"));
        assertThat(service.status().isEmpty()).isTrue();
    }

    @Test
    void shouldResolveReferencesWhenRecordingOutcome() {
        service.seed(definitions());

        Outcome byBareId = service.recordOutcome("schema", OutcomeKind.COMPLETED, "migrated");
        Outcome qualified = service.recordOutcome("web:shell", OutcomeKind.FAILED, null);

        assertThat(byBareId.ref()).isEqualTo(ItemRef.of("api", "schema"));
        assertThat(byBareId.isRecorded()).isTrue();
        assertThat(qualified.ref()).isEqualTo(ItemRef.of("web", "shell"));
        assertThat(qualified.revision()).isEqualTo(byBareId.revision() + 1);

        StatusRecord record = service.status();
        assertThat(record.item(ItemRef.of("api", "schema")).orElseThrow().status()).isEqualTo(WorkStatus.COMPLETED);
        assertThat(record.item(ItemRef.of("web", "shell")).orElseThrow().status()).isEqualTo(WorkStatus.FAILED);
    }

    @Test
    void shouldRejectUnresolvableReferences() {
        service.seed(definitions());

        assertThatThrownBy(() -> service.recordOutcome("docs", OutcomeKind.COMPLETED, null))
                .isInstanceOf(ItemNotFoundException.class)
                .hasMessageContaining("ambiguous")
                .hasMessageContaining("api:docs")
                .hasMessageContaining("web:docs");
        assertThatThrownBy(() -> service.recordOutcome("ghost", OutcomeKind.COMPLETED, null))
                .isInstanceOf(ItemNotFoundException.class);
        assertThatThrownBy(() -> service.recordOutcome("mobile:shell", OutcomeKind.COMPLETED, null))
                .isInstanceOf(PlanNotFoundException.class);
        assertThatThrownBy(() -> service.recordOutcome("api:ghost", OutcomeKind.COMPLETED, null))
                .isInstanceOf(ItemNotFoundException.class);
        assertThatThrownBy(() -> service.recordOutcome("api:schema", OutcomeKind.NOT_DISPATCHED, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRunCyclesUntilEverythingCompletes() {
        // Given: trial-run worker reports success for every item
        service.seed(definitions());

        // When
        List<Outcome> outcomes = service.runCycle(0);

        // Then
        assertThat(outcomes).hasSize(5).allSatisfy(o -> assertThat(o.kind()).isEqualTo(OutcomeKind.COMPLETED));
        assertThat(outcomes.get(outcomes.size() - 1).ref()).isEqualTo(ItemRef.of("web", "docs"));
        assertThat(service.status().summary().allCompleted()).isTrue();
    }

    @Test
    void shouldReportDeliverableDriftWithoutWriting() throws IOException {
        // Given
        service.seed(definitions());
        Files.writeString(DELIVERABLES.resolve("schema.md"), "Schema notes\nTODO: indexes\n");
        long before = service.status().revision();

        // When
        List<Discrepancy> report = service.applyReconciliation(ReconcileMode.REPORT);

        // Then
        assertThat(report).singleElement().satisfies(d -> {
            assertThat(d.ref()).isEqualTo(ItemRef.of("api", "schema"));
            assertThat(d.observed()).isEqualTo(WorkStatus.IN_PROGRESS);
        });
        assertThat(service.status().revision()).isEqualTo(before);

        service.applyReconciliation(ReconcileMode.APPLY);
        assertThat(service.status().revision()).isEqualTo(before + 1);
        assertThat(service.applyReconciliation(ReconcileMode.REPORT)).isEmpty();
    }

    @Test
    void shouldDescribeGraph() {
        service.seed(definitions());

        GraphStatistics statistics = service.statistics();

        assertThat(statistics.totalItems()).isEqualTo(5);
        assertThat(statistics.plans()).isEqualTo(2);
        assertThat(statistics.phases()).isEqualTo(2);
        assertThat(statistics.executionLevels()).isEqualTo(3);
    }

    /**
     * Phase "build" (critical gating) holds plan api; phase "ship" holds plan web.
     * schema is the only critical item, so web opens once schema completes.
     */
    private static StatusRecord definitions() {
        Plan api = new Plan("api", "build", List.of(
                WorkItem.builder("schema").priority(Priority.CRITICAL).deliverable("schema.md").build(),
                WorkItem.builder("handlers").dependsOn("schema").priority(Priority.HIGH).build(),
                WorkItem.builder("docs").build()));
        Plan web = new Plan("web", "ship", List.of(
                WorkItem.builder("shell").build(),
                WorkItem.builder("docs").dependsOn("shell", "api:docs").build()));
        return StatusRecord.of(
                List.of(
                        new Phase("build", GatingRule.CRITICAL_COMPLETED, List.of("api")),
                        new Phase("ship", null, List.of("web"))),
                List.of(api, web));
    }
}
