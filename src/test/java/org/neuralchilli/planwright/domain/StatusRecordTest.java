package org.neuralchilli.planwright.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusRecordTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Test
    void shouldOrderPlansByPhase() {
        // Given: plans declared out of phase order, one plan not listed by any phase
        StatusRecord record = StatusRecord.of(
                List.of(new Phase("first", null, List.of("b", "a")), new Phase("second", null, List.of("c"))),
                List.of(plan("c", "second"), plan("orphan", "second"), plan("a", "first"), plan("b", "first")));

        // When
        List<String> order = record.plansInPhaseOrder().stream().map(Plan::id).toList();

        // Then
        assertThat(order).containsExactly("b", "a", "c", "orphan");
    }

    @Test
    void shouldReplaceStatusWithoutTouchingOriginal() {
        StatusRecord record = sample();

        StatusRecord updated = record.withItemStatus(ItemRef.of("a", "x"), WorkStatus.COMPLETED);

        assertThat(updated.item(ItemRef.of("a", "x")).orElseThrow().status()).isEqualTo(WorkStatus.COMPLETED);
        assertThat(record.item(ItemRef.of("a", "x")).orElseThrow().status()).isEqualTo(WorkStatus.NOT_STARTED);
        assertThat(record.withItemStatus(ItemRef.of("a", "x"), WorkStatus.NOT_STARTED)).isSameAs(record);
        assertThatThrownBy(() -> record.withItemStatus(ItemRef.of("a", "ghost"), WorkStatus.FAILED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareShapeIgnoringStatus() {
        StatusRecord record = sample();

        assertThat(record.sameShapeAs(record.withItemStatus(ItemRef.of("a", "x"), WorkStatus.FAILED))).isTrue();
        assertThat(record.sameShapeAs(StatusRecord.of(record.phases(), List.of(plan("a", "first"))))).isFalse();
        assertThat(record.sameShapeAs(null)).isFalse();
    }

    @Test
    void shouldStampOnlyChangedItems() {
        // Given
        StatusRecord committed = sample().stamp(null, 1, NOW);
        StatusRecord changed = committed.withItemStatuses(Map.of(ItemRef.of("b", "x"), WorkStatus.IN_PROGRESS));

        // When
        StatusRecord stamped = changed.stamp(committed, 2, NOW.plusSeconds(5));

        // Then
        assertThat(stamped.revision()).isEqualTo(2);
        assertThat(stamped.lastUpdated()).isEqualTo(NOW.plusSeconds(5));
        assertThat(stamped.item(ItemRef.of("b", "x")).orElseThrow().revision()).isEqualTo(2);
        assertThat(stamped.item(ItemRef.of("a", "x")).orElseThrow().revision()).isEqualTo(1);
        assertThat(stamped.item(ItemRef.of("a", "x")).orElseThrow().lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void shouldSummarizeCounts() {
        StatusRecord record = sample().withItemStatus(ItemRef.of("a", "x"), WorkStatus.COMPLETED);

        StatusSummary summary = record.summary();

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.count(WorkStatus.COMPLETED)).isEqualTo(1);
        assertThat(summary.count(WorkStatus.BLOCKED)).isZero();
        assertThat(summary.allCompleted()).isFalse();
        assertThat(StatusRecord.empty().isEmpty()).isTrue();
        assertThat(StatusRecord.empty().summary().allCompleted()).isTrue();
    }

    private static StatusRecord sample() {
        return StatusRecord.of(
                List.of(new Phase("first", null, List.of("a", "b"))),
                List.of(plan("a", "first"), plan("b", "first")));
    }

    private static Plan plan(String id, String phase) {
        return new Plan(id, phase, List.of(WorkItem.builder("x").build()));
    }
}
