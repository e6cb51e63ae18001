package org.neuralchilli.planwright.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemRefTest {

    @Test
    void shouldParseQualifiedForm() {
        ItemRef ref = ItemRef.parse("api:schema");

        assertThat(ref.planId()).isEqualTo("api");
        assertThat(ref.itemId()).isEqualTo("schema");
        assertThat(ref.toString()).isEqualTo("api:schema");
    }

    @Test
    void shouldSplitOnFirstSeparatorOnly() {
        ItemRef ref = ItemRef.parse("api:v2:schema");

        assertThat(ref.planId()).isEqualTo("api");
        assertThat(ref.itemId()).isEqualTo("v2:schema");
    }

    @Test
    void shouldRejectMalformedReferences() {
        assertThatThrownBy(() -> ItemRef.parse("schema")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ItemRef.parse(":schema")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ItemRef.parse("api:")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ItemRef.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ItemRef.of(" ", "a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDetectQualifiedText() {
        assertThat(ItemRef.isQualified("api:schema")).isTrue();
        assertThat(ItemRef.isQualified("schema")).isFalse();
        assertThat(ItemRef.isQualified(":schema")).isFalse();
        assertThat(ItemRef.isQualified(null)).isFalse();
    }

    @Test
    void shouldOrderByPlanThenItem() {
        assertThat(ItemRef.of("a", "z")).isLessThan(ItemRef.of("b", "a"));
        assertThat(ItemRef.of("a", "a")).isLessThan(ItemRef.of("a", "b"));
        assertThat(ItemRef.of("a", "a").compareTo(ItemRef.parse("a:a"))).isZero();
    }
}
