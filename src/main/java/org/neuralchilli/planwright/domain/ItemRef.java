package org.neuralchilli.planwright.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import java.io.Serializable;

/**
 * Fully qualified address of a work item. Item identifiers are only unique
 * within their plan, so the plan id is always part of the address.
 */
public record ItemRef(String planId, String itemId) implements Serializable, Comparable<ItemRef> {

    public static final char SEPARATOR = ':';

    public ItemRef {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("Plan id cannot be null or empty");
        }
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("Item id cannot be null or empty");
        }
    }

    public static ItemRef of(String planId, String itemId) {
        return new ItemRef(planId, itemId);
    }

    /**
     * Parse the {@code plan:item} text form.
     */
    @JsonCreator
    public static ItemRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Item reference cannot be null");
        }
        int idx = text.indexOf(SEPARATOR);
        if (idx <= 0 || idx == text.length() - 1) {
            throw new IllegalArgumentException(
                    "Item reference must have the form plan" + SEPARATOR + "item, got: " + text);
        }
        return new ItemRef(text.substring(0, idx), text.substring(idx + 1));
    }

    /**
     * Check whether the text is a qualified {@code plan:item} reference.
     */
    public static boolean isQualified(String text) {
        return text != null && text.indexOf(SEPARATOR) > 0;
    }

    @Override
    public int compareTo(ItemRef other) {
        int byPlan = planId.compareTo(other.planId);
        return byPlan != 0 ? byPlan : itemId.compareTo(other.itemId);
    }

    @Nonnull
    @JsonValue
    @Override
    public String toString() {
        return planId + SEPARATOR + itemId;
    }
}
