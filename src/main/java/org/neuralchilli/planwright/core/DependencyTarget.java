package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.Plan;

import java.util.Map;
import java.util.Optional;

/**
 * A resolved dependency identifier: either one work item or a whole plan.
 */
public sealed interface DependencyTarget {

    record OnItem(ItemRef ref) implements DependencyTarget {
    }

    record OnPlan(String planId) implements DependencyTarget {
    }

    /**
     * Resolve a declared dependency of an item in {@code owner}.
     * Order: same-plan item id, qualified {@code plan:item}, plan id.
     */
    static Optional<DependencyTarget> resolve(String declared, Plan owner, Map<String, Plan> plansById) {
        if (owner.hasItem(declared)) {
            return Optional.of(new OnItem(ItemRef.of(owner.id(), declared)));
        }
        if (ItemRef.isQualified(declared)) {
            ItemRef ref;
            try {
                ref = ItemRef.parse(declared);
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
            Plan other = plansById.get(ref.planId());
            if (other != null && other.hasItem(ref.itemId())) {
                return Optional.of(new OnItem(ref));
            }
            return Optional.empty();
        }
        if (plansById.containsKey(declared)) {
            return Optional.of(new OnPlan(declared));
        }
        return Optional.empty();
    }
}
