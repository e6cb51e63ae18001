package org.neuralchilli.planwright.service;

import java.util.List;
import java.util.Map;

public class ItemNotFoundException extends PlanwrightException {

    public ItemNotFoundException(String reference) {
        super(ErrorKind.ITEM_NOT_FOUND, "Work item not found: " + reference, Map.of("item", reference));
    }

    /**
     * An unqualified id matched items in several plans.
     */
    public ItemNotFoundException(String reference, List<String> candidates) {
        super(ErrorKind.ITEM_NOT_FOUND,
                "Work item id '" + reference + "' is ambiguous, qualify it as plan:item. Candidates: " + candidates,
                Map.of("item", reference, "candidates", List.copyOf(candidates)));
    }
}
