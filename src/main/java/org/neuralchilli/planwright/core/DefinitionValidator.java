package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.service.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates plan and phase definitions before a graph is built.
 * Checks identifier uniqueness, phase membership and dependency references.
 * Cycles are left to the graph builder.
 */
public class DefinitionValidator {

    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(List<Plan> plans, List<Phase> phases) {
        List<String> errors = new ArrayList<>();

        Map<String, Phase> phasesById = new HashMap<>();
        for (Phase phase : phases) {
            if (phasesById.putIfAbsent(phase.id(), phase) != null) {
                errors.add("Duplicate phase id '" + phase.id() + "'");
            }
        }

        Map<String, Plan> plansById = new HashMap<>();
        for (Plan plan : plans) {
            if (plansById.putIfAbsent(plan.id(), plan) != null) {
                errors.add("Duplicate plan id '" + plan.id() + "'");
            }
        }

        validatePhaseMembership(plans, phases, phasesById, plansById, errors);
        validateDependencies(plans, plansById, errors);

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void validatePhaseMembership(
            List<Plan> plans,
            List<Phase> phases,
            Map<String, Phase> phasesById,
            Map<String, Plan> plansById,
            List<String> errors
    ) {
        Set<String> listed = new HashSet<>();
        for (Phase phase : phases) {
            for (String planId : phase.planIds()) {
                Plan plan = plansById.get(planId);
                if (plan == null) {
                    errors.add("Phase '" + phase.id() + "' lists plan '" + planId + "' which is not defined");
                } else if (!plan.phaseId().equals(phase.id())) {
                    errors.add("Phase '" + phase.id() + "' lists plan '" + planId
                            + "' which belongs to phase '" + plan.phaseId() + "'");
                }
                if (!listed.add(planId)) {
                    errors.add("Plan '" + planId + "' is listed by more than one phase entry");
                }
            }
        }

        for (Plan plan : plans) {
            Phase phase = phasesById.get(plan.phaseId());
            if (phase == null) {
                errors.add("Plan '" + plan.id() + "' belongs to phase '" + plan.phaseId() + "' which is not defined");
            } else if (!phase.planIds().contains(plan.id())) {
                errors.add("Plan '" + plan.id() + "' is not listed by its phase '" + phase.id() + "'");
            }
        }
    }

    private void validateDependencies(List<Plan> plans, Map<String, Plan> plansById, List<String> errors) {
        for (Plan plan : plans) {
            for (WorkItem item : plan.items()) {
                for (String dependency : item.dependsOn()) {
                    if (DependencyTarget.resolve(dependency, plan, plansById).isEmpty()) {
                        errors.add("Item '" + plan.ref(item) + "' depends on '" + dependency
                                + "' which is neither an item of this plan, a plan:item reference nor a plan");
                    }
                }
            }
        }
    }
}
