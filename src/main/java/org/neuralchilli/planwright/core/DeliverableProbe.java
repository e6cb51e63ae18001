package org.neuralchilli.planwright.core;

import java.util.List;

/**
 * What an {@link EvidenceProvider} observed for one deliverable reference.
 *
 * @param reference         the deliverable reference as declared on the item
 * @param presence          what was found
 * @param content           file content for {@link Presence#FILE}, otherwise null
 * @param criteriaTotal     completion-criteria markers found in the content
 * @param criteriaSatisfied how many of them are checked off
 * @param candidates        matched paths, for {@link Presence#AMBIGUOUS}
 */
public record DeliverableProbe(
        String reference,
        Presence presence,
        String content,
        int criteriaTotal,
        int criteriaSatisfied,
        List<String> candidates
) {

    public enum Presence {
        ABSENT,
        FILE,
        /**
         * Exists but has no content to inspect (e.g. a directory)
         */
        UNINSPECTABLE,
        AMBIGUOUS
    }

    public DeliverableProbe {
        if (presence == null) {
            throw new IllegalArgumentException("Presence cannot be null");
        }
        if (criteriaSatisfied > criteriaTotal || criteriaSatisfied < 0) {
            throw new IllegalArgumentException(
                    "Satisfied criteria (" + criteriaSatisfied + ") out of range for " + criteriaTotal);
        }
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static DeliverableProbe absent(String reference) {
        return new DeliverableProbe(reference, Presence.ABSENT, null, 0, 0, List.of());
    }

    public static DeliverableProbe file(String reference, String content, int criteriaTotal, int criteriaSatisfied) {
        return new DeliverableProbe(reference, Presence.FILE, content, criteriaTotal, criteriaSatisfied, List.of());
    }

    public static DeliverableProbe uninspectable(String reference) {
        return new DeliverableProbe(reference, Presence.UNINSPECTABLE, null, 0, 0, List.of());
    }

    public static DeliverableProbe ambiguous(String reference, List<String> candidates) {
        return new DeliverableProbe(reference, Presence.AMBIGUOUS, null, 0, 0, candidates);
    }

    public boolean hasCriteria() {
        return criteriaTotal > 0;
    }

    public boolean exists() {
        return presence == Presence.FILE || presence == Presence.UNINSPECTABLE;
    }
}
