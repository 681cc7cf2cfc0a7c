package com.gdin.inspection.gsw.update;

import com.gdin.inspection.gsw.models.StateValue;

/**
 * Decides which value of a state key survives a merge.
 * When both values carry a parsed date the later date always wins (equal dates: incoming).
 * The policy only matters when that rule cannot decide.
 */
public enum StateConflictPolicy {

    /** later extraction wins */
    EXTRACTION_ORDER,

    /** higher confidence wins; missing or equal confidence falls back to extraction order */
    HIGHER_CONFIDENCE;

    public boolean incomingWins(StateValue existing, StateValue incoming) {
        if (existing == null) return true;
        if (incoming == null) return false;
        if (existing.hasTimestamp() && incoming.hasTimestamp()) {
            return !incoming.getDate().getParsed().isBefore(existing.getDate().getParsed());
        }
        if (this == HIGHER_CONFIDENCE && !existing.hasTimestamp() && !incoming.hasTimestamp()) {
            Double a = existing.getConfidence();
            Double b = incoming.getConfidence();
            if (a != null && b != null && !a.equals(b)) return b > a;
        }
        return true;
    }
}
