package relief.siting.core;

import java.util.Comparator;

/**
 * A cell scored for one tier. Produced fresh per allocator run and never modified.
 */
public final class ScoredCandidate {

    /** Highest efficiency first; equal scores fall back to ascending cell id. */
    public static final Comparator<ScoredCandidate> BY_EFFICIENCY =
            Comparator.comparingDouble((ScoredCandidate c) -> c.efficiencyScore)
                    .reversed()
                    .thenComparing(c -> c.cell.id);

    public final Cell cell;
    public final double efficiencyScore;
    public final double setupCost;
    public final double recurringCost; // monthly
    public final double expectedImpact; // people served

    public ScoredCandidate(
            Cell cell, double efficiencyScore, double setupCost, double recurringCost, double expectedImpact) {
        this.cell = cell;
        this.efficiencyScore = efficiencyScore;
        this.setupCost = setupCost;
        this.recurringCost = recurringCost;
        this.expectedImpact = expectedImpact;
    }

    @Override
    public String toString() {
        return String.format(
                "ScoredCandidate{%s, score=%.4f, setup=%.0f, recurring=%.0f, impact=%.0f}",
                cell.id, efficiencyScore, setupCost, recurringCost, expectedImpact);
    }
}
