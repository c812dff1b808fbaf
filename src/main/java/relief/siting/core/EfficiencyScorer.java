package relief.siting.core;

import java.util.Optional;
import relief.siting.parameters.ScoringWeights;

/**
 * Multi-factor suitability score for a single cell:
 * <pre>
 *   score = w.need * (need / needNormalization)
 *         + w.accessBarrier * (1 - vehicleAccessRate)
 *         + w.poverty * povertyRate
 * </pre>
 * Costs and expected impact come from the tier's {@link CostModel}. Stateless and safe to
 * call from several threads.
 */
public final class EfficiencyScorer {

    private final ScoringWeights weights;
    private final double needNormalization;
    private final CostModel costModel;

    public EfficiencyScorer(ScoringWeights weights, double needNormalization, CostModel costModel) {
        this.weights = weights;
        this.needNormalization = needNormalization;
        this.costModel = costModel;
    }

    public CostModel costModel() {
        return costModel;
    }

    /**
     * Scores a cell. Unpopulated or malformed cells yield no candidate.
     */
    public Optional<ScoredCandidate> score(Cell cell) {
        if (cell == null || cell.population <= 0 || !cell.isWellFormed()) {
            return Optional.empty();
        }
        double impact = costModel.expectedImpact(cell);
        return Optional.of(new ScoredCandidate(
                cell, efficiency(cell), costModel.setupCost(impact), costModel.recurringCost(impact), impact));
    }

    /**
     * Weighted score only, for callers that build their own candidate around the cell. The cell
     * is not checked here, so ratios outside [0, 1] are clamped.
     */
    public double efficiency(Cell cell) {
        double needFactor = cell.needIndex / needNormalization;
        double accessBarrier = 1.0 - clamp01(cell.vehicleAccessRate);
        double poverty = clamp01(cell.povertyRate);
        return weights.need * needFactor + weights.accessBarrier * accessBarrier + weights.poverty * poverty;
    }

    private static double clamp01(double v) {
        if (v < 0) return 0;
        if (v > 1) return 1;
        return v;
    }
}
