package relief.siting.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import relief.siting.parameters.OptimizationParams;
import relief.siting.utils.DomainStatistics;
import relief.siting.utils.Log;
import relief.siting.utils.ProgressEvent;

/**
 * Runs both tiers end to end: depots first, then distribution points inside depot coverage,
 * then the feasibility pass over the combined plan.
 */
public final class SitingPipeline {

    public interface ProgressListener {
        void onProgress(ProgressEvent event);
    }

    public static final String STOPPED_REASON = "Optimization stopped";

    private final OptimizationParams params;
    private ProgressListener listener;
    private BooleanSupplier stopRequested = () -> false;

    public SitingPipeline(OptimizationParams params) {
        this.params = params;
    }

    public void setProgressListener(ProgressListener listener) {
        this.listener = listener;
    }

    public void setStopSignal(BooleanSupplier stopRequested) {
        this.stopRequested = stopRequested;
    }

    public OptimizationResult run(List<Cell> cells) {
        long start = System.currentTimeMillis();
        try {
            params.validate();
        } catch (IllegalArgumentException e) {
            Log.error("[Pipeline] Invalid parameters: %s", e.getMessage());
            emit(ProgressEvent.stage("initialization", "Orchestrator", "error", e.getMessage()));
            return OptimizationResult.failure("Invalid parameters: " + e.getMessage(), params.totalBudget, 0L);
        }
        Deadline deadline = Deadline.after(Duration.ofMillis(params.timeLimitMs)).orWhen(stopRequested);

        try {
            return execute(cells, deadline, start);
        } catch (InvariantViolationException e) {
            Log.error("[Pipeline] Invariant violated: %s", e.getMessage());
            emit(ProgressEvent.stage("finalization", "Orchestrator", "error", e.getMessage()));
            return OptimizationResult.failure(e.getMessage(), params.totalBudget, System.currentTimeMillis() - start);
        } catch (CancellationException e) {
            Log.warn("[Pipeline] %s", e.getMessage());
            emit(ProgressEvent.stage("finalization", "Orchestrator", "error", STOPPED_REASON));
            return OptimizationResult.failure(STOPPED_REASON, params.totalBudget, System.currentTimeMillis() - start);
        }
    }

    private OptimizationResult execute(List<Cell> cells, Deadline deadline, long start) {
        emit(ProgressEvent.stage("initialization", "Orchestrator", "starting", "Starting two-tier optimization")
                .with("totalBudget", params.totalBudget)
                .with("maxDepots", params.maxDepots)
                .with("maxFacilities", params.maxFacilities));

        List<Cell> pool = new ArrayList<>(cells.size());
        int dropped = 0;
        for (Cell c : cells) {
            if (c != null && c.population > 0 && c.isWellFormed()) pool.add(c);
            else dropped++;
        }
        if (dropped > 0) Log.warn("[Pipeline] Ignored %d empty or malformed cells", dropped);
        DomainStatistics stats = DomainStatistics.of(pool);
        emit(ProgressEvent.stage("data_collection", "Data Analysis", "completed",
                        String.format("%d usable cells, %d people", stats.totalCells, stats.totalPopulation))
                .with("totalCells", stats.totalCells)
                .with("ignoredCells", dropped)
                .with("totalPopulation", stats.totalPopulation)
                .with("highNeedCells", stats.highNeedCells));

        BudgetSplit split = BudgetSplit.of(params.totalBudget, params.depotBudgetFraction);
        TierSettings depotSettings = TierSettings.depot(params);
        TierSettings distributionSettings = TierSettings.distribution(params);
        FacilityAllocator.RoundListener rounds = this::onRound;

        // Depot tier
        FacilityAllocator.Allocation depotRun = null;
        List<Facility> depots = List.of();
        if (params.maxDepots > 0 && split.depotShare > 0 && !pool.isEmpty()) {
            emit(ProgressEvent.stage("depot_optimization", "Depot Allocator", "starting",
                            String.format("Selecting up to %d depots", params.maxDepots))
                    .with("budget", split.depotShare));
            EfficiencyScorer depotScorer =
                    new EfficiencyScorer(params.scoringWeights, params.needNormalization, depotSettings.costModel);
            FacilityAllocator allocator = new FacilityAllocator(
                    depotSettings,
                    new DepotClusterGenerator(depotScorer, params.depotPartitions, params.depotServiceRadius));
            allocator.setRoundListener(rounds);
            depotRun = allocator.allocate(pool, split.depotShare, deadline);
            depots = depotRun.facilities;
            emit(ProgressEvent.stage("depot_optimization", "Depot Allocator", "completed",
                            String.format("Selected %d depots", depots.size()))
                    .with("selected", depots.size())
                    .with("budgetUsed", depotRun.budgetUsed)
                    .with("stopReason", depotRun.stopReason.name()));
        } else {
            Log.info("[Pipeline] Depot tier skipped");
        }

        CoverageFilter coverageFilter = new CoverageFilter();
        CoverageFilter.Coverage coverage = coverageFilter.filter(depots, pool);
        emit(ProgressEvent.stage("coverage_filter", "Coverage Filter", "completed",
                        String.format("%d cells eligible for distribution points", coverage.eligibleCells.size()))
                .with("eligibleCells", coverage.eligibleCells.size())
                .with("constrained", coverage.constrained));

        // Distribution tier
        emit(ProgressEvent.stage("distribution_optimization", "Distribution Allocator", "starting",
                        String.format("Selecting up to %d distribution points", params.maxFacilities))
                .with("budget", split.distributionShare));
        EfficiencyScorer distributionScorer =
                new EfficiencyScorer(params.scoringWeights, params.needNormalization, distributionSettings.costModel);
        FacilityAllocator distributionAllocator =
                new FacilityAllocator(distributionSettings, new CellCandidateGenerator(distributionScorer));
        distributionAllocator.setRoundListener(rounds);
        FacilityAllocator.Allocation distributionRun =
                distributionAllocator.allocate(coverage.eligibleCells, split.distributionShare, deadline);
        coverageFilter.recordServedFacilities(coverage, depots, distributionRun.facilities);
        emit(ProgressEvent.stage("distribution_optimization", "Distribution Allocator", "completed",
                        String.format("Selected %d distribution points", distributionRun.facilities.size()))
                .with("selected", distributionRun.facilities.size())
                .with("budgetUsed", distributionRun.budgetUsed)
                .with("stopReason", distributionRun.stopReason.name()));

        if (deadline.stopRequested()) throw new CancellationException("Stop requested");

        List<Facility> proposed = new ArrayList<>(depots.size() + distributionRun.facilities.size());
        proposed.addAll(depots);
        proposed.addAll(distributionRun.facilities);
        emit(ProgressEvent.stage("feasibility_validation", "Validator", "in_progress",
                        String.format("Validating %d proposed facilities", proposed.size()))
                .with("proposed", proposed.size()));
        FeasibilityValidator validator =
                new FeasibilityValidator(depotSettings.amortization, distributionSettings.amortization);
        FeasibilityValidator.Report report = validator.validate(proposed, pool, split);
        emit(ProgressEvent.stage("feasibility_validation", "Validator", "completed",
                        String.format("%d facilities validated, %d adjustments",
                                report.facilities.size(), report.adjustmentsMade))
                .with("adjustmentsMade", report.adjustmentsMade)
                .with("coveragePercentage", report.coveragePercentage));

        int iterations = (depotRun == null ? 0 : depotRun.rounds) + distributionRun.rounds;
        boolean timedOut = (depotRun != null && depotRun.timedOut()) || distributionRun.timedOut();
        long elapsed = System.currentTimeMillis() - start;
        OptimizationResult result =
                OptimizationResult.success(report, params.totalBudget, iterations, timedOut, elapsed);
        Log.info("[Pipeline] Done in %d ms: %d depots, %d distribution points, impact %.1f, coverage %.1f%%%s",
                elapsed, result.depotCount, result.distributionCount, result.totalExpectedImpact,
                result.coveragePercentage, timedOut ? " (time limit reached)" : "");
        emit(ProgressEvent.stage("finalization", "Orchestrator", "completed", "Optimization complete")
                .with("facilities", result.facilities.size())
                .with("budgetUsed", result.budgetUsed)
                .with("timedOut", timedOut));
        return result;
    }

    private void onRound(Tier tier, int round, int added, int totalSelected, double remainingBudget) {
        String stage = tier == Tier.DEPOT ? "depot_optimization" : "distribution_optimization";
        String component = tier == Tier.DEPOT ? "Depot Allocator" : "Distribution Allocator";
        emit(new ProgressEvent("round", stage, component, "in_progress",
                        String.format("Round %d added %d", round, added))
                .with("round", round)
                .with("added", added)
                .with("totalSelected", totalSelected)
                .with("remainingBudget", remainingBudget));
    }

    private void emit(ProgressEvent event) {
        if (listener != null) listener.onProgress(event);
    }
}
