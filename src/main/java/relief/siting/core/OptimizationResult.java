package relief.siting.core;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one pipeline run. Failures carry a reason and no facilities.
 */
public final class OptimizationResult {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public final Status status;
    public final String reason; // null on success
    public final List<Facility> facilities; // depots first, then distribution points
    public final int depotCount;
    public final int distributionCount;
    public final double totalExpectedImpact;
    public final double budgetUsed;
    public final double budgetRemaining;
    public final double depotBudgetUsed;
    public final double distributionBudgetUsed;
    public final double coveragePercentage;
    public final double depotCoveragePercentage;
    public final int cellsCovered;
    public final int totalCells;
    public final int iterations;
    public final int adjustmentsMade;
    public final double meanEfficiencyScore;
    public final boolean timedOut;
    public final long elapsedMs;
    public final String timestamp;

    private OptimizationResult(
            Status status,
            String reason,
            List<Facility> facilities,
            double totalBudget,
            FeasibilityValidator.Report report,
            int iterations,
            boolean timedOut,
            long elapsedMs) {
        this.status = status;
        this.reason = reason;
        this.facilities = Collections.unmodifiableList(facilities);
        int depots = 0;
        double scoreSum = 0.0;
        for (Facility f : facilities) {
            if (f.tier == Tier.DEPOT) depots++;
            scoreSum += f.efficiencyScore;
        }
        this.depotCount = depots;
        this.distributionCount = facilities.size() - depots;
        this.meanEfficiencyScore = facilities.isEmpty() ? 0.0 : scoreSum / facilities.size();
        this.totalExpectedImpact = report == null ? 0.0 : report.totalExpectedImpact;
        this.budgetUsed = report == null ? 0.0 : report.budgetUsed;
        this.budgetRemaining = totalBudget - budgetUsed;
        this.depotBudgetUsed = report == null ? 0.0 : report.depotBudgetUsed;
        this.distributionBudgetUsed = report == null ? 0.0 : report.distributionBudgetUsed;
        this.coveragePercentage = report == null ? 0.0 : report.coveragePercentage;
        this.depotCoveragePercentage = report == null ? 0.0 : report.depotCoveragePercentage;
        this.cellsCovered = report == null ? 0 : report.cellsCovered;
        this.totalCells = report == null ? 0 : report.totalCells;
        this.iterations = iterations;
        this.adjustmentsMade = report == null ? 0 : report.adjustmentsMade;
        this.timedOut = timedOut;
        this.elapsedMs = elapsedMs;
        this.timestamp = Instant.now().toString();
    }

    static OptimizationResult success(
            FeasibilityValidator.Report report, double totalBudget, int iterations, boolean timedOut, long elapsedMs) {
        return new OptimizationResult(
                Status.SUCCESS, null, report.facilities, totalBudget, report, iterations, timedOut, elapsedMs);
    }

    public static OptimizationResult failure(String reason, double totalBudget, long elapsedMs) {
        return new OptimizationResult(Status.FAILURE, reason, List.of(), totalBudget, null, 0, false, elapsedMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
