package relief.siting.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import relief.siting.utils.Log;

/**
 * Post-hoc feasibility pass over both tiers. It recomputes everything from the facilities,
 * the cell pool and the budget split alone, so a composition error between the two allocator
 * runs shows up here as an adjustment.
 * <p>
 * Depots are checked first, then distribution points, each in selection order. A facility is
 * dropped when it covers no cell, when it was placed under a depot that no longer survives
 * and no other surviving depot reaches it, or when neither amortization horizon fits the
 * budget left for its tier. A facility kept at a different horizon than it was proposed with
 * is replaced by a re-costed copy. Each dropped or re-costed facility counts once in
 * {@link Report#adjustmentsMade}.
 * </p>
 */
public final class FeasibilityValidator {

    public static final class Report {
        public final List<Facility> facilities;
        public final int adjustmentsMade;
        public final double budgetUsed;
        public final double depotBudgetUsed;
        public final double distributionBudgetUsed;
        public final double totalExpectedImpact;
        public final int cellsCovered;
        public final int totalCells;
        public final double coveragePercentage; // 0..100, any surviving facility
        public final double depotCoveragePercentage; // 0..100, depots only

        Report(
                List<Facility> facilities,
                int adjustmentsMade,
                double depotBudgetUsed,
                double distributionBudgetUsed,
                double totalExpectedImpact,
                int cellsCovered,
                int depotCellsCovered,
                int totalCells) {
            this.facilities = Collections.unmodifiableList(facilities);
            this.adjustmentsMade = adjustmentsMade;
            this.depotBudgetUsed = depotBudgetUsed;
            this.distributionBudgetUsed = distributionBudgetUsed;
            this.budgetUsed = depotBudgetUsed + distributionBudgetUsed;
            this.totalExpectedImpact = totalExpectedImpact;
            this.cellsCovered = cellsCovered;
            this.totalCells = totalCells;
            this.coveragePercentage = totalCells == 0 ? 0.0 : 100.0 * cellsCovered / totalCells;
            this.depotCoveragePercentage = totalCells == 0 ? 0.0 : 100.0 * depotCellsCovered / totalCells;
        }
    }

    private final AmortizationPolicy depotPolicy;
    private final AmortizationPolicy distributionPolicy;

    public FeasibilityValidator(AmortizationPolicy depotPolicy, AmortizationPolicy distributionPolicy) {
        this.depotPolicy = depotPolicy;
        this.distributionPolicy = distributionPolicy;
    }

    public Report validate(List<Facility> proposed, List<Cell> cells, BudgetSplit split) {
        List<Facility> depots = new ArrayList<>();
        List<Facility> distribution = new ArrayList<>();
        Set<String> dependent = new HashSet<>();
        for (Facility f : proposed) {
            if (f.tier == Tier.DEPOT) {
                depots.add(f);
                dependent.addAll(f.servedFacilityIds());
            } else {
                distribution.add(f);
            }
        }

        BudgetLedger total = new BudgetLedger(split.total);
        BudgetLedger depotLedger = new BudgetLedger(split.depotShare);
        BudgetLedger distributionLedger = new BudgetLedger(split.distributionShare);
        int[] adjustments = {0};

        List<Facility> keptDepots = new ArrayList<>();
        for (Facility d : depots) {
            Facility kept = check(d, cells, depotPolicy, depotLedger, total, adjustments);
            if (kept != null) keptDepots.add(kept);
        }

        List<Facility> keptDistribution = new ArrayList<>();
        for (Facility f : distribution) {
            if (dependent.contains(f.id) && servingDepot(f, keptDepots) == null) {
                Log.debug("[Validator] %s dropped: no surviving depot reaches it", f.id);
                adjustments[0]++;
                continue;
            }
            Facility kept = check(f, cells, distributionPolicy, distributionLedger, total, adjustments);
            if (kept != null) keptDistribution.add(kept);
        }

        // Rebuild depot back-references from the survivors only
        for (Facility d : keptDepots) d.clearServed();
        for (Facility f : keptDistribution) {
            if (!dependent.contains(f.id)) continue;
            Facility depot = servingDepot(f, keptDepots);
            if (depot != null) depot.recordServed(f.id);
        }

        List<Facility> kept = new ArrayList<>(keptDepots.size() + keptDistribution.size());
        kept.addAll(keptDepots);
        kept.addAll(keptDistribution);

        int covered = 0, depotCovered = 0;
        double impact = 0.0;
        for (Facility f : kept) impact += f.expectedImpact;
        for (Cell c : cells) {
            boolean byDepot = false, byAny = false;
            for (Facility f : kept) {
                if (!f.covers(c)) continue;
                byAny = true;
                if (f.tier == Tier.DEPOT) {
                    byDepot = true;
                    break;
                }
            }
            if (byAny) covered++;
            if (byDepot) depotCovered++;
        }

        Report report = new Report(
                kept,
                adjustments[0],
                depotLedger.spent(),
                distributionLedger.spent(),
                impact,
                covered,
                depotCovered,
                cells.size());
        Log.info("[Validator] %d of %d facilities validated, %d adjustments, coverage %.1f%%",
                kept.size(), proposed.size(), report.adjustmentsMade, report.coveragePercentage);
        return report;
    }

    private static Facility check(
            Facility f,
            List<Cell> cells,
            AmortizationPolicy policy,
            BudgetLedger tierLedger,
            BudgetLedger total,
            int[] adjustments) {
        boolean servesAny = false;
        for (Cell c : cells) {
            if (f.covers(c)) {
                servesAny = true;
                break;
            }
        }
        if (!servesAny) {
            Log.debug("[Validator] %s dropped: serves no cell within %.2f mi", f.id, f.serviceRadius);
            adjustments[0]++;
            return null;
        }

        double remaining = Math.min(tierLedger.remaining(), total.remaining());
        int months = policy.horizonFor(f.setupCost, f.recurringCost, remaining, tierLedger.budget());
        if (months == AmortizationPolicy.REJECTED) {
            Log.debug("[Validator] %s dropped: does not fit %.2f remaining", f.id, remaining);
            adjustments[0]++;
            return null;
        }

        Facility kept = f;
        if (months != f.amortizationMonths) {
            Log.debug("[Validator] %s re-costed at %d months (was %d)", f.id, months, f.amortizationMonths);
            kept = f.withAmortization(months);
            adjustments[0]++;
        }
        tierLedger.commit(kept.id, kept.committedCost);
        total.commit(kept.id, kept.committedCost);
        return kept;
    }

    private static Facility servingDepot(Facility f, List<Facility> depots) {
        Comparator<Facility> pref = CoverageFilter.preference(f.lat, f.lon);
        Facility best = null;
        for (Facility d : depots) {
            if (GeoDistance.miles(d, f) > d.serviceRadius) continue;
            if (best == null || pref.compare(d, best) < 0) best = d;
        }
        return best;
    }
}
