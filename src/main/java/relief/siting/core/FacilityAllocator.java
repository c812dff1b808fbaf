package relief.siting.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import relief.siting.utils.Log;

/**
 * Greedy, budget- and distance-constrained site selection, shared by both tiers.
 * <p>
 * Candidates are sorted by efficiency (ties by cell id) and swept in rounds. Within a round a
 * candidate is skipped when its cell is already used, its zone is full, it lies closer than
 * {@code minDistance} to a selected site of the same tier, or it cannot be afforded at either
 * amortization horizon. Later rounds revisit candidates skipped for zone or distance reasons,
 * since zone capacity grows as sites fill in. The run ends after a round that adds nothing,
 * once the remaining budget drops under the floor, or when the facility cap is reached.
 * </p>
 */
public final class FacilityAllocator {

    public enum StopReason {
        NO_CANDIDATES,
        NO_PROGRESS,
        BUDGET_FLOOR,
        FACILITY_CAP,
        DEADLINE
    }

    // Optional per-round progress reporting
    public interface RoundListener {
        void onRound(Tier tier, int round, int added, int totalSelected, double remainingBudget);
    }

    public static final class Allocation {
        public final List<Facility> facilities; // selection order
        public final int rounds;
        public final int candidatesScored;
        public final double budgetUsed;
        public final double budgetRemaining;
        public final StopReason stopReason;

        Allocation(
                List<Facility> facilities,
                int rounds,
                int candidatesScored,
                double budgetUsed,
                double budgetRemaining,
                StopReason stopReason) {
            this.facilities = Collections.unmodifiableList(new ArrayList<>(facilities));
            this.rounds = rounds;
            this.candidatesScored = candidatesScored;
            this.budgetUsed = budgetUsed;
            this.budgetRemaining = budgetRemaining;
            this.stopReason = stopReason;
        }

        public boolean timedOut() {
            return stopReason == StopReason.DEADLINE;
        }
    }

    private final TierSettings settings;
    private final CandidateGenerator generator;
    private RoundListener roundListener;

    public FacilityAllocator(TierSettings settings, CandidateGenerator generator) {
        this.settings = settings;
        this.generator = generator;
    }

    public void setRoundListener(RoundListener listener) {
        this.roundListener = listener;
    }

    public Allocation allocate(List<Cell> pool, double budget) {
        return allocate(pool, budget, Deadline.none());
    }

    /**
     * Runs the selection.
     *
     * @param pool candidate cells for this tier
     * @param budget budget available to this tier
     * @param deadline checked before every round
     * @return selected facilities and run statistics
     */
    public Allocation allocate(List<Cell> pool, double budget, Deadline deadline) {
        SelectionState state = new SelectionState(budget);
        List<ScoredCandidate> candidates = new ArrayList<>(generator.generate(pool));
        Log.info("[%s] Scored %d candidates from %d cells, budget %.2f",
                settings.tier, candidates.size(), pool.size(), budget);
        if (candidates.isEmpty()) {
            return new Allocation(List.of(), 0, 0, 0.0, state.remainingBudget(), StopReason.NO_CANDIDATES);
        }
        candidates.sort(ScoredCandidate.BY_EFFICIENCY);

        ZoneGrid grid = null;
        if (settings.declustering != null) {
            List<Cell> candidateCells = new ArrayList<>(candidates.size());
            for (ScoredCandidate c : candidates) candidateCells.add(c.cell);
            grid = ZoneGrid.over(candidateCells, settings.declustering.gridSize);
        }

        double floor = budget * settings.budgetFloorFraction;
        int rounds = 0;
        StopReason reason;
        while (true) {
            if (deadline.expired()) {
                reason = StopReason.DEADLINE;
                Log.warn("[%s] Stopped before round %d: time limit reached or stop requested",
                        settings.tier, rounds + 1);
                break;
            }
            rounds++;
            int added = runRound(candidates, state, grid);
            Log.debug("[%s] Round %d added %d (total %d, remaining %.2f)",
                    settings.tier, rounds, added, state.selectedCount(), state.remainingBudget());
            if (roundListener != null) {
                roundListener.onRound(settings.tier, rounds, added, state.selectedCount(), state.remainingBudget());
            }

            if (state.selectedCount() >= settings.maxFacilities) {
                reason = StopReason.FACILITY_CAP;
                break;
            }
            if (added == 0) {
                reason = StopReason.NO_PROGRESS;
                break;
            }
            if (state.remainingBudget() < floor) {
                reason = StopReason.BUDGET_FLOOR;
                break;
            }
        }

        Log.info("[%s] Selected %d facilities in %d rounds (%s), used %.2f of %.2f",
                settings.tier, state.selectedCount(), rounds, reason, state.budgetUsed(), budget);
        return new Allocation(
                state.selected(), rounds, candidates.size(), state.budgetUsed(), state.remainingBudget(), reason);
    }

    private int runRound(List<ScoredCandidate> sorted, SelectionState state, ZoneGrid grid) {
        int added = 0;
        for (ScoredCandidate c : sorted) {
            if (state.isUsed(c.cell.id)) continue;
            if (state.selectedCount() >= settings.maxFacilities) break;

            Integer zone = null;
            if (grid != null) {
                zone = grid.zoneOf(c.cell);
                if (!settings.declustering.admits(zone, grid, state.zoneOccupancy(), state.selectedCount())) {
                    Log.debug("[%s] %s skipped: zone %d is full", settings.tier, c.cell.id, zone);
                    continue;
                }
            }

            if (tooClose(c.cell, state)) {
                Log.debug("[%s] %s skipped: within %.2f mi of a selected site",
                        settings.tier, c.cell.id, settings.minDistance);
                continue;
            }

            int months = settings.amortization.horizonFor(
                    c.setupCost, c.recurringCost, state.remainingBudget(), state.originalBudget());
            if (months == AmortizationPolicy.REJECTED) {
                Log.debug("[%s] %s skipped: unaffordable with %.2f remaining",
                        settings.tier, c.cell.id, state.remainingBudget());
                continue;
            }

            Facility f = Facility.fromCandidate(c, settings.tier, settings.serviceRadius, months);
            state.commit(f, zone);
            added++;
        }
        return added;
    }

    private boolean tooClose(Cell cell, SelectionState state) {
        for (Facility f : state.selected()) {
            if (GeoDistance.miles(f.lat, f.lon, cell.lat, cell.lon) < settings.minDistance) return true;
        }
        return false;
    }
}
