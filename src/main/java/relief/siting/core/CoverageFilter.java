package relief.siting.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import relief.siting.utils.Log;

/**
 * Restricts the second-tier pool to cells inside a first-tier service radius and remembers
 * which first-tier facility serves each of them.
 */
public final class CoverageFilter {

    /**
     * Among several depots covering the same cell the one with the larger impact wins, then the
     * nearer one, then the lower id.
     */
    static Comparator<Facility> preference(double lat, double lon) {
        return Comparator.comparingDouble((Facility f) -> f.expectedImpact)
                .reversed()
                .thenComparingDouble(f -> GeoDistance.miles(f.lat, f.lon, lat, lon))
                .thenComparing(f -> f.id);
    }

    public static final class Coverage {
        public final List<Cell> eligibleCells;
        public final Set<String> reservedCellIds; // anchors already taken by the first tier
        public final Map<String, String> servingFacilityByCell;
        public final boolean constrained; // false = fell back to the unfiltered pool

        Coverage(
                List<Cell> eligibleCells,
                Set<String> reservedCellIds,
                Map<String, String> servingFacilityByCell,
                boolean constrained) {
            this.eligibleCells = Collections.unmodifiableList(eligibleCells);
            this.reservedCellIds = Collections.unmodifiableSet(reservedCellIds);
            this.servingFacilityByCell = Collections.unmodifiableMap(servingFacilityByCell);
            this.constrained = constrained;
        }
    }

    /**
     * Filters {@code pool} to cells within reach of {@code depots}. When no depot exists, or no
     * cell is in reach, the whole pool (minus depot anchors) is returned unconstrained.
     */
    public Coverage filter(List<Facility> depots, List<Cell> pool) {
        Set<String> reserved = new HashSet<>();
        for (Facility d : depots) reserved.add(d.anchorCellId);

        List<Cell> open = new ArrayList<>(pool.size());
        for (Cell c : pool) {
            if (!reserved.contains(c.id)) open.add(c);
        }

        if (depots.isEmpty()) {
            Log.info("[Coverage] No depots; distribution tier is unconstrained (%d cells)", open.size());
            return new Coverage(open, reserved, Map.of(), false);
        }

        List<Cell> eligible = new ArrayList<>();
        Map<String, String> serving = new LinkedHashMap<>();
        for (Cell c : open) {
            Facility best = null;
            Comparator<Facility> pref = preference(c.lat, c.lon);
            for (Facility d : depots) {
                if (!d.covers(c)) continue;
                if (best == null || pref.compare(d, best) < 0) best = d;
            }
            if (best != null) {
                eligible.add(c);
                serving.put(c.id, best.id);
            }
        }

        if (eligible.isEmpty()) {
            Log.warn("[Coverage] %d depots cover no cells; falling back to the unfiltered pool", depots.size());
            return new Coverage(open, reserved, Map.of(), false);
        }
        Log.info("[Coverage] %d of %d cells lie within depot coverage", eligible.size(), open.size());
        return new Coverage(eligible, reserved, serving, true);
    }

    /**
     * Records on each depot the distribution facilities anchored in the cells it serves.
     */
    public void recordServedFacilities(Coverage coverage, List<Facility> depots, List<Facility> distribution) {
        Map<String, Facility> byId = new LinkedHashMap<>();
        for (Facility d : depots) byId.put(d.id, d);
        for (Facility f : distribution) {
            String depotId = coverage.servingFacilityByCell.get(f.anchorCellId);
            Facility depot = depotId == null ? null : byId.get(depotId);
            if (depot != null) depot.recordServed(f.id);
        }
    }
}
