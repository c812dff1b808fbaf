package relief.siting.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A selected site. Read-only once created, except for the set of dependent facility ids that a
 * depot serves, which is filled in after the distribution tier has been allocated.
 */
public final class Facility {
    public final String id;
    public final String anchorCellId;
    public final double lat;
    public final double lon;
    public final Tier tier;
    public final double serviceRadius; // miles
    public final double setupCost;
    public final double recurringCost; // monthly
    public final double efficiencyScore;
    public final double expectedImpact;
    public final int amortizationMonths; // horizon actually committed
    public final double committedCost;

    private final Set<String> servedFacilityIds = new LinkedHashSet<>();

    public Facility(
            String anchorCellId,
            double lat,
            double lon,
            Tier tier,
            double serviceRadius,
            double setupCost,
            double recurringCost,
            double efficiencyScore,
            double expectedImpact,
            int amortizationMonths) {
        this.id = tier.facilityId(anchorCellId);
        this.anchorCellId = anchorCellId;
        this.lat = lat;
        this.lon = lon;
        this.tier = tier;
        this.serviceRadius = serviceRadius;
        this.setupCost = setupCost;
        this.recurringCost = recurringCost;
        this.efficiencyScore = efficiencyScore;
        this.expectedImpact = expectedImpact;
        this.amortizationMonths = amortizationMonths;
        this.committedCost = AmortizationPolicy.totalCost(setupCost, recurringCost, amortizationMonths);
    }

    static Facility fromCandidate(ScoredCandidate c, Tier tier, double serviceRadius, int amortizationMonths) {
        return new Facility(
                c.cell.id,
                c.cell.lat,
                c.cell.lon,
                tier,
                serviceRadius,
                c.setupCost,
                c.recurringCost,
                c.efficiencyScore,
                c.expectedImpact,
                amortizationMonths);
    }

    /**
     * Copy of this facility costed at a different horizon. Served ids are carried over.
     */
    public Facility withAmortization(int months) {
        Facility copy = new Facility(
                anchorCellId, lat, lon, tier, serviceRadius, setupCost, recurringCost, efficiencyScore,
                expectedImpact, months);
        copy.servedFacilityIds.addAll(servedFacilityIds);
        return copy;
    }

    public Set<String> servedFacilityIds() {
        return Collections.unmodifiableSet(servedFacilityIds);
    }

    void recordServed(String facilityId) {
        servedFacilityIds.add(facilityId);
    }

    void clearServed() {
        servedFacilityIds.clear();
    }

    public boolean covers(Cell cell) {
        return GeoDistance.miles(this, cell) <= serviceRadius;
    }

    @Override
    public String toString() {
        return String.format(
                "Facility{%s, %s, score=%.4f, cost=%.0f (%d mo), impact=%.0f}",
                id, tier, efficiencyScore, committedCost, amortizationMonths, expectedImpact);
    }
}
