package relief.siting.utils;

import java.util.ArrayList;
import java.util.List;
import relief.siting.core.Facility;
import relief.siting.core.Tier;

// Flat view of a selected facility for the HTTP layer
public class FacilityResult {
    public String id;
    public String tier;
    public String anchorCellId;
    public double lat;
    public double lon;
    public double serviceRadius;
    public double efficiencyScore;
    public double expectedImpact;
    public double setupCost;
    public double recurringCost;
    public int amortizationMonths;
    public double committedCost;
    public String servingDepotId; // distribution points only, null when unconstrained
    public List<String> servedFacilityIds; // depots only

    public FacilityResult(Facility f, String servingDepotId) {
        this.id = f.id;
        this.tier = f.tier.name().toLowerCase();
        this.anchorCellId = f.anchorCellId;
        this.lat = f.lat;
        this.lon = f.lon;
        this.serviceRadius = f.serviceRadius;
        this.efficiencyScore = f.efficiencyScore;
        this.expectedImpact = f.expectedImpact;
        this.setupCost = f.setupCost;
        this.recurringCost = f.recurringCost;
        this.amortizationMonths = f.amortizationMonths;
        this.committedCost = f.committedCost;
        this.servingDepotId = servingDepotId;
        this.servedFacilityIds = new ArrayList<>(f.servedFacilityIds());
    }

    public static List<FacilityResult> of(List<Facility> facilities) {
        List<FacilityResult> out = new ArrayList<>(facilities.size());
        for (Facility f : facilities) {
            String depotId = null;
            if (f.tier == Tier.DISTRIBUTION) {
                for (Facility d : facilities) {
                    if (d.tier == Tier.DEPOT && d.servedFacilityIds().contains(f.id)) {
                        depotId = d.id;
                        break;
                    }
                }
            }
            out.add(new FacilityResult(f, depotId));
        }
        return out;
    }
}
