package relief.siting.core;

import relief.siting.parameters.OptimizationParams;

/**
 * Everything that makes one allocator instance a depot allocator or a distribution allocator.
 */
public final class TierSettings {
    public final Tier tier;
    public final double serviceRadius; // miles
    public final double minDistance; // miles between same-tier sites
    public final int maxFacilities;
    public final CostModel costModel;
    public final AmortizationPolicy amortization;
    public final ZoneDeclustering declustering; // null = no declustering
    public final double budgetFloorFraction;

    public TierSettings(
            Tier tier,
            double serviceRadius,
            double minDistance,
            int maxFacilities,
            CostModel costModel,
            AmortizationPolicy amortization,
            ZoneDeclustering declustering,
            double budgetFloorFraction) {
        this.tier = tier;
        this.serviceRadius = serviceRadius;
        this.minDistance = minDistance;
        this.maxFacilities = maxFacilities;
        this.costModel = costModel;
        this.amortization = amortization;
        this.declustering = declustering;
        this.budgetFloorFraction = budgetFloorFraction;
    }

    public static TierSettings distribution(OptimizationParams p) {
        return new TierSettings(
                Tier.DISTRIBUTION,
                p.distributionServiceRadius,
                p.minDistanceBetweenDistributionPoints,
                p.maxFacilities,
                CostModel.distributionDefaults(),
                new AmortizationPolicy(
                        p.distributionHorizonMonths,
                        p.distributionFallbackHorizonMonths,
                        p.fallbackSetupMultiple,
                        p.fallbackMinBudgetFraction),
                new ZoneDeclustering(p.zoneGridSize, p.zoneCapacityThresholds, p.relaxNeighborFraction),
                p.budgetFloorFraction);
    }

    public static TierSettings depot(OptimizationParams p) {
        return new TierSettings(
                Tier.DEPOT,
                p.depotServiceRadius,
                p.minDistanceBetweenDepots,
                p.maxDepots,
                CostModel.depotDefaults(),
                new AmortizationPolicy(
                        p.depotHorizonMonths,
                        p.depotFallbackHorizonMonths,
                        p.fallbackSetupMultiple,
                        p.fallbackMinBudgetFraction),
                p.depotDeclustering
                        ? new ZoneDeclustering(p.depotPartitions, p.zoneCapacityThresholds, p.relaxNeighborFraction)
                        : null,
                p.budgetFloorFraction);
    }
}
