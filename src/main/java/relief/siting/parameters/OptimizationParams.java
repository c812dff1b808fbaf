package relief.siting.parameters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Arrays;

@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimizationParams {
    public double totalBudget = 1_000_000;
    public double depotBudgetFraction = 0.25;
    public int maxFacilities = 10;
    public int maxDepots = 4;
    public double minDistanceBetweenDistributionPoints = 0.5;
    public double minDistanceBetweenDepots = 3.0;
    public double depotServiceRadius = 7.0;
    public double distributionServiceRadius = 1.5;
    public ScoringWeights scoringWeights = new ScoringWeights();
    public long timeLimitMs = 0;

    // Tuning knobs; defaults reproduce the reference heuristics
    public double needNormalization = 1000.0;
    public int zoneGridSize = 6;
    public int[] zoneCapacityThresholds = {12, 20};
    public double relaxNeighborFraction = 0.7;
    public double budgetFloorFraction = 0.10;
    public double fallbackMinBudgetFraction = 0.10;
    public double fallbackSetupMultiple = 2.0;
    public int distributionHorizonMonths = 12;
    public int distributionFallbackHorizonMonths = 6;
    public int depotHorizonMonths = 6;
    public int depotFallbackHorizonMonths = 3;
    public int depotPartitions = 2;
    public boolean depotDeclustering = false;

    /**
     * Validate the optimization parameters.
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public void validate() {
        if (!Double.isFinite(totalBudget) || totalBudget < 0)
            throw new IllegalArgumentException("Invalid totalBudget: " + totalBudget);
        requireFraction("depotBudgetFraction", depotBudgetFraction);
        if (maxFacilities < 1) throw new IllegalArgumentException("Invalid maxFacilities: " + maxFacilities);
        if (maxFacilities > 10000) throw new IllegalArgumentException("maxFacilities too large: " + maxFacilities);
        if (maxDepots < 0) throw new IllegalArgumentException("Invalid maxDepots: " + maxDepots);
        if (maxDepots > 1000) throw new IllegalArgumentException("maxDepots too large: " + maxDepots);
        requireNonNegative("minDistanceBetweenDistributionPoints", minDistanceBetweenDistributionPoints);
        requireNonNegative("minDistanceBetweenDepots", minDistanceBetweenDepots);
        requirePositive("depotServiceRadius", depotServiceRadius);
        requirePositive("distributionServiceRadius", distributionServiceRadius);
        if (scoringWeights == null) throw new IllegalArgumentException("Missing scoringWeights");
        scoringWeights.validate();
        if (timeLimitMs < 0) throw new IllegalArgumentException("Invalid timeLimitMs: " + timeLimitMs);

        requirePositive("needNormalization", needNormalization);
        if (zoneGridSize < 1) throw new IllegalArgumentException("Invalid zoneGridSize: " + zoneGridSize);
        if (zoneGridSize > 50) throw new IllegalArgumentException("zoneGridSize too large: " + zoneGridSize);
        if (zoneCapacityThresholds == null)
            throw new IllegalArgumentException("Missing zoneCapacityThresholds");
        for (int i = 0; i < zoneCapacityThresholds.length; i++) {
            if (zoneCapacityThresholds[i] < 1)
                throw new IllegalArgumentException("Invalid zone capacity threshold: " + zoneCapacityThresholds[i]);
            if (i > 0 && zoneCapacityThresholds[i] <= zoneCapacityThresholds[i - 1])
                throw new IllegalArgumentException("zoneCapacityThresholds must be strictly increasing");
        }
        requireFraction("relaxNeighborFraction", relaxNeighborFraction);
        requireFraction("budgetFloorFraction", budgetFloorFraction);
        requireFraction("fallbackMinBudgetFraction", fallbackMinBudgetFraction);
        requireNonNegative("fallbackSetupMultiple", fallbackSetupMultiple);
        requireHorizons("distribution", distributionHorizonMonths, distributionFallbackHorizonMonths);
        requireHorizons("depot", depotHorizonMonths, depotFallbackHorizonMonths);
        if (depotPartitions < 1) throw new IllegalArgumentException("Invalid depotPartitions: " + depotPartitions);
        if (depotPartitions > 20) throw new IllegalArgumentException("depotPartitions too large: " + depotPartitions);
    }

    private static void requireFraction(String name, double value) {
        if (!Double.isFinite(value) || value < 0 || value > 1)
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) throw new IllegalArgumentException("Invalid " + name + ": " + value);
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) throw new IllegalArgumentException("Invalid " + name + ": " + value);
    }

    private static void requireHorizons(String tier, int primary, int fallback) {
        if (primary < 0) throw new IllegalArgumentException("Invalid " + tier + " horizon: " + primary);
        if (fallback < 0) throw new IllegalArgumentException("Invalid " + tier + " fallback horizon: " + fallback);
        if (fallback > primary)
            throw new IllegalArgumentException(tier + " fallback horizon cannot exceed the primary horizon");
    }

    @Override
    public String toString() {
        return "OptimizationParams {\n"
                + "  totalBudget = " + totalBudget + ",\n"
                + "  depotBudgetFraction = " + depotBudgetFraction + ",\n"
                + "  maxFacilities = " + maxFacilities + ",\n"
                + "  maxDepots = " + maxDepots + ",\n"
                + "  minDistanceBetweenDistributionPoints = " + minDistanceBetweenDistributionPoints + ",\n"
                + "  minDistanceBetweenDepots = " + minDistanceBetweenDepots + ",\n"
                + "  depotServiceRadius = " + depotServiceRadius + ",\n"
                + "  distributionServiceRadius = " + distributionServiceRadius + ",\n"
                + "  scoringWeights = " + scoringWeights + ",\n"
                + "  timeLimitMs = " + timeLimitMs + ",\n"
                + "  zoneGridSize = " + zoneGridSize + ",\n"
                + "  zoneCapacityThresholds = " + Arrays.toString(zoneCapacityThresholds) + ",\n"
                + "  depotPartitions = " + depotPartitions + "\n"
                + "}";
    }
}

/**
 * Budget split
 * - depotBudgetFraction of totalBudget goes to depots, the rest to distribution points.
 * - Neither tier borrows the other's unspent share.
 *
 * Amortization horizon
 * - A facility's budget cost is setup + horizon x monthly recurring cost.
 * - The primary horizon is tried first. The fallback horizon is used only while the
 *   remaining tier budget exceeds fallbackSetupMultiple x setup cost and
 *   fallbackMinBudgetFraction of the tier budget.
 *
 * Zone declustering (distribution tier)
 * - The candidate bounding box is cut into zoneGridSize x zoneGridSize zones.
 * - Zone capacity is 1 below the first threshold, 2 below the second, and so on.
 * - A full zone may take one extra site once relaxNeighborFraction of its
 *   neighbouring zones hold at least one site.
 *
 * Depot placement
 * - The bounding box is cut into depotPartitions x depotPartitions regions
 *   (2 = quadrants); each region proposes one comparatively low-need anchor.
 **/
