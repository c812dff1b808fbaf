package relief.siting.core;

/**
 * Per-tier cost and impact model.
 * <ul>
 *   <li>impact = min(need x serveFraction, population x populationCapFraction)</li>
 *   <li>setup = setupBase + min(setupCap, impact x setupPerUnit)</li>
 *   <li>recurring (monthly) = recurringBase + min(recurringCap, impact x recurringPerUnit)</li>
 * </ul>
 */
public final class CostModel {
    public final double setupBase;
    public final double setupPerUnit;
    public final double setupCap;
    public final double recurringBase;
    public final double recurringPerUnit;
    public final double recurringCap;
    public final double serveFraction;
    public final double populationCapFraction;

    public CostModel(
            double setupBase,
            double setupPerUnit,
            double setupCap,
            double recurringBase,
            double recurringPerUnit,
            double recurringCap,
            double serveFraction,
            double populationCapFraction) {
        this.setupBase = setupBase;
        this.setupPerUnit = setupPerUnit;
        this.setupCap = setupCap;
        this.recurringBase = recurringBase;
        this.recurringPerUnit = recurringPerUnit;
        this.recurringCap = recurringCap;
        this.serveFraction = serveFraction;
        this.populationCapFraction = populationCapFraction;
    }

    public static CostModel distributionDefaults() {
        return new CostModel(100_000, 60, 200_000, 10_000, 12, 20_000, 0.4, 0.3);
    }

    public static CostModel depotDefaults() {
        return new CostModel(60_000, 2, 40_000, 8_000, 0.5, 12_000, 0.4, 0.3);
    }

    public double expectedImpact(Cell cell) {
        return Math.min(cell.needIndex * serveFraction, cell.population * populationCapFraction);
    }

    public double setupCost(double impact) {
        return setupBase + Math.min(setupCap, impact * setupPerUnit);
    }

    public double recurringCost(double impact) {
        return recurringBase + Math.min(recurringCap, impact * recurringPerUnit);
    }
}
