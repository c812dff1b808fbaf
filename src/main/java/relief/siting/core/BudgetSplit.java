package relief.siting.core;

/**
 * Division of the total budget between the two tiers. Shares are fixed up front; an unspent
 * depot share is not handed to the distribution tier.
 */
public final class BudgetSplit {
    public final double total;
    public final double depotShare;
    public final double distributionShare;

    public BudgetSplit(double total, double depotShare, double distributionShare) {
        this.total = total;
        this.depotShare = depotShare;
        this.distributionShare = distributionShare;
    }

    public static BudgetSplit of(double total, double depotFraction) {
        double depot = total * depotFraction;
        return new BudgetSplit(total, depot, total - depot);
    }
}
