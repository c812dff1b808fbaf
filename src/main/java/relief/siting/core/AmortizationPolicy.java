package relief.siting.core;

/**
 * Two-step amortization rule shared by the allocator and the validator. A site is costed at
 * the primary horizon; when that does not fit, the shorter fallback horizon is tried, but only
 * while the remaining budget is still more than {@code fallbackSetupMultiple} setup costs and
 * more than {@code fallbackMinBudgetFraction} of the reference budget.
 */
public final class AmortizationPolicy {

    public static final int REJECTED = -1;

    public final int primaryMonths;
    public final int fallbackMonths;
    public final double fallbackSetupMultiple;
    public final double fallbackMinBudgetFraction;

    public AmortizationPolicy(
            int primaryMonths, int fallbackMonths, double fallbackSetupMultiple, double fallbackMinBudgetFraction) {
        this.primaryMonths = primaryMonths;
        this.fallbackMonths = fallbackMonths;
        this.fallbackSetupMultiple = fallbackSetupMultiple;
        this.fallbackMinBudgetFraction = fallbackMinBudgetFraction;
    }

    public static double totalCost(double setupCost, double recurringCost, int months) {
        return setupCost + months * recurringCost;
    }

    /**
     * Picks the amortization horizon a site can be afforded at.
     *
     * @param setupCost one-off setup cost
     * @param recurringCost monthly recurring cost
     * @param remaining budget still available
     * @param referenceBudget budget the tier started with
     * @return the horizon in months, or {@link #REJECTED}
     */
    public int horizonFor(double setupCost, double recurringCost, double remaining, double referenceBudget) {
        if (totalCost(setupCost, recurringCost, primaryMonths) <= remaining) return primaryMonths;
        boolean worthRetrying = remaining > fallbackSetupMultiple * setupCost
                && remaining > fallbackMinBudgetFraction * referenceBudget;
        if (worthRetrying && totalCost(setupCost, recurringCost, fallbackMonths) <= remaining) {
            return fallbackMonths;
        }
        return REJECTED;
    }
}
