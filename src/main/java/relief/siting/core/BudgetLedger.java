package relief.siting.core;

/**
 * Running total of committed spend against a fixed budget. Rejects anything that is not a
 * finite, non-negative amount instead of coercing it.
 */
public final class BudgetLedger {

    private final double budget;
    private double spent = 0.0;

    public BudgetLedger(double budget) {
        if (!Double.isFinite(budget) || budget < 0) {
            throw new InvariantViolationException("Budget must be a finite non-negative amount, got " + budget);
        }
        this.budget = budget;
    }

    public double budget() {
        return budget;
    }

    public double spent() {
        return spent;
    }

    public double remaining() {
        return budget - spent;
    }

    public void commit(String what, double amount) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new InvariantViolationException("Non-numeric or negative cost " + amount + " for " + what);
        }
        if (amount > remaining() + 1e-6) {
            throw new InvariantViolationException(String.format(
                    "Cost %.2f for %s exceeds remaining budget %.2f", amount, what, remaining()));
        }
        spent += amount;
    }
}
