package relief.siting.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class BudgetLedgerTest {

    @Test
    void tracksSpend() {
        BudgetLedger ledger = new BudgetLedger(100.0);
        ledger.commit("a", 60.0);
        ledger.commit("b", 40.0);
        assertEquals(100.0, ledger.spent(), 0.0);
        assertEquals(0.0, ledger.remaining(), 0.0);
    }

    @Test
    void rejectsOverspendAndBadAmounts() {
        BudgetLedger ledger = new BudgetLedger(100.0);
        assertThrows(InvariantViolationException.class, () -> ledger.commit("big", 100.5));
        assertThrows(InvariantViolationException.class, () -> ledger.commit("nan", Double.NaN));
        assertThrows(InvariantViolationException.class, () -> ledger.commit("neg", -1.0));
        assertEquals(0.0, ledger.spent(), 0.0);
    }

    @Test
    void rejectsInvalidBudget() {
        assertThrows(InvariantViolationException.class, () -> new BudgetLedger(Double.POSITIVE_INFINITY));
        assertThrows(InvariantViolationException.class, () -> new BudgetLedger(-5.0));
    }
}
