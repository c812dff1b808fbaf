package relief.siting.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one allocator run. Single-threaded; each decision depends on the one before.
 */
public final class SelectionState {

    private final BudgetLedger ledger;
    private final Set<String> usedCellIds = new HashSet<>();
    private final Map<Integer, Integer> zoneOccupancy = new HashMap<>();
    private final List<Facility> selected = new ArrayList<>();

    public SelectionState(double budget) {
        this.ledger = new BudgetLedger(budget);
    }

    public double originalBudget() {
        return ledger.budget();
    }

    public double remainingBudget() {
        return ledger.remaining();
    }

    public double budgetUsed() {
        return ledger.spent();
    }

    public boolean isUsed(String cellId) {
        return usedCellIds.contains(cellId);
    }

    public Map<Integer, Integer> zoneOccupancy() {
        return Collections.unmodifiableMap(zoneOccupancy);
    }

    /** Selection order. */
    public List<Facility> selected() {
        return Collections.unmodifiableList(selected);
    }

    public int selectedCount() {
        return selected.size();
    }

    void commit(Facility facility, Integer zone) {
        ledger.commit(facility.id, facility.committedCost);
        usedCellIds.add(facility.anchorCellId);
        if (zone != null) zoneOccupancy.merge(zone, 1, Integer::sum);
        selected.add(facility);
    }
}
