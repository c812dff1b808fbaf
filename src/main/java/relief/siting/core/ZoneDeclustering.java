package relief.siting.core;

import java.util.Map;

/**
 * Grid-based declustering. A zone may hold one site while fewer than {@code thresholds[0]}
 * sites are selected overall, two while fewer than {@code thresholds[1]}, and so on. A full
 * zone may still take one more site once enough of its neighbours are occupied.
 */
public final class ZoneDeclustering {

    public final int gridSize;
    public final int[] capacityThresholds;
    public final double relaxNeighborFraction;

    public ZoneDeclustering(int gridSize, int[] capacityThresholds, double relaxNeighborFraction) {
        this.gridSize = gridSize;
        this.capacityThresholds = capacityThresholds.clone();
        this.relaxNeighborFraction = relaxNeighborFraction;
    }

    public static ZoneDeclustering defaults() {
        return new ZoneDeclustering(6, new int[] {12, 20}, 0.7);
    }

    public int zoneCapacity(int selectedCount) {
        int capacity = 1;
        for (int threshold : capacityThresholds) {
            if (selectedCount >= threshold) capacity++;
        }
        return capacity;
    }

    /**
     * Whether a candidate in {@code zone} may be placed given the current occupancy.
     */
    public boolean admits(int zone, ZoneGrid grid, Map<Integer, Integer> occupancy, int selectedCount) {
        int occupied = occupancy.getOrDefault(zone, 0);
        int capacity = zoneCapacity(selectedCount);
        if (occupied < capacity) return true;
        if (occupied >= capacity + 1) return false;

        var neighbors = grid.neighbors(zone);
        if (neighbors.isEmpty()) return true;
        int nonEmpty = 0;
        for (int n : neighbors) {
            if (occupancy.getOrDefault(n, 0) > 0) nonEmpty++;
        }
        return (double) nonEmpty / neighbors.size() >= relaxNeighborFraction;
    }
}
