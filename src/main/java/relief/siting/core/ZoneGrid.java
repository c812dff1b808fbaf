package relief.siting.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fixed N x N grid laid over the bounding box of a set of cells. Zone keys are
 * {@code row * N + col}; points outside the box are clamped to the border zones.
 */
public final class ZoneGrid {

    private final int size;
    private final double minLat, maxLat, minLon, maxLon;

    private ZoneGrid(int size, double minLat, double maxLat, double minLon, double maxLon) {
        this.size = size;
        this.minLat = minLat;
        this.maxLat = maxLat;
        this.minLon = minLon;
        this.maxLon = maxLon;
    }

    public static ZoneGrid over(Collection<Cell> cells, int size) {
        if (size < 1) throw new IllegalArgumentException("Invalid grid size: " + size);
        double minLat = Double.POSITIVE_INFINITY, maxLat = Double.NEGATIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY, maxLon = Double.NEGATIVE_INFINITY;
        for (Cell c : cells) {
            minLat = Math.min(minLat, c.lat);
            maxLat = Math.max(maxLat, c.lat);
            minLon = Math.min(minLon, c.lon);
            maxLon = Math.max(maxLon, c.lon);
        }
        if (cells.isEmpty()) {
            minLat = maxLat = minLon = maxLon = 0.0;
        }
        return new ZoneGrid(size, minLat, maxLat, minLon, maxLon);
    }

    public int size() {
        return size;
    }

    public int zoneOf(double lat, double lon) {
        return row(lat) * size + col(lon);
    }

    public int zoneOf(Cell cell) {
        return zoneOf(cell.lat, cell.lon);
    }

    private int row(double lat) {
        return bucket(lat, minLat, maxLat);
    }

    private int col(double lon) {
        return bucket(lon, minLon, maxLon);
    }

    private int bucket(double v, double lo, double hi) {
        double span = hi - lo;
        if (span <= 0) return 0;
        int b = (int) Math.floor((v - lo) / span * size);
        if (b < 0) return 0;
        return Math.min(size - 1, b);
    }

    /**
     * The up to eight zones touching {@code zone}, clipped to the grid.
     */
    public List<Integer> neighbors(int zone) {
        int r = zone / size;
        int c = zone % size;
        List<Integer> out = new ArrayList<>(8);
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0) continue;
                int nr = r + dr, nc = c + dc;
                if (nr >= 0 && nr < size && nc >= 0 && nc < size) out.add(nr * size + nc);
            }
        }
        return out;
    }
}
