package relief.siting.core;

import java.util.Objects;

/**
 * Immutable unit of geography with demographic attributes. Ratios are expected in [0, 1].
 */
public final class Cell {
    public final String id;
    public final double lat; // centroid latitude (degrees)
    public final double lon; // centroid longitude (degrees)
    public final int population;
    public final double riskScore;
    public final double needIndex;
    public final double povertyRate;
    public final double snapRate;
    public final double vehicleAccessRate;

    public Cell(
            String id,
            double lat,
            double lon,
            int population,
            double riskScore,
            Double needIndex,
            double povertyRate,
            double snapRate,
            double vehicleAccessRate) {
        this.id = id;
        this.lat = lat;
        this.lon = lon;
        this.population = population;
        this.riskScore = riskScore;
        // Supplied need wins; population x risk is only the fallback
        this.needIndex = needIndex != null ? needIndex : population * riskScore;
        this.povertyRate = povertyRate;
        this.snapRate = snapRate;
        this.vehicleAccessRate = vehicleAccessRate;
    }

    /**
     * Whether every field the scorer reads is present and numeric. Cells failing this are
     * input-data defects and are skipped, never scored.
     */
    public boolean isWellFormed() {
        if (id == null || id.isBlank()) return false;
        if (!Double.isFinite(lat) || lat < -90 || lat > 90) return false;
        if (!Double.isFinite(lon) || lon < -180 || lon > 180) return false;
        if (population < 0) return false;
        if (!Double.isFinite(needIndex) || needIndex < 0) return false;
        return isRatio(povertyRate) && isRatio(snapRate) && isRatio(vehicleAccessRate);
    }

    private static boolean isRatio(double v) {
        return Double.isFinite(v) && v >= 0 && v <= 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell)) return false;
        return Objects.equals(id, ((Cell) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Cell{" + id + " @ " + lat + "," + lon + ", pop=" + population + ", need=" + needIndex + "}";
    }
}
