package relief.siting.core;

/**
 * Great-circle distances on a spherical earth. Coordinates are latitude/longitude in degrees.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_MILES = 3958.7613; // mean radius

    private GeoDistance() {}

    // Haversine distance in miles
    public static double miles(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1))
                        * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2)
                        * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    public static double miles(Cell a, Cell b) {
        return miles(a.lat, a.lon, b.lat, b.lon);
    }

    public static double miles(Facility f, Cell c) {
        return miles(f.lat, f.lon, c.lat, c.lon);
    }

    public static double miles(Facility a, Facility b) {
        return miles(a.lat, a.lon, b.lat, b.lon);
    }
}
