package net.spotter.core.model;

import java.util.Locale;

public record GeoPoint(double lat, double lon) {
    private static final double EARTH_RADIUS_M = 6_371_008.8;

    public GeoPoint {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) throw new IllegalArgumentException("lat out of range: " + lat);
        if (Double.isNaN(lon) || lon < -180 || lon > 180) throw new IllegalArgumentException("lon out of range: " + lon);
    }

    /** 하버사인 거리(미터) */
    public double distanceTo(GeoPoint o) {
        double dLat = Math.toRadians(o.lat - lat);
        double dLon = Math.toRadians(o.lon - lon);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat)) * Math.cos(Math.toRadians(o.lat))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_M * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    /** 좌표 기반 식별자 (소수 6자리, 약 0.1m) */
    public String key() {
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lon);
    }

    public GeoPoint offset(double dLat, double dLon) {
        return new GeoPoint(lat + dLat, lon + dLon);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.5f, %.5f)", lat, lon);
    }
}
