package com.gocars.ridesafety.util;

import com.gocars.ridesafety.model.RoutePoint;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Geometry helpers for route matching and driving-behavior analysis.
 *
 * Supports two ways of matching a fix against a planned route:
 *  - Vertex  : brute-force nearest planned point
 *  - Segment : nearest point on the planned polyline, projected on a local
 *              equirectangular plane around the fix (accurate for the few-km
 *              segments of a city route)
 */
public final class GeoUtil {

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @return Distance in meters
     */
    public static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double calculateDistance(RoutePoint from, RoutePoint to) {
        return calculateDistance(from.getLatitude(), from.getLongitude(),
                to.getLatitude(), to.getLongitude());
    }

    /**
     * Brute-force nearest planned point.
     *
     * @param route non-empty planned route
     */
    public static RoutePoint nearestVertex(RoutePoint location, List<RoutePoint> route) {
        RoutePoint closest = route.get(0);
        double minDistance = calculateDistance(location, closest);
        for (RoutePoint point : route) {
            double distance = calculateDistance(location, point);
            if (distance < minDistance) {
                minDistance = distance;
                closest = point;
            }
        }
        return closest;
    }

    /**
     * Distance in meters from {@code location} to the nearest planned vertex.
     */
    public static double distanceToNearestVertex(RoutePoint location, List<RoutePoint> route) {
        return calculateDistance(location, nearestVertex(location, route));
    }

    /**
     * Distance in meters from {@code location} to the nearest point of the planned polyline.
     * A single-point route degenerates to the vertex distance.
     *
     * @param route non-empty planned route
     */
    public static double distanceToPolyline(RoutePoint location, List<RoutePoint> route) {
        if (route.size() == 1) {
            return calculateDistance(location, route.get(0));
        }
        double best = Double.MAX_VALUE;
        for (int i = 1; i < route.size(); i++) {
            double[] nearest = nearestPointOnSegment(location, route.get(i - 1), route.get(i));
            double distance = calculateDistance(location.getLatitude(), location.getLongitude(),
                    nearest[0], nearest[1]);
            best = Math.min(best, distance);
        }
        return best;
    }

    /**
     * Nearest point on segment a→b to {@code p}, as a [lat, lon] pair.
     *
     * Projects onto a plane tangent at p: x east, y north, both in meters.
     */
    static double[] nearestPointOnSegment(RoutePoint p, RoutePoint a, RoutePoint b) {
        double cosLat = Math.cos(Math.toRadians(p.getLatitude()));
        double ax = toMetersX(a.getLongitude() - p.getLongitude(), cosLat);
        double ay = toMetersY(a.getLatitude() - p.getLatitude());
        double bx = toMetersX(b.getLongitude() - p.getLongitude(), cosLat);
        double by = toMetersY(b.getLatitude() - p.getLatitude());

        double dx = bx - ax;
        double dy = by - ay;
        double lengthSq = dx * dx + dy * dy;
        double t = lengthSq == 0 ? 0 : (-ax * dx - ay * dy) / lengthSq;
        t = Math.max(0, Math.min(1, t));

        double lat = a.getLatitude() + t * (b.getLatitude() - a.getLatitude());
        double lon = a.getLongitude() + t * (b.getLongitude() - a.getLongitude());
        return new double[]{lat, lon};
    }

    /**
     * Smallest angle between two headings, in degrees within [0, 180].
     */
    public static double headingDelta(double heading1, double heading2) {
        double change = Math.abs(normalizeHeading(heading1) - normalizeHeading(heading2));
        return Math.min(change, 360 - change);
    }

    /**
     * Initial great-circle bearing from one fix to another, degrees clockwise from north in [0, 360).
     */
    public static double bearing(RoutePoint from, RoutePoint to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());

        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        return normalizeHeading(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Speed between two fixes in m/s; 0 when time does not advance.
     */
    public static double speedBetween(RoutePoint from, RoutePoint to) {
        double seconds = secondsBetween(from, to);
        return seconds > 0 ? calculateDistance(from, to) / seconds : 0;
    }

    public static double secondsBetween(RoutePoint from, RoutePoint to) {
        return Duration.between(from.getTimestamp(), to.getTimestamp()).toMillis() / 1000.0;
    }

    public static double metersPerSecondToKmh(double metersPerSecond) {
        return metersPerSecond * 3.6;
    }

    /** Coordinates as "lat, lon" with six decimals, used where no reverse geocoder exists. */
    public static String formatCoordinates(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.6f, %.6f", latitude, longitude);
    }

    private static double normalizeHeading(double heading) {
        double h = heading % 360;
        return h < 0 ? h + 360 : h;
    }

    private static double toMetersX(double deltaLonDegrees, double cosLat) {
        return Math.toRadians(deltaLonDegrees) * EARTH_RADIUS_METERS * cosLat;
    }

    private static double toMetersY(double deltaLatDegrees) {
        return Math.toRadians(deltaLatDegrees) * EARTH_RADIUS_METERS;
    }
}
