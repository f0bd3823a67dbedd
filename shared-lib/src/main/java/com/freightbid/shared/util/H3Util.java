package com.freightbid.shared.util;

import com.uber.h3core.H3Core;

import java.io.IOException;
import java.util.List;

/**
 * H3 hexagonal geo-cell utilities.
 * Resolution 5 ≈ 252 km², average edge ≈ 8.5 km, coarse enough for
 * lane-level freight lookups (backhaul search around a delivery point).
 */
public final class H3Util {

    public static final int BACKHAUL_RESOLUTION = 5;

    // Distance between neighbouring cell centres at BACKHAUL_RESOLUTION (≈ √3 × edge length)
    private static final double BACKHAUL_CELL_SPACING_KM = 14.8;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private H3Util() {}

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static String backhaulCell(double lat, double lng) {
        return latLngToCell(lat, lng, BACKHAUL_RESOLUTION);
    }

    public static List<String> kRingCells(String cellId, int ringSize) {
        return h3.gridDisk(cellId, ringSize);
    }

    /**
     * All backhaul cells whose centre may lie within radiusKm of the given point.
     * One extra ring covers points sitting near the edge of the centre cell.
     */
    public static List<String> backhaulCellsWithin(double lat, double lng, double radiusKm) {
        int rings = (int) Math.ceil(radiusKm / BACKHAUL_CELL_SPACING_KM) + 1;
        return kRingCells(backhaulCell(lat, lng), rings);
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        final int R = 6371;
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return R * c;
    }
}
