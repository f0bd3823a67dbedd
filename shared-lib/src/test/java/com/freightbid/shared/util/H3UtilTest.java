package com.freightbid.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class H3UtilTest {

    @Test
    @DisplayName("Chicago to Indianapolis is about 265 km great-circle")
    void haversineDistance() {
        assertThat(H3Util.distanceKm(41.8781, -87.6298, 39.7684, -86.1581)).isCloseTo(265.0, within(5.0));
        assertThat(H3Util.distanceKm(41.8781, -87.6298, 41.8781, -87.6298)).isZero();
    }

    @Test
    @DisplayName("Backhaul cells around a point include its own cell and cover the radius")
    void backhaulCellsCoverRadius() {
        List<String> cells = H3Util.backhaulCellsWithin(41.8781, -87.6298, 75);

        assertThat(cells).contains(H3Util.backhaulCell(41.8781, -87.6298));
        // Joliet, ~60 km south-west of the Loop
        assertThat(cells).contains(H3Util.backhaulCell(41.5250, -88.0817));
        // Indianapolis is well outside
        assertThat(cells).doesNotContain(H3Util.backhaulCell(39.7684, -86.1581));
    }
}
