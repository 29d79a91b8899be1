package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectedComponentLabelerTest {

    @Test
    void diagonalNeighboursConnect() {
        ForegroundMask mask = new ForegroundMask(4, 4);
        mask.set(0, 0, true);
        mask.set(1, 1, true);
        mask.set(2, 2, true);

        RegionLabelMap labels = ConnectedComponentLabeler.label(mask);
        assertEquals(1, labels.count());
        assertEquals(1, labels.label(2, 2));
        assertEquals(0, labels.label(3, 3));
    }

    @Test
    void labelsFollowRasterOrder() {
        ForegroundMask mask = new ForegroundMask(10, 10);
        mask.set(8, 1, true);
        mask.set(1, 5, true);
        mask.set(2, 5, true);

        RegionLabelMap labels = ConnectedComponentLabeler.label(mask);
        assertEquals(2, labels.count());
        assertEquals(1, labels.label(8, 1));
        assertEquals(2, labels.label(2, 5));
    }

    @Test
    void emptyMaskHasNoComponents() {
        assertEquals(0, ConnectedComponentLabeler.label(new ForegroundMask(7, 3)).count());
    }

    @Test
    void bounds_restrictedToGivenMask() {
        ForegroundMask original = new ForegroundMask(20, 20);
        for (int y = 5; y < 8; y++) for (int x = 5; x < 9; x++) original.set(x, y, true);
        ForegroundMask dilated = Morphology.dilate(original, 2);

        RegionLabelMap labels = ConnectedComponentLabeler.label(dilated);
        Box[] tight = labels.bounds(original);
        Box[] loose = labels.bounds(dilated);

        assertEquals(1, tight.length);
        assertEquals(new Box(5, 5, 9, 8), tight[0]);
        assertEquals(new Box(3, 3, 11, 10), loose[0]);
    }
}
