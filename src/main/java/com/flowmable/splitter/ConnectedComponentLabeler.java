package com.flowmable.splitter;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Breadth-first 8-connected component labeling.
 * <p>
 * Labels are assigned in raster order of each component's first pixel, so the
 * output is deterministic for a given mask.
 */
public final class ConnectedComponentLabeler {

    private static final int[] DX = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] DY = {-1, -1, -1, 0, 0, 1, 1, 1};

    private ConnectedComponentLabeler() {}

    public static RegionLabelMap label(ForegroundMask mask) {
        int w = mask.width();
        int h = mask.height();
        boolean[] bits = mask.bits();
        int[] labels = new int[w * h];
        int next = 0;

        Queue<Integer> queue = new ArrayDeque<>();
        for (int start = 0; start < bits.length; start++) {
            if (!bits[start] || labels[start] != 0) continue;

            int id = ++next;
            labels[start] = id;
            queue.add(start);

            while (!queue.isEmpty()) {
                int p = queue.poll();
                int px = p % w;
                int py = p / w;
                for (int i = 0; i < DX.length; i++) {
                    int nx = px + DX[i];
                    int ny = py + DY[i];
                    if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;
                    int n = ny * w + nx;
                    if (bits[n] && labels[n] == 0) {
                        labels[n] = id;
                        queue.add(n);
                    }
                }
            }
        }
        return new RegionLabelMap(w, h, labels, next);
    }
}
