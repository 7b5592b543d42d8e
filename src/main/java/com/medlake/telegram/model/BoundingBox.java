package com.medlake.telegram.model;

import java.util.List;

/**
 * Corner coordinates of a detection, top-left (x1, y1) to bottom-right (x2, y2).
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public List<Double> toList() {
        return List.of(x1, y1, x2, y2);
    }
}
