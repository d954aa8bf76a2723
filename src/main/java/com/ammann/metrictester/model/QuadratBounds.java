/* (C)2026 */
package com.ammann.metrictester.model;

/**
 * Axis-aligned square sampling window placed in an arena. Bounds are inclusive on all sides.
 *
 * @param quadrat 1-based placement order, which is also the quadrat's identity
 * @param xMin left edge
 * @param xMax right edge
 * @param yMin bottom edge
 * @param yMax top edge
 */
public record QuadratBounds(int quadrat, int xMin, int xMax, int yMin, int yMax) {

    /**
     * Two boxes overlap when both their X-intervals and their Y-intervals intersect. Shared
     * edges count as intersecting.
     */
    public boolean overlaps(QuadratBounds other) {
        boolean xIntersects = xMin <= other.xMax && other.xMin <= xMax;
        boolean yIntersects = yMin <= other.yMax && other.yMin <= yMax;
        return xIntersects && yIntersects;
    }

    public boolean contains(double x, double y) {
        return x >= xMin && x <= xMax && y >= yMin && y <= yMax;
    }

    /** Unit id of the CDM row sampled by this quadrat. */
    public String unitId() {
        return Integer.toString(quadrat);
    }
}
