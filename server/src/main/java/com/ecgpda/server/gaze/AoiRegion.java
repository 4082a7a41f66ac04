package com.ecgpda.server.gaze;

/**
 * Axis-aligned area of interest covering one lead on screen. Bounds are
 * inclusive.
 */
public class AoiRegion {
    private final String lead;
    private final double xMin;
    private final double yMin;
    private final double xMax;
    private final double yMax;

    public AoiRegion(String lead, double xMin, double yMin, double xMax, double yMax) {
        if (lead == null) {
            throw new NullPointerException("lead");
        }
        if (xMin > xMax || yMin > yMax) {
            throw new IllegalArgumentException("Invalid bounds for AOI " + lead + ": (" + xMin + ", " + yMin
                    + ", " + xMax + ", " + yMax + ")");
        }
        this.lead = lead;
        this.xMin = xMin;
        this.yMin = yMin;
        this.xMax = xMax;
        this.yMax = yMax;
    }

    /**
     * @param bounds {@code [xMin, yMin, xMax, yMax]}
     */
    public static AoiRegion fromBounds(String lead, double[] bounds) {
        if (bounds == null || bounds.length != 4) {
            throw new IllegalArgumentException("AOI " + lead + " must have exactly 4 bounds");
        }
        return new AoiRegion(lead, bounds[0], bounds[1], bounds[2], bounds[3]);
    }

    public boolean contains(double x, double y) {
        return xMin <= x && x <= xMax && yMin <= y && y <= yMax;
    }

    public String getLead() {
        return lead;
    }
}
