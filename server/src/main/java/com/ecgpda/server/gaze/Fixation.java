package com.ecgpda.server.gaze;

/**
 * A single eye fixation on the displayed ECG.
 */
public class Fixation {
    // screen coordinates in pixels
    public double x;
    public double y;
    public double duration; // ms
    public double timestamp;

    public Fixation() {
    }

    public Fixation(double x, double y, double duration, double timestamp) {
        this.x = x;
        this.y = y;
        this.duration = duration;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "Fixation(x=" + x + ", y=" + y + ", d=" + duration + "ms, t=" + timestamp + ")";
    }
}
