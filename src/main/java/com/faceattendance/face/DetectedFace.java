package com.faceattendance.face;

/**
 * One face found by the embedding service. The descriptor array is never handed
 * out directly so callers cannot mutate it.
 */
public final class DetectedFace {

    private final float[] descriptor;
    private final BoundingBox box;
    private final double score;

    public DetectedFace(float[] descriptor, BoundingBox box, double score) {
        this.descriptor = descriptor.clone();
        this.box = box;
        this.score = score;
    }

    public float[] descriptor() {
        return descriptor.clone();
    }

    public BoundingBox box() {
        return box;
    }

    public double score() {
        return score;
    }
}
