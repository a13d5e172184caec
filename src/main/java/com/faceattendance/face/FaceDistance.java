package com.faceattendance.face;

public final class FaceDistance {

    private FaceDistance() {}

    /** Euclidean distance over the raw descriptor values. */
    public static double euclidean(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Descriptor length mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
