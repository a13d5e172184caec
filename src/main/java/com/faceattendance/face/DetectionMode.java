package com.faceattendance.face;

public enum DetectionMode {
    /** Only the highest-scoring face in the image. */
    SINGLE("single"),
    /** Every face the detector finds. */
    ALL("all");

    private final String wireValue;

    DetectionMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
