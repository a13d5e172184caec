package com.faceattendance.matching;

/**
 * Best candidate for a probe. {@code label} is {@link FaceMatcher#UNKNOWN} when no
 * enrolled student is within the threshold; {@code distance} is always the best one seen.
 */
public record MatchResult(String label, double distance) {

    public boolean isKnown() {
        return !FaceMatcher.UNKNOWN.equals(label);
    }
}
