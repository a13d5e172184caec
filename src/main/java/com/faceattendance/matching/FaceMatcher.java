package com.faceattendance.matching;

import com.faceattendance.face.FaceDistance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Nearest-descriptor classifier over a fixed set of labelled descriptors.
 *
 * <p>A label's distance to a probe is the minimum over all of that label's
 * descriptors. The closest label wins if it lies within the threshold. Labels are
 * visited in ascending order and only a strictly smaller distance replaces the
 * current best, so equal distances resolve to the smallest label.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class FaceMatcher {

    public static final String UNKNOWN = "unknown";

    private final NavigableMap<String, List<float[]>> index;
    private final double threshold;

    private FaceMatcher(NavigableMap<String, List<float[]>> index, double threshold) {
        this.index = index;
        this.threshold = threshold;
    }

    public static FaceMatcher of(Map<String, ? extends Collection<float[]>> labeled, double threshold) {
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("Threshold must be a non-negative number: " + threshold);
        }
        NavigableMap<String, List<float[]>> copy = new TreeMap<>();
        labeled.forEach((label, descriptors) -> {
            if (descriptors == null || descriptors.isEmpty()) {
                return;
            }
            List<float[]> owned = new ArrayList<>(descriptors.size());
            for (float[] d : descriptors) {
                owned.add(d.clone());
            }
            copy.put(label, Collections.unmodifiableList(owned));
        });
        return new FaceMatcher(Collections.unmodifiableNavigableMap(copy), threshold);
    }

    public MatchResult classify(float[] probe) {
        String bestLabel = null;
        double bestDistance = Double.POSITIVE_INFINITY;

        for (Map.Entry<String, List<float[]>> entry : index.entrySet()) {
            double labelDistance = Double.POSITIVE_INFINITY;
            for (float[] descriptor : entry.getValue()) {
                labelDistance = Math.min(labelDistance, FaceDistance.euclidean(probe, descriptor));
            }
            if (labelDistance < bestDistance) {
                bestDistance = labelDistance;
                bestLabel = entry.getKey();
            }
        }

        if (bestLabel == null || bestDistance > threshold) {
            return new MatchResult(UNKNOWN, bestDistance);
        }
        return new MatchResult(bestLabel, bestDistance);
    }

    public Set<String> labels() {
        return index.keySet();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }
}
