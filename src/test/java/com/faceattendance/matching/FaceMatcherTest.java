package com.faceattendance.matching;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.faceattendance.Vectors.along;
import static com.faceattendance.Vectors.origin;
import static com.faceattendance.Vectors.vec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FaceMatcherTest {

    @Test
    void closestStudentWithinThresholdWins() {
        FaceMatcher matcher = FaceMatcher.of(Map.of(
                "S1", List.of(along(0.4), along(1.2)),
                "S2", List.of(vec(0f, 0.9f, 0f, 0f))), 0.6);

        MatchResult result = matcher.classify(origin());

        assertThat(result.label()).isEqualTo("S1");
        assertThat(result.isKnown()).isTrue();
        assertThat(result.distance()).isCloseTo(0.4, within(1e-6));
    }

    @Test
    void bestCandidateBeyondThresholdIsUnknown() {
        FaceMatcher matcher = FaceMatcher.of(Map.of("S1", List.of(along(0.7))), 0.6);

        MatchResult result = matcher.classify(origin());

        assertThat(result.label()).isEqualTo(FaceMatcher.UNKNOWN);
        assertThat(result.isKnown()).isFalse();
        assertThat(result.distance()).isCloseTo(0.7, within(1e-6));
    }

    @Test
    void distanceEqualToThresholdStillMatches() {
        FaceMatcher matcher = FaceMatcher.of(Map.of("S1", List.of(along(0.5))), 0.5);

        assertThat(matcher.classify(origin()).label()).isEqualTo("S1");
    }

    @Test
    void usesNearestDescriptorNotTheAverage() {
        // S1's descriptors average far away, but one of them is close
        FaceMatcher matcher = FaceMatcher.of(Map.of(
                "S1", List.of(along(0.3), along(-4.0), along(-5.0)),
                "S2", List.of(along(0.55))), 0.6);

        assertThat(matcher.classify(origin()).label()).isEqualTo("S1");
    }

    @Test
    void equalDistancesResolveToSmallestStudentId() {
        Map<String, List<float[]>> labeled = new LinkedHashMap<>();
        labeled.put("S9", List.of(along(0.3)));
        labeled.put("S10", List.of(along(-0.3)));
        labeled.put("S2", List.of(vec(0f, 0.3f, 0f, 0f)));

        FaceMatcher matcher = FaceMatcher.of(labeled, 0.6);

        assertThat(matcher.classify(origin()).label()).isEqualTo("S10");
        assertThat(matcher.classify(origin()).label()).isEqualTo("S10");
    }

    @Test
    void emptyIndexNeverMatches() {
        FaceMatcher matcher = FaceMatcher.of(Map.of(), 0.6);

        MatchResult result = matcher.classify(origin());

        assertThat(matcher.isEmpty()).isTrue();
        assertThat(result.isKnown()).isFalse();
        assertThat(result.distance()).isInfinite();
    }

    @Test
    void studentsWithoutDescriptorsAreLeftOut() {
        FaceMatcher matcher = FaceMatcher.of(Map.of("S1", List.of(), "S2", List.of(along(0.1))), 0.6);

        assertThat(matcher.labels()).containsExactly("S2");
    }

    @Test
    void laterChangesToInputArraysDoNotAffectMatching() {
        float[] stored = along(0.2);
        FaceMatcher matcher = FaceMatcher.of(Map.of("S1", List.of(stored)), 0.6);

        stored[0] = 50f;

        assertThat(matcher.classify(origin()).label()).isEqualTo("S1");
    }

    @Test
    void rejectsNegativeThreshold() {
        assertThatThrownBy(() -> FaceMatcher.of(Map.of(), -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
