package com.faceattendance.service;

import java.util.SortedSet;

public record AttendanceOutcome(String sessionKey,
                                SortedSet<String> present,
                                SortedSet<String> absent,
                                int detections,
                                int unknownFaces,
                                int skippedImages) {
}
