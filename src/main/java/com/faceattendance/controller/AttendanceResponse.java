package com.faceattendance.controller;

import com.faceattendance.service.AttendanceOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AttendanceResponse(String message,
                                 @JsonProperty("timetable_id") String timetableId,
                                 int presentCount,
                                 int absentCount,
                                 List<String> present,
                                 List<String> absent,
                                 int detections,
                                 int skippedImages) {

    static AttendanceResponse of(String message, AttendanceOutcome outcome) {
        return new AttendanceResponse(message,
                outcome.sessionKey(),
                outcome.present().size(),
                outcome.absent().size(),
                List.copyOf(outcome.present()),
                List.copyOf(outcome.absent()),
                outcome.detections(),
                outcome.skippedImages());
    }
}
