package com.faceattendance.controller;

import com.faceattendance.model.AttendanceRecordView;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SessionAttendance(@JsonProperty("timetable_id") String timetableId,
                                List<AttendanceRecordView> records) {
}
