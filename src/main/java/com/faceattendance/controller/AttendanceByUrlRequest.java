package com.faceattendance.controller;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AttendanceByUrlRequest(
        @JsonProperty("timetable_id") String timetableId,
        @JsonProperty("student_ids")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> studentIds,
        @JsonProperty("image_urls")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> imageUrls) {
}
