package com.faceattendance.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JobAcknowledgement(String message,
                                 @JsonProperty("timetable_id") String sessionKey,
                                 int studentCount,
                                 int imageCount) {
}
