package com.faceattendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class FaceAttendanceApplication {

    private static final String DEFAULT_TIME_ZONE = "Asia/Kolkata";

    public static void main(String[] args) {

        // JVM time zone has to be fixed before Spring and Hibernate read it
        String zone = System.getProperty("face.time-zone", DEFAULT_TIME_ZONE);
        TimeZone.setDefault(TimeZone.getTimeZone(zone));

        SpringApplication.run(FaceAttendanceApplication.class, args);
    }
}
