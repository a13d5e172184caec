package com.faceattendance.intake;

import java.util.Objects;

public record ImageInput(String sourceRef, byte[] bytes) {

    public ImageInput {
        Objects.requireNonNull(bytes, "bytes");
    }

    // multipart file name
    public String fileName() {
        if (sourceRef == null || sourceRef.isBlank()) {
            return "image.jpg";
        }
        String path = sourceRef.split("\\?")[0];
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isBlank() ? "image.jpg" : name;
    }
}
