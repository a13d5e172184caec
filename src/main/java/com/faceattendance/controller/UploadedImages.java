package com.faceattendance.controller;

import com.faceattendance.exception.InputException;
import com.faceattendance.intake.ImageArchive;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

final class UploadedImages {

    private UploadedImages() {}

    record Upload(String originalName, String contentType, byte[] bytes) {
    }

    /** Reads the uploaded files, rejecting anything that is not JPG, PNG or WEBP. */
    static List<Upload> read(List<MultipartFile> files) {
        List<Upload> uploads = new ArrayList<>();
        if (files == null) {
            return uploads;
        }
        for (MultipartFile file : files) {
            if (file == null || file.isEmpty()) {
                continue;
            }
            if (!ImageArchive.isSupportedType(file.getContentType())) {
                throw new InputException("Only JPG/PNG/WEBP allowed");
            }
            try {
                uploads.add(new Upload(file.getOriginalFilename(), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                throw new InputException("Could not read uploaded file " + file.getOriginalFilename());
            }
        }
        return uploads;
    }
}
