package com.faceattendance.face;

import com.faceattendance.exception.ExtractionException;
import com.faceattendance.intake.ImageInput;

import java.util.List;

/**
 * Face detection + embedding model, hosted outside this service.
 */
public interface FaceEmbeddingExtractor {

    /**
     * Detects faces in an image and returns their descriptors.
     *
     * @param image the decoded image bytes
     * @param mode  {@link DetectionMode#SINGLE} returns at most one face,
     *              {@link DetectionMode#ALL} returns every face found
     * @return the faces found, empty when the image holds no face
     * @throws ExtractionException if the image could not be processed
     */
    List<DetectedFace> detectFaces(ImageInput image, DetectionMode mode);

    /**
     * @throws ExtractionException if the service is unreachable or its models are not loaded
     */
    void checkHealth();
}
