package com.faceattendance.controller;

import com.faceattendance.exception.ConflictException;
import com.faceattendance.exception.ExtractionException;
import com.faceattendance.exception.ImageFetchException;
import com.faceattendance.exception.InputException;
import com.faceattendance.exception.ServiceNotReadyException;
import com.faceattendance.exception.StoreException;
import com.faceattendance.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Renders failures as {"error": "..."} with an optional "imageIndex".
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({InputException.class, ImageFetchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), OptionalInt.empty());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", OptionalInt.empty());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(ConflictException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), OptionalInt.empty());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.getImageIndex());
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<Map<String, Object>> extraction(ExtractionException e) {
        log.warn("Face extraction failed: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.getImageIndex());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> tooLarge(MaxUploadSizeExceededException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Image exceeds the upload size limit", OptionalInt.empty());
    }

    @ExceptionHandler({ServiceNotReadyException.class, TaskRejectedException.class})
    public ResponseEntity<Map<String, Object>> unavailable(RuntimeException e) {
        log.warn("Request refused: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable, try again later", OptionalInt.empty());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> store(StoreException e) {
        log.error("Store failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), OptionalInt.empty());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception e) {
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), OptionalInt.empty());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, OptionalInt imageIndex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        imageIndex.ifPresent(i -> body.put("imageIndex", i));
        return ResponseEntity.status(status).body(body);
    }
}
