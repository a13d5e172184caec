package com.faceattendance.face;

import com.faceattendance.config.FaceAttendanceConfig;
import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.ExtractionException;
import com.faceattendance.intake.ImageInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends every image of a batch to the extractor in parallel and waits for all of them.
 * Outcomes come back in input order, one per image, failures included.
 */
@Slf4j
@Component
public class FaceExtractionFanOut {

    private final FaceEmbeddingExtractor extractor;
    private final Executor executor;
    private final Duration timeout;

    public FaceExtractionFanOut(FaceEmbeddingExtractor extractor,
                                @Qualifier(FaceAttendanceConfig.FACE_TASK_EXECUTOR) Executor executor,
                                FaceAttendanceProperties props) {
        this.extractor = extractor;
        this.executor = executor;
        this.timeout = props.getExtractor().getTimeout();
    }

    public List<ExtractionOutcome> extractAll(List<ImageInput> images, DetectionMode mode) {
        List<CompletableFuture<List<DetectedFace>>> futures = new ArrayList<>(images.size());
        for (ImageInput image : images) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> extractor.detectFaces(image, mode), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        List<ExtractionOutcome> outcomes = new ArrayList<>(images.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(i, images.get(i), futures.get(i)));
        }
        return outcomes;
    }

    private ExtractionOutcome await(int index, ImageInput image, CompletableFuture<List<DetectedFace>> future) {
        try {
            List<DetectedFace> faces = future.join();
            return ExtractionOutcome.success(index, image.sourceRef(), faces == null ? List.of() : faces);
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ExtractionException failure = toExtractionException(cause).atImage(index);
            log.debug("Extraction failed for image {} ({}): {}", index, image.sourceRef(), failure.getMessage());
            return ExtractionOutcome.failure(index, image.sourceRef(), failure);
        }
    }

    private ExtractionException toExtractionException(Throwable cause) {
        if (cause instanceof ExtractionException) {
            return (ExtractionException) cause;
        }
        if (cause instanceof TimeoutException) {
            // the HTTP read timeout releases the worker thread
            return new ExtractionException("Face extraction timed out after " + timeout.toMillis() + " ms", cause);
        }
        return new ExtractionException("Face extraction failed: " + cause.getMessage(), cause);
    }
}
