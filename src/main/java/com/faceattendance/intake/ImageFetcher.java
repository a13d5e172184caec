package com.faceattendance.intake;

import com.faceattendance.config.FaceAttendanceConfig;
import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.FaceAttendanceException;
import com.faceattendance.exception.ImageFetchException;
import com.faceattendance.exception.InputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns image references into bytes. http(s) references are downloaded,
 * anything else is read from the upload archive.
 */
@Slf4j
@Component
public class ImageFetcher {

    private final RestTemplate restTemplate;
    private final ImageArchive archive;
    private final Executor executor;
    private final Duration downloadTimeout;

    public ImageFetcher(RestTemplate restTemplate,
                        ImageArchive archive,
                        @Qualifier(FaceAttendanceConfig.FACE_TASK_EXECUTOR) Executor executor,
                        FaceAttendanceProperties props) {
        this.restTemplate = restTemplate;
        this.archive = archive;
        this.executor = executor;
        this.downloadTimeout = props.getIntake().getDownloadTimeout();
    }

    public ImageInput fetch(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new ImageFetchException("Image reference is empty");
        }
        byte[] bytes = isRemote(ref) ? download(ref) : readArchived(ref);
        if (bytes == null || bytes.length == 0) {
            throw new ImageFetchException("Image is empty: " + ref);
        }
        return new ImageInput(ref, bytes);
    }

    /** Fetches every reference in parallel; the first failure (in input order) is rethrown. */
    public List<ImageInput> fetchAll(List<String> refs) {
        List<CompletableFuture<ImageInput>> futures = startAll(refs);
        List<ImageInput> images = new ArrayList<>(refs.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                images.add(futures.get(i).join());
            } catch (CompletionException e) {
                throw toFetchException(refs.get(i), e.getCause());
            }
        }
        return images;
    }

    /** Fetches every reference in parallel, dropping the ones that fail. */
    public List<ImageInput> fetchAvailable(List<String> refs) {
        List<CompletableFuture<ImageInput>> futures = startAll(refs);
        List<ImageInput> images = new ArrayList<>(refs.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                images.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Skipping image {}: {}", refs.get(i), toFetchException(refs.get(i), e.getCause()).getMessage());
            }
        }
        return images;
    }

    private List<CompletableFuture<ImageInput>> startAll(List<String> refs) {
        List<CompletableFuture<ImageInput>> futures = new ArrayList<>(refs.size());
        for (String ref : refs) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> fetch(ref), executor)
                    .orTimeout(downloadTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        return futures;
    }

    private byte[] download(String url) {
        try {
            return restTemplate.getForObject(URI.create(url), byte[].class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new ImageFetchException("Could not download " + url + ": " + e.getMessage(), e);
        }
    }

    private byte[] readArchived(String ref) {
        Path path;
        try {
            path = archive.resolve(ref);
        } catch (InputException e) {
            throw new ImageFetchException(e.getMessage(), e);
        }
        if (!Files.isRegularFile(path)) {
            throw new ImageFetchException("Image file not found: " + ref);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageFetchException("Could not read " + ref, e);
        }
    }

    private static boolean isRemote(String ref) {
        String lower = ref.toLowerCase();
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private FaceAttendanceException toFetchException(String ref, Throwable cause) {
        if (cause instanceof FaceAttendanceException) {
            return (FaceAttendanceException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new ImageFetchException("Download timed out: " + ref, cause);
        }
        return new ImageFetchException("Could not fetch " + ref + ": " + cause.getMessage(), cause);
    }
}
