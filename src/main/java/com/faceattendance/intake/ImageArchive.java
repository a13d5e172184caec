package com.faceattendance.intake;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.InputException;
import com.faceattendance.exception.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps uploaded enrollment photos on disk under {@code <upload-root>/students}.
 * The returned relative path is what gets stored as the embedding's image path.
 */
@Slf4j
@Component
public class ImageArchive {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/webp", "webp");

    private static final String STUDENTS_FOLDER = "students";

    private final Path root;
    private final AtomicLong sequence = new AtomicLong();

    public ImageArchive(FaceAttendanceProperties props) {
        this.root = Paths.get(props.getStorage().getUploadRoot()).toAbsolutePath().normalize();
    }

    public static boolean isSupportedType(String contentType) {
        return contentType != null && EXTENSIONS.containsKey(contentType.toLowerCase());
    }

    public String storeEnrollmentImage(String studentId, byte[] bytes, String contentType) {
        if (!isSupportedType(contentType)) {
            throw new InputException("Only JPG/PNG/WEBP allowed");
        }
        String extension = EXTENSIONS.get(contentType.toLowerCase());
        String safeName = studentId == null ? "student" : studentId.replaceAll("[^\\w\\-]+", "_");
        String fileName = safeName + "_" + System.currentTimeMillis() + "_" + sequence.incrementAndGet() + "." + extension;

        Path folder = root.resolve(STUDENTS_FOLDER);
        Path target = folder.resolve(fileName);
        try {
            Files.createDirectories(folder);
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new StoreException("Could not store uploaded image " + fileName, e);
        }
        return STUDENTS_FOLDER + "/" + fileName;
    }

    /**
     * Resolves a path previously returned by this archive. Anything pointing
     * outside the archive root is refused.
     */
    public Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new InputException("Image path is outside the upload folder: " + relativePath);
        }
        return resolved;
    }

    /** Removes files stored for an enrollment that was rejected. */
    public void discard(List<String> relativePaths) {
        for (String relativePath : relativePaths) {
            try {
                Files.deleteIfExists(resolve(relativePath));
            } catch (IOException e) {
                log.warn("Could not remove rejected upload {}: {}", relativePath, e.getMessage());
            }
        }
    }
}
