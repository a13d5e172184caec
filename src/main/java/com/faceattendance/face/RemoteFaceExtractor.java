package com.faceattendance.face;

import com.faceattendance.config.FaceAttendanceProperties;
import com.faceattendance.exception.ExtractionException;
import com.faceattendance.intake.ImageInput;
import com.faceattendance.matching.DescriptorCodec;
import com.faceattendance.matching.InvalidDescriptorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Talks to the face detection/embedding service over HTTP.
 *
 * POST {base-url}/detect-faces  (multipart: file, mode=single|all)
 *   -> {"success": true, "faces": [{"descriptor": [...], "box": {...}, "score": 0.98}]}
 *   -> {"success": false, "message": "..."}
 * GET  {base-url}/health
 */
@Slf4j
@Component
public class RemoteFaceExtractor implements FaceEmbeddingExtractor {

    private final RestTemplate restTemplate;
    private final DescriptorCodec codec;
    private final String baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RemoteFaceExtractor(RestTemplate restTemplate,
                               DescriptorCodec codec,
                               FaceAttendanceProperties props) {
        this.restTemplate = restTemplate;
        this.codec = codec;
        this.baseUrl = stripTrailingSlash(props.getExtractor().getBaseUrl());
    }

    @Override
    public List<DetectedFace> detectFaces(ImageInput image, DetectionMode mode) {
        String url = baseUrl + "/detect-faces";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new NamedByteArrayResource(image.bytes(), image.fileName()));
        body.add("mode", mode.wireValue());

        HttpEntity<MultiValueMap<String, Object>> requestEntity = new HttpEntity<>(body, headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, requestEntity, String.class);
        } catch (RestClientException e) {
            throw new ExtractionException("Face embedding service call failed: " + e.getMessage(), e);
        }

        List<DetectedFace> faces = parseFaces(response.getBody());
        if (mode == DetectionMode.SINGLE && faces.size() > 1) {
            faces = List.of(faces.stream().max(Comparator.comparingDouble(DetectedFace::score)).orElseThrow());
        }
        log.debug("Detected {} face(s) in {} ({} mode)", faces.size(), image.fileName(), mode.wireValue());
        return faces;
    }

    @Override
    public void checkHealth() {
        try {
            restTemplate.getForEntity(baseUrl + "/health", String.class);
        } catch (RestClientException e) {
            throw new ExtractionException("Face embedding service is not available at " + baseUrl, e);
        }
    }

    List<DetectedFace> parseFaces(String responseBody) {
        JsonNode root;
        try {
            root = responseBody == null ? null : objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Unreadable response from face embedding service", e);
        }
        if (root == null || !root.path("success").asBoolean(false)) {
            String message = root != null && root.hasNonNull("message")
                    ? root.get("message").asText()
                    : "Unknown error from face embedding service";
            throw new ExtractionException("Face detection failed: " + message);
        }

        JsonNode facesNode = root.path("faces");
        if (!facesNode.isArray()) {
            throw new ExtractionException("Face embedding service returned no face list");
        }

        List<DetectedFace> faces = new ArrayList<>(facesNode.size());
        for (JsonNode faceNode : facesNode) {
            float[] descriptor;
            try {
                descriptor = codec.fromNode(faceNode.get("descriptor"));
            } catch (InvalidDescriptorException e) {
                throw new ExtractionException("Face embedding service returned a bad descriptor: " + e.getMessage(), e);
            }
            faces.add(new DetectedFace(descriptor, readBox(faceNode.path("box")), faceNode.path("score").asDouble(0)));
        }
        return faces;
    }

    private BoundingBox readBox(JsonNode box) {
        if (box.isMissingNode() || box.isNull()) {
            return null;
        }
        return new BoundingBox(
                box.path("x").asDouble(),
                box.path("y").asDouble(),
                box.path("width").asDouble(),
                box.path("height").asDouble());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // multipart parts need a file name or the receiving side treats them as plain fields
    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
