package com.faceattendance.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts face descriptors to and from the JSON array form stored in
 * {@code ai_student_images.face_descriptor} and returned by the embedding service.
 */
public class DescriptorCodec {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int expectedLength;

    public DescriptorCodec(int expectedLength) {
        if (expectedLength <= 0) {
            throw new IllegalArgumentException("Descriptor length must be positive: " + expectedLength);
        }
        this.expectedLength = expectedLength;
    }

    public String encode(float[] descriptor) {
        if (descriptor == null || descriptor.length != expectedLength) {
            throw new IllegalArgumentException("Expected a descriptor of length " + expectedLength);
        }
        try {
            return objectMapper.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize descriptor", e);
        }
    }

    public float[] decode(String json) throws InvalidDescriptorException {
        if (json == null || json.isBlank()) {
            throw new InvalidDescriptorException("Descriptor is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptorException("Descriptor is not valid JSON", e);
        }
        return fromNode(node);
    }

    public float[] fromNode(JsonNode node) throws InvalidDescriptorException {
        if (node == null || !node.isArray()) {
            throw new InvalidDescriptorException("Descriptor is not a JSON array");
        }
        if (node.size() != expectedLength) {
            throw new InvalidDescriptorException(
                    "Descriptor has " + node.size() + " values, expected " + expectedLength);
        }
        float[] values = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new InvalidDescriptorException("Descriptor value " + i + " is not a number");
            }
            float f = value.floatValue();
            if (!Float.isFinite(f)) {
                throw new InvalidDescriptorException("Descriptor value " + i + " is not finite");
            }
            values[i] = f;
        }
        return values;
    }
}
