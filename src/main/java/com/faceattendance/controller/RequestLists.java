package com.faceattendance.controller;

import com.faceattendance.exception.InputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * List-valued form fields arrive either as repeated values or as one JSON array
 * string ("[101, 102]"). Both end up as a flat list of strings.
 */
final class RequestLists {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RequestLists() {}

    static List<String> flatten(List<String> raw, String field) {
        List<String> values = new ArrayList<>();
        if (raw == null) {
            return values;
        }
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String trimmed = value.trim();
            if (trimmed.startsWith("[")) {
                values.addAll(parseJsonArray(trimmed, field));
            } else {
                values.add(trimmed);
            }
        }
        return values;
    }

    private static List<String> parseJsonArray(String json, String field) {
        List<Object> parsed;
        try {
            parsed = MAPPER.readValue(json, new TypeReference<List<Object>>() {});
        } catch (JsonProcessingException e) {
            throw new InputException(field + " is not a valid JSON array");
        }
        List<String> values = new ArrayList<>(parsed.size());
        for (Object item : parsed) {
            if (item != null && !String.valueOf(item).isBlank()) {
                values.add(String.valueOf(item).trim());
            }
        }
        return values;
    }
}
