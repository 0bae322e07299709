package com.rescuegrid.dispatch.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/** 메모 목록 ↔ JSON 배열 문자열 ({@code ["note 1","note 2"]}) */
@Converter
public class NotesConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> NOTES_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> notes) {
        try {
            return MAPPER.writeValueAsString(notes != null ? notes : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notes", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(MAPPER.readValue(json, NOTES_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Corrupted notes column: " + json, e);
        }
    }
}
