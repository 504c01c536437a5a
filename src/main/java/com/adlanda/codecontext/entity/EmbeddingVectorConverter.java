package com.adlanda.codecontext.entity;

import com.adlanda.codecontext.model.EmbeddingVector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores an embedding vector as a JSON array of numbers.
 */
@Converter
public class EmbeddingVectorConverter implements AttributeConverter<EmbeddingVector, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Double>> VALUES = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(EmbeddingVector vector) {
        if (vector == null || vector.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(vector.values());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize embedding vector", e);
        }
    }

    @Override
    public EmbeddingVector convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            return new EmbeddingVector(MAPPER.readValue(column, VALUES));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read stored embedding vector", e);
        }
    }
}
