package com.carescore.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class CategoryScoresConverter extends JsonAttributeConverter<Map<String, Integer>> {

    public CategoryScoresConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected Map<String, Integer> emptyValue() {
        return new LinkedHashMap<>();
    }
}
