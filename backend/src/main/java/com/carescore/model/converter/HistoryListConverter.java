package com.carescore.model.converter;

import com.carescore.model.HistoryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class HistoryListConverter extends JsonAttributeConverter<List<HistoryEntry>> {

    public HistoryListConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<HistoryEntry> emptyValue() {
        return new ArrayList<>();
    }
}
