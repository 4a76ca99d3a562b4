package com.carescore.model.converter;

import com.carescore.model.progress.Intervention;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class InterventionListConverter extends JsonAttributeConverter<List<Intervention>> {

    public InterventionListConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<Intervention> emptyValue() {
        return new ArrayList<>();
    }
}
