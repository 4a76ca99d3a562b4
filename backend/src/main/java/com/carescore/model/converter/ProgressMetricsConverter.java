package com.carescore.model.converter;

import com.carescore.model.progress.ProgressMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ProgressMetricsConverter extends JsonAttributeConverter<ProgressMetrics> {

    public ProgressMetricsConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected ProgressMetrics emptyValue() {
        return new ProgressMetrics();
    }
}
