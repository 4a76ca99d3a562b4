package com.carescore.model.converter;

import com.carescore.model.progress.Goal;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class GoalListConverter extends JsonAttributeConverter<List<Goal>> {

    public GoalListConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<Goal> emptyValue() {
        return new ArrayList<>();
    }
}
