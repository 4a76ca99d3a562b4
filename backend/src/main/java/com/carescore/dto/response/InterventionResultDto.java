package com.carescore.dto.response;

import com.carescore.model.progress.Intervention;

import java.util.List;

public record InterventionResultDto(
    ProgressRecordDto record,
    Intervention intervention,
    List<String> warnings
) {}
