package com.carescore.service.risk;

import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;

import java.util.List;

public record RiskAlert(
    RiskType riskType,
    RiskLevel level,
    double score,
    String immediateAction,
    List<String> alertCriteria
) {}
