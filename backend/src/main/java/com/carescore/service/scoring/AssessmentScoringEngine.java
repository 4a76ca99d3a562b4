package com.carescore.service.scoring;

import com.carescore.exception.ValidationException;
import com.carescore.model.enums.ToolType;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assessment Scoring Engine
 *
 * Side-effect-free scorers for the supported instruments:
 * - Morse Fall Scale (fall risk), 0-125, higher is riskier
 * - Braden Scale (pressure ulcer risk), 6-23, lower is riskier
 * - MMSE (cognition), 0-30, lower is more impaired
 *
 * Totals are always recomputed from the category values; bands come from {@link ScoringBands}.
 */
@Service
public class AssessmentScoringEngine {

    private final ScoringBands bands;
    private final Map<ToolType, ScoringTool> tools = new EnumMap<>(ToolType.class);

    public AssessmentScoringEngine(ScoringBands bands) {
        this.bands = bands;
        register(new MorseFallScale());
        register(new BradenScale());
        register(new MiniMentalStateExam());
    }

    public ToolScore scoreFallRisk(Map<String, Integer> categories) {
        return score(ToolType.MORSE, categories);
    }

    public ToolScore scorePressureUlcerRisk(Map<String, Integer> categories) {
        return score(ToolType.BRADEN, categories);
    }

    public ToolScore scoreCognition(Map<String, Integer> categories) {
        return score(ToolType.MMSE, categories);
    }

    public ToolScore score(ToolType toolType, Map<String, Integer> categories) {
        if (toolType == null) {
            throw ValidationException.required("toolType");
        }
        return toolFor(toolType).score(categories, bands.bandsFor(toolType));
    }

    public ScoringTool toolFor(ToolType toolType) {
        ScoringTool tool = tools.get(toolType);
        if (tool == null) {
            throw new ValidationException("toolType", "allowed_values", "Unsupported tool: " + toolType);
        }
        return tool;
    }

    public List<ScoreBand> bandsFor(ToolType toolType) {
        return bands.bandsFor(toolType);
    }

    private void register(ScoringTool tool) {
        tools.put(tool.getType(), tool);
    }
}
