package com.carescore.service.scoring;

import com.carescore.model.enums.ToolType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mini-Mental State Examination. Five domains summing to at most 30; lower is more impaired.
 */
public class MiniMentalStateExam extends ScoringTool {

    public static final String ORIENTATION = "orientation";
    public static final String REGISTRATION = "registration";
    public static final String ATTENTION_CALCULATION = "attentionCalculation";
    public static final String RECALL = "recall";
    public static final String LANGUAGE = "language";

    private static final double IMPAIRED_SHARE = 0.6;

    public MiniMentalStateExam() {
        super(ToolType.MMSE, 0, 30, List.of(
            CategoryRule.range(ORIENTATION, "impaired orientation", 0, 10),
            CategoryRule.range(REGISTRATION, "impaired registration", 0, 3),
            CategoryRule.range(ATTENTION_CALCULATION, "impaired attention and calculation", 0, 5),
            CategoryRule.range(RECALL, "impaired recall", 0, 3),
            CategoryRule.range(LANGUAGE, "impaired language", 0, 9)
        ));
    }

    @Override
    public double normalize(int total) {
        return round1(clampPercent((getMaxTotal() - total) * 100.0 / getMaxTotal()));
    }

    /**
     * Supplied domains scored below 60% of their maximum.
     */
    @Override
    public List<String> contributingFactors(Map<String, Integer> values) {
        List<String> factors = new ArrayList<>();
        for (CategoryRule rule : getRules()) {
            Integer value = values.get(rule.name());
            if (value != null && value < rule.max() * IMPAIRED_SHARE) {
                factors.add(rule.label());
            }
        }
        return factors;
    }
}
