package com.carescore.service.scoring;

import com.carescore.model.enums.ToolType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Morse Fall Scale. Six items with fixed point values, total 0-125; higher is riskier.
 */
public class MorseFallScale extends ScoringTool {

    public static final String HISTORY_OF_FALLS = "historyOfFalls";
    public static final String SECONDARY_DIAGNOSIS = "secondaryDiagnosis";
    public static final String AMBULATORY_AID = "ambulatoryAid";
    public static final String IV_THERAPY = "ivTherapy";
    public static final String GAIT = "gait";
    public static final String MENTAL_STATUS = "mentalStatus";

    public MorseFallScale() {
        super(ToolType.MORSE, 0, 125, List.of(
            CategoryRule.discrete(HISTORY_OF_FALLS, "history of falls", 0, 25),
            CategoryRule.discrete(SECONDARY_DIAGNOSIS, "secondary diagnosis", 0, 15),
            CategoryRule.discrete(AMBULATORY_AID, "ambulatory aid", 0, 15, 30),
            CategoryRule.discrete(IV_THERAPY, "IV therapy", 0, 20),
            CategoryRule.discrete(GAIT, "gait", 0, 10, 20),
            CategoryRule.discrete(MENTAL_STATUS, "mental status", 0, 15)
        ));
    }

    @Override
    public boolean higherIsRiskier() {
        return true;
    }

    @Override
    public double normalize(int total) {
        return round1(clampPercent(total * 100.0 / getMaxTotal()));
    }

    @Override
    public List<String> contributingFactors(Map<String, Integer> values) {
        List<String> factors = new ArrayList<>();
        if (value(values, HISTORY_OF_FALLS) > 0) factors.add("history of falls");
        if (value(values, SECONDARY_DIAGNOSIS) > 0) factors.add("secondary diagnosis");
        int aid = value(values, AMBULATORY_AID);
        if (aid == 30) factors.add("ambulatory aid: furniture");
        else if (aid == 15) factors.add("ambulatory aid: crutches, cane or walker");
        if (value(values, IV_THERAPY) > 0) factors.add("IV therapy");
        int gait = value(values, GAIT);
        if (gait == 20) factors.add("impaired gait");
        else if (gait == 10) factors.add("weak gait");
        if (value(values, MENTAL_STATUS) > 0) factors.add("forgets limitations");
        return factors;
    }

    private static int value(Map<String, Integer> values, String key) {
        return values.getOrDefault(key, 0);
    }
}
