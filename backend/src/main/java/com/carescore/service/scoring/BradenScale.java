package com.carescore.service.scoring;

import com.carescore.model.enums.ToolType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Braden Scale for pressure ulcer risk. Total 6-23; a lower total means higher risk.
 */
public class BradenScale extends ScoringTool {

    public static final String SENSORY_PERCEPTION = "sensoryPerception";
    public static final String MOISTURE = "moisture";
    public static final String ACTIVITY = "activity";
    public static final String MOBILITY = "mobility";
    public static final String NUTRITION = "nutrition";
    public static final String FRICTION_SHEAR = "frictionShear";

    public BradenScale() {
        super(ToolType.BRADEN, 6, 23, List.of(
            CategoryRule.range(SENSORY_PERCEPTION, "limited sensory perception", 1, 4),
            CategoryRule.range(MOISTURE, "moisture exposure", 1, 4),
            CategoryRule.range(ACTIVITY, "limited activity", 1, 4),
            CategoryRule.range(MOBILITY, "limited mobility", 1, 4),
            CategoryRule.range(NUTRITION, "poor nutrition", 1, 4),
            CategoryRule.range(FRICTION_SHEAR, "friction and shear", 1, 3)
        ));
    }

    @Override
    public double normalize(int total) {
        double span = getMaxTotal() - getMinTotal();
        return round1(clampPercent((getMaxTotal() - total) * 100.0 / span));
    }

    /**
     * Supplied subscales in the lower half of their range.
     */
    @Override
    public List<String> contributingFactors(Map<String, Integer> values) {
        List<String> factors = new ArrayList<>();
        for (CategoryRule rule : getRules()) {
            int value = values.getOrDefault(rule.name(), 0);
            int concernAt = rule.max() == 3 ? 1 : 2;
            if (value > 0 && value <= concernAt) {
                factors.add(rule.label());
            }
        }
        return factors;
    }
}
