package com.carescore.service.risk;

import com.carescore.model.enums.RiskType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Standard-of-care mitigation text per risk type: immediate actions, alert criteria and
 * recommendations. Factor keywords let a specific finding pick a more targeted action.
 */
@Component
public class MitigationCatalog {

    private static final String CRITICAL_PREFIX = "CRITICAL: ";

    private final Map<RiskType, List<String>> criticalActions = new EnumMap<>(RiskType.class);
    private final Map<RiskType, List<String>> alertCriteria = new EnumMap<>(RiskType.class);
    private final Map<RiskType, List<String>> highRiskRecommendations = new EnumMap<>(RiskType.class);
    private final Map<RiskType, List<String>> moderateRiskRecommendations = new EnumMap<>(RiskType.class);
    private final Map<String, String> factorActions = new LinkedHashMap<>();

    public MitigationCatalog() {
        criticalActions.put(RiskType.FALL, List.of(
            "Implement maximum fall precautions", "Consider 1:1 observation", "Bed alarm activation"));
        criticalActions.put(RiskType.PRESSURE_ULCER, List.of(
            "Immediate pressure relief", "Wound care consultation", "Nutrition assessment"));
        criticalActions.put(RiskType.COGNITIVE_DECLINE, List.of(
            "Provide continuous supervision", "Physician notification for acute confusion", "Remove environmental hazards"));
        criticalActions.put(RiskType.INFECTION, List.of(
            "Isolation precautions", "Infection control measures", "Physician notification"));
        criticalActions.put(RiskType.MEDICATION, List.of(
            "Medication reconciliation", "Pharmacy consultation", "Double verification"));
        criticalActions.put(RiskType.READMISSION, List.of(
            "Discharge planning review", "Case management referral", "Family education"));

        alertCriteria.put(RiskType.FALL, List.of(
            "Unsteady gait observed", "Confusion or disorientation", "Orthostatic hypotension"));
        alertCriteria.put(RiskType.PRESSURE_ULCER, List.of(
            "Skin breakdown noted", "Prolonged pressure", "Nutritional decline"));
        alertCriteria.put(RiskType.COGNITIVE_DECLINE, List.of(
            "New or worsening confusion", "Agitation or wandering", "Refusal of care"));
        alertCriteria.put(RiskType.INFECTION, List.of(
            "Temperature elevation", "WBC changes", "New symptoms"));
        alertCriteria.put(RiskType.MEDICATION, List.of(
            "Medication discrepancy", "Adverse reaction", "Missed doses"));
        alertCriteria.put(RiskType.READMISSION, List.of(
            "Symptom recurrence", "Non-compliance", "Social issues"));

        highRiskRecommendations.put(RiskType.FALL, List.of(
            "Implement fall prevention protocol",
            "Ensure bed in lowest position with side rails up",
            "Provide non-slip footwear",
            "Consider bed alarm or chair alarm",
            "Increase frequency of rounding"));
        highRiskRecommendations.put(RiskType.PRESSURE_ULCER, List.of(
            "Implement pressure ulcer prevention protocol",
            "Turn patient every 2 hours",
            "Use pressure-relieving mattress",
            "Assess skin integrity daily",
            "Optimize nutrition and hydration"));
        highRiskRecommendations.put(RiskType.COGNITIVE_DECLINE, List.of(
            "Implement delirium and dementia care protocol",
            "Provide frequent reorientation",
            "Involve family in care planning",
            "Review medications affecting cognition",
            "Increase frequency of rounding."));
        highRiskRecommendations.put(RiskType.INFECTION, List.of(
            "Implement infection prevention measures",
            "Monitor for signs of infection",
            "Ensure proper hand hygiene",
            "Consider isolation precautions if indicated",
            "Review antibiotic stewardship"));
        highRiskRecommendations.put(RiskType.MEDICATION, List.of(
            "Implement medication safety protocols",
            "Double-check high-risk medications",
            "Provide medication education",
            "Consider medication reconciliation",
            "Monitor for adverse drug events"));
        highRiskRecommendations.put(RiskType.READMISSION, List.of(
            "Develop comprehensive discharge plan",
            "Ensure medication reconciliation",
            "Arrange appropriate follow-up care",
            "Provide patient education materials",
            "Consider case management referral"));

        moderateRiskRecommendations.put(RiskType.FALL, List.of("Regular safety rounds", "Mobility encouragement"));
        moderateRiskRecommendations.put(RiskType.PRESSURE_ULCER, List.of("Daily skin checks", "Position changes"));
        moderateRiskRecommendations.put(RiskType.COGNITIVE_DECLINE, List.of("Regular safety rounds", "Repeat cognitive screening"));
        moderateRiskRecommendations.put(RiskType.INFECTION, List.of("Routine vital signs", "Hygiene maintenance"));
        moderateRiskRecommendations.put(RiskType.MEDICATION, List.of("Standard medication protocols"));
        moderateRiskRecommendations.put(RiskType.READMISSION, List.of("Education reinforcement", "Discharge preparation"));

        // Matched against contributing factors, first keyword wins
        factorActions.put("gait", "Assist with all transfers and ambulation using a gait belt");
        factorActions.put("ambulatory aid", "Keep mobility aid within reach and supervise ambulation");
        factorActions.put("history of falls", "Bed in lowest position with bed alarm on");
        factorActions.put("forgets limitations", "Frequent reorientation with bed or chair alarm");
        factorActions.put("iv therapy", "Secure IV lines and assist with toileting");
        factorActions.put("moisture", "Manage incontinence and keep skin clean and dry");
        factorActions.put("nutrition", "Request dietitian consultation");
        factorActions.put("mobility", "Reposition at least every 2 hours");
        factorActions.put("activity", "Reposition at least every 2 hours");
        factorActions.put("friction", "Use lift sheets to reduce friction and shear");
        factorActions.put("sensory", "Inspect skin over bony prominences every shift");
        factorActions.put("orientation", "Provide reorientation cues and a consistent routine");
        factorActions.put("recall", "Use memory aids and involve family in reorientation");
    }

    /**
     * Targeted action for the first factor matching a known keyword, else the risk type's default.
     */
    public String immediateAction(RiskType type, List<String> contributingFactors) {
        if (contributingFactors != null) {
            for (String factor : contributingFactors) {
                String normalized = factor.toLowerCase(Locale.ROOT);
                for (Map.Entry<String, String> entry : factorActions.entrySet()) {
                    if (normalized.contains(entry.getKey())) {
                        return entry.getValue();
                    }
                }
            }
        }
        return criticalActions(type).get(0);
    }

    public List<String> criticalActions(RiskType type) {
        return criticalActions.getOrDefault(type, List.of("Standard critical risk protocols"));
    }

    public List<String> alertCriteria(RiskType type, boolean critical) {
        List<String> criteria = alertCriteria.getOrDefault(type, List.of("Condition changes"));
        if (!critical) {
            return criteria;
        }
        return criteria.stream().map(c -> CRITICAL_PREFIX + c).toList();
    }

    public List<String> highRiskRecommendations(RiskType type) {
        return highRiskRecommendations.getOrDefault(type, List.of("Monitor closely"));
    }

    public List<String> moderateRiskRecommendations(RiskType type) {
        return moderateRiskRecommendations.getOrDefault(type, List.of("Standard moderate risk monitoring"));
    }
}
