package com.carescore.integration;

import java.util.List;

public record ClinicalInsights(
    List<String> recommendations,
    List<String> alerts,
    String narrative
) {

    public static ClinicalInsights empty() {
        return new ClinicalInsights(List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return recommendations.isEmpty() && alerts.isEmpty() && (narrative == null || narrative.isBlank());
    }
}
