package com.carescore.service.scoring;

import com.carescore.model.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive total-score range of a tool, its label on the tool's own scale and the
 * normalized risk level it stands for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBand {

    private String label;
    private int min;
    private int max;
    private RiskLevel riskLevel;

    public boolean contains(int total) {
        return total >= min && total <= max;
    }
}
