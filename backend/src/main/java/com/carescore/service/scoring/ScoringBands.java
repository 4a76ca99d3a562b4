package com.carescore.service.scoring;

import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk bands per tool, bound from {@code carescore.scoring.*}. Defaults are the published cut-offs.
 * Bands must be ascending and must not overlap; the application refuses to start otherwise.
 */
@Data
@ConfigurationProperties(prefix = "carescore.scoring")
public class ScoringBands {

    private List<ScoreBand> morse = new ArrayList<>(List.of(
        new ScoreBand("low", 0, 24, RiskLevel.LOW),
        new ScoreBand("moderate", 25, 44, RiskLevel.MEDIUM),
        new ScoreBand("high", 45, 125, RiskLevel.HIGH)
    ));

    // Braden: lower total means higher risk
    private List<ScoreBand> braden = new ArrayList<>(List.of(
        new ScoreBand("high", 6, 9, RiskLevel.HIGH),
        new ScoreBand("moderate", 10, 12, RiskLevel.MEDIUM),
        new ScoreBand("mild", 13, 14, RiskLevel.LOW),
        new ScoreBand("minimal", 15, 18, RiskLevel.LOW),
        new ScoreBand("no_risk", 19, 23, RiskLevel.LOW)
    ));

    private List<ScoreBand> mmse = new ArrayList<>(List.of(
        new ScoreBand("severe", 0, 9, RiskLevel.HIGH),
        new ScoreBand("moderate", 10, 18, RiskLevel.MEDIUM),
        new ScoreBand("mild", 19, 23, RiskLevel.LOW),
        new ScoreBand("normal", 24, 30, RiskLevel.LOW)
    ));

    public List<ScoreBand> bandsFor(ToolType tool) {
        return switch (tool) {
            case MORSE -> morse;
            case BRADEN -> braden;
            case MMSE -> mmse;
        };
    }

    @PostConstruct
    public void validate() {
        for (ToolType tool : ToolType.values()) {
            validate(tool, bandsFor(tool));
        }
    }

    static void validate(ToolType tool, List<ScoreBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalStateException("No score bands configured for " + tool.getValue());
        }
        ScoreBand previous = null;
        for (ScoreBand band : bands) {
            if (band.getLabel() == null || band.getLabel().isBlank() || band.getRiskLevel() == null) {
                throw new IllegalStateException("Score band for " + tool.getValue() + " needs a label and a risk level");
            }
            if (band.getMin() > band.getMax()) {
                throw new IllegalStateException("Score band '" + band.getLabel() + "' of " + tool.getValue()
                    + " has min " + band.getMin() + " above max " + band.getMax());
            }
            if (previous != null && band.getMin() <= previous.getMax()) {
                throw new IllegalStateException("Score bands of " + tool.getValue() + " overlap or are not ascending: '"
                    + previous.getLabel() + "' and '" + band.getLabel() + "'");
            }
            previous = band;
        }
    }
}
