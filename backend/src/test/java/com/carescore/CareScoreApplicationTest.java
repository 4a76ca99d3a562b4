package com.carescore;

import com.carescore.integration.ApplicationEventClinicalEventPublisher;
import com.carescore.integration.ClinicalEventPublisher;
import com.carescore.integration.DisabledInsightGenerator;
import com.carescore.integration.InsightGenerator;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import com.carescore.service.scoring.ScoringBands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DisplayName("CareScore application context")
class CareScoreApplicationTest {

    @Autowired
    private ClinicalEventPublisher eventPublisher;

    @Autowired
    private InsightGenerator insightGenerator;

    @Autowired
    private ScoringBands scoringBands;

    @Test
    @DisplayName("Should wire local events and the disabled insight generator by default")
    void shouldWireDefaultCollaborators() {
        assertThat(eventPublisher).isInstanceOf(ApplicationEventClinicalEventPublisher.class);
        assertThat(insightGenerator).isInstanceOf(DisabledInsightGenerator.class);
    }

    @Test
    @DisplayName("Should bind score bands from application.yml")
    void shouldBindScoreBands() {
        assertThat(scoringBands.bandsFor(ToolType.BRADEN)).hasSize(5);
        assertThat(scoringBands.bandsFor(ToolType.MORSE).get(1).getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(scoringBands.bandsFor(ToolType.MMSE).get(0).getLabel()).isEqualTo("severe");
    }
}
