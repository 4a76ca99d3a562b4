package com.carescore.integration;

public final class EventTypes {

    public static final String ASSESSMENT_CREATED = "assessment.created";
    public static final String ASSESSMENT_UPDATED = "assessment.updated";
    public static final String ASSESSMENT_ARCHIVED = "assessment.archived";

    public static final String PROGRESS_CREATED = "progress.created";
    public static final String PROGRESS_GOAL_UPDATED = "progress.goal_updated";
    public static final String PROGRESS_MILESTONE_REACHED = "progress.milestone_reached";
    public static final String PROGRESS_INTERVENTION_RECORDED = "progress.intervention_recorded";
    public static final String PROGRESS_ARCHIVED = "progress.archived";

    public static final String RISK_ALERT = "risk.alert";

    private EventTypes() {
    }
}
