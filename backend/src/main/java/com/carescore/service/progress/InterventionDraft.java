package com.carescore.service.progress;

import java.util.List;

/**
 * Caller input for an intervention. {@code effectiveness} is estimated when absent.
 */
public record InterventionDraft(
    String type,
    String description,
    Double effectiveness,
    List<String> goalIds
) {}
