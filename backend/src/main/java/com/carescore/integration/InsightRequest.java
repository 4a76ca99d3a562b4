package com.carescore.integration;

import java.util.Map;

/**
 * Domain data handed to the insight generator.
 *
 * @param domain e.g. "assessment", "risk", "progress"
 */
public record InsightRequest(String domain, String patientId, Map<String, Object> data) {}
