package com.carescore.integration;

/**
 * @param key      partition/ordering key, usually the patient id
 * @param priority "normal" or "high"
 */
public record PublishOptions(String key, String priority) {

    public static PublishOptions forPatient(String patientId) {
        return new PublishOptions(patientId, "normal");
    }

    public static PublishOptions urgent(String patientId) {
        return new PublishOptions(patientId, "high");
    }
}
