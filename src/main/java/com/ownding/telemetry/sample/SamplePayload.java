package com.ownding.telemetry.sample;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SamplePayload(
        Integer heartRate,
        Double hrv,
        double accelX,
        double accelY,
        double accelZ,
        Double temperature,
        Double stressLevel,
        Map<String, Object> modelWeights
) {
}
