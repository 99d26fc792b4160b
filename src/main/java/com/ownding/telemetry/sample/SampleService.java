package com.ownding.telemetry.sample;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ownding.telemetry.common.ApiException;
import com.ownding.telemetry.device.Device;
import com.ownding.telemetry.device.DeviceService;
import com.ownding.telemetry.retention.EnforcementDispatcher;
import com.ownding.telemetry.retention.EnforcementFailure;
import com.ownding.telemetry.retention.EnforcementOutcome;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Ingestion path. The insert commits on its own; retention is dispatched afterwards and its result is
 * only reported, never allowed to fail the ingest.
 */
@Service
public class SampleService {

    private final SampleRepository sampleRepository;
    private final DeviceService deviceService;
    private final EnforcementDispatcher enforcementDispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SampleService(SampleRepository sampleRepository, DeviceService deviceService,
            EnforcementDispatcher enforcementDispatcher, ObjectMapper objectMapper, Clock clock) {
        this.sampleRepository = sampleRepository;
        this.deviceService = deviceService;
        this.enforcementDispatcher = enforcementDispatcher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public IngestResult ingest(IngestCommand command) {
        Instant timestamp = parseTimestamp(command.timestamp());
        Device device = deviceService.resolveDevice(command.userId(), command.deviceCode());
        long sampleId = sampleRepository.insertSample(device.userId(), device.id(), timestamp,
                writePayload(command.payload()));

        EnforcementDispatcher.DispatchResult dispatch =
                enforcementDispatcher.onSampleInserted(device.userId(), device.id());
        EnforcementOutcome outcome = dispatch.outcome();
        return new IngestResult(
                sampleId,
                device.userId(),
                device.id(),
                timestamp.toString(),
                outcome != null ? outcome.status().name() : dispatch.state().name(),
                outcome != null ? outcome.deleted() : 0,
                dispatch.failure());
    }

    private Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            try {
                timestamp = Instant.parse(raw.trim());
            } catch (DateTimeParseException ignored) {
                throw ApiException.badRequest("时间戳格式错误，需为带时区的 ISO-8601 时间: " + raw);
            }
        }
        if (!SampleRepository.isStorable(timestamp)) {
            throw ApiException.badRequest("时间戳超出支持范围 (" + SampleRepository.MIN_TIMESTAMP + " ~ "
                    + SampleRepository.MAX_TIMESTAMP + "): " + raw);
        }
        return timestamp;
    }

    private String writePayload(SamplePayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw ApiException.badRequest("采样数据无法序列化: " + ex.getOriginalMessage());
        }
    }

    public record IngestCommand(long userId, String deviceCode, String timestamp, SamplePayload payload) {
    }

    public record IngestResult(
            long sampleId,
            long userId,
            long deviceId,
            String timestamp,
            String enforcement,
            int pruned,
            EnforcementFailure failure
    ) {
    }
}
