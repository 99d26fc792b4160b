package com.ownding.telemetry.sample;

import com.ownding.telemetry.common.ApiResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/users/{userId}/devices/{deviceCode}/samples")
public class SampleController {

    private final SampleService sampleService;

    public SampleController(SampleService sampleService) {
        this.sampleService = sampleService;
    }

    @PostMapping
    public Mono<ApiResult<SampleService.IngestResult>> ingest(@PathVariable long userId,
            @PathVariable String deviceCode, @Valid @RequestBody SampleRequest request) {
        SamplePayload payload = new SamplePayload(
                request.heartRate(),
                request.hrv(),
                request.accelX(),
                request.accelY(),
                request.accelZ(),
                request.temperature(),
                request.stressLevel(),
                request.modelWeights());
        return Mono.fromCallable(() -> ApiResult.success(sampleService.ingest(
                        new SampleService.IngestCommand(userId, deviceCode, request.timestamp(), payload))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record SampleRequest(
            String timestamp,
            Integer heartRate,
            Double hrv,
            @NotNull(message = "不能为空") Double accelX,
            @NotNull(message = "不能为空") Double accelY,
            @NotNull(message = "不能为空") Double accelZ,
            Double temperature,
            Double stressLevel,
            Map<String, Object> modelWeights
    ) {
    }
}
