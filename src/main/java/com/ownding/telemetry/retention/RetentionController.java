package com.ownding.telemetry.retention;

import com.ownding.telemetry.common.ApiResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Validated
@RestController
@RequestMapping("/api/retention")
public class RetentionController {

    private final RetentionEnforcer retentionEnforcer;
    private final EnforcementMonitor monitor;
    private final KeyedEnforcementGate gate;

    public RetentionController(RetentionEnforcer retentionEnforcer, EnforcementMonitor monitor,
            KeyedEnforcementGate gate) {
        this.retentionEnforcer = retentionEnforcer;
        this.monitor = monitor;
        this.gate = gate;
    }

    @GetMapping("/stats")
    public Mono<ApiResult<EnforcementMonitor.RetentionStats>> stats() {
        return Mono.fromSupplier(() -> ApiResult.success(monitor.snapshot(gate.activeKeys())));
    }

    @PostMapping("/enforce")
    public Mono<ApiResult<EnforcementOutcome>> enforce(@Valid @RequestBody EnforceRequest request) {
        return Mono.fromCallable(() -> ApiResult.success(
                        retentionEnforcer.enforce(request.userId(), request.deviceId())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record EnforceRequest(
            @Positive(message = "必须大于0") long userId,
            @Positive(message = "必须大于0") long deviceId
    ) {
    }
}
