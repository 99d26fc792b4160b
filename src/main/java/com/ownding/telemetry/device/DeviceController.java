package com.ownding.telemetry.device;

import com.ownding.telemetry.common.ApiResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/users/{userId}/devices")
public class DeviceController {

    private final DeviceService deviceService;

    public DeviceController(DeviceService deviceService) {
        this.deviceService = deviceService;
    }

    @GetMapping
    public Mono<ApiResult<List<Device>>> listDevices(@PathVariable long userId) {
        return Mono.fromCallable(() -> ApiResult.success(deviceService.listDevices(userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ApiResult<Device>> registerDevice(@PathVariable long userId, @Valid @RequestBody DeviceRequest request) {
        return Mono.fromCallable(() -> ApiResult.success("设备注册成功",
                        deviceService.registerDevice(userId, request.deviceCode(), request.name())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record DeviceRequest(
            @NotBlank(message = "不能为空")
            @Size(max = 128, message = "不能超过128个字符")
            String deviceCode,
            String name
    ) {
    }
}
