package com.ownding.telemetry.device;

import com.ownding.telemetry.common.ApiException;
import com.ownding.telemetry.user.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DeviceService {

    private static final Logger log = LoggerFactory.getLogger(DeviceService.class);

    private final DeviceRepository deviceRepository;
    private final UserService userService;

    public DeviceService(DeviceRepository deviceRepository, UserService userService) {
        this.deviceRepository = deviceRepository;
        this.userService = userService;
    }

    public List<Device> listDevices(long userId) {
        userService.getUser(userId);
        return deviceRepository.findDevicesByUser(userId);
    }

    public Device registerDevice(long userId, String deviceCode, String name) {
        userService.getUser(userId);
        if (deviceRepository.findDeviceByCode(userId, deviceCode).isPresent()) {
            throw ApiException.conflict("设备编码已存在");
        }
        Device device = deviceRepository.createDevice(userId, deviceCode, name);
        log.info("device registered. userId={}, deviceId={}, deviceCode={}", userId, device.id(), deviceCode);
        return device;
    }

    public Device resolveDevice(long userId, String deviceCode) {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw ApiException.badRequest("设备编码不能为空");
        }
        return deviceRepository.findDeviceByCode(userId, deviceCode)
                .orElseGet(() -> {
                    userService.getUser(userId);
                    Device device = deviceRepository.createDevice(userId, deviceCode, deviceCode);
                    log.info("device auto-registered. userId={}, deviceId={}, deviceCode={}",
                            userId, device.id(), deviceCode);
                    return device;
                });
    }
}
