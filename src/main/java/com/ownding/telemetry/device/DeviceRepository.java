package com.ownding.telemetry.device;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class DeviceRepository {

    private static final RowMapper<Device> DEVICE_MAPPER = (rs, rowNum) -> new Device(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("device_code"),
            rs.getString("name"),
            rs.getString("created_at")
    );

    private final JdbcClient jdbcClient;

    public DeviceRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public List<Device> findDevicesByUser(long userId) {
        return jdbcClient.sql("""
                        SELECT id, user_id, device_code, name, created_at
                        FROM sensor_device
                        WHERE user_id = :userId
                        ORDER BY id
                        """)
                .param("userId", userId)
                .query(DEVICE_MAPPER)
                .list();
    }

    public Optional<Device> findDeviceById(long id) {
        return jdbcClient.sql("""
                        SELECT id, user_id, device_code, name, created_at
                        FROM sensor_device
                        WHERE id = :id
                        LIMIT 1
                        """)
                .param("id", id)
                .query(DEVICE_MAPPER)
                .optional();
    }

    public Optional<Device> findDeviceByCode(long userId, String deviceCode) {
        return jdbcClient.sql("""
                        SELECT id, user_id, device_code, name, created_at
                        FROM sensor_device
                        WHERE user_id = :userId AND device_code = :deviceCode
                        LIMIT 1
                        """)
                .param("userId", userId)
                .param("deviceCode", deviceCode)
                .query(DEVICE_MAPPER)
                .optional();
    }

    public Device createDevice(long userId, String deviceCode, String name) {
        jdbcClient.sql("""
                        INSERT INTO sensor_device (user_id, device_code, name, created_at)
                        VALUES (:userId, :deviceCode, :name, :now)
                        ON CONFLICT (user_id, device_code) DO NOTHING
                        """)
                .param("userId", userId)
                .param("deviceCode", deviceCode)
                .param("name", name)
                .param("now", Instant.now().toString())
                .update();
        return findDeviceByCode(userId, deviceCode).orElseThrow();
    }
}
