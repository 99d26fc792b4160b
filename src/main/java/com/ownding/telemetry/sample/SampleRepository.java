package com.ownding.telemetry.sample;

import com.ownding.telemetry.retention.SeriesKey;
import com.ownding.telemetry.retention.SeriesStore;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Sample storage. Per-series reads go through {@code idx_sensor_sample_series}
 * (user_id, device_id, timestamp); ties on timestamp are broken by the rowid id.
 */
@Repository
public class SampleRepository implements SeriesStore {

    // stays well under SQLite's bound-parameter limit
    private static final int DELETE_CHUNK_SIZE = 500;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    // timestamp is epoch nanoseconds in a signed 64-bit INTEGER
    static final Instant MIN_TIMESTAMP = Instant.ofEpochSecond(0, Long.MIN_VALUE);
    static final Instant MAX_TIMESTAMP = Instant.ofEpochSecond(0, Long.MAX_VALUE);

    private final JdbcClient jdbcClient;

    public SampleRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public long insertSample(long userId, long deviceId, Instant timestamp, String payload) {
        return jdbcClient.sql("""
                        INSERT INTO sensor_sample (user_id, device_id, timestamp, payload, created_at)
                        VALUES (:userId, :deviceId, :timestamp, :payload, :now)
                        RETURNING id
                        """)
                .param("userId", userId)
                .param("deviceId", deviceId)
                .param("timestamp", toEpochNanos(timestamp))
                .param("payload", payload)
                .param("now", Instant.now().toString())
                .query(Long.class)
                .single();
    }

    @Override
    public List<Long> rankedIds(SeriesKey key) {
        return jdbcClient.sql("""
                        SELECT id
                        FROM sensor_sample
                        WHERE user_id = :userId AND device_id = :deviceId
                        ORDER BY timestamp DESC, id DESC
                        """)
                .param("userId", key.userId())
                .param("deviceId", key.deviceId())
                .query(Long.class)
                .list();
    }

    @Override
    public int deleteByIds(SeriesKey key, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Long> all = List.copyOf(ids);
        int deleted = 0;
        for (int from = 0; from < all.size(); from += DELETE_CHUNK_SIZE) {
            List<Long> chunk = all.subList(from, Math.min(all.size(), from + DELETE_CHUNK_SIZE));
            deleted += jdbcClient.sql("""
                            DELETE FROM sensor_sample
                            WHERE user_id = :userId AND device_id = :deviceId AND id IN (:ids)
                            """)
                    .param("userId", key.userId())
                    .param("deviceId", key.deviceId())
                    .param("ids", chunk)
                    .update();
        }
        return deleted;
    }

    public int countSamples(SeriesKey key) {
        return jdbcClient.sql("""
                        SELECT COUNT(*)
                        FROM sensor_sample
                        WHERE user_id = :userId AND device_id = :deviceId
                        """)
                .param("userId", key.userId())
                .param("deviceId", key.deviceId())
                .query(Integer.class)
                .single();
    }

    public List<Sample> findSeries(SeriesKey key) {
        return jdbcClient.sql("""
                        SELECT id, user_id, device_id, timestamp, payload, created_at
                        FROM sensor_sample
                        WHERE user_id = :userId AND device_id = :deviceId
                        ORDER BY timestamp DESC, id DESC
                        """)
                .param("userId", key.userId())
                .param("deviceId", key.deviceId())
                .query((rs, rowNum) -> new Sample(
                        rs.getLong("id"),
                        rs.getLong("user_id"),
                        rs.getLong("device_id"),
                        fromEpochNanos(rs.getLong("timestamp")),
                        rs.getString("payload"),
                        rs.getString("created_at")
                ))
                .list();
    }

    static boolean isStorable(Instant instant) {
        return !instant.isBefore(MIN_TIMESTAMP) && !instant.isAfter(MAX_TIMESTAMP);
    }

    static long toEpochNanos(Instant instant) {
        long seconds = instant.getEpochSecond();
        long nanos = instant.getNano();
        if (seconds < 0 && nanos > 0) {
            return Math.addExact(Math.multiplyExact(seconds + 1, NANOS_PER_SECOND), nanos - NANOS_PER_SECOND);
        }
        return Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND), nanos);
    }

    static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(0, nanos);
    }
}
