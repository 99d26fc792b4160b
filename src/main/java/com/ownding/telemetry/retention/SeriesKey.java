package com.ownding.telemetry.retention;

public record SeriesKey(long userId, long deviceId) {

    @Override
    public String toString() {
        return userId + "/" + deviceId;
    }
}
