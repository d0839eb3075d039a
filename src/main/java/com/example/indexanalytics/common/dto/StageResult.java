package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.StageStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one pipeline stage: the value plus an OK / DEGRADED / SKIPPED tag.
 * A degraded result still carries a usable neutral value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StageResult<T> {

    StageStatus status;
    T value;
    String reason;

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(StageStatus.OK, value, null);
    }

    public static <T> StageResult<T> degraded(T value, String reason) {
        return new StageResult<>(StageStatus.DEGRADED, value, reason);
    }

    public static <T> StageResult<T> skipped(String reason) {
        return new StageResult<>(StageStatus.SKIPPED, null, reason);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == StageStatus.OK;
    }

    @JsonIgnore
    public boolean isDegraded() {
        return status == StageStatus.DEGRADED;
    }
}
