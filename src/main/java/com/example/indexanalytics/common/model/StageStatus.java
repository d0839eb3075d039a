package com.example.indexanalytics.common.model;

public enum StageStatus {
    OK,
    DEGRADED,
    SKIPPED
}
