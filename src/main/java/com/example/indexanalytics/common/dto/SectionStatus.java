package com.example.indexanalytics.common.dto;

import com.example.indexanalytics.common.model.StageStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SectionStatus {
    StageStatus status;
    String reason;

    public static SectionStatus of(StageResult<?> result) {
        return SectionStatus.builder()
                .status(result.getStatus())
                .reason(result.getReason())
                .build();
    }
}
