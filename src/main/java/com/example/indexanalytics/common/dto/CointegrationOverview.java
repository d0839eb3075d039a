package com.example.indexanalytics.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CointegrationOverview {
    List<String> symbols;
    int alignedLength;
    List<List<Double>> correlationMatrix;
    int cointegratingRelations;
}
