package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainVerdict {
    boolean shouldRetrain;
    String reason;
    long labeledPredictions;
    DegradationResult degradation;

    public static RetrainVerdict no(String reason, long labeledPredictions) {
        return RetrainVerdict.builder()
            .shouldRetrain(false)
            .reason(reason)
            .labeledPredictions(labeledPredictions)
            .build();
    }
}
