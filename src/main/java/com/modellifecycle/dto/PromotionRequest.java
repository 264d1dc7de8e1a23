package com.modellifecycle.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PromotionRequest {
    String requestedBy;
    String note;
}
