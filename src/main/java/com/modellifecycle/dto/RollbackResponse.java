package com.modellifecycle.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RollbackResponse {
    String restoredVersionId;
    String demotedVersionId;
}
