package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Body returned with HTTP 200 when there is not enough labeled data to decide anything.
 */
@Value
@Builder
public class NoActionResponse {
    @Builder.Default
    String decision = "no action";
    String reason;
    String errorCode;
    String path;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}
