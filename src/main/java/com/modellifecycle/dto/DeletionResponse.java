package com.modellifecycle.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Result of deleting a model version. {@code artifactPurged} is false when no purge was asked
 * for, when another version still references the blob, or when the store failed to remove it.
 */
@Value
@Builder
public class DeletionResponse {
    String versionId;
    String artifactLocation;
    boolean artifactPurged;
}
