package org.nowstart.fundnav.data.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.nowstart.fundnav.data.type.SourceMode;

public record NavSyncRequest(
        SourceMode sourceMode,
        @Positive @Max(500) Integer batchSize
) {
    public static NavSyncRequest defaults() {
        return new NavSyncRequest(null, null);
    }
}
