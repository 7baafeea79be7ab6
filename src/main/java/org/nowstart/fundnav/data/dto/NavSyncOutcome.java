package org.nowstart.fundnav.data.dto;

import java.util.List;
import org.nowstart.fundnav.data.type.SyncPhase;

public record NavSyncOutcome(
        boolean success,
        int recordsProcessed,
        List<SchemeFailure> failedSchemes,
        long durationMs,
        SyncPhase phase,
        String error
) {
}
