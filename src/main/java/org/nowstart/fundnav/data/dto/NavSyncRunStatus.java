package org.nowstart.fundnav.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.fundnav.data.type.SourceMode;
import org.nowstart.fundnav.data.type.SyncPhase;

public record NavSyncRunStatus(
        String runId,
        SourceMode sourceMode,
        SyncPhase phase,
        int targetCount,
        int processedCount,
        int recomputedCount,
        List<SchemeFailure> failedSchemes,
        Instant startedAt,
        Instant completedAt,
        boolean stopRequested,
        String error
) {
}
