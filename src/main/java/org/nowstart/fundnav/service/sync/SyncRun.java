package org.nowstart.fundnav.service.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.AccessLevel;
import lombok.Getter;
import org.nowstart.fundnav.data.dto.NavSyncOutcome;
import org.nowstart.fundnav.data.dto.NavSyncRunStatus;
import org.nowstart.fundnav.data.dto.SchemeFailure;
import org.nowstart.fundnav.data.type.SourceMode;
import org.nowstart.fundnav.data.type.SyncErrorKind;
import org.nowstart.fundnav.data.type.SyncPhase;

/**
 * State of one sync pass. Progress only moves forward: the processed counter never decreases and
 * a run that reached a terminal phase cannot be moved again. Safe to read from other threads
 * while the run executes.
 */
@Getter
public class SyncRun {

    private final String runId = UUID.randomUUID().toString();
    private final SourceMode sourceMode;
    private final int batchSize;
    private final Instant startedAt = Instant.now();

    private volatile SyncPhase phase = SyncPhase.PENDING;
    private volatile int targetCount;
    private volatile boolean stopRequested;
    private volatile Instant completedAt;
    private volatile String error;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger processedCount = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger recomputedCount = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final Map<String, SchemeFailure> failures = new LinkedHashMap<>();

    public SyncRun(SourceMode sourceMode, int batchSize) {
        this.sourceMode = sourceMode;
        this.batchSize = batchSize;
    }

    public synchronized void transitionTo(SyncPhase next) {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already finished in phase " + phase);
        }
        phase = next;
    }

    public void setTargetCount(int targetCount) {
        this.targetCount = targetCount;
    }

    public void requestStop() {
        stopRequested = true;
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public void addProcessed(int count) {
        processedCount.addAndGet(count);
    }

    public int getRecomputedCount() {
        return recomputedCount.get();
    }

    public void markRecomputed() {
        recomputedCount.incrementAndGet();
    }

    public void recordFailure(String schemeCode, SyncErrorKind errorKind, String message) {
        synchronized (failures) {
            failures.put(schemeCode, new SchemeFailure(schemeCode, errorKind, message));
        }
    }

    public boolean hasFailed(String schemeCode) {
        synchronized (failures) {
            return failures.containsKey(schemeCode);
        }
    }

    public List<SchemeFailure> failures() {
        synchronized (failures) {
            return List.copyOf(new ArrayList<>(failures.values()));
        }
    }

    /**
     * Ends the run after every stage ran. Any recorded failure or an early stop makes the run
     * partial.
     */
    public synchronized void finish() {
        boolean clean;
        synchronized (failures) {
            clean = failures.isEmpty();
        }
        transitionTo(clean && !stopRequested ? SyncPhase.COMPLETED : SyncPhase.PARTIALLY_FAILED);
        completedAt = Instant.now();
    }

    public synchronized void fail(String error) {
        this.error = error;
        transitionTo(SyncPhase.FAILED);
        completedAt = Instant.now();
    }

    public boolean isActive() {
        return !phase.isTerminal();
    }

    public NavSyncRunStatus toStatus() {
        return new NavSyncRunStatus(
                runId,
                sourceMode,
                phase,
                targetCount,
                getProcessedCount(),
                getRecomputedCount(),
                failures(),
                startedAt,
                completedAt,
                stopRequested,
                error
        );
    }

    /**
     * A failed run claims no processed records even if some batches were written before the
     * fatal error.
     */
    public NavSyncOutcome toOutcome() {
        SyncPhase current = phase;
        Instant end = completedAt == null ? Instant.now() : completedAt;
        return new NavSyncOutcome(
                current == SyncPhase.COMPLETED,
                current == SyncPhase.FAILED ? 0 : getProcessedCount(),
                failures(),
                Duration.between(startedAt, end).toMillis(),
                current,
                error
        );
    }
}
