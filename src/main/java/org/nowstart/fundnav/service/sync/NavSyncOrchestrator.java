package org.nowstart.fundnav.service.sync;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.MfApiSchemeResponse;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.nowstart.fundnav.data.dto.NavSyncOutcome;
import org.nowstart.fundnav.data.dto.NavSyncRequest;
import org.nowstart.fundnav.data.dto.NavSyncRunStatus;
import org.nowstart.fundnav.data.dto.NavUpsertResult;
import org.nowstart.fundnav.data.dto.ReturnsRecomputeResult;
import org.nowstart.fundnav.data.dto.SchemeFailure;
import org.nowstart.fundnav.data.exception.NavSyncApiException;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.data.type.SourceMode;
import org.nowstart.fundnav.data.type.SyncErrorKind;
import org.nowstart.fundnav.data.type.SyncPhase;
import org.nowstart.fundnav.service.FundReturnsService;
import org.nowstart.fundnav.service.NavFeedParser;
import org.nowstart.fundnav.service.NavTimeSeriesStore;
import org.nowstart.fundnav.service.registry.SchemeRegistry;
import org.nowstart.fundnav.service.source.NavSourceService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Drives a sync pass: resolve targets, fetch and parse in bounded batches, persist each batch as
 * one unit of work, then recompute returns for the schemes whose history changed.
 *
 * <p>Only one run is active at a time. Scheme-level problems are collected on the run and never
 * abort it; an unreachable store or registry fails the whole run.
 */
@Slf4j
@Service
public class NavSyncOrchestrator {

    private final SchemeRegistry schemeRegistry;
    private final NavSourceService navSourceService;
    private final NavFeedParser navFeedParser;
    private final NavTimeSeriesStore navTimeSeriesStore;
    private final FundReturnsService fundReturnsService;
    private final NavSyncProperties navSyncProperties;
    private final SyncPacer syncPacer;
    private final ExecutorService navFetchExecutor;
    private final ExecutorService navSyncRunner;

    private final AtomicReference<SyncRun> currentRun = new AtomicReference<>();

    public NavSyncOrchestrator(
            SchemeRegistry schemeRegistry,
            NavSourceService navSourceService,
            NavFeedParser navFeedParser,
            NavTimeSeriesStore navTimeSeriesStore,
            FundReturnsService fundReturnsService,
            NavSyncProperties navSyncProperties,
            SyncPacer syncPacer,
            @Qualifier("navFetchExecutor") ExecutorService navFetchExecutor,
            @Qualifier("navSyncRunner") ExecutorService navSyncRunner
    ) {
        this.schemeRegistry = schemeRegistry;
        this.navSourceService = navSourceService;
        this.navFeedParser = navFeedParser;
        this.navTimeSeriesStore = navTimeSeriesStore;
        this.fundReturnsService = fundReturnsService;
        this.navSyncProperties = navSyncProperties;
        this.syncPacer = syncPacer;
        this.navFetchExecutor = navFetchExecutor;
        this.navSyncRunner = navSyncRunner;
    }

    public NavSyncOutcome runOnce(NavSyncRequest request) {
        SyncRun run = begin(request);
        return execute(run);
    }

    public NavSyncRunStatus startAsync(NavSyncRequest request) {
        SyncRun run = begin(request);
        try {
            navSyncRunner.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            run.fail("Sync runner rejected the run");
            throw new NavSyncApiException(HttpStatus.SERVICE_UNAVAILABLE, "sync_runner_unavailable", "Sync runner is not accepting runs");
        }
        return run.toStatus();
    }

    public NavSyncRunStatus currentRun() {
        SyncRun run = currentRun.get();
        return run == null ? null : run.toStatus();
    }

    public boolean isRunning() {
        SyncRun run = currentRun.get();
        return run != null && run.isActive();
    }

    /**
     * Asks the active run to stop at the next batch boundary. Returns false when nothing is running.
     */
    public boolean requestStop() {
        SyncRun run = currentRun.get();
        if (run == null || !run.isActive()) {
            return false;
        }
        run.requestStop();
        log.info("event=nav_sync_stop_requested run_id={} phase={}", run.getRunId(), run.getPhase());
        return true;
    }

    public ReturnsRecomputeResult recomputeReturns(Collection<String> schemeCodes) {
        LocalDate asOfDate = LocalDate.now(navSyncProperties.zone());
        List<SchemeFailure> failures = new ArrayList<>();
        int computed = 0;

        for (String schemeCode : normalize(schemeCodes)) {
            try {
                fundReturnsService.recompute(schemeCode, asOfDate);
                computed++;
            } catch (RuntimeException e) {
                if (isStoreUnreachable(e)) {
                    throw e;
                }
                log.error("Failed to recompute returns. scheme_code={}", schemeCode, e);
                failures.add(new SchemeFailure(schemeCode, SyncErrorKind.COMPUTATION, e.getMessage()));
            }
        }
        return new ReturnsRecomputeResult(computed, List.copyOf(failures));
    }

    private SyncRun begin(NavSyncRequest request) {
        NavSyncRequest effective = request == null ? NavSyncRequest.defaults() : request;
        SourceMode sourceMode = effective.sourceMode() == null ? navSyncProperties.sourceMode() : effective.sourceMode();
        int batchSize = effective.batchSize() == null ? navSyncProperties.batchSize() : effective.batchSize();
        if (batchSize <= 0) {
            throw new NavSyncApiException(HttpStatus.BAD_REQUEST, "invalid_batch_size", "batchSize must be positive");
        }

        SyncRun run = new SyncRun(sourceMode, batchSize);
        SyncRun existing = currentRun.get();
        if ((existing != null && existing.isActive()) || !currentRun.compareAndSet(existing, run)) {
            throw new NavSyncApiException(HttpStatus.CONFLICT, "sync_in_progress", "A NAV sync run is already in progress");
        }
        return run;
    }

    NavSyncOutcome execute(SyncRun run) {
        log.info(
                "event=nav_sync_started run_id={} source_mode={} batch_size={}",
                run.getRunId(),
                run.getSourceMode(),
                run.getBatchSize()
        );

        try {
            List<String> targets = resolveTargets();
            run.setTargetCount(targets.size());

            Set<String> changed = run.getSourceMode() == SourceMode.BULK
                    ? syncFromBulkFeed(run, targets)
                    : syncPerScheme(run, targets);

            recomputeChanged(run, changed);
            run.finish();
        } catch (FatalSyncException e) {
            log.error("NAV sync run failed. run_id={} reason={}", run.getRunId(), e.getMessage(), e);
            run.fail(e.getMessage());
        } catch (RuntimeException e) {
            log.error("NAV sync run failed unexpectedly. run_id={}", run.getRunId(), e);
            run.fail("Unexpected error: " + e.getMessage());
        } finally {
            // Errors skip the handlers above; the run must not stay active
            if (run.isActive()) {
                run.fail("Run aborted");
            }
        }

        NavSyncOutcome outcome = run.toOutcome();
        log.info(
                "event=nav_sync_finished run_id={} phase={} targets={} processed={} recomputed={} failed={} duration_ms={}",
                run.getRunId(),
                outcome.phase(),
                run.getTargetCount(),
                run.getProcessedCount(),
                run.getRecomputedCount(),
                outcome.failedSchemes().size(),
                outcome.durationMs()
        );
        return outcome;
    }

    private List<String> resolveTargets() {
        try {
            return schemeRegistry.resolveTargets();
        } catch (RuntimeException e) {
            throw new FatalSyncException("Scheme registry unavailable: " + e.getMessage(), e);
        }
    }

    private Set<String> syncPerScheme(SyncRun run, List<String> targets) {
        Set<String> changed = new LinkedHashSet<>();
        List<List<String>> batches = partition(targets, run.getBatchSize());

        for (int index = 0; index < batches.size(); index++) {
            if (index > 0) {
                pace(run);
            }
            if (run.isStopRequested()) {
                markStopped(run, batches.subList(index, batches.size()).stream().flatMap(List::stream).toList());
                break;
            }

            List<String> batch = batches.get(index);
            run.transitionTo(SyncPhase.FETCHING);
            List<SchemeFetch> fetched = fetchBatch(run, batch);

            Map<String, List<NavPoint>> pointsByScheme = new LinkedHashMap<>();
            for (SchemeFetch fetch : fetched) {
                pointsByScheme.put(fetch.schemeCode(), fetch.points());
            }

            run.transitionTo(SyncPhase.PERSISTING);
            Set<String> persisted = persistBatch(run, pointsByScheme, pointsByScheme.size());
            changed.addAll(persisted);
            fetched.stream()
                    .filter(fetch -> !run.hasFailed(fetch.schemeCode()))
                    .forEach(this::describe);

            log.info(
                    "event=nav_sync_batch run_id={} batch={}/{} schemes={} processed={} failed={}",
                    run.getRunId(),
                    index + 1,
                    batches.size(),
                    batch.size(),
                    run.getProcessedCount(),
                    run.failures().size()
            );
        }
        return changed;
    }

    private List<SchemeFetch> fetchBatch(SyncRun run, List<String> batch) {
        List<CompletableFuture<SchemeFetch>> futures = new ArrayList<>(batch.size());
        for (String schemeCode : batch) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> fetchScheme(schemeCode), navFetchExecutor)
                    .handle((fetch, failure) -> {
                        if (failure == null) {
                            return fetch;
                        }
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause()
                                : failure;
                        log.warn("Scheme fetch failed. run_id={} scheme_code={} reason={}", run.getRunId(), schemeCode, cause.getMessage());
                        run.recordFailure(schemeCode, SyncErrorKind.TRANSIENT_FETCH, cause.getMessage());
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SchemeFetch> fetched = new ArrayList<>();
        for (CompletableFuture<SchemeFetch> future : futures) {
            SchemeFetch fetch = future.join();
            if (fetch == null) {
                continue;
            }
            if (fetch.points().isEmpty()) {
                run.recordFailure(fetch.schemeCode(), SyncErrorKind.NO_VALID_RECORDS, "Source returned no valid NAV records");
                continue;
            }
            fetched.add(fetch);
        }
        return fetched;
    }

    private SchemeFetch fetchScheme(String schemeCode) {
        MfApiSchemeResponse document = navSourceService.fetchScheme(schemeCode);
        List<NavPoint> points = navFeedParser.parseSingle(schemeCode, document).toList();
        return new SchemeFetch(schemeCode, document.meta(), points);
    }

    private Set<String> syncFromBulkFeed(SyncRun run, List<String> targets) {
        run.transitionTo(SyncPhase.FETCHING);
        String feed;
        try {
            feed = navSourceService.fetchBulkFeed();
        } catch (RuntimeException e) {
            throw new FatalSyncException("Bulk NAV feed unavailable: " + e.getMessage(), e);
        }

        Set<String> targetSet = new HashSet<>(targets);
        boolean includeUnknown = navSyncProperties.registerUnknownSchemes();
        Set<String> settled = new HashSet<>();
        Set<String> changed = new LinkedHashSet<>();
        Map<String, List<NavPoint>> pending = new LinkedHashMap<>();
        int batchNumber = 0;
        boolean stopped = false;

        try (Stream<NavPoint> points = navFeedParser.parse(feed)) {
            Iterator<NavPoint> iterator = points.iterator();
            while (iterator.hasNext()) {
                NavPoint point = iterator.next();
                if (!includeUnknown && !targetSet.contains(point.schemeCode())) {
                    continue;
                }
                pending.computeIfAbsent(point.schemeCode(), code -> new ArrayList<>()).add(point);
                if (pending.size() >= run.getBatchSize()) {
                    if (!flushBulkBatch(run, pending, batchNumber++, settled, changed)) {
                        stopped = true;
                        break;
                    }
                }
            }
        }

        if (!stopped && !pending.isEmpty()) {
            stopped = !flushBulkBatch(run, pending, batchNumber, settled, changed);
        }

        if (stopped) {
            markStopped(run, targets.stream().filter(code -> !settled.contains(code)).toList());
        } else {
            long missing = targets.stream().filter(code -> !settled.contains(code)).count();
            if (missing > 0) {
                log.info("Targets absent from bulk feed. run_id={} count={}", run.getRunId(), missing);
            }
        }
        return changed;
    }

    /**
     * Persists the accumulated bulk batch. Returns false when the run was asked to stop before the
     * batch was written; the batch is then left unwritten.
     */
    private boolean flushBulkBatch(
            SyncRun run,
            Map<String, List<NavPoint>> pending,
            int batchNumber,
            Set<String> settled,
            Set<String> changed
    ) {
        if (batchNumber > 0) {
            pace(run);
        }
        if (run.isStopRequested()) {
            return false;
        }

        // a backfilled scheme can span several bulk batches; count it once
        int firstSeen = (int) pending.keySet().stream().filter(code -> !settled.contains(code)).count();
        run.transitionTo(SyncPhase.PERSISTING);
        changed.addAll(persistBatch(run, pending, firstSeen));
        settled.addAll(pending.keySet());
        log.info(
                "event=nav_sync_batch run_id={} batch={} schemes={} processed={} failed={}",
                run.getRunId(),
                batchNumber + 1,
                pending.size(),
                run.getProcessedCount(),
                run.failures().size()
        );
        pending.clear();
        run.transitionTo(SyncPhase.FETCHING);
        return true;
    }

    /**
     * Writes one batch as a single unit of work. A non-fatal write failure rolls the whole batch
     * back and marks every scheme in it failed; the run moves on to the next batch.
     * {@code newlyProcessed} is how many of the batch's schemes have not been counted before.
     */
    private Set<String> persistBatch(SyncRun run, Map<String, List<NavPoint>> pointsByScheme, int newlyProcessed) {
        if (pointsByScheme.isEmpty()) {
            return Set.of();
        }

        List<NavPoint> points = pointsByScheme.values().stream().flatMap(List::stream).toList();
        try {
            NavUpsertResult result = navTimeSeriesStore.upsertMany(points);
            run.addProcessed(newlyProcessed);
            return result.changedSchemeCodes();
        } catch (RuntimeException e) {
            if (isStoreUnreachable(e)) {
                throw new FatalSyncException("NAV store unreachable: " + e.getMessage(), e);
            }
            log.error("Failed to persist NAV batch. run_id={} schemes={}", run.getRunId(), pointsByScheme.keySet(), e);
            pointsByScheme.keySet().forEach(code ->
                    run.recordFailure(code, SyncErrorKind.PERSISTENCE, "Batch write rolled back: " + e.getMessage()));
            return Set.of();
        }
    }

    private void recomputeChanged(SyncRun run, Set<String> changed) {
        run.transitionTo(SyncPhase.COMPUTING);
        LocalDate asOfDate = LocalDate.now(navSyncProperties.zone());

        for (String schemeCode : changed) {
            try {
                fundReturnsService.recompute(schemeCode, asOfDate);
                run.markRecomputed();
            } catch (RuntimeException e) {
                if (isStoreUnreachable(e)) {
                    throw new FatalSyncException("NAV store unreachable: " + e.getMessage(), e);
                }
                log.error("Failed to recompute returns. run_id={} scheme_code={}", run.getRunId(), schemeCode, e);
                run.recordFailure(schemeCode, SyncErrorKind.COMPUTATION, e.getMessage());
            }
        }
    }

    private void describe(SchemeFetch fetch) {
        if (fetch.meta() == null) {
            return;
        }
        try {
            schemeRegistry.describe(fetch.schemeCode(), fetch.meta().scheme_name(), fetch.meta().scheme_category());
        } catch (RuntimeException e) {
            log.warn("Failed to update scheme catalogue. scheme_code={} reason={}", fetch.schemeCode(), e.getMessage());
        }
    }

    private void pace(SyncRun run) {
        try {
            syncPacer.pause(navSyncProperties.interBatchDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted between batches; stopping run. run_id={}", run.getRunId());
            run.requestStop();
        }
    }

    private void markStopped(SyncRun run, List<String> remaining) {
        remaining.forEach(code -> run.recordFailure(code, SyncErrorKind.STOPPED, "Run stopped before this scheme was synced"));
        log.info("event=nav_sync_stopped run_id={} remaining={}", run.getRunId(), remaining.size());
    }

    private boolean isStoreUnreachable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException || current instanceof CannotCreateTransactionException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private List<List<String>> partition(List<String> values, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int from = 0; from < values.size(); from += size) {
            batches.add(values.subList(from, Math.min(values.size(), from + size)));
        }
        return batches;
    }

    private List<String> normalize(Collection<String> schemeCodes) {
        if (schemeCodes == null) {
            return List.of();
        }
        return schemeCodes.stream()
                .filter(code -> code != null && !code.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private record SchemeFetch(String schemeCode, MfApiSchemeResponse.Meta meta, List<NavPoint> points) {
    }

    private static final class FatalSyncException extends RuntimeException {

        private FatalSyncException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
