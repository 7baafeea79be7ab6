package org.nowstart.fundnav.service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.nowstart.fundnav.data.dto.NavUpsertResult;
import org.nowstart.fundnav.data.entity.NavHistory;
import org.nowstart.fundnav.repository.FundRepository;
import org.nowstart.fundnav.repository.NavHistoryRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable NAV time series keyed by (scheme code, date) together with the per-scheme latest NAV
 * projection. Writes are idempotent and a single {@link #upsertMany(Collection)} call is one unit
 * of work: either every point lands or none does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NavTimeSeriesStore {

    private static final Comparator<NavHistory.NavHistoryKey> KEY_ORDER = Comparator
            .comparing(NavHistory.NavHistoryKey::schemeCode)
            .thenComparing(NavHistory.NavHistoryKey::navDate);

    private final NavHistoryRepository navHistoryRepository;
    private final FundRepository fundRepository;

    @Transactional
    public NavUpsertResult upsertMany(Collection<NavPoint> points) {
        if (points == null || points.isEmpty()) {
            return NavUpsertResult.empty();
        }

        // fixed key order so concurrent writers lock overlapping rows in the same sequence
        Map<NavHistory.NavHistoryKey, NavPoint> deduplicated = new TreeMap<>(KEY_ORDER);
        for (NavPoint point : points) {
            if (!isStorable(point)) {
                log.warn("Rejecting NAV point that cannot be stored. point={}", point);
                continue;
            }
            // later duplicates of the same key win
            deduplicated.put(new NavHistory.NavHistoryKey(point.schemeCode(), point.date()), point);
        }

        int inserted = 0;
        int updated = 0;
        Set<String> changedSchemeCodes = new LinkedHashSet<>();
        Map<String, NavPoint> newestByScheme = new LinkedHashMap<>();

        for (NavPoint point : deduplicated.values()) {
            List<Boolean> outcome = navHistoryRepository.upsert(point.schemeCode(), point.date(), point.value());
            if (outcome != null && !outcome.isEmpty()) {
                if (Boolean.TRUE.equals(outcome.get(0))) {
                    inserted++;
                } else {
                    updated++;
                }
                changedSchemeCodes.add(point.schemeCode());
            }
            newestByScheme.merge(
                    point.schemeCode(),
                    point,
                    (current, candidate) -> candidate.date().isAfter(current.date()) ? candidate : current
            );
        }

        newestByScheme.values().forEach(this::advanceLatest);

        log.debug(
                "event=nav_upsert submitted={} inserted={} updated={} changed_schemes={}",
                points.size(),
                inserted,
                updated,
                changedSchemeCodes.size()
        );
        return new NavUpsertResult(inserted, updated, Set.copyOf(changedSchemeCodes));
    }

    /**
     * Moves the scheme's latest NAV forward to {@code point} when it is newer than what is
     * recorded. Returns whether the projection changed.
     */
    @Transactional
    public boolean advanceLatest(NavPoint point) {
        return fundRepository.advanceLatestNav(point.schemeCode(), point.date(), point.value()) > 0;
    }

    @Transactional(readOnly = true)
    public Optional<NavPoint> latestBefore(String schemeCode, LocalDate date) {
        return navHistoryRepository
                .findTopByIdSchemeCodeAndIdNavDateLessThanEqualOrderByIdNavDateDesc(schemeCode, date)
                .map(NavHistory::toNavPoint);
    }

    /**
     * Newest-first slice of a scheme's history, at most {@code limit} points.
     */
    @Transactional(readOnly = true)
    public List<NavPoint> rangeDescending(String schemeCode, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return navHistoryRepository.findByIdSchemeCodeOrderByIdNavDateDesc(schemeCode, PageRequest.of(0, limit))
                .stream()
                .map(NavHistory::toNavPoint)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<NavPoint> earliest(String schemeCode) {
        return navHistoryRepository.findTopByIdSchemeCodeOrderByIdNavDateAsc(schemeCode)
                .map(NavHistory::toNavPoint);
    }

    private boolean isStorable(NavPoint point) {
        return point != null
                && point.schemeCode() != null
                && !point.schemeCode().isBlank()
                && point.date() != null
                && point.value() != null
                && point.value().signum() > 0;
    }
}
