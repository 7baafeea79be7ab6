package org.nowstart.fundnav.service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.nowstart.fundnav.data.dto.ReturnsSnapshot;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.data.type.ReturnPeriod;
import org.nowstart.fundnav.data.type.RiskWindow;
import org.springframework.stereotype.Component;

/**
 * Computes trailing returns, CAGR and risk figures for one scheme from its NAV history. Holds no
 * state and performs no I/O; the same inputs always produce the same snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReturnCalculator {

    static final int TRADING_DAYS_PER_YEAR = 252;
    private static final double DAYS_PER_YEAR = 365.0;

    private final NavSyncProperties navSyncProperties;

    public ReturnsSnapshot compute(String schemeCode, List<NavPoint> history, LocalDate asOfDate) {
        NavigableMap<LocalDate, NavPoint> series = toSeries(history, asOfDate);
        if (series.isEmpty()) {
            return ReturnsSnapshot.empty(schemeCode, asOfDate);
        }

        NavPoint latest = series.lastEntry().getValue();
        NavPoint earliest = series.firstEntry().getValue();
        List<String> issues = new ArrayList<>();
        Map<ReturnPeriod, Double> periodReturns = new EnumMap<>(ReturnPeriod.class);
        Map<ReturnPeriod, Double> cagrs = new EnumMap<>(ReturnPeriod.class);
        Map<RiskWindow, Double> volatilities = new EnumMap<>(RiskWindow.class);
        Map<RiskWindow, Double> sharpeRatios = new EnumMap<>(RiskWindow.class);
        Map<RiskWindow, Double> sortinoRatios = new EnumMap<>(RiskWindow.class);
        Map<RiskWindow, Double> maxDrawdowns = new EnumMap<>(RiskWindow.class);

        if (latest.value().signum() <= 0) {
            issues.add(reportIssue(schemeCode, "non_positive_latest_nav", latest));
            return snapshot(schemeCode, asOfDate, latest, periodReturns, cagrs,
                    volatilities, sharpeRatios, sortinoRatios, maxDrawdowns, issues);
        }

        for (ReturnPeriod period : ReturnPeriod.values()) {
            if (period.isSinceInception()) {
                continue;
            }

            LocalDate anchorDate = asOfDate.minusDays(period.getLookbackDays());
            if (earliest.date().isAfter(anchorDate)) {
                continue;
            }

            NavPoint anchor = nearest(series, anchorDate);
            if (!anchor.date().isBefore(latest.date())) {
                continue;
            }
            if (anchor.value().signum() <= 0) {
                issues.add(reportIssue(schemeCode, "non_positive_anchor_nav_" + period.getKey(), anchor));
                continue;
            }

            double ratio = latest.value().doubleValue() / anchor.value().doubleValue();
            periodReturns.put(period, (ratio - 1.0) * 100.0);
            if (period.hasFixedCagr()) {
                cagrs.put(period, annualize(ratio, period.getLookbackDays()));
            }
        }

        if (series.size() >= 2) {
            if (earliest.value().signum() <= 0) {
                issues.add(reportIssue(schemeCode, "non_positive_inception_nav", earliest));
            } else {
                double ratio = latest.value().doubleValue() / earliest.value().doubleValue();
                periodReturns.put(ReturnPeriod.SINCE_INCEPTION, (ratio - 1.0) * 100.0);
                long spanDays = ChronoUnit.DAYS.between(earliest.date(), latest.date());
                if (spanDays >= DAYS_PER_YEAR) {
                    cagrs.put(ReturnPeriod.SINCE_INCEPTION, annualize(ratio, spanDays));
                }
            }
        }

        double riskFreeRatePct = navSyncProperties.riskFreeRatePct().doubleValue();
        for (RiskWindow window : RiskWindow.values()) {
            NavigableMap<LocalDate, NavPoint> windowSeries = series.tailMap(asOfDate.minusYears(window.getYears()), true);
            List<Double> dailyChanges = dailyChangesPct(windowSeries);
            if (dailyChanges.size() < 2) {
                continue;
            }

            double mean = mean(dailyChanges);
            double annualExcess = mean * TRADING_DAYS_PER_YEAR - riskFreeRatePct;
            double volatility = Math.sqrt(populationVariance(dailyChanges, mean)) * Math.sqrt(TRADING_DAYS_PER_YEAR);
            volatilities.put(window, volatility);
            if (volatility > 0.0) {
                sharpeRatios.put(window, annualExcess / volatility);
            }

            double downside = downsideDeviation(dailyChanges) * Math.sqrt(TRADING_DAYS_PER_YEAR);
            if (downside > 0.0) {
                sortinoRatios.put(window, annualExcess / downside);
            }
            maxDrawdowns.put(window, maxDrawdownPct(windowSeries));
        }

        return snapshot(schemeCode, asOfDate, latest, periodReturns, cagrs,
                volatilities, sharpeRatios, sortinoRatios, maxDrawdowns, issues);
    }

    /**
     * Point closest to {@code target}; on an equal distance the earlier point wins.
     */
    NavPoint nearest(NavigableMap<LocalDate, NavPoint> series, LocalDate target) {
        Map.Entry<LocalDate, NavPoint> floor = series.floorEntry(target);
        Map.Entry<LocalDate, NavPoint> ceiling = series.ceilingEntry(target);
        if (floor == null) {
            return ceiling.getValue();
        }
        if (ceiling == null) {
            return floor.getValue();
        }

        long before = ChronoUnit.DAYS.between(floor.getKey(), target);
        long after = ChronoUnit.DAYS.between(target, ceiling.getKey());
        return after < before ? ceiling.getValue() : floor.getValue();
    }

    private NavigableMap<LocalDate, NavPoint> toSeries(List<NavPoint> history, LocalDate asOfDate) {
        NavigableMap<LocalDate, NavPoint> series = new TreeMap<>();
        if (history == null || asOfDate == null) {
            return series;
        }

        for (NavPoint point : history) {
            if (point == null || point.date() == null || point.value() == null || point.date().isAfter(asOfDate)) {
                continue;
            }
            series.put(point.date(), point);
        }
        return series;
    }

    private List<Double> dailyChangesPct(NavigableMap<LocalDate, NavPoint> window) {
        if (window.size() < 2) {
            return List.of();
        }

        List<Double> changes = new ArrayList<>(window.size() - 1);
        NavPoint previous = null;
        for (NavPoint current : window.values()) {
            if (previous != null && previous.value().signum() > 0 && current.value().signum() > 0) {
                double prev = previous.value().doubleValue();
                changes.add((current.value().doubleValue() - prev) / prev * 100.0);
            }
            previous = current;
        }
        return changes;
    }

    /**
     * Root mean square of the negative daily changes, divided over all observations.
     */
    private double downsideDeviation(List<Double> dailyChanges) {
        double sumSquares = 0.0;
        for (double change : dailyChanges) {
            if (change < 0.0) {
                sumSquares += change * change;
            }
        }
        return Math.sqrt(sumSquares / dailyChanges.size());
    }

    /**
     * Largest peak-to-trough fall inside the window, as a positive percentage of the peak.
     */
    private double maxDrawdownPct(NavigableMap<LocalDate, NavPoint> window) {
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (NavPoint point : window.values()) {
            double value = point.value().doubleValue();
            if (value <= 0.0) {
                continue;
            }
            peak = Math.max(peak, value);
            maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak * 100.0);
        }
        return maxDrawdown;
    }

    private double annualize(double ratio, long days) {
        return (Math.pow(ratio, DAYS_PER_YEAR / days) - 1.0) * 100.0;
    }

    private double mean(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private double populationVariance(List<Double> values, double mean) {
        double sumSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return sumSquares / values.size();
    }

    private String reportIssue(String schemeCode, String issue, NavPoint point) {
        log.warn("event=nav_data_quality scheme_code={} issue={} date={} value={}", schemeCode, issue, point.date(), point.value());
        return issue + "@" + point.date();
    }

    private ReturnsSnapshot snapshot(
            String schemeCode,
            LocalDate asOfDate,
            NavPoint latest,
            Map<ReturnPeriod, Double> periodReturns,
            Map<ReturnPeriod, Double> cagrs,
            Map<RiskWindow, Double> volatilities,
            Map<RiskWindow, Double> sharpeRatios,
            Map<RiskWindow, Double> sortinoRatios,
            Map<RiskWindow, Double> maxDrawdowns,
            List<String> issues
    ) {
        return new ReturnsSnapshot(
                schemeCode,
                asOfDate,
                latest,
                Collections.unmodifiableMap(periodReturns),
                Collections.unmodifiableMap(cagrs),
                Collections.unmodifiableMap(volatilities),
                Collections.unmodifiableMap(sharpeRatios),
                Collections.unmodifiableMap(sortinoRatios),
                Collections.unmodifiableMap(maxDrawdowns),
                List.copyOf(issues)
        );
    }
}
