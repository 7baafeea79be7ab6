package org.nowstart.fundnav.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.nowstart.fundnav.data.dto.ReturnsSnapshot;
import org.nowstart.fundnav.data.entity.FundReturns;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.data.type.ReturnPeriod;
import org.nowstart.fundnav.data.type.RiskWindow;
import org.nowstart.fundnav.repository.FundReturnsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FundReturnsService {

    private static final int METRIC_SCALE = 4;

    private final NavTimeSeriesStore navTimeSeriesStore;
    private final ReturnCalculator returnCalculator;
    private final FundReturnsRepository fundReturnsRepository;
    private final NavSyncProperties navSyncProperties;

    public ReturnsSnapshot recompute(String schemeCode) {
        return recompute(schemeCode, LocalDate.now(navSyncProperties.zone()));
    }

    /**
     * Recomputes the scheme's snapshot from its bounded history and replaces the stored row.
     * Every column is rewritten, so a metric that became absent is cleared rather than kept.
     */
    @Transactional
    public ReturnsSnapshot recompute(String schemeCode, LocalDate asOfDate) {
        List<NavPoint> history = loadHistory(schemeCode);
        ReturnsSnapshot snapshot = returnCalculator.compute(schemeCode, history, asOfDate);
        if (snapshot.latest() == null) {
            log.info("Skipping returns snapshot for scheme without history. scheme_code={} as_of={}", schemeCode, asOfDate);
            return snapshot;
        }

        fundReturnsRepository.save(toEntity(snapshot));
        log.info(
                "event=returns_computed scheme_code={} as_of={} latest_date={} periods={} cagrs={} issues={}",
                schemeCode,
                asOfDate,
                snapshot.latest().date(),
                snapshot.periodReturns().size(),
                snapshot.cagrs().size(),
                snapshot.dataQualityIssues().size()
        );
        return snapshot;
    }

    List<NavPoint> loadHistory(String schemeCode) {
        List<NavPoint> recent = navTimeSeriesStore.rangeDescending(schemeCode, navSyncProperties.historyWindow());
        if (recent.isEmpty()) {
            return recent;
        }

        // the window may cut off inception; since-inception still needs the first point
        List<NavPoint> history = new ArrayList<>(recent);
        NavPoint oldestInWindow = recent.get(recent.size() - 1);
        Optional<NavPoint> earliest = navTimeSeriesStore.earliest(schemeCode);
        earliest.filter(point -> point.date().isBefore(oldestInWindow.date()))
                .ifPresent(history::add);
        return history;
    }

    FundReturns toEntity(ReturnsSnapshot snapshot) {
        Map<ReturnPeriod, Double> returns = snapshot.periodReturns();
        Map<ReturnPeriod, Double> cagrs = snapshot.cagrs();
        Map<RiskWindow, Double> volatilities = snapshot.volatilities();
        Map<RiskWindow, Double> sharpe = snapshot.sharpeRatios();
        Map<RiskWindow, Double> sortino = snapshot.sortinoRatios();
        Map<RiskWindow, Double> drawdowns = snapshot.maxDrawdowns();

        return FundReturns.builder()
                .schemeCode(snapshot.schemeCode())
                .asOfDate(snapshot.asOfDate())
                .calculatedAt(Instant.now())
                .latestNavDate(snapshot.latest().date())
                .latestNav(snapshot.latest().value())
                .return1w(metric(returns.get(ReturnPeriod.ONE_WEEK)))
                .return1m(metric(returns.get(ReturnPeriod.ONE_MONTH)))
                .return3m(metric(returns.get(ReturnPeriod.THREE_MONTHS)))
                .return6m(metric(returns.get(ReturnPeriod.SIX_MONTHS)))
                .return1y(metric(returns.get(ReturnPeriod.ONE_YEAR)))
                .return2y(metric(returns.get(ReturnPeriod.TWO_YEARS)))
                .return3y(metric(returns.get(ReturnPeriod.THREE_YEARS)))
                .return5y(metric(returns.get(ReturnPeriod.FIVE_YEARS)))
                .return7y(metric(returns.get(ReturnPeriod.SEVEN_YEARS)))
                .return10y(metric(returns.get(ReturnPeriod.TEN_YEARS)))
                .returnSinceInception(metric(returns.get(ReturnPeriod.SINCE_INCEPTION)))
                .cagr1y(metric(cagrs.get(ReturnPeriod.ONE_YEAR)))
                .cagr2y(metric(cagrs.get(ReturnPeriod.TWO_YEARS)))
                .cagr3y(metric(cagrs.get(ReturnPeriod.THREE_YEARS)))
                .cagr5y(metric(cagrs.get(ReturnPeriod.FIVE_YEARS)))
                .cagr7y(metric(cagrs.get(ReturnPeriod.SEVEN_YEARS)))
                .cagr10y(metric(cagrs.get(ReturnPeriod.TEN_YEARS)))
                .cagrSinceInception(metric(cagrs.get(ReturnPeriod.SINCE_INCEPTION)))
                .volatility1y(metric(volatilities.get(RiskWindow.ONE_YEAR)))
                .volatility3y(metric(volatilities.get(RiskWindow.THREE_YEARS)))
                .volatility5y(metric(volatilities.get(RiskWindow.FIVE_YEARS)))
                .sharpe1y(metric(sharpe.get(RiskWindow.ONE_YEAR)))
                .sharpe3y(metric(sharpe.get(RiskWindow.THREE_YEARS)))
                .sharpe5y(metric(sharpe.get(RiskWindow.FIVE_YEARS)))
                .sortino1y(metric(sortino.get(RiskWindow.ONE_YEAR)))
                .sortino3y(metric(sortino.get(RiskWindow.THREE_YEARS)))
                .sortino5y(metric(sortino.get(RiskWindow.FIVE_YEARS)))
                .maxDrawdown1y(metric(drawdowns.get(RiskWindow.ONE_YEAR)))
                .maxDrawdown3y(metric(drawdowns.get(RiskWindow.THREE_YEARS)))
                .maxDrawdown5y(metric(drawdowns.get(RiskWindow.FIVE_YEARS)))
                .build();
    }

    private BigDecimal metric(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(METRIC_SCALE, RoundingMode.HALF_UP);
    }
}
