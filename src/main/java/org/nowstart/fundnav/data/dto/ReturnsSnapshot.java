package org.nowstart.fundnav.data.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.nowstart.fundnav.data.type.ReturnPeriod;
import org.nowstart.fundnav.data.type.RiskWindow;

/**
 * Point-in-time performance of one scheme. A period missing from a map means the history could
 * not support it; it never means zero.
 */
public record ReturnsSnapshot(
        String schemeCode,
        LocalDate asOfDate,
        NavPoint latest,
        Map<ReturnPeriod, Double> periodReturns,
        Map<ReturnPeriod, Double> cagrs,
        Map<RiskWindow, Double> volatilities,
        Map<RiskWindow, Double> sharpeRatios,
        Map<RiskWindow, Double> sortinoRatios,
        Map<RiskWindow, Double> maxDrawdowns,
        List<String> dataQualityIssues
) {
    public static ReturnsSnapshot empty(String schemeCode, LocalDate asOfDate) {
        return new ReturnsSnapshot(schemeCode, asOfDate, null, Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), List.of());
    }

    public boolean isEmpty() {
        return periodReturns.isEmpty() && cagrs.isEmpty();
    }
}
