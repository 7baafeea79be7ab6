package org.nowstart.fundnav.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReturnPeriod {
    ONE_WEEK("1w", 7),
    ONE_MONTH("1m", 30),
    THREE_MONTHS("3m", 90),
    SIX_MONTHS("6m", 180),
    ONE_YEAR("1y", 365),
    TWO_YEARS("2y", 730),
    THREE_YEARS("3y", 1095),
    FIVE_YEARS("5y", 1825),
    SEVEN_YEARS("7y", 2555),
    TEN_YEARS("10y", 3650),
    SINCE_INCEPTION("since_inception", 0);

    private final String key;
    private final int lookbackDays;

    public boolean isSinceInception() {
        return this == SINCE_INCEPTION;
    }

    /**
     * Fixed lookback periods of at least one year report CAGR. Since inception is decided per
     * scheme by the elapsed span.
     */
    public boolean hasFixedCagr() {
        return !isSinceInception() && lookbackDays >= 365;
    }
}
