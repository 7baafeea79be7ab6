package org.nowstart.fundnav.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RiskWindow {
    ONE_YEAR("1y", 1),
    THREE_YEARS("3y", 3),
    FIVE_YEARS("5y", 5);

    private final String key;
    private final int years;
}
