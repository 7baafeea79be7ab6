package org.nowstart.fundnav.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record NavPoint(
        String schemeCode,
        LocalDate date,
        BigDecimal value
) {
}
