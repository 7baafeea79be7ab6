package org.nowstart.fundnav.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "fund_returns")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundReturns extends AuditableEntity {

    @Id
    private String schemeCode;

    @Column(nullable = false)
    private LocalDate asOfDate;

    @Column(nullable = false)
    private Instant calculatedAt;

    private LocalDate latestNavDate;

    @Column(precision = 16, scale = 6)
    private BigDecimal latestNav;

    @Column(name = "return_1w", precision = 14, scale = 4)
    private BigDecimal return1w;

    @Column(name = "return_1m", precision = 14, scale = 4)
    private BigDecimal return1m;

    @Column(name = "return_3m", precision = 14, scale = 4)
    private BigDecimal return3m;

    @Column(name = "return_6m", precision = 14, scale = 4)
    private BigDecimal return6m;

    @Column(name = "return_1y", precision = 14, scale = 4)
    private BigDecimal return1y;

    @Column(name = "return_2y", precision = 14, scale = 4)
    private BigDecimal return2y;

    @Column(name = "return_3y", precision = 14, scale = 4)
    private BigDecimal return3y;

    @Column(name = "return_5y", precision = 14, scale = 4)
    private BigDecimal return5y;

    @Column(name = "return_7y", precision = 14, scale = 4)
    private BigDecimal return7y;

    @Column(name = "return_10y", precision = 14, scale = 4)
    private BigDecimal return10y;

    @Column(precision = 14, scale = 4)
    private BigDecimal returnSinceInception;

    @Column(name = "cagr_1y", precision = 14, scale = 4)
    private BigDecimal cagr1y;

    @Column(name = "cagr_2y", precision = 14, scale = 4)
    private BigDecimal cagr2y;

    @Column(name = "cagr_3y", precision = 14, scale = 4)
    private BigDecimal cagr3y;

    @Column(name = "cagr_5y", precision = 14, scale = 4)
    private BigDecimal cagr5y;

    @Column(name = "cagr_7y", precision = 14, scale = 4)
    private BigDecimal cagr7y;

    @Column(name = "cagr_10y", precision = 14, scale = 4)
    private BigDecimal cagr10y;

    @Column(precision = 14, scale = 4)
    private BigDecimal cagrSinceInception;

    @Column(name = "volatility_1y", precision = 14, scale = 4)
    private BigDecimal volatility1y;

    @Column(name = "volatility_3y", precision = 14, scale = 4)
    private BigDecimal volatility3y;

    @Column(name = "volatility_5y", precision = 14, scale = 4)
    private BigDecimal volatility5y;

    @Column(name = "sharpe_1y", precision = 14, scale = 4)
    private BigDecimal sharpe1y;

    @Column(name = "sharpe_3y", precision = 14, scale = 4)
    private BigDecimal sharpe3y;

    @Column(name = "sharpe_5y", precision = 14, scale = 4)
    private BigDecimal sharpe5y;

    @Column(name = "sortino_1y", precision = 14, scale = 4)
    private BigDecimal sortino1y;

    @Column(name = "sortino_3y", precision = 14, scale = 4)
    private BigDecimal sortino3y;

    @Column(name = "sortino_5y", precision = 14, scale = 4)
    private BigDecimal sortino5y;

    // 고점 대비 최대 하락률(%), 양수로 저장
    @Column(name = "max_drawdown_1y", precision = 14, scale = 4)
    private BigDecimal maxDrawdown1y;

    @Column(name = "max_drawdown_3y", precision = 14, scale = 4)
    private BigDecimal maxDrawdown3y;

    @Column(name = "max_drawdown_5y", precision = 14, scale = 4)
    private BigDecimal maxDrawdown5y;
}
