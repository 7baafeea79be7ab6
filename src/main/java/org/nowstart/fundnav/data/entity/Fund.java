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
import java.time.LocalDate;

/**
 * Scheme registry row. Name, category and the active flag belong to the fund catalogue; the
 * latest NAV columns are the projection maintained by {@code NavTimeSeriesStore}.
 */
@Entity
@Table(name = "funds")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Fund extends AuditableEntity {

    @Id
    private String schemeCode;

    private String schemeName;

    private String category;

    @Column(precision = 16, scale = 6)
    private BigDecimal latestNav;

    private LocalDate latestNavDate;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;
}
