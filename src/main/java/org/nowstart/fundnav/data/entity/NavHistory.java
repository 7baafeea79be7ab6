package org.nowstart.fundnav.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.fundnav.data.dto.NavPoint;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "nav_history")
public class NavHistory extends AuditableEntity {

    @EmbeddedId
    private NavHistoryKey id;

    @Column(nullable = false, precision = 16, scale = 6)
    private BigDecimal navValue;

    public NavPoint toNavPoint() {
        return new NavPoint(id.schemeCode(), id.navDate(), navValue);
    }

    @Embeddable
    public record NavHistoryKey(String schemeCode, LocalDate navDate) implements Serializable {}
}
