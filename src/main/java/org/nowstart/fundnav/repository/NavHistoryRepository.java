package org.nowstart.fundnav.repository;

import org.nowstart.fundnav.data.entity.NavHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface NavHistoryRepository extends JpaRepository<NavHistory, NavHistory.NavHistoryKey> {

    /**
     * Insert-or-update keyed by (scheme_code, nav_date). Returns {@code [true]} for an insert,
     * {@code [false]} for a changed value and an empty list when the stored value already matches.
     */
    @Transactional
    @Query(value = """
            INSERT INTO nav_history (scheme_code, nav_date, nav_value, created_at, updated_at)
            VALUES (:schemeCode, :navDate, :navValue, now(), now())
            ON CONFLICT (scheme_code, nav_date) DO UPDATE
            SET nav_value = EXCLUDED.nav_value,
                updated_at = now()
            WHERE nav_history.nav_value <> EXCLUDED.nav_value
            RETURNING (xmax = 0)
            """, nativeQuery = true)
    List<Boolean> upsert(
            @Param("schemeCode") String schemeCode,
            @Param("navDate") LocalDate navDate,
            @Param("navValue") BigDecimal navValue
    );

    Optional<NavHistory> findTopByIdSchemeCodeAndIdNavDateLessThanEqualOrderByIdNavDateDesc(String schemeCode, LocalDate navDate);

    Optional<NavHistory> findTopByIdSchemeCodeOrderByIdNavDateAsc(String schemeCode);

    List<NavHistory> findByIdSchemeCodeOrderByIdNavDateDesc(String schemeCode, Pageable pageable);
}
