package org.nowstart.fundnav.repository;

import org.nowstart.fundnav.data.entity.Fund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface FundRepository extends JpaRepository<Fund, String> {

    @Query("select f.schemeCode from Fund f where f.active = true order by f.schemeCode")
    List<String> findActiveSchemeCodes();

    /**
     * Moves the latest NAV projection forward. A row whose recorded date is newer than
     * {@code navDate} is left untouched; the same date only rewrites a corrected value.
     */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO funds (scheme_code, latest_nav, latest_nav_date, active, created_at, updated_at)
            VALUES (:schemeCode, :navValue, :navDate, true, now(), now())
            ON CONFLICT (scheme_code) DO UPDATE
            SET latest_nav = EXCLUDED.latest_nav,
                latest_nav_date = EXCLUDED.latest_nav_date,
                updated_at = now()
            WHERE funds.latest_nav_date IS NULL
               OR funds.latest_nav_date < EXCLUDED.latest_nav_date
               OR (funds.latest_nav_date = EXCLUDED.latest_nav_date AND funds.latest_nav <> EXCLUDED.latest_nav)
            """, nativeQuery = true)
    int advanceLatestNav(
            @Param("schemeCode") String schemeCode,
            @Param("navDate") LocalDate navDate,
            @Param("navValue") BigDecimal navValue
    );
}
