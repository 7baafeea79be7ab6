package org.nowstart.fundnav.repository;

import org.nowstart.fundnav.data.entity.FundReturns;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FundReturnsRepository extends JpaRepository<FundReturns, String> {
}
