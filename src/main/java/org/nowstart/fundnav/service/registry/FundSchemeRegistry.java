package org.nowstart.fundnav.service.registry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.repository.FundRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FundSchemeRegistry implements SchemeRegistry {

    private final FundRepository fundRepository;
    private final NavSyncProperties navSyncProperties;

    @Override
    @Transactional(readOnly = true)
    public List<String> resolveTargets() {
        Set<String> targets = new LinkedHashSet<>();
        addAll(targets, fundRepository.findActiveSchemeCodes());
        addAll(targets, navSyncProperties.seedSchemeCodes());
        log.debug("Resolved sync targets. count={}", targets.size());
        return List.copyOf(targets);
    }

    @Override
    @Transactional
    public void describe(String schemeCode, String schemeName, String category) {
        if (schemeCode == null || schemeName == null || schemeName.isBlank()) {
            return;
        }
        fundRepository.findById(schemeCode.trim()).ifPresent(fund -> {
            fund.setSchemeName(schemeName.trim());
            if (category != null && !category.isBlank()) {
                fund.setCategory(category.trim());
            }
        });
    }

    private void addAll(Set<String> targets, List<String> codes) {
        if (codes == null) {
            return;
        }
        for (String code : codes) {
            if (code != null && !code.isBlank()) {
                targets.add(code.trim());
            }
        }
    }
}
