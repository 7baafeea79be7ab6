package org.nowstart.fundnav.service.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.fundnav.data.entity.Fund;
import org.nowstart.fundnav.data.property.NavSyncPropertiesFixture;
import org.nowstart.fundnav.data.type.SourceMode;
import org.nowstart.fundnav.repository.FundRepository;

@ExtendWith(MockitoExtension.class)
class FundSchemeRegistryTest {

    @Mock
    private FundRepository fundRepository;

    @Test
    void resolveTargets_mergesActiveFundsWithSeedCodes() {
        FundSchemeRegistry registry = new FundSchemeRegistry(
                fundRepository,
                NavSyncPropertiesFixture.with(SourceMode.BULK, 20, 2, List.of(" 120437 ", "119551", ""), false)
        );
        when(fundRepository.findActiveSchemeCodes()).thenReturn(Arrays.asList("119551", null, "118989"));

        assertThat(registry.resolveTargets()).containsExactly("119551", "118989", "120437");
    }

    @Test
    void describe_updatesKnownFundCatalogue() {
        FundSchemeRegistry registry = new FundSchemeRegistry(fundRepository, NavSyncPropertiesFixture.defaults());
        Fund fund = Fund.builder().schemeCode("119551").build();
        when(fundRepository.findById("119551")).thenReturn(Optional.of(fund));

        registry.describe("119551", " Scheme A ", "Debt Scheme - Banking and PSU Fund");

        assertThat(fund.getSchemeName()).isEqualTo("Scheme A");
        assertThat(fund.getCategory()).isEqualTo("Debt Scheme - Banking and PSU Fund");
        assertThat(fund.isActive()).isTrue();
    }
}
