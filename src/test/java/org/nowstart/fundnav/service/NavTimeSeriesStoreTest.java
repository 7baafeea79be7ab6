package org.nowstart.fundnav.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.nowstart.fundnav.data.dto.NavUpsertResult;
import org.nowstart.fundnav.data.entity.NavHistory;
import org.nowstart.fundnav.repository.FundRepository;
import org.nowstart.fundnav.repository.NavHistoryRepository;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class NavTimeSeriesStoreTest {

    private static final LocalDate D0 = LocalDate.of(2023, 12, 29);
    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 3);

    @Mock
    private NavHistoryRepository navHistoryRepository;
    @Mock
    private FundRepository fundRepository;

    @InjectMocks
    private NavTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        lenient().when(fundRepository.advanceLatestNav(any(), any(), any())).thenReturn(1);
    }

    @Test
    void upsertMany_countsInsertsUpdatesAndNoOps() {
        when(navHistoryRepository.upsert(eq("A"), eq(D1), any())).thenReturn(List.of(true));
        when(navHistoryRepository.upsert(eq("A"), eq(D2), any())).thenReturn(List.of(false));
        when(navHistoryRepository.upsert(eq("B"), eq(D1), any())).thenReturn(List.of());

        NavUpsertResult result = store.upsertMany(List.of(
                point("A", D1, "10.0"),
                point("A", D2, "11.0"),
                point("B", D1, "20.0")
        ));

        assertThat(result.inserted()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.changedSchemeCodes()).containsExactly("A");
    }

    @Test
    void upsertMany_advancesLatestWithNewestPointPerSchemeRegardlessOfOrder() {
        when(navHistoryRepository.upsert(any(), any(), any())).thenReturn(List.of(true));

        store.upsertMany(List.of(
                point("A", D3, "13.0"),
                point("A", D1, "11.0"),
                point("A", D2, "12.0")
        ));

        verify(fundRepository).advanceLatestNav("A", D3, new BigDecimal("13.0"));
        verify(fundRepository, times(1)).advanceLatestNav(eq("A"), any(), any());
    }

    @Test
    void upsertMany_collapsesDuplicateKeysLastWins() {
        when(navHistoryRepository.upsert(any(), any(), any())).thenReturn(List.of(true));

        NavUpsertResult result = store.upsertMany(List.of(
                point("A", D1, "10.0"),
                point("A", D1, "10.5")
        ));

        verify(navHistoryRepository).upsert("A", D1, new BigDecimal("10.5"));
        verify(navHistoryRepository, never()).upsert("A", D1, new BigDecimal("10.0"));
        assertThat(result.inserted()).isEqualTo(1);
    }

    @Test
    void upsertMany_writesInSchemeThenDateOrderWhateverTheInputOrder() {
        when(navHistoryRepository.upsert(any(), any(), any())).thenReturn(List.of(true));

        store.upsertMany(List.of(
                point("B", D1, "20.0"),
                point("A", D2, "11.0"),
                point("B", D0, "19.0"),
                point("A", D1, "10.0")
        ));

        InOrder inOrder = inOrder(navHistoryRepository);
        inOrder.verify(navHistoryRepository).upsert("A", D1, new BigDecimal("10.0"));
        inOrder.verify(navHistoryRepository).upsert("A", D2, new BigDecimal("11.0"));
        inOrder.verify(navHistoryRepository).upsert("B", D0, new BigDecimal("19.0"));
        inOrder.verify(navHistoryRepository).upsert("B", D1, new BigDecimal("20.0"));
    }

    @Test
    void upsertMany_skipsPointsThatViolateInvariants() {
        when(navHistoryRepository.upsert(any(), any(), any())).thenReturn(List.of(true));

        NavUpsertResult result = store.upsertMany(List.of(
                point("A", D1, "0"),
                new NavPoint("A", null, BigDecimal.ONE),
                point(" ", D1, "1.0"),
                point("A", D2, "1.0")
        ));

        verify(navHistoryRepository, times(1)).upsert(any(), any(), any());
        assertThat(result.inserted()).isEqualTo(1);
    }

    @Test
    void upsertMany_emptyInputDoesNothing() {
        assertThat(store.upsertMany(List.of())).isEqualTo(NavUpsertResult.empty());
        verifyNoInteractions(navHistoryRepository, fundRepository);
    }

    @Test
    void latestBefore_mapsGreatestDateOnOrBefore() {
        when(navHistoryRepository.findTopByIdSchemeCodeAndIdNavDateLessThanEqualOrderByIdNavDateDesc("A", D3))
                .thenReturn(Optional.of(new NavHistory(new NavHistory.NavHistoryKey("A", D2), new BigDecimal("12.0"))));

        assertThat(store.latestBefore("A", D3)).contains(point("A", D2, "12.0"));
    }

    @Test
    void rangeDescending_boundsByLimit() {
        when(navHistoryRepository.findByIdSchemeCodeOrderByIdNavDateDesc("A", PageRequest.of(0, 2)))
                .thenReturn(List.of(
                        new NavHistory(new NavHistory.NavHistoryKey("A", D3), new BigDecimal("13.0")),
                        new NavHistory(new NavHistory.NavHistoryKey("A", D2), new BigDecimal("12.0"))
                ));

        assertThat(store.rangeDescending("A", 2)).extracting(NavPoint::date).containsExactly(D3, D2);
        assertThat(store.rangeDescending("A", 0)).isEmpty();
    }

    private NavPoint point(String schemeCode, LocalDate date, String value) {
        return new NavPoint(schemeCode, date, new BigDecimal(value));
    }
}
