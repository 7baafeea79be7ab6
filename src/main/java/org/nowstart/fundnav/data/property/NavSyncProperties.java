package org.nowstart.fundnav.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.nowstart.fundnav.data.type.SourceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fundnav.sync")
public record NavSyncProperties(
        // AMFI 전체 NAV 파일 기본 URL
        @NotBlank @DefaultValue("https://www.amfiindia.com") String amfiBaseUrl,
        // 펀드별 NAV 이력 API 기본 URL
        @NotBlank @DefaultValue("https://api.mfapi.in") String mfApiBaseUrl,
        // 외부 요청 User-Agent 헤더 값
        @NotBlank @DefaultValue("fundnav-sync/1.0") String userAgent,
        // 기본 수집 모드(BULK 또는 PER_SCHEME)
        @NotNull @DefaultValue("BULK") SourceMode sourceMode,
        // 배치당 스킴 수
        @Positive @Max(500) @DefaultValue("20") int batchSize,
        // 배치 내 동시 수집 워커 수
        @Positive @Max(64) @DefaultValue("4") int maxConcurrency,
        // 배치 사이 최소 대기 시간(외부 소스 rate limit 준수)
        @NotNull @DefaultValue("500ms") Duration interBatchDelay,
        // 스킴별 수집 최대 시도 횟수
        @Positive @DefaultValue("2") int fetchAttempts,
        // 수집 재시도 사이 대기 시간
        @NotNull @DefaultValue("1s") Duration retryBackoff,
        // 수익률 계산에 사용할 최근 NAV 개수
        @Positive @DefaultValue("4000") int historyWindow,
        // 기준일 계산 타임존
        @NotNull @DefaultValue("Asia/Kolkata") ZoneId zone,
        // 레지스트리에 없을 때 추가로 수집할 스킴 코드
        @NotNull @DefaultValue("") List<String> seedSchemeCodes,
        // BULK 모드에서 레지스트리에 없는 스킴도 수집할지 여부
        @DefaultValue("false") boolean registerUnknownSchemes,
        // 샤프 비율 계산용 무위험 수익률(연 %, 예: 6.0)
        @NotNull @DecimalMin("0") @DefaultValue("6.0") BigDecimal riskFreeRatePct
) {
}
