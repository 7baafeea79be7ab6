package org.nowstart.fundnav.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.fundnav.config.SwaggerConfig;
import org.nowstart.fundnav.data.dto.NavSyncOutcome;
import org.nowstart.fundnav.data.dto.NavSyncRequest;
import org.nowstart.fundnav.data.dto.NavSyncRunStatus;
import org.nowstart.fundnav.data.dto.ReturnsRecomputeRequest;
import org.nowstart.fundnav.data.dto.ReturnsRecomputeResult;
import org.nowstart.fundnav.data.exception.NavSyncApiException;
import org.nowstart.fundnav.service.sync.NavSyncOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/nav-sync")
@Tag(name = SwaggerConfig.NAV_SYNC_TAG, description = "NAV 수집 실행, 진행 상태 조회, 수익률 재계산 API")
public class NavSyncController {

    private final NavSyncOrchestrator navSyncOrchestrator;

    public NavSyncController(NavSyncOrchestrator navSyncOrchestrator) {
        this.navSyncOrchestrator = navSyncOrchestrator;
    }

    @PostMapping("/runs")
    @Operation(summary = "동기화 실행", description = "NAV 수집을 실행하고 완료될 때까지 기다린 뒤 결과를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 완료(부분 실패 포함)"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "409", description = "이미 실행 중인 동기화 존재")
    })
    public NavSyncOutcome run(@RequestBody(required = false) @Valid NavSyncRequest request) {
        return navSyncOrchestrator.runOnce(request);
    }

    @PostMapping("/runs/async")
    @Operation(summary = "비동기 동기화 시작", description = "NAV 수집을 백그라운드에서 시작하고 즉시 실행 상태를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "실행 시작"),
            @ApiResponse(responseCode = "409", description = "이미 실행 중인 동기화 존재")
    })
    public ResponseEntity<NavSyncRunStatus> start(@RequestBody(required = false) @Valid NavSyncRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(navSyncOrchestrator.startAsync(request));
    }

    @GetMapping("/runs/current")
    @Operation(summary = "현재 실행 상태 조회", description = "진행 중이거나 마지막으로 끝난 동기화의 단계, 처리 수, 실패 목록을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "실행 이력 없음")
    })
    public NavSyncRunStatus current() {
        NavSyncRunStatus status = navSyncOrchestrator.currentRun();
        if (status == null) {
            throw new NavSyncApiException(HttpStatus.NOT_FOUND, "run_not_found", "No NAV sync run has been started");
        }
        return status;
    }

    @PostMapping("/runs/current/stop")
    @Operation(summary = "실행 중지 요청", description = "진행 중인 동기화를 다음 배치 경계에서 멈추도록 요청합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "중지 요청 접수"),
            @ApiResponse(responseCode = "409", description = "진행 중인 동기화 없음")
    })
    public ResponseEntity<NavSyncRunStatus> stop() {
        if (!navSyncOrchestrator.requestStop()) {
            throw new NavSyncApiException(HttpStatus.CONFLICT, "no_active_run", "No NAV sync run is in progress");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(navSyncOrchestrator.currentRun());
    }

    @PostMapping("/returns/recompute")
    @Operation(summary = "수익률 재계산", description = "NAV 수집 없이 지정한 스킴의 수익률 스냅샷을 다시 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "재계산 완료"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public ReturnsRecomputeResult recompute(@RequestBody @Valid ReturnsRecomputeRequest request) {
        return navSyncOrchestrator.recomputeReturns(request.schemeCodes());
    }
}
