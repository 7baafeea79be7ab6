package org.nowstart.fundnav.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.NavSyncRequest;
import org.nowstart.fundnav.data.exception.NavSyncApiException;
import org.nowstart.fundnav.service.sync.NavSyncOrchestrator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NavSyncScheduler {

    private final NavSyncOrchestrator navSyncOrchestrator;

    @Scheduled(cron = "${fundnav.sync.cron:0 30 23 * * *}", zone = "${fundnav.sync.cron-zone:Asia/Kolkata}")
    public void run() {
        if (navSyncOrchestrator.isRunning()) {
            log.info("Skipping scheduled NAV sync because a run is already active.");
            return;
        }
        try {
            navSyncOrchestrator.runOnce(NavSyncRequest.defaults());
        } catch (NavSyncApiException e) {
            log.info("Skipping scheduled NAV sync. reason={}", e.getMessage());
        }
    }
}
